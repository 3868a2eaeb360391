package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.JobHandle;
import github.sarthakdev143.animation_studio.model.RenderJob;

import java.util.Optional;

/**
 * Submits render pipelines as background jobs. Submission checks preconditions
 * synchronously and throws {@link github.sarthakdev143.animation_studio.exception.JobPreconditionException}
 * before any job is created; once a job exists, every failure is recorded on the job.
 */
public interface RenderJobService {

    JobHandle submitSceneRender(String sceneId);

    JobHandle submitExport(String projectId);

    JobHandle submitRenderAll(String projectId);

    Optional<RenderJob> getJob(String jobId);
}
