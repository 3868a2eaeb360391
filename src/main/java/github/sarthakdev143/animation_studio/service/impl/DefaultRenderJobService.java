package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.exception.JobPreconditionException;
import github.sarthakdev143.animation_studio.model.CancellationToken;
import github.sarthakdev143.animation_studio.model.JobHandle;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.model.RenderJob;
import github.sarthakdev143.animation_studio.model.RenderJobKind;
import github.sarthakdev143.animation_studio.model.RenderedScene;
import github.sarthakdev143.animation_studio.model.Scene;
import github.sarthakdev143.animation_studio.service.RenderJobService;
import github.sarthakdev143.animation_studio.service.SceneRenderer;
import github.sarthakdev143.animation_studio.service.VideoCombiner;
import github.sarthakdev143.animation_studio.store.StudioStore;
import github.sarthakdev143.animation_studio.validation.SceneCodeValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Service
public class DefaultRenderJobService implements RenderJobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderJobService.class);
    private static final String RENDERING_PHASE = "Rendering scene";
    private static final String COMBINING_PHASE = "Combining scenes";
    private static final int EXPORT_COMBINE_PROGRESS = 10;

    private final StudioStore store;
    private final SceneCodeValidator codeValidator;
    private final SceneRenderer sceneRenderer;
    private final VideoCombiner videoCombiner;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final StudioProperties properties;
    private final Counter renderFailureCounter;

    public DefaultRenderJobService(
            StudioStore store,
            SceneCodeValidator codeValidator,
            SceneRenderer sceneRenderer,
            VideoCombiner videoCombiner,
            @Qualifier("renderTaskExecutor") TaskExecutor taskExecutor,
            MeterRegistry meterRegistry,
            StudioProperties properties) {
        this.store = store;
        this.codeValidator = codeValidator;
        this.sceneRenderer = sceneRenderer;
        this.videoCombiner = videoCombiner;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.renderFailureCounter = meterRegistry.counter("animation_studio.render.failures");
    }

    @Override
    public JobHandle submitSceneRender(String sceneId) {
        Scene scene = store.findScene(sceneId)
                .orElseThrow(() -> JobPreconditionException.notFound("Scene not found"));
        if (!scene.hasCode()) {
            throw JobPreconditionException.invalidState("Scene has no code to render");
        }

        RenderJob job = RenderJob.pending(newJobId(), RenderJobKind.SINGLE_SCENE_RENDER, sceneId, scene.projectId());
        return dispatch(job, () -> runSceneRender(job.id(), sceneId));
    }

    @Override
    public JobHandle submitExport(String projectId) {
        Project project = store.findProject(projectId)
                .orElseThrow(() -> JobPreconditionException.notFound("Project not found"));
        if (project.sceneIds().isEmpty()) {
            throw JobPreconditionException.invalidState("Project has no scenes");
        }
        for (String sceneId : project.sceneIds()) {
            Optional<Scene> scene = store.findScene(sceneId);
            if (scene.isPresent() && !scene.get().hasRenderedVideo()) {
                throw JobPreconditionException.invalidState("Scene " + sceneId + " is not rendered yet");
            }
        }

        RenderJob job = RenderJob.pending(newJobId(), RenderJobKind.EXPORT_COMBINE, null, projectId);
        return dispatch(job, () -> runExport(job.id(), projectId));
    }

    @Override
    public JobHandle submitRenderAll(String projectId) {
        Project project = store.findProject(projectId)
                .orElseThrow(() -> JobPreconditionException.notFound("Project not found"));
        if (project.sceneIds().isEmpty()) {
            throw JobPreconditionException.invalidState("Project has no scenes to render");
        }
        for (String sceneId : project.sceneIds()) {
            Optional<Scene> scene = store.findScene(sceneId);
            if (scene.isPresent() && !scene.get().hasCode()) {
                String label = scene.get().prompt() != null ? scene.get().prompt() : sceneId;
                throw JobPreconditionException.invalidState("Scene '" + label + "' has no code");
            }
        }

        RenderJob job = RenderJob.pending(newJobId(), RenderJobKind.RENDER_ALL_AND_COMBINE, null, projectId);
        return dispatch(job, () -> runRenderAll(job.id(), projectId));
    }

    @Override
    public Optional<RenderJob> getJob(String jobId) {
        return store.findJob(jobId);
    }

    private JobHandle dispatch(RenderJob job, JobPipeline pipeline) {
        store.saveJob(job);
        meterRegistry.counter("animation_studio.jobs.submitted", "kind", job.kind().apiValue()).increment();
        logger.info(
                "Accepted {} job {} sceneId={} projectId={}",
                job.kind().apiValue(),
                job.id(),
                job.sceneId(),
                job.projectId());

        CancellationToken cancellation = new CancellationToken();
        CompletableFuture<RenderJob> completion = CompletableFuture.supplyAsync(
                () -> execute(job, pipeline),
                taskExecutor);
        return new JobHandle(job, completion, cancellation);
    }

    private RenderJob execute(RenderJob job, JobPipeline pipeline) {
        try {
            String outputUrl = pipeline.run();
            store.updateJob(job.id(), current -> current.completed(outputUrl));
            logger.info("Completed {} job {} output={}", job.kind().apiValue(), job.id(), outputUrl);
        } catch (Throwable e) {
            meterRegistry.counter("animation_studio.jobs.failed", "kind", job.kind().apiValue()).increment();
            logger.error("{} job {} failed", job.kind().apiValue(), job.id(), e);
            String message = failureMessage(e);
            store.updateJob(job.id(), current -> current.failed(message));
        }
        return store.findJob(job.id()).orElse(job);
    }

    private String runSceneRender(String jobId, String sceneId) {
        store.updateJob(jobId, current -> current.running(RENDERING_PHASE, 0));
        Scene scene = store.findScene(sceneId)
                .orElseThrow(() -> new IllegalStateException("Scene " + sceneId + " no longer exists"));
        return renderScene(scene).videoUrl();
    }

    private String runExport(String jobId, String projectId) {
        store.updateJob(jobId, current -> current.running(COMBINING_PHASE, EXPORT_COMBINE_PROGRESS));
        Project project = loadProject(projectId);
        return videoCombiner.combine(store.scenesForProject(project), projectId, project.audioUrl());
    }

    private String runRenderAll(String jobId, String projectId) {
        Project project = loadProject(projectId);
        List<Scene> scenes = store.scenesForProject(project);
        int total = scenes.size();
        int renderBudget = properties.getRenderProgressBudget();
        List<Scene> rendered = new ArrayList<>(total);

        for (int index = 0; index < total; index++) {
            Scene scene = scenes.get(index);
            int progress = (int) ((long) index * renderBudget / total);
            String phase = RENDERING_PHASE + " " + (index + 1) + "/" + total;
            store.updateJob(jobId, current -> current.running(phase, progress));

            if (scene.hasRenderedVideo()) {
                rendered.add(scene);
                continue;
            }
            try {
                renderScene(scene);
            } catch (RuntimeException e) {
                throw new IllegalStateException("Failed to render scene " + (index + 1) + ": " + e.getMessage(), e);
            }
            rendered.add(store.findScene(scene.id()).orElse(scene));
        }

        store.updateJob(jobId, current -> current.running(COMBINING_PHASE, properties.getCombineProgress()));
        return videoCombiner.combine(rendered, projectId, loadProject(projectId).audioUrl());
    }

    /**
     * Validates and renders one scene, recording the outcome on the scene.
     */
    private RenderedScene renderScene(Scene scene) {
        store.updateScene(scene.id(), Scene::rendering);
        try {
            codeValidator.validate(scene.code());
            RenderedScene rendered = sceneRenderer.render(scene.code(), scene.id());
            store.updateScene(scene.id(), current -> current.completed(rendered));
            return rendered;
        } catch (RuntimeException | Error e) {
            renderFailureCounter.increment();
            String message = failureMessage(e);
            store.updateScene(scene.id(), current -> current.failed(message));
            throw e;
        }
    }

    private static String failureMessage(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private Project loadProject(String projectId) {
        return store.findProject(projectId)
                .orElseThrow(() -> new IllegalStateException("Project " + projectId + " no longer exists"));
    }

    private String newJobId() {
        return UUID.randomUUID().toString();
    }

    @FunctionalInterface
    private interface JobPipeline {
        String run();
    }
}
