package github.sarthakdev143.animation_studio.store;

import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.model.RenderJob;
import github.sarthakdev143.animation_studio.model.RenderJobKind;
import github.sarthakdev143.animation_studio.model.RenderJobState;
import github.sarthakdev143.animation_studio.model.Scene;
import github.sarthakdev143.animation_studio.model.SceneStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StudioStoreTest {

    private final StudioStore store = new StudioStore();

    @Test
    void scenesForProjectFollowsOrderIndexAndSkipsMissingScenes() {
        store.saveScene(scene("late", 2));
        store.saveScene(scene("early", 0));
        store.saveScene(scene("middle", 1));
        Project project = store.saveProject(project("project-1", List.of("late", "gone", "early", "middle")));

        List<Scene> scenes = store.scenesForProject(project);

        assertThat(scenes).extracting(Scene::id).containsExactly("early", "middle", "late");
    }

    @Test
    void updateJobKeepsProgressFromGoingBackwards() {
        store.saveJob(RenderJob.pending("job-1", RenderJobKind.RENDER_ALL_AND_COMBINE, null, "project-1"));
        store.updateJob("job-1", job -> job.running("Rendering scene 2/3", 40));

        RenderJob updated = store.updateJob("job-1", job -> new RenderJob(
                job.id(), job.kind(), job.sceneId(), job.projectId(), RenderJobState.RUNNING,
                "Rendering scene 1/3", 10, null, null, job.createdAt(), Instant.now())).orElseThrow();

        assertThat(updated.progress()).isEqualTo(40);
        assertThat(updated.phase()).isEqualTo("Rendering scene 1/3");
    }

    @Test
    void updateJobIgnoresChangesToTerminalJobs() {
        store.saveJob(RenderJob.pending("job-1", RenderJobKind.SINGLE_SCENE_RENDER, "scene-1", null));
        store.updateJob("job-1", job -> job.completed("/outputs/scene-1.mp4"));

        RenderJob afterLateUpdate = store.updateJob("job-1", job -> job.failed("late failure")).orElseThrow();

        assertThat(afterLateUpdate.state()).isEqualTo(RenderJobState.COMPLETED);
        assertThat(afterLateUpdate.outputUrl()).isEqualTo("/outputs/scene-1.mp4");
        assertThat(afterLateUpdate.errorMessage()).isNull();
        assertThat(store.findJob("job-1")).contains(afterLateUpdate);
    }

    @Test
    void updatesOfUnknownIdsReturnEmpty() {
        assertThat(store.updateJob("missing", job -> job.running("x", 1))).isEmpty();
        assertThat(store.updateScene("missing", Scene::rendering)).isEmpty();
        assertThat(store.updateProject("missing", p -> p.withAudioUrl(null))).isEmpty();
        assertThat(store.findJob(null)).isEmpty();
    }

    @Test
    void listProjectsIsOrderedByCreationTime() {
        Instant now = Instant.now();
        store.saveProject(new Project("newer", "Newer", null, List.of(), null, now, now));
        store.saveProject(new Project("older", "Older", null, List.of(), null, now.minusSeconds(60), now));

        assertThat(store.listProjects()).extracting(Project::id).containsExactly("older", "newer");
    }

    private static Scene scene(String id, int orderIndex) {
        Instant now = Instant.now();
        return new Scene(id, "project-1", "prompt " + id, "code", SceneStatus.PENDING, null, null,
                0, orderIndex, null, now, now);
    }

    private static Project project(String id, List<String> sceneIds) {
        Instant now = Instant.now();
        return new Project(id, "Project", null, sceneIds, null, now, now);
    }
}
