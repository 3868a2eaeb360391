package github.sarthakdev143.animation_studio.store;

import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.model.RenderJob;
import github.sarthakdev143.animation_studio.model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory projects, scenes and render jobs for the lifetime of the process.
 *
 * <p>Records are immutable and every update swaps the stored instance atomically, so readers
 * always see either the previous or the next complete record. Jobs in a terminal state are
 * never replaced, and a job's progress never goes backwards.
 */
@Component
public class StudioStore {

    private static final Logger logger = LoggerFactory.getLogger(StudioStore.class);

    private final Map<String, Project> projects = new ConcurrentHashMap<>();
    private final Map<String, Scene> scenes = new ConcurrentHashMap<>();
    private final Map<String, RenderJob> jobs = new ConcurrentHashMap<>();

    public Project saveProject(Project project) {
        projects.put(project.id(), project);
        return project;
    }

    public Optional<Project> findProject(String projectId) {
        return Optional.ofNullable(projectId).map(projects::get);
    }

    public List<Project> listProjects() {
        return projects.values()
                .stream()
                .sorted(Comparator.comparing(Project::createdAt))
                .toList();
    }

    public Optional<Project> updateProject(String projectId, UnaryOperator<Project> update) {
        return Optional.ofNullable(projects.computeIfPresent(projectId, (ignored, current) -> update.apply(current)));
    }

    public Optional<Project> removeProject(String projectId) {
        return Optional.ofNullable(projects.remove(projectId));
    }

    public Scene saveScene(Scene scene) {
        scenes.put(scene.id(), scene);
        return scene;
    }

    public Optional<Scene> findScene(String sceneId) {
        return Optional.ofNullable(sceneId).map(scenes::get);
    }

    public Optional<Scene> updateScene(String sceneId, UnaryOperator<Scene> update) {
        return Optional.ofNullable(scenes.computeIfPresent(sceneId, (ignored, current) -> update.apply(current)));
    }

    public Optional<Scene> removeScene(String sceneId) {
        return Optional.ofNullable(scenes.remove(sceneId));
    }

    /**
     * Scenes referenced by the project, ordered by order index. Ids without a stored scene
     * are skipped.
     */
    public List<Scene> scenesForProject(Project project) {
        return project.sceneIds()
                .stream()
                .map(scenes::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(Scene::orderIndex))
                .toList();
    }

    public RenderJob saveJob(RenderJob job) {
        jobs.put(job.id(), job);
        return job;
    }

    public Optional<RenderJob> findJob(String jobId) {
        return Optional.ofNullable(jobId).map(jobs::get);
    }

    public Optional<RenderJob> updateJob(String jobId, UnaryOperator<RenderJob> update) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.state().isTerminal()) {
                logger.warn("Ignoring update to job {} in terminal state {}", jobId, current.state());
                return current;
            }
            RenderJob next = update.apply(current);
            if (next.progress() < current.progress()) {
                return new RenderJob(
                        next.id(),
                        next.kind(),
                        next.sceneId(),
                        next.projectId(),
                        next.state(),
                        next.phase(),
                        current.progress(),
                        next.outputUrl(),
                        next.errorMessage(),
                        next.createdAt(),
                        next.updatedAt());
            }
            return next;
        }));
    }
}
