package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.service.ProjectService;
import github.sarthakdev143.animation_studio.store.StudioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class DefaultProjectService implements ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProjectService.class);
    private static final int MAX_NAME_LENGTH = 200;

    private final StudioStore store;

    public DefaultProjectService(StudioStore store) {
        this.store = store;
    }

    @Override
    public Project createProject(String name, String description) {
        validateName(name);
        Instant now = Instant.now();
        Project project = store.saveProject(new Project(
                UUID.randomUUID().toString(),
                name.trim(),
                description,
                List.of(),
                null,
                now,
                now));
        logger.info("Created project {}", project.id());
        return project;
    }

    @Override
    public List<Project> listProjects() {
        return store.listProjects();
    }

    @Override
    public Project getProject(String projectId) {
        return store.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
    }

    @Override
    public Project updateProject(String projectId, String name, String description) {
        if (name != null) {
            validateName(name);
        }
        return store.updateProject(projectId, current -> current.withDetails(
                        name != null ? name.trim() : current.name(),
                        description != null ? description : current.description()))
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
    }

    @Override
    public void deleteProject(String projectId) {
        Project removed = store.removeProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
        removed.sceneIds().forEach(store::removeScene);
        logger.info("Deleted project {} and {} scenes", projectId, removed.sceneCount());
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name is required.");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Project name must be at most " + MAX_NAME_LENGTH + " characters.");
        }
    }
}
