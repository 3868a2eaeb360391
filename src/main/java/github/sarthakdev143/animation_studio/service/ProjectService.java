package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.Project;

import java.util.List;

public interface ProjectService {

    Project createProject(String name, String description);

    List<Project> listProjects();

    Project getProject(String projectId);

    /**
     * Applies the non-null fields to the project.
     */
    Project updateProject(String projectId, String name, String description);

    /**
     * Deletes the project together with its scenes.
     */
    void deleteProject(String projectId);
}
