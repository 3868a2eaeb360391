package github.sarthakdev143.animation_studio.dto;

import github.sarthakdev143.animation_studio.model.Project;

import java.time.Instant;

public record ProjectResponse(
        String id,
        String name,
        String description,
        int sceneCount,
        String audioUrl,
        Instant createdAt,
        Instant updatedAt) {

    public static ProjectResponse from(Project project) {
        return new ProjectResponse(
                project.id(),
                project.name(),
                project.description(),
                project.sceneCount(),
                project.audioUrl(),
                project.createdAt(),
                project.updatedAt());
    }
}
