package github.sarthakdev143.animation_studio.dto;

public record SceneCreateRequest(String projectId, String prompt) {
}
