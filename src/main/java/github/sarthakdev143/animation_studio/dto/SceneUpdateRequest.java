package github.sarthakdev143.animation_studio.dto;

/**
 * Partial scene update; null fields are left unchanged.
 */
public record SceneUpdateRequest(String prompt, String code, Integer orderIndex) {
}
