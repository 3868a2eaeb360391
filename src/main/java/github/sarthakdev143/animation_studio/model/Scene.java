package github.sarthakdev143.animation_studio.model;

import java.time.Instant;

/**
 * One unit of generated animation code plus its rendered artifact.
 *
 * <p>Instances are immutable; stores publish a new instance on every change.
 */
public record Scene(
        String id,
        String projectId,
        String prompt,
        String code,
        SceneStatus status,
        String videoUrl,
        String thumbnailUrl,
        double durationSeconds,
        int orderIndex,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public Scene {
        if (status == null) {
            throw new IllegalArgumentException("Scene status is required.");
        }
        if (status == SceneStatus.COMPLETED && (videoUrl == null || videoUrl.isBlank())) {
            throw new IllegalArgumentException("A completed scene must have a video URL.");
        }
    }

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }

    public boolean hasRenderedVideo() {
        return status == SceneStatus.COMPLETED && videoUrl != null;
    }

    public Scene withStatus(SceneStatus newStatus) {
        return new Scene(id, projectId, prompt, code, newStatus, videoUrl, thumbnailUrl,
                durationSeconds, orderIndex, errorMessage, createdAt, Instant.now());
    }

    public Scene rendering() {
        return new Scene(id, projectId, prompt, code, SceneStatus.RENDERING, videoUrl, thumbnailUrl,
                durationSeconds, orderIndex, null, createdAt, Instant.now());
    }

    public Scene completed(RenderedScene rendered) {
        return new Scene(id, projectId, prompt, code, SceneStatus.COMPLETED, rendered.videoUrl(),
                rendered.thumbnailUrl(), rendered.durationSeconds(), orderIndex, null, createdAt, Instant.now());
    }

    public Scene failed(String error) {
        return new Scene(id, projectId, prompt, code, SceneStatus.FAILED, videoUrl, thumbnailUrl,
                durationSeconds, orderIndex, error, createdAt, Instant.now());
    }

    public Scene withGeneratedCode(String newPrompt, String newCode) {
        return new Scene(id, projectId, newPrompt, newCode, SceneStatus.PENDING, null, null,
                durationSeconds, orderIndex, null, createdAt, Instant.now());
    }

    public Scene withEdits(String newPrompt, String newCode, int newOrderIndex) {
        return new Scene(id, projectId, newPrompt, newCode, status, videoUrl, thumbnailUrl,
                durationSeconds, newOrderIndex, errorMessage, createdAt, Instant.now());
    }
}
