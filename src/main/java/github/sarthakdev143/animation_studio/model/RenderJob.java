package github.sarthakdev143.animation_studio.model;

import java.time.Instant;

/**
 * Snapshot of one orchestrated pipeline run. Jobs are created per request and never reused.
 */
public record RenderJob(
        String id,
        RenderJobKind kind,
        String sceneId,
        String projectId,
        RenderJobState state,
        String phase,
        int progress,
        String outputUrl,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public RenderJob {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100.");
        }
    }

    public static RenderJob pending(String id, RenderJobKind kind, String sceneId, String projectId) {
        Instant now = Instant.now();
        return new RenderJob(id, kind, sceneId, projectId, RenderJobState.PENDING, "Queued", 0, null, null, now, now);
    }

    public RenderJob running(String newPhase, int newProgress) {
        return new RenderJob(id, kind, sceneId, projectId, RenderJobState.RUNNING, newPhase,
                Math.max(progress, newProgress), outputUrl, null, createdAt, Instant.now());
    }

    public RenderJob completed(String newOutputUrl) {
        return new RenderJob(id, kind, sceneId, projectId, RenderJobState.COMPLETED, "Completed",
                100, newOutputUrl, null, createdAt, Instant.now());
    }

    public RenderJob failed(String error) {
        return new RenderJob(id, kind, sceneId, projectId, RenderJobState.FAILED, "Failed",
                progress, outputUrl, error, createdAt, Instant.now());
    }
}
