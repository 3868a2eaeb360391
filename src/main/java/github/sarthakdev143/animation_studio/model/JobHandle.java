package github.sarthakdev143.animation_studio.model;

import java.util.concurrent.CompletableFuture;

/**
 * Returned at submission: the job as accepted, a future that completes with the terminal
 * snapshot, and the job's cancellation token.
 */
public record JobHandle(
        RenderJob job,
        CompletableFuture<RenderJob> completion,
        CancellationToken cancellation) {
}
