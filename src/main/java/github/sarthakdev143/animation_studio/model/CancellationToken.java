package github.sarthakdev143.animation_studio.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records a request to cancel a job. Running pipelines do not observe it yet: a job
 * always runs to completion or failure.
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean();

    public void cancel() {
        requested.set(true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }
}
