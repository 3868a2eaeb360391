package github.sarthakdev143.animation_studio.exception;

public class SceneRenderException extends RuntimeException {

    public enum Reason {
        ENGINE_FAILED,
        NO_ARTIFACT,
        IO_FAILURE
    }

    private final Reason reason;

    public SceneRenderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SceneRenderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
