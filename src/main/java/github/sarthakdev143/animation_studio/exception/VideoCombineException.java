package github.sarthakdev143.animation_studio.exception;

public class VideoCombineException extends RuntimeException {

    public enum Reason {
        NO_SCENES,
        NO_ARTIFACTS,
        CONCAT_FAILED,
        MUX_FAILED,
        IO_FAILURE
    }

    private final Reason reason;

    public VideoCombineException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public VideoCombineException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
