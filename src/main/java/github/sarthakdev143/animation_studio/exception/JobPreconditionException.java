package github.sarthakdev143.animation_studio.exception;

/**
 * Raised synchronously at submission time, before any job record exists.
 */
public class JobPreconditionException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INVALID_STATE
    }

    private final Reason reason;

    public JobPreconditionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static JobPreconditionException notFound(String message) {
        return new JobPreconditionException(Reason.NOT_FOUND, message);
    }

    public static JobPreconditionException invalidState(String message) {
        return new JobPreconditionException(Reason.INVALID_STATE, message);
    }

    public Reason reason() {
        return reason;
    }
}
