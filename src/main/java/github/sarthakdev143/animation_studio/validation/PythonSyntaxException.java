package github.sarthakdev143.animation_studio.validation;

public class PythonSyntaxException extends RuntimeException {

    private final int lineNumber;

    public PythonSyntaxException(int lineNumber, String message) {
        super(message);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
