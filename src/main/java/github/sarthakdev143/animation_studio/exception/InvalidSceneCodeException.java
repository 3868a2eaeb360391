package github.sarthakdev143.animation_studio.exception;

import java.util.List;

/**
 * Raised when scene code fails validation. Nothing has been executed when this is thrown.
 */
public class InvalidSceneCodeException extends RuntimeException {

    public enum Reason {
        EMPTY_CODE,
        SYNTAX_INVALID,
        UNSAFE_CONSTRUCT,
        STRUCTURE_INVALID
    }

    public enum MissingElement {
        ENGINE_IMPORT,
        SCENE_CLASS,
        CONSTRUCT_METHOD
    }

    private final Reason reason;
    private final Integer lineNumber;
    private final List<String> matchedPatterns;
    private final MissingElement missingElement;

    private InvalidSceneCodeException(
            Reason reason,
            String message,
            Integer lineNumber,
            List<String> matchedPatterns,
            MissingElement missingElement) {
        super(message);
        this.reason = reason;
        this.lineNumber = lineNumber;
        this.matchedPatterns = matchedPatterns == null ? List.of() : List.copyOf(matchedPatterns);
        this.missingElement = missingElement;
    }

    public static InvalidSceneCodeException emptyCode() {
        return new InvalidSceneCodeException(Reason.EMPTY_CODE, "Code is empty", null, null, null);
    }

    public static InvalidSceneCodeException syntaxInvalid(int lineNumber, String detail) {
        return new InvalidSceneCodeException(
                Reason.SYNTAX_INVALID,
                "Syntax error at line " + lineNumber + ": " + detail,
                lineNumber,
                null,
                null);
    }

    public static InvalidSceneCodeException unsafeConstruct(List<String> patterns) {
        return new InvalidSceneCodeException(
                Reason.UNSAFE_CONSTRUCT,
                "Code contains dangerous patterns: " + String.join(", ", patterns),
                null,
                patterns,
                null);
    }

    public static InvalidSceneCodeException structureInvalid(MissingElement missingElement, String message) {
        return new InvalidSceneCodeException(Reason.STRUCTURE_INVALID, message, null, null, missingElement);
    }

    public Reason reason() {
        return reason;
    }

    public Integer lineNumber() {
        return lineNumber;
    }

    public List<String> matchedPatterns() {
        return matchedPatterns;
    }

    public MissingElement missingElement() {
        return missingElement;
    }
}
