package github.sarthakdev143.animation_studio.dto;

import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException;

import java.util.List;

public record CodeValidationResponse(
        boolean valid,
        InvalidSceneCodeException.Reason reason,
        String message,
        Integer lineNumber,
        List<String> matchedPatterns,
        InvalidSceneCodeException.MissingElement missingElement) {

    public static CodeValidationResponse passed() {
        return new CodeValidationResponse(true, null, "Code is valid", null, List.of(), null);
    }

    public static CodeValidationResponse rejected(InvalidSceneCodeException e) {
        return new CodeValidationResponse(
                false,
                e.reason(),
                e.getMessage(),
                e.lineNumber(),
                e.matchedPatterns(),
                e.missingElement());
    }
}
