package github.sarthakdev143.animation_studio.dto;

public record CodeValidationRequest(String code) {
}
