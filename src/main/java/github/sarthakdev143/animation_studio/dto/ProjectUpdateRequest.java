package github.sarthakdev143.animation_studio.dto;

public record ProjectUpdateRequest(String name, String description) {
}
