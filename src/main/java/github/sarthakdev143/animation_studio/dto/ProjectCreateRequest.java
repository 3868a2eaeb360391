package github.sarthakdev143.animation_studio.dto;

public record ProjectCreateRequest(String name, String description) {
}
