package github.sarthakdev143.animation_studio.model;

public record RenderedScene(String videoUrl, String thumbnailUrl, double durationSeconds) {
}
