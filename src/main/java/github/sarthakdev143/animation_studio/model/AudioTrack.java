package github.sarthakdev143.animation_studio.model;

import java.time.Instant;

public record AudioTrack(String id, String projectId, String originalFilename, String url, Instant createdAt) {
}
