package github.sarthakdev143.animation_studio.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record Project(
        String id,
        String name,
        String description,
        List<String> sceneIds,
        String audioUrl,
        Instant createdAt,
        Instant updatedAt) {

    public Project {
        sceneIds = sceneIds == null ? List.of() : List.copyOf(sceneIds);
    }

    public int sceneCount() {
        return sceneIds.size();
    }

    public Project withDetails(String newName, String newDescription) {
        return new Project(id, newName, newDescription, sceneIds, audioUrl, createdAt, Instant.now());
    }

    public Project withSceneAdded(String sceneId) {
        List<String> updated = new ArrayList<>(sceneIds);
        updated.add(sceneId);
        return new Project(id, name, description, updated, audioUrl, createdAt, Instant.now());
    }

    public Project withSceneRemoved(String sceneId) {
        List<String> updated = new ArrayList<>(sceneIds);
        updated.remove(sceneId);
        return new Project(id, name, description, updated, audioUrl, createdAt, Instant.now());
    }

    public Project withAudioUrl(String newAudioUrl) {
        return new Project(id, name, description, sceneIds, newAudioUrl, createdAt, Instant.now());
    }
}
