package github.sarthakdev143.animation_studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SceneStatus {
    PENDING,
    GENERATING,
    RENDERING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
