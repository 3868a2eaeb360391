package github.sarthakdev143.animation_studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RenderJobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
