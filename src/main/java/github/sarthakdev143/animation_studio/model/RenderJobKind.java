package github.sarthakdev143.animation_studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RenderJobKind {
    SINGLE_SCENE_RENDER("single-scene-render"),
    EXPORT_COMBINE("export-combine"),
    RENDER_ALL_AND_COMBINE("render-all-and-combine");

    private final String apiValue;

    RenderJobKind(String apiValue) {
        this.apiValue = apiValue;
    }

    @JsonValue
    public String apiValue() {
        return apiValue;
    }
}
