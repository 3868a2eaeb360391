package github.sarthakdev143.animation_studio.dto;

/**
 * Request to split one prompt into several scenes. {@code numScenes} defaults to five.
 */
public record SceneMultiCreateRequest(String projectId, String prompt, Integer numScenes) {

    public static final int DEFAULT_SCENE_COUNT = 5;

    public int sceneCount() {
        return numScenes != null ? numScenes : DEFAULT_SCENE_COUNT;
    }
}
