package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.Scene;

import java.util.List;

public interface SceneService {

    /**
     * Creates a scene at the end of the project and generates its code. A generation failure
     * leaves the scene in the failed state rather than failing the call.
     */
    Scene createScene(String projectId, String prompt);

    /**
     * Splits the prompt into up to {@code sceneCount} scenes appended to the project with
     * consecutive order indices. The scenes come back pending with their code already set.
     */
    List<Scene> createScenes(String projectId, String prompt, int sceneCount);

    List<Scene> listScenes(String projectId);

    Scene getScene(String sceneId);

    Scene updateScene(String sceneId, String prompt, String code, Integer orderIndex);

    void deleteScene(String sceneId);

    Scene regenerateScene(String sceneId, String newPrompt);
}
