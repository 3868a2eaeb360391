package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.RenderedScene;

public interface SceneRenderer {

    /**
     * Renders one scene's code into a persistent video named after the scene.
     *
     * @throws github.sarthakdev143.animation_studio.exception.SceneRenderException when the
     *         engine fails or produces no video
     */
    RenderedScene render(String code, String sceneId);
}
