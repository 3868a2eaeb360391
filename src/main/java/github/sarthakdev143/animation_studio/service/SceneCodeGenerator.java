package github.sarthakdev143.animation_studio.service;

import java.util.List;

public interface SceneCodeGenerator {

    /**
     * Returns scene code for the prompt. Returned code has already passed validation.
     */
    String generate(String prompt);

    /**
     * Splits a topic into consecutive parts (introduction first, summary last) and generates
     * code for each. At most {@code sceneCount} parts are returned; every part's code has
     * already passed validation.
     */
    List<ScenePart> generateSequence(String prompt, int sceneCount);
}
