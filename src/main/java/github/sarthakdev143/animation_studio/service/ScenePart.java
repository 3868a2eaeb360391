package github.sarthakdev143.animation_studio.service;

/**
 * One generated part of a multi-scene sequence: the prompt stored on the scene and its code.
 */
public record ScenePart(String prompt, String code) {
}
