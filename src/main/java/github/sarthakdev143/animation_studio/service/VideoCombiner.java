package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.Scene;

import java.util.List;

public interface VideoCombiner {

    /**
     * Concatenates the scenes' videos in list order and muxes the optional audio track.
     *
     * @return URL of the combined video
     * @throws github.sarthakdev143.animation_studio.exception.VideoCombineException when nothing
     *         can be combined or ffmpeg fails
     */
    String combine(List<Scene> orderedScenes, String projectId, String audioUrl);
}
