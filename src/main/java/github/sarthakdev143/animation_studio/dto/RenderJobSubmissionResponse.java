package github.sarthakdev143.animation_studio.dto;

import github.sarthakdev143.animation_studio.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
