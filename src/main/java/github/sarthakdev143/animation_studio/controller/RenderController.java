package github.sarthakdev143.animation_studio.controller;

import github.sarthakdev143.animation_studio.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.animation_studio.exception.JobPreconditionException;
import github.sarthakdev143.animation_studio.model.JobHandle;
import github.sarthakdev143.animation_studio.service.RenderJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Supplier;

@RestController
@RequestMapping("/api/render")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);
    private static final String POLL_HINT = " Poll /api/render/job/{jobId} for progress.";

    private final RenderJobService renderJobService;

    public RenderController(RenderJobService renderJobService) {
        this.renderJobService = renderJobService;
    }

    @PostMapping("/scene/{sceneId}")
    public ResponseEntity<?> renderScene(@PathVariable String sceneId) {
        return submit(() -> renderJobService.submitSceneRender(sceneId), "Render job started.");
    }

    @PostMapping("/export/{projectId}")
    public ResponseEntity<?> exportProject(@PathVariable String projectId) {
        return submit(() -> renderJobService.submitExport(projectId), "Export job started.");
    }

    @PostMapping("/render-all/{projectId}")
    public ResponseEntity<?> renderAllAndCombine(@PathVariable String projectId) {
        return submit(() -> renderJobService.submitRenderAll(projectId), "Render-all job started.");
    }

    @GetMapping("/job/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        return renderJobService.getJob(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Render job not found for id: " + jobId));
    }

    private ResponseEntity<?> submit(Supplier<JobHandle> submission, String message) {
        try {
            JobHandle handle = submission.get();
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            handle.job().id(),
                            handle.job().state(),
                            message + POLL_HINT));
        } catch (JobPreconditionException e) {
            HttpStatus status = e.reason() == JobPreconditionException.Reason.NOT_FOUND
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Render job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start render job. Please try again.");
        }
    }
}
