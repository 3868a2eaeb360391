package github.sarthakdev143.animation_studio.controller;

import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.service.AudioService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/audio")
public class AudioController {

    private static final Logger logger = LoggerFactory.getLogger(AudioController.class);

    private final AudioService audioService;

    public AudioController(AudioService audioService) {
        this.audioService = audioService;
    }

    @PostMapping(value = "/upload/{projectId}", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadAudio(@PathVariable String projectId, @RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(audioService.uploadAudio(projectId, file));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (IOException e) {
            logger.error("Audio upload for project {} failed", projectId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to store audio file. Please try again.");
        }
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<?> removeAudio(@PathVariable String projectId) {
        try {
            audioService.removeAudio(projectId);
            return ResponseEntity.noContent().build();
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IOException e) {
            logger.error("Audio removal for project {} failed", projectId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to remove audio file. Please try again.");
        }
    }
}
