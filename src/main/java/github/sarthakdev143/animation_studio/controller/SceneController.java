package github.sarthakdev143.animation_studio.controller;

import github.sarthakdev143.animation_studio.dto.CodeValidationRequest;
import github.sarthakdev143.animation_studio.dto.CodeValidationResponse;
import github.sarthakdev143.animation_studio.dto.SceneCreateRequest;
import github.sarthakdev143.animation_studio.dto.SceneMultiCreateRequest;
import github.sarthakdev143.animation_studio.dto.SceneUpdateRequest;
import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException;
import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.service.SceneService;
import github.sarthakdev143.animation_studio.validation.SceneCodeValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scenes")
public class SceneController {

    private final SceneService sceneService;
    private final SceneCodeValidator codeValidator;

    public SceneController(SceneService sceneService, SceneCodeValidator codeValidator) {
        this.sceneService = sceneService;
        this.codeValidator = codeValidator;
    }

    @PostMapping
    public ResponseEntity<?> createScene(@RequestBody SceneCreateRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(sceneService.createScene(request.projectId(), request.prompt()));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }

    @PostMapping("/multi")
    public ResponseEntity<?> createScenes(@RequestBody SceneMultiCreateRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(sceneService.createScenes(request.projectId(), request.prompt(), request.sceneCount()));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }

    @GetMapping("/project/{projectId}")
    public ResponseEntity<?> listScenes(@PathVariable String projectId) {
        try {
            return ResponseEntity.ok(sceneService.listScenes(projectId));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        }
    }

    @GetMapping("/{sceneId}")
    public ResponseEntity<?> getScene(@PathVariable String sceneId) {
        try {
            return ResponseEntity.ok(sceneService.getScene(sceneId));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        }
    }

    @PutMapping("/{sceneId}")
    public ResponseEntity<?> updateScene(@PathVariable String sceneId, @RequestBody SceneUpdateRequest request) {
        try {
            return ResponseEntity.ok(
                    sceneService.updateScene(sceneId, request.prompt(), request.code(), request.orderIndex()));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }

    @DeleteMapping("/{sceneId}")
    public ResponseEntity<?> deleteScene(@PathVariable String sceneId) {
        try {
            sceneService.deleteScene(sceneId);
            return ResponseEntity.noContent().build();
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        }
    }

    @PostMapping("/{sceneId}/regenerate")
    public ResponseEntity<?> regenerateScene(
            @PathVariable String sceneId,
            @RequestParam(value = "newPrompt", required = false) String newPrompt) {
        try {
            return ResponseEntity.ok(sceneService.regenerateScene(sceneId, newPrompt));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        }
    }

    @PostMapping("/validate")
    public CodeValidationResponse validateCode(@RequestBody CodeValidationRequest request) {
        try {
            codeValidator.validate(request.code());
            return CodeValidationResponse.passed();
        } catch (InvalidSceneCodeException e) {
            return CodeValidationResponse.rejected(e);
        }
    }
}
