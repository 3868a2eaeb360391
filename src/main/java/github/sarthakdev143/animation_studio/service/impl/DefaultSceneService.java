package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.model.Scene;
import github.sarthakdev143.animation_studio.model.SceneStatus;
import github.sarthakdev143.animation_studio.service.SceneCodeGenerator;
import github.sarthakdev143.animation_studio.service.ScenePart;
import github.sarthakdev143.animation_studio.service.SceneService;
import github.sarthakdev143.animation_studio.store.StudioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class DefaultSceneService implements SceneService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSceneService.class);
    private static final int MAX_PROMPT_LENGTH = 2000;
    private static final int MAX_SCENES_PER_REQUEST = 10;

    private final StudioStore store;
    private final SceneCodeGenerator codeGenerator;

    public DefaultSceneService(StudioStore store, SceneCodeGenerator codeGenerator) {
        this.store = store;
        this.codeGenerator = codeGenerator;
    }

    @Override
    public Scene createScene(String projectId, String prompt) {
        validatePrompt(prompt);
        Project project = store.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));

        int orderIndex = nextOrderIndex(project);
        Instant now = Instant.now();
        Scene scene = store.saveScene(new Scene(
                UUID.randomUUID().toString(),
                projectId,
                prompt,
                null,
                SceneStatus.GENERATING,
                null,
                null,
                0,
                orderIndex,
                null,
                now,
                now));
        store.updateProject(projectId, current -> current.withSceneAdded(scene.id()));
        logger.info("Created scene {} in project {} at index {}", scene.id(), projectId, orderIndex);

        return generateCode(scene.id(), prompt);
    }

    @Override
    public List<Scene> createScenes(String projectId, String prompt, int sceneCount) {
        validatePrompt(prompt);
        if (sceneCount < 1 || sceneCount > MAX_SCENES_PER_REQUEST) {
            throw new IllegalArgumentException(
                    "Number of scenes must be between 1 and " + MAX_SCENES_PER_REQUEST + ".");
        }
        Project project = store.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));

        List<ScenePart> parts = codeGenerator.generateSequence(prompt, sceneCount);
        int firstIndex = nextOrderIndex(project);
        Instant now = Instant.now();
        List<Scene> created = new ArrayList<>(parts.size());
        for (int offset = 0; offset < parts.size(); offset++) {
            ScenePart part = parts.get(offset);
            Scene scene = store.saveScene(new Scene(
                    UUID.randomUUID().toString(),
                    projectId,
                    part.prompt(),
                    part.code(),
                    SceneStatus.PENDING,
                    null,
                    null,
                    0,
                    firstIndex + offset,
                    null,
                    now,
                    now));
            store.updateProject(projectId, current -> current.withSceneAdded(scene.id()));
            created.add(scene);
        }
        logger.info("Created {} scenes in project {} from index {}", created.size(), projectId, firstIndex);
        return List.copyOf(created);
    }

    @Override
    public List<Scene> listScenes(String projectId) {
        Project project = store.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
        return store.scenesForProject(project);
    }

    @Override
    public Scene getScene(String sceneId) {
        return store.findScene(sceneId)
                .orElseThrow(() -> new ResourceNotFoundException("Scene not found"));
    }

    @Override
    public Scene updateScene(String sceneId, String prompt, String code, Integer orderIndex) {
        Scene existing = getScene(sceneId);
        if (prompt != null) {
            validatePrompt(prompt);
        }
        if (orderIndex != null) {
            validateOrderIndex(existing, orderIndex);
        }

        return store.updateScene(sceneId, current -> current.withEdits(
                        prompt != null ? prompt : current.prompt(),
                        code != null ? code : current.code(),
                        orderIndex != null ? orderIndex : current.orderIndex()))
                .orElseThrow(() -> new ResourceNotFoundException("Scene not found"));
    }

    @Override
    public void deleteScene(String sceneId) {
        Scene removed = store.removeScene(sceneId)
                .orElseThrow(() -> new ResourceNotFoundException("Scene not found"));
        store.updateProject(removed.projectId(), current -> current.withSceneRemoved(sceneId));
        logger.info("Deleted scene {} from project {}", sceneId, removed.projectId());
    }

    @Override
    public Scene regenerateScene(String sceneId, String newPrompt) {
        Scene existing = getScene(sceneId);
        String prompt = newPrompt != null && !newPrompt.isBlank() ? newPrompt : existing.prompt();
        validatePrompt(prompt);

        store.updateScene(sceneId, current -> current.withStatus(SceneStatus.GENERATING));
        return generateCode(sceneId, prompt);
    }

    private Scene generateCode(String sceneId, String prompt) {
        try {
            String code = codeGenerator.generate(prompt);
            return store.updateScene(sceneId, current -> current.withGeneratedCode(prompt, code))
                    .orElseThrow(() -> new ResourceNotFoundException("Scene not found"));
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Code generation failed for scene {}", sceneId, e);
            return store.updateScene(sceneId, current -> current.failed(e.getMessage()))
                    .orElseThrow(() -> new ResourceNotFoundException("Scene not found"));
        }
    }

    private int nextOrderIndex(Project project) {
        return store.scenesForProject(project)
                .stream()
                .mapToInt(Scene::orderIndex)
                .max()
                .orElse(-1) + 1;
    }

    private void validatePrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required.");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("Prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
        }
    }

    private void validateOrderIndex(Scene scene, int orderIndex) {
        if (orderIndex < 0) {
            throw new IllegalArgumentException("Order index must not be negative.");
        }
        store.findProject(scene.projectId())
                .map(store::scenesForProject)
                .orElse(List.of())
                .stream()
                .filter(other -> !other.id().equals(scene.id()))
                .filter(other -> other.orderIndex() == orderIndex)
                .findFirst()
                .ifPresent(other -> {
                    throw new IllegalArgumentException(
                            "Order index " + orderIndex + " is already used by scene " + other.id() + ".");
                });
    }
}
