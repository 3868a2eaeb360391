package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.model.Scene;
import github.sarthakdev143.animation_studio.model.SceneStatus;
import github.sarthakdev143.animation_studio.service.SceneCodeGenerator;
import github.sarthakdev143.animation_studio.service.ScenePart;
import github.sarthakdev143.animation_studio.store.StudioStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultSceneServiceTest {

    @Mock
    private SceneCodeGenerator codeGenerator;

    private StudioStore store;
    private DefaultSceneService service;

    @BeforeEach
    void setUp() {
        store = new StudioStore();
        service = new DefaultSceneService(store, codeGenerator);
        Instant now = Instant.now();
        store.saveProject(new Project("project-1", "Project", null, List.of(), null, now, now));
    }

    @Test
    void createSceneGeneratesCodeAndAppendsToProject() {
        when(codeGenerator.generate("a red circle")).thenReturn("circle code");
        when(codeGenerator.generate("a blue square")).thenReturn("square code");

        Scene first = service.createScene("project-1", "a red circle");
        Scene second = service.createScene("project-1", "a blue square");

        assertThat(first.status()).isEqualTo(SceneStatus.PENDING);
        assertThat(first.code()).isEqualTo("circle code");
        assertThat(first.orderIndex()).isZero();
        assertThat(second.orderIndex()).isEqualTo(1);
        assertThat(store.findProject("project-1").orElseThrow().sceneIds())
                .containsExactly(first.id(), second.id());
        assertThat(service.listScenes("project-1")).extracting(Scene::id).containsExactly(first.id(), second.id());
    }

    @Test
    void createSceneRecordsGenerationFailureOnTheScene() {
        when(codeGenerator.generate(anyString())).thenThrow(new IllegalStateException("generator unavailable"));

        Scene scene = service.createScene("project-1", "a red circle");

        assertThat(scene.status()).isEqualTo(SceneStatus.FAILED);
        assertThat(scene.errorMessage()).isEqualTo("generator unavailable");
        assertThat(scene.hasCode()).isFalse();
    }

    @Test
    void createSceneValidatesPromptAndProject() {
        assertThatThrownBy(() -> service.createScene("project-1", " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prompt is required.");
        assertThatThrownBy(() -> service.createScene("project-1", "x".repeat(2001)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prompt must be at most 2000 characters.");
        assertThatThrownBy(() -> service.createScene("missing", "a red circle"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Project not found");
        verifyNoInteractions(codeGenerator);
    }

    @Test
    void createScenesAppendsPartsWithConsecutiveOrderIndices() {
        when(codeGenerator.generate("a red circle")).thenReturn("circle code");
        Scene existing = service.createScene("project-1", "a red circle");
        when(codeGenerator.generateSequence("bubble sort", 3)).thenReturn(List.of(
                new ScenePart("Introduction", "intro code"),
                new ScenePart("Unsorted Array", "array code"),
                new ScenePart("Compare & Swap", "swap code")));

        List<Scene> created = service.createScenes("project-1", "bubble sort", 3);

        assertThat(created).extracting(Scene::prompt)
                .containsExactly("Introduction", "Unsorted Array", "Compare & Swap");
        assertThat(created).extracting(Scene::orderIndex).containsExactly(1, 2, 3);
        assertThat(created).extracting(Scene::code).containsExactly("intro code", "array code", "swap code");
        assertThat(created).allSatisfy(scene -> {
            assertThat(scene.status()).isEqualTo(SceneStatus.PENDING);
            assertThat(scene.projectId()).isEqualTo("project-1");
        });
        assertThat(store.findProject("project-1").orElseThrow().sceneIds())
                .containsExactly(existing.id(), created.get(0).id(), created.get(1).id(), created.get(2).id());
    }

    @Test
    void createScenesValidatesPromptCountAndProject() {
        assertThatThrownBy(() -> service.createScenes("project-1", "", 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prompt is required.");
        assertThatThrownBy(() -> service.createScenes("project-1", "bubble sort", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Number of scenes must be between 1 and 10.");
        assertThatThrownBy(() -> service.createScenes("project-1", "bubble sort", 11))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Number of scenes must be between 1 and 10.");
        assertThatThrownBy(() -> service.createScenes("missing", "bubble sort", 5))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Project not found");
        verifyNoInteractions(codeGenerator);
        assertThat(store.findProject("project-1").orElseThrow().sceneIds()).isEmpty();
    }

    @Test
    void updateSceneAppliesOnlyProvidedFields() {
        when(codeGenerator.generate("a red circle")).thenReturn("circle code");
        Scene scene = service.createScene("project-1", "a red circle");

        Scene updated = service.updateScene(scene.id(), null, "edited code", 4);

        assertThat(updated.prompt()).isEqualTo("a red circle");
        assertThat(updated.code()).isEqualTo("edited code");
        assertThat(updated.orderIndex()).isEqualTo(4);
    }

    @Test
    void updateSceneRejectsOrderIndexUsedByAnotherScene() {
        when(codeGenerator.generate(anyString())).thenReturn("code");
        Scene first = service.createScene("project-1", "first");
        Scene second = service.createScene("project-1", "second");

        assertThatThrownBy(() -> service.updateScene(second.id(), null, null, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Order index 0 is already used by scene " + first.id() + ".");
        assertThatThrownBy(() -> service.updateScene(second.id(), null, null, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Order index must not be negative.");
        assertThat(service.updateScene(second.id(), null, null, 1).orderIndex()).isEqualTo(1);
    }

    @Test
    void deleteSceneRemovesItFromTheProject() {
        when(codeGenerator.generate(anyString())).thenReturn("code");
        Scene scene = service.createScene("project-1", "a red circle");

        service.deleteScene(scene.id());

        assertThat(store.findScene(scene.id())).isEmpty();
        assertThat(store.findProject("project-1").orElseThrow().sceneIds()).isEmpty();
        assertThatThrownBy(() -> service.getScene(scene.id()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Scene not found");
    }

    @Test
    void regenerateSceneUsesNewPromptAndClearsRenderedVideo() {
        when(codeGenerator.generate("a red circle")).thenReturn("circle code");
        when(codeGenerator.generate("a blue square")).thenReturn("square code");
        Scene scene = service.createScene("project-1", "a red circle");

        Scene regenerated = service.regenerateScene(scene.id(), "a blue square");

        assertThat(regenerated.prompt()).isEqualTo("a blue square");
        assertThat(regenerated.code()).isEqualTo("square code");
        assertThat(regenerated.status()).isEqualTo(SceneStatus.PENDING);
        assertThat(regenerated.videoUrl()).isNull();
    }

    @Test
    void regenerateSceneFallsBackToExistingPrompt() {
        when(codeGenerator.generate("a red circle")).thenReturn("circle code");
        Scene scene = service.createScene("project-1", "a red circle");

        Scene regenerated = service.regenerateScene(scene.id(), "  ");

        assertThat(regenerated.prompt()).isEqualTo("a red circle");
        verify(codeGenerator, times(2)).generate("a red circle");
    }
}
