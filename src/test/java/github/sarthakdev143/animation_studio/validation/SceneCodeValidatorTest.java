package github.sarthakdev143.animation_studio.validation;

import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException;
import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException.MissingElement;
import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException.Reason;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SceneCodeValidatorTest {

    private static final String VALID_SCENE = """
            from manim import *

            class GeneratedScene(Scene):
                def construct(self):
                    circle = Circle(color=BLUE, fill_opacity=0.5)
                    self.play(Create(circle))
                    self.wait(1)
            """;

    private final SceneCodeValidator validator = new SceneCodeValidator();

    @Test
    void acceptsWellFormedScene() {
        assertThatCode(() -> validator.validate(VALID_SCENE)).doesNotThrowAnyException();
    }

    @Test
    void acceptsPlainModuleImport() {
        String code = """
                import manim

                class Intro(Scene):
                    def construct(self):
                        pass
                """;

        assertThatCode(() -> validator.validate(code)).doesNotThrowAnyException();
    }

    @Test
    void rejectsBlankCode() {
        InvalidSceneCodeException error = validationError("   \n\t ");

        assertThat(error.reason()).isEqualTo(Reason.EMPTY_CODE);
        assertThat(error).hasMessage("Code is empty");
        assertThat(validationError("").reason()).isEqualTo(Reason.EMPTY_CODE);
    }

    @Test
    void reportsSyntaxErrorWithLineNumber() {
        String code = """
                from manim import *

                class GeneratedScene(Scene)
                    def construct(self):
                        pass
                """;

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.reason()).isEqualTo(Reason.SYNTAX_INVALID);
        assertThat(error.lineNumber()).isEqualTo(3);
        assertThat(error).hasMessage("Syntax error at line 3: expected ':'");
    }

    @Test
    void checksSyntaxBeforeDangerousPatterns() {
        String code = "from manim import *\neval('1'\n";

        assertThat(validationError(code).reason()).isEqualTo(Reason.SYNTAX_INVALID);
    }

    @Test
    void reportsDeeplyNestedBlocksAsSyntaxError() {
        StringBuilder code = new StringBuilder("from manim import *\n");
        for (int level = 0; level < 3000; level++) {
            code.append(" ".repeat(level)).append("if True:\n");
        }
        code.append(" ".repeat(3000)).append("pass\n");

        InvalidSceneCodeException error = validationError(code.toString());

        assertThat(error.reason()).isEqualTo(Reason.SYNTAX_INVALID);
        assertThat(error.lineNumber()).isEqualTo(103);
        assertThat(error).hasMessage("Syntax error at line 103: too many levels of indentation");
    }

    @Test
    void listsEveryMatchedDangerousPattern() {
        String code = """
                from manim import *
                import os

                class GeneratedScene(Scene):
                    def construct(self):
                        eval("1 + 1")
                """;

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.reason()).isEqualTo(Reason.UNSAFE_CONSTRUCT);
        assertThat(error.matchedPatterns()).containsExactly("\\beval\\s*\\(", "\\bimport\\s+os\\b");
        assertThat(error).hasMessage("Code contains dangerous patterns: \\beval\\s*\\(, \\bimport\\s+os\\b");
    }

    @Test
    void scansCommentsAndStringsToo() {
        String code = VALID_SCENE + "        # os.remove('x')\n";

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.reason()).isEqualTo(Reason.UNSAFE_CONSTRUCT);
        assertThat(error.matchedPatterns()).containsExactly("\\bos\\.");
    }

    @Test
    void doesNotFlagIdentifiersThatMerelyContainDeniedNames() {
        String code = VALID_SCENE + "        positions.append(reopen(1))\n";

        assertThatCode(() -> validator.validate(code)).doesNotThrowAnyException();
    }

    @Test
    void requiresEngineImport() {
        String code = """
                class GeneratedScene(Scene):
                    def construct(self):
                        pass
                """;

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.reason()).isEqualTo(Reason.STRUCTURE_INVALID);
        assertThat(error.missingElement()).isEqualTo(MissingElement.ENGINE_IMPORT);
        assertThat(error).hasMessage("Code must import from manim (e.g., 'from manim import *')");
    }

    @Test
    void requiresClassDerivingFromScene() {
        String code = """
                from manim import *

                class GeneratedScene(MovingCameraScene):
                    def construct(self):
                        pass
                """;

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.missingElement()).isEqualTo(MissingElement.SCENE_CLASS);
        assertThat(error).hasMessage("Code must define a class that inherits from Scene");
    }

    @Test
    void requiresConstructMethodOnSceneClass() {
        String code = """
                from manim import *

                class GeneratedScene(Scene):
                    def setup(self):
                        pass

                def construct(self):
                    pass
                """;

        InvalidSceneCodeException error = validationError(code);

        assertThat(error.missingElement()).isEqualTo(MissingElement.CONSTRUCT_METHOD);
        assertThat(error).hasMessage("Scene class must have a construct method");
    }

    @Test
    void acceptsConstructOnAnyOfSeveralSceneClasses() {
        String code = """
                from manim import *

                class Helper(Scene):
                    pass

                class GeneratedScene(Scene):
                    def construct(self):
                        pass
                """;

        assertThatCode(() -> validator.validate(code)).doesNotThrowAnyException();
    }

    @Test
    void givesSameVerdictOnRepeatedCalls() {
        String code = "from manim import *\nx = 1\n";

        InvalidSceneCodeException first = validationError(code);
        InvalidSceneCodeException second = validationError(code);

        assertThat(second.reason()).isEqualTo(first.reason());
        assertThat(second.missingElement()).isEqualTo(first.missingElement());
        assertThat(second).hasMessage(first.getMessage());
    }

    private InvalidSceneCodeException validationError(String code) {
        try {
            validator.validate(code);
        } catch (InvalidSceneCodeException e) {
            return e;
        }
        throw new AssertionError("Expected validation to fail for:\n" + code);
    }
}
