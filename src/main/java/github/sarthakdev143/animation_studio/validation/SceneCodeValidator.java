package github.sarthakdev143.animation_studio.validation;

import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException;
import github.sarthakdev143.animation_studio.exception.InvalidSceneCodeException.MissingElement;
import github.sarthakdev143.animation_studio.validation.PythonStatement.ClassDefinition;
import github.sarthakdev143.animation_studio.validation.PythonStatement.FunctionDefinition;
import github.sarthakdev143.animation_studio.validation.PythonStatement.ImportFromStatement;
import github.sarthakdev143.animation_studio.validation.PythonStatement.ImportStatement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Gates generated scene code before it reaches the render engine. Checks run in order and
 * stop at the first failure: emptiness, syntax, denylisted patterns, then scene structure.
 * Nothing is executed.
 */
@Component
public class SceneCodeValidator {

    static final List<String> DANGEROUS_PATTERNS = List.of(
            "\\bos\\.",
            "\\bsys\\.",
            "\\bsubprocess\\.",
            "\\bopen\\s*\\(",
            "\\beval\\s*\\(",
            "\\bexec\\s*\\(",
            "\\bcompile\\s*\\(",
            "\\b__import__\\s*\\(",
            "\\bimport\\s+os\\b",
            "\\bimport\\s+sys\\b",
            "\\bimport\\s+subprocess\\b",
            "\\bfrom\\s+os\\b",
            "\\bfrom\\s+sys\\b",
            "\\bfrom\\s+subprocess\\b",
            "\\bshutil\\.",
            "\\brequests\\.",
            "\\burllib\\.",
            "\\bsocket\\.",
            "\\bpickle\\.");

    private static final String ENGINE_MODULE = "manim";
    private static final String SCENE_BASE_CLASS = "Scene";
    private static final String ENTRY_METHOD = "construct";

    private final List<Pattern> dangerousPatterns = DANGEROUS_PATTERNS.stream()
            .map(Pattern::compile)
            .toList();

    public void validate(String code) {
        if (code == null || code.isBlank()) {
            throw InvalidSceneCodeException.emptyCode();
        }

        PythonModule module;
        try {
            module = PythonModuleParser.parse(code);
        } catch (PythonSyntaxException e) {
            throw InvalidSceneCodeException.syntaxInvalid(e.lineNumber(), e.getMessage());
        }

        List<String> matched = new ArrayList<>();
        for (Pattern pattern : dangerousPatterns) {
            if (pattern.matcher(code).find()) {
                matched.add(pattern.pattern());
            }
        }
        if (!matched.isEmpty()) {
            throw InvalidSceneCodeException.unsafeConstruct(matched);
        }

        checkStructure(module);
    }

    private void checkStructure(PythonModule module) {
        List<PythonStatement> statements = module.walk();

        boolean importsEngine = statements.stream().anyMatch(this::importsEngine);
        if (!importsEngine) {
            throw InvalidSceneCodeException.structureInvalid(
                    MissingElement.ENGINE_IMPORT,
                    "Code must import from manim (e.g., 'from manim import *')");
        }

        List<ClassDefinition> sceneClasses = statements.stream()
                .filter(ClassDefinition.class::isInstance)
                .map(ClassDefinition.class::cast)
                .filter(definition -> definition.bases().contains(SCENE_BASE_CLASS))
                .toList();
        if (sceneClasses.isEmpty()) {
            throw InvalidSceneCodeException.structureInvalid(
                    MissingElement.SCENE_CLASS,
                    "Code must define a class that inherits from Scene");
        }

        boolean hasEntryMethod = sceneClasses.stream()
                .flatMap(definition -> definition.body().stream())
                .anyMatch(statement -> statement instanceof FunctionDefinition function
                        && !function.async()
                        && function.name().equals(ENTRY_METHOD));
        if (!hasEntryMethod) {
            throw InvalidSceneCodeException.structureInvalid(
                    MissingElement.CONSTRUCT_METHOD,
                    "Scene class must have a construct method");
        }
    }

    private boolean importsEngine(PythonStatement statement) {
        if (statement instanceof ImportFromStatement importFrom) {
            return importFrom.module().equals(ENGINE_MODULE);
        }
        if (statement instanceof ImportStatement importStatement) {
            return importStatement.modules().contains(ENGINE_MODULE);
        }
        return false;
    }
}
