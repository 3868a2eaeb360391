package github.sarthakdev143.animation_studio.integration.codegen;

import github.sarthakdev143.animation_studio.integration.codegen.TopicOutline.Part;
import github.sarthakdev143.animation_studio.service.SceneCodeGenerator;
import github.sarthakdev143.animation_studio.service.ScenePart;
import github.sarthakdev143.animation_studio.validation.SceneCodeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks a bundled scene template by prompt keywords. Rules are checked in order and the
 * first rule with a matching keyword wins; prompts matching nothing get the default template.
 *
 * <p>Multi-scene sequences follow a {@link TopicOutline}: the first part is an introduction,
 * the last a summary, and the parts in between pick a part template by their description.
 */
@Component
public class TemplateSceneCodeGenerator implements SceneCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(TemplateSceneCodeGenerator.class);
    private static final String TEMPLATE_LOCATION = "scene-templates/";
    private static final String PART_TEMPLATE_LOCATION = TEMPLATE_LOCATION + "parts/";
    private static final String DEFAULT_TEMPLATE = "default";
    private static final String INTRO_PART = "intro";
    private static final String SUMMARY_PART = "summary";
    private static final String GENERIC_PART = "generic";
    private static final int CAPTION_LENGTH = 50;
    private static final List<String> PART_COLORS = List.of("BLUE", "RED", "GREEN", "PURPLE", "ORANGE");

    static final List<TemplateRule> RULES = List.of(
            new TemplateRule("pythagorean", List.of("pythagorean", "theorem")),
            new TemplateRule("sort", List.of("sort", "bubble", "algorithm")),
            new TemplateRule("client_server", List.of("client", "server", "database", "request")),
            new TemplateRule("neural_network", List.of("neural", "network", "ai", "machine learning")),
            new TemplateRule("formula", List.of("formula", "equation", "quadratic", "euler")),
            new TemplateRule("transform", List.of("transform", "morph", "change")),
            new TemplateRule("triangle", List.of("triangle")),
            new TemplateRule("circle", List.of("circle")),
            new TemplateRule("square", List.of("square", "rectangle")));

    static final List<TemplateRule> PART_RULES = List.of(
            new TemplateRule("array", List.of("array", "unsorted")),
            new TemplateRule("compare_swap", List.of("compare", "swap")),
            new TemplateRule("layer", List.of("node", "layer")),
            new TemplateRule("geometry", List.of("triangle", "geometry")),
            new TemplateRule("flow", List.of("flow", "request", "response")));

    private final SceneCodeValidator codeValidator;
    private final Map<String, String> templates;
    private final Map<String, String> partTemplates;

    public TemplateSceneCodeGenerator(SceneCodeValidator codeValidator) {
        this.codeValidator = codeValidator;
        this.templates = loadTemplates();
        this.partTemplates = loadPartTemplates();
    }

    @Override
    public String generate(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required.");
        }

        String templateName = selectTemplate(prompt);
        String code = templates.get(templateName);
        codeValidator.validate(code);
        logger.info("Generated scene code from template {}", templateName);
        return code;
    }

    @Override
    public List<ScenePart> generateSequence(String prompt, int sceneCount) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required.");
        }
        if (sceneCount < 1) {
            throw new IllegalArgumentException("Scene count must be at least 1.");
        }

        List<Part> outline = TopicOutline.outline(prompt);
        List<Part> parts = outline.subList(0, Math.min(sceneCount, outline.size()));
        List<ScenePart> generated = new ArrayList<>(parts.size());
        for (int index = 0; index < parts.size(); index++) {
            Part part = parts.get(index);
            String code = renderPart(part, index, parts.size());
            codeValidator.validate(code);
            generated.add(new ScenePart(part.title(), code));
        }
        logger.info("Generated {} scene parts starting with '{}'", generated.size(), parts.get(0).heading());
        return List.copyOf(generated);
    }

    String renderPart(Part part, int index, int total) {
        String heading = index == 0 ? part.heading() : part.title();
        return partTemplates.get(selectPartTemplate(part, index, total))
                .replace("{{title}}", pythonStringContent(heading))
                .replace("{{caption}}", pythonStringContent(caption(part.description())))
                .replace("{{color}}", PART_COLORS.get(index % PART_COLORS.size()));
    }

    static String selectPartTemplate(Part part, int index, int total) {
        if (index == 0) {
            return INTRO_PART;
        }
        if (index == total - 1) {
            return SUMMARY_PART;
        }
        String description = part.description().toLowerCase(Locale.ROOT);
        return PART_RULES.stream()
                .filter(rule -> rule.keywords().stream().anyMatch(description::contains))
                .map(TemplateRule::templateName)
                .findFirst()
                .orElse(GENERIC_PART);
    }

    private static String caption(String description) {
        return description.length() > CAPTION_LENGTH
                ? description.substring(0, CAPTION_LENGTH) + "..."
                : description;
    }

    /**
     * Escapes text for the inside of a double-quoted Python string literal.
     */
    static String pythonStringContent(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace('\n', ' ')
                .replace('\r', ' ');
    }

    String selectTemplate(String prompt) {
        String normalized = prompt.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.keywords().stream().anyMatch(normalized::contains))
                .map(TemplateRule::templateName)
                .findFirst()
                .orElse(DEFAULT_TEMPLATE);
    }

    private static Map<String, String> loadTemplates() {
        Map<String, String> loaded = new LinkedHashMap<>();
        for (TemplateRule rule : RULES) {
            loaded.put(rule.templateName(), readTemplate(rule.templateName()));
        }
        loaded.put(DEFAULT_TEMPLATE, readTemplate(DEFAULT_TEMPLATE));
        return Map.copyOf(loaded);
    }

    private static Map<String, String> loadPartTemplates() {
        Map<String, String> loaded = new LinkedHashMap<>();
        for (TemplateRule rule : PART_RULES) {
            loaded.put(rule.templateName(), readTemplate(PART_TEMPLATE_LOCATION, rule.templateName()));
        }
        for (String name : List.of(INTRO_PART, SUMMARY_PART, GENERIC_PART)) {
            loaded.put(name, readTemplate(PART_TEMPLATE_LOCATION, name));
        }
        return Map.copyOf(loaded);
    }

    private static String readTemplate(String name) {
        return readTemplate(TEMPLATE_LOCATION, name);
    }

    private static String readTemplate(String location, String name) {
        ClassPathResource resource = new ClassPathResource(location + name + ".py");
        try (InputStream inputStream = resource.getInputStream()) {
            return StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load scene template " + name, e);
        }
    }

    record TemplateRule(String templateName, List<String> keywords) {
    }
}
