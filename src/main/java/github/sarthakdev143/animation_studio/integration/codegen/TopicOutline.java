package github.sarthakdev143.animation_studio.integration.codegen;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered breakdowns of well-known topics into five scene parts. The first outline whose
 * keyword appears in the prompt wins; other prompts get a generic breakdown built from the
 * prompt's own words.
 */
final class TopicOutline {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "how", "what", "why", "show", "explain", "create", "make",
            "visualize", "animate", "demonstrate");
    private static final int TOPIC_WORDS = 4;

    static final List<Rule> RULES = List.of(
            new Rule(List.of("sort", "bubble"), List.of(
                    new Part("Introduction", "Title: Bubble Sort Algorithm - How it works"),
                    new Part("Unsorted Array", "Show initial unsorted array of numbers"),
                    new Part("Compare & Swap", "Demonstrate comparing adjacent elements and swapping"),
                    new Part("Multiple Passes", "Show multiple passes through the array"),
                    new Part("Sorted Result", "Show final sorted array with summary"))),
            new Rule(List.of("binary search", "search"), List.of(
                    new Part("Introduction", "Title: Binary Search - Efficient searching"),
                    new Part("Sorted Array", "Show a sorted array we'll search in"),
                    new Part("Find Middle", "Highlight the middle element"),
                    new Part("Compare & Narrow", "Compare target with middle, narrow search range"),
                    new Part("Found Target", "Show successful search with complexity O(log n)"))),
            new Rule(List.of("neural", "network", "deep learning"), List.of(
                    new Part("Introduction", "Title: Neural Networks Explained"),
                    new Part("Input Layer", "Show input neurons receiving data"),
                    new Part("Hidden Layers", "Visualize hidden layer processing"),
                    new Part("Weights & Connections", "Animate data flowing through connections"),
                    new Part("Output Layer", "Show final output and prediction"))),
            new Rule(List.of("pythagorean", "theorem"), List.of(
                    new Part("Introduction", "Title: The Pythagorean Theorem"),
                    new Part("Right Triangle", "Draw a right triangle with sides a, b, c"),
                    new Part("Squares on Sides", "Draw squares on each side of the triangle"),
                    new Part("Area Comparison", "Show a² + b² = c² visually"),
                    new Part("Formula", "Display the famous equation"))),
            new Rule(List.of("client", "server", "api"), List.of(
                    new Part("Introduction", "Title: Client-Server Architecture"),
                    new Part("The Client", "Show client making a request"),
                    new Part("The Server", "Server receives and processes request"),
                    new Part("Database Query", "Server queries the database"),
                    new Part("Response Flow", "Data flows back to client"))),
            new Rule(List.of("recursion", "fibonacci"), List.of(
                    new Part("Introduction", "Title: Recursion & Fibonacci"),
                    new Part("Base Case", "Show the base case F(0)=0, F(1)=1"),
                    new Part("Recursive Call", "Visualize function calling itself"),
                    new Part("Call Stack", "Show the call stack building up"),
                    new Part("Result", "Show final computed value"))),
            new Rule(List.of("tree"), List.of(
                    new Part("Introduction", "Title: Binary Tree Data Structure"),
                    new Part("Root Node", "Create and show the root node"),
                    new Part("Adding Children", "Add left and right children"),
                    new Part("Tree Traversal", "Show in-order, pre-order traversal"),
                    new Part("Complete Tree", "Display the full tree structure"))),
            new Rule(List.of("stack"), List.of(
                    new Part("Introduction", "Title: Stack (LIFO) Data Structure"),
                    new Part("Empty Structure", "Show empty stack/queue"),
                    new Part("Push/Enqueue", "Add elements to the structure"),
                    new Part("Pop/Dequeue", "Remove elements showing order"),
                    new Part("Use Cases", "Show common applications"))),
            new Rule(List.of("queue"), List.of(
                    new Part("Introduction", "Title: Queue (FIFO) Data Structure"),
                    new Part("Empty Structure", "Show empty stack/queue"),
                    new Part("Push/Enqueue", "Add elements to the structure"),
                    new Part("Pop/Dequeue", "Remove elements showing order"),
                    new Part("Use Cases", "Show common applications"))),
            new Rule(List.of("graph", "bfs", "dfs"), List.of(
                    new Part("Introduction", "Title: Graph Traversal Algorithms"),
                    new Part("Create Graph", "Show nodes and edges"),
                    new Part("Start Node", "Highlight the starting node"),
                    new Part("Traversal Steps", "Animate visiting each node"),
                    new Part("Visited All", "Show complete traversal path"))),
            new Rule(List.of("array", "list"), List.of(
                    new Part("Introduction", "Title: Arrays and Lists"),
                    new Part("Create Array", "Show array with indices"),
                    new Part("Access Element", "Highlight accessing by index O(1)"),
                    new Part("Insert/Delete", "Show insert and delete operations"),
                    new Part("Summary", "Compare time complexities"))));

    private TopicOutline() {
    }

    static List<Part> outline(String prompt) {
        String normalized = prompt.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.keywords().stream().anyMatch(normalized::contains))
                .map(Rule::parts)
                .findFirst()
                .orElseGet(() -> genericOutline(prompt));
    }

    static List<Part> genericOutline(String prompt) {
        String topic = topicOf(prompt);
        return List.of(
                new Part("Introduction", "Title: " + topic),
                new Part("Core Concept", "Explain the main idea of " + topic),
                new Part("Visualization", "Visual demonstration of " + topic),
                new Part("Details", "Additional details and examples"),
                new Part("Summary", "Recap of " + topic + " with key points"));
    }

    /**
     * Title-cased first few significant words of the prompt, letters and digits only.
     */
    static String topicOf(String prompt) {
        String topic = Arrays.stream(prompt.trim().split("\\s+"))
                .map(word -> word.replaceAll("[^\\p{L}\\p{N}]", ""))
                .filter(word -> word.length() > 3 && !STOP_WORDS.contains(word.toLowerCase(Locale.ROOT)))
                .limit(TOPIC_WORDS)
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT)
                        + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
        return topic.isEmpty() ? "Animation" : topic;
    }

    record Rule(List<String> keywords, List<Part> parts) {
    }

    record Part(String title, String description) {

        /**
         * Heading shown on screen; introductions use the text after {@code Title:}.
         */
        String heading() {
            int marker = description.indexOf("Title:");
            return marker >= 0 ? description.substring(marker + "Title:".length()).trim() : title;
        }
    }
}
