package github.sarthakdev143.animation_studio.validation;

import java.util.Set;

public record PythonToken(PythonTokenType type, String text, int line) {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    public boolean isOp(String value) {
        return type == PythonTokenType.OP && text.equals(value);
    }

    public boolean isKeyword(String value) {
        return type == PythonTokenType.NAME && text.equals(value);
    }

    public boolean isKeyword() {
        return type == PythonTokenType.NAME && KEYWORDS.contains(text);
    }

    public boolean isIdentifier() {
        return type == PythonTokenType.NAME && !KEYWORDS.contains(text);
    }
}
