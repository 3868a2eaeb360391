package github.sarthakdev143.animation_studio.validation;

public enum PythonTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    END_MARKER
}
