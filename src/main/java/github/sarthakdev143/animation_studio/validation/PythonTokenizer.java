package github.sarthakdev143.animation_studio.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits Python source into tokens, tracking indentation and bracket nesting the way the
 * reference tokenizer does. Errors carry the 1-based line they were detected on.
 */
public class PythonTokenizer {

    private static final int TAB_SIZE = 8;
    static final int MAX_INDENT_LEVELS = 100;
    static final int MAX_BRACKET_NESTING = 200;
    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");
    private static final List<String> THREE_CHAR_OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...");
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=",
            "%=", "&=", "|=", "^=", "@=", ":=");
    private static final String ONE_CHAR_OPERATORS = "+-*/%@&|^~<>()[]{},:.;=";
    private static final Map<Character, Character> CLOSING_TO_OPENING = Map.of(
            ')', '(',
            ']', '[',
            '}', '{');
    private static final Pattern NUMBER_PATTERN = Pattern.compile(
            "(?i)0x[0-9a-f_]+|0o[0-7_]+|0b[01_]+|(\\d[\\d_]*\\.?[\\d_]*|\\.\\d[\\d_]*)(e[+-]?\\d[\\d_]*)?j?");

    private final String source;
    private final List<PythonToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<OpenBracket> brackets = new ArrayDeque<>();
    private int position;
    private int line = 1;

    public PythonTokenizer(String source) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
    }

    public List<PythonToken> tokenize() {
        indents.push(0);
        boolean atLineStart = true;

        while (position < source.length()) {
            if (atLineStart && brackets.isEmpty()) {
                atLineStart = false;
                if (!readIndentation()) {
                    atLineStart = true;
                    continue;
                }
            }

            char current = source.charAt(position);
            if (current == ' ' || current == '\t' || current == '\f') {
                position++;
            } else if (current == '#') {
                skipComment();
            } else if (current == '\\') {
                readLineContinuation();
            } else if (current == '\n') {
                position++;
                if (brackets.isEmpty()) {
                    emitNewlineIfStatementOpen();
                    atLineStart = true;
                }
                line++;
            } else if (current == '\'' || current == '"') {
                readString(position);
            } else if (Character.isDigit(current)
                    || (current == '.' && position + 1 < source.length() && Character.isDigit(source.charAt(position + 1)))) {
                readNumber();
            } else if (isIdentifierStart(current)) {
                readNameOrPrefixedString();
            } else {
                readOperator(current);
            }
        }

        if (!brackets.isEmpty()) {
            OpenBracket unclosed = brackets.peek();
            throw new PythonSyntaxException(unclosed.line(), "'" + unclosed.symbol() + "' was never closed");
        }
        emitNewlineIfStatementOpen();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new PythonToken(PythonTokenType.DEDENT, "", line));
        }
        tokens.add(new PythonToken(PythonTokenType.END_MARKER, "", line));
        return tokens;
    }

    /**
     * Measures the indentation of a physical line. Returns false for blank and comment-only
     * lines, which do not take part in indentation.
     */
    private boolean readIndentation() {
        int column = 0;
        while (position < source.length()) {
            char current = source.charAt(position);
            if (current == ' ') {
                column++;
            } else if (current == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (current == '\f') {
                column = 0;
            } else {
                break;
            }
            position++;
        }

        if (position >= source.length()) {
            return false;
        }
        char current = source.charAt(position);
        if (current == '#' || current == '\n') {
            skipComment();
            if (position < source.length()) {
                position++;
                line++;
            }
            return false;
        }

        int currentIndent = indents.peek();
        if (column > currentIndent) {
            if (indents.size() > MAX_INDENT_LEVELS) {
                throw new PythonSyntaxException(line, "too many levels of indentation");
            }
            indents.push(column);
            tokens.add(new PythonToken(PythonTokenType.INDENT, "", line));
        } else if (column < currentIndent) {
            while (indents.peek() > column) {
                indents.pop();
                tokens.add(new PythonToken(PythonTokenType.DEDENT, "", line));
            }
            if (indents.peek() != column) {
                throw new PythonSyntaxException(line, "unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void skipComment() {
        while (position < source.length() && source.charAt(position) != '\n') {
            position++;
        }
    }

    private void readLineContinuation() {
        if (position + 1 >= source.length()) {
            throw new PythonSyntaxException(line, "unexpected EOF while parsing");
        }
        if (source.charAt(position + 1) != '\n') {
            throw new PythonSyntaxException(line, "unexpected character after line continuation character");
        }
        position += 2;
        line++;
    }

    private void emitNewlineIfStatementOpen() {
        if (tokens.isEmpty()) {
            return;
        }
        PythonTokenType last = tokens.get(tokens.size() - 1).type();
        if (last != PythonTokenType.NEWLINE && last != PythonTokenType.INDENT && last != PythonTokenType.DEDENT) {
            tokens.add(new PythonToken(PythonTokenType.NEWLINE, "", line));
        }
    }

    private void readNameOrPrefixedString() {
        int start = position;
        while (position < source.length() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
        String word = source.substring(start, position);
        if (position < source.length()
                && (source.charAt(position) == '\'' || source.charAt(position) == '"')
                && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            readString(start);
            return;
        }
        tokens.add(new PythonToken(PythonTokenType.NAME, word, line));
    }

    private void readString(int tokenStart) {
        int startLine = line;
        char quote = source.charAt(position);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), position);
        position += triple ? 3 : 1;

        while (true) {
            if (position >= source.length()) {
                if (triple) {
                    throw new PythonSyntaxException(
                            startLine,
                            "unterminated triple-quoted string literal (detected at line " + line + ")");
                }
                throw new PythonSyntaxException(
                        startLine,
                        "unterminated string literal (detected at line " + startLine + ")");
            }

            char current = source.charAt(position);
            if (current == '\\') {
                if (position + 1 < source.length() && source.charAt(position + 1) == '\n') {
                    line++;
                }
                position += 2;
                continue;
            }
            if (current == '\n') {
                if (!triple) {
                    throw new PythonSyntaxException(
                            startLine,
                            "unterminated string literal (detected at line " + startLine + ")");
                }
                line++;
                position++;
                continue;
            }
            if (current == quote) {
                if (!triple) {
                    position++;
                    break;
                }
                if (source.startsWith(String.valueOf(quote).repeat(3), position)) {
                    position += 3;
                    break;
                }
            }
            position++;
        }

        tokens.add(new PythonToken(PythonTokenType.STRING, source.substring(tokenStart, position), startLine));
    }

    private void readNumber() {
        int start = position;
        while (position < source.length()) {
            char current = source.charAt(position);
            boolean exponentSign = (current == '+' || current == '-')
                    && position > start
                    && Character.toLowerCase(source.charAt(position - 1)) == 'e'
                    && !source.substring(start, position).toLowerCase(Locale.ROOT).startsWith("0x");
            if (Character.isLetterOrDigit(current) || current == '_' || current == '.' || exponentSign) {
                position++;
            } else {
                break;
            }
        }

        String literal = source.substring(start, position);
        if (!NUMBER_PATTERN.matcher(literal).matches()) {
            throw new PythonSyntaxException(line, "invalid decimal literal");
        }
        tokens.add(new PythonToken(PythonTokenType.NUMBER, literal, line));
    }

    private void readOperator(char current) {
        for (String operator : THREE_CHAR_OPERATORS) {
            if (source.startsWith(operator, position)) {
                addOperator(operator);
                return;
            }
        }
        if (position + 1 < source.length()) {
            String pair = source.substring(position, position + 2);
            if (TWO_CHAR_OPERATORS.contains(pair)) {
                addOperator(pair);
                return;
            }
        }
        if (ONE_CHAR_OPERATORS.indexOf(current) < 0) {
            throw new PythonSyntaxException(
                    line,
                    String.format(Locale.ROOT, "invalid character '%c' (U+%04X)", current, (int) current));
        }

        if (current == '(' || current == '[' || current == '{') {
            if (brackets.size() >= MAX_BRACKET_NESTING) {
                throw new PythonSyntaxException(line, "too many nested parentheses");
            }
            brackets.push(new OpenBracket(current, line));
        } else if (CLOSING_TO_OPENING.containsKey(current)) {
            if (brackets.isEmpty()) {
                throw new PythonSyntaxException(line, "unmatched '" + current + "'");
            }
            OpenBracket opening = brackets.pop();
            if (opening.symbol() != CLOSING_TO_OPENING.get(current)) {
                throw new PythonSyntaxException(
                        line,
                        "closing parenthesis '" + current + "' does not match opening parenthesis '"
                                + opening.symbol() + "'");
            }
        }
        addOperator(String.valueOf(current));
    }

    private void addOperator(String operator) {
        tokens.add(new PythonToken(PythonTokenType.OP, operator, line));
        position += operator.length();
    }

    private boolean isIdentifierStart(char value) {
        return value == '_' || Character.isLetter(value);
    }

    private boolean isIdentifierPart(char value) {
        return value == '_' || Character.isLetterOrDigit(value);
    }

    private record OpenBracket(char symbol, int line) {
    }
}
