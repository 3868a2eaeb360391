package github.sarthakdev143.animation_studio.validation;

import github.sarthakdev143.animation_studio.validation.PythonStatement.ClassDefinition;
import github.sarthakdev143.animation_studio.validation.PythonStatement.CompoundStatement;
import github.sarthakdev143.animation_studio.validation.PythonStatement.FunctionDefinition;
import github.sarthakdev143.animation_studio.validation.PythonStatement.ImportFromStatement;
import github.sarthakdev143.animation_studio.validation.PythonStatement.ImportStatement;
import github.sarthakdev143.animation_studio.validation.PythonStatement.SimpleStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statement-level parser for Python source.
 *
 * <p>Block structure, clause ordering, definitions and imports are parsed fully. Expressions
 * are checked for token-level well-formedness (operands separated by operators, no dangling
 * operators) rather than parsed into expression trees.
 */
public class PythonModuleParser {

    private static final Set<String> BLOCK_KEYWORDS = Set.of(
            "if", "for", "while", "try", "with", "class", "def");
    private static final Set<String> CLAUSE_KEYWORDS = Set.of("elif", "else", "except", "finally");
    private static final Set<String> SOFT_BLOCK_KEYWORDS = Set.of("match", "case");
    private static final Set<String> EXPRESSION_START_OPERATORS = Set.of(
            "(", "[", "{", "-", "+", "~", "*", "**", "...");
    private static final Set<String> DANGLING_OPERATORS = Set.of(
            "+", "-", "*", "/", "//", "%", "**", "@", "=", "==", "!=", "<", ">", "<=", ">=",
            "&", "|", "^", "<<", ">>", "~", ".", "->", ":", ":=", "+=", "-=", "*=", "/=", "//=",
            "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=");
    private static final Set<String> STATEMENT_START_KEYWORDS = Set.of(
            "pass", "break", "continue", "return", "raise", "global", "nonlocal", "del", "assert",
            "yield", "await", "lambda", "not", "None", "True", "False");
    private static final Set<String> DANGLING_KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "lambda", "as", "from", "import", "assert",
            "del", "global", "nonlocal", "with", "while", "for", "class", "def", "elif", "except", "await");
    private static final Set<String> OPERAND_KEYWORDS = Set.of("None", "True", "False");
    private static final Set<String> OPENING_BRACKETS = Set.of("(", "[", "{");
    private static final Set<String> CLOSING_BRACKETS = Set.of(")", "]", "}");

    private final List<PythonToken> tokens;
    private int position;

    public PythonModuleParser(List<PythonToken> tokens) {
        this.tokens = tokens;
    }

    public static PythonModule parse(String source) {
        return new PythonModuleParser(new PythonTokenizer(source).tokenize()).parseModule();
    }

    public PythonModule parseModule() {
        return new PythonModule(parseStatements(false));
    }

    private List<PythonStatement> parseStatements(boolean nested) {
        List<PythonStatement> statements = new ArrayList<>();
        ClauseChain chain = null;
        Integer pendingDecoratorLine = null;

        while (true) {
            PythonToken next = peek();
            if (next.type() == PythonTokenType.END_MARKER) {
                break;
            }
            if (next.type() == PythonTokenType.DEDENT) {
                position++;
                if (nested) {
                    break;
                }
                continue;
            }
            if (next.type() == PythonTokenType.INDENT) {
                throw new PythonSyntaxException(next.line(), "unexpected indent");
            }
            if (next.type() == PythonTokenType.NEWLINE) {
                position++;
                continue;
            }

            List<PythonToken> line = readLogicalLine();
            PythonToken first = line.get(0);
            String keyword = statementKeyword(line);

            if (pendingDecoratorLine != null && !isDecorator(first) && !"def".equals(keyword) && !"class".equals(keyword)) {
                throw new PythonSyntaxException(first.line(), "invalid syntax");
            }

            if (isDecorator(first)) {
                checkExpression(line.subList(1, line.size()), first.line());
                closeChain(chain);
                chain = null;
                pendingDecoratorLine = first.line();
                continue;
            }
            pendingDecoratorLine = null;

            if (keyword != null && CLAUSE_KEYWORDS.contains(keyword)) {
                if (chain == null || !chain.accepts(keyword)) {
                    throw new PythonSyntaxException(first.line(), "invalid syntax");
                }
                chain.advance(keyword);
                statements.add(parseCompound(line, keyword));
                continue;
            }

            closeChain(chain);
            chain = null;
            if (keyword != null) {
                statements.add(parseCompound(line, keyword));
                if (Set.of("if", "for", "while", "try").contains(keyword)) {
                    chain = new ClauseChain(keyword, first.line());
                }
            } else {
                statements.addAll(parseSimpleStatements(line));
            }
        }

        if (pendingDecoratorLine != null) {
            throw new PythonSyntaxException(pendingDecoratorLine, "invalid syntax");
        }
        closeChain(chain);
        return statements;
    }

    private List<PythonToken> readLogicalLine() {
        List<PythonToken> line = new ArrayList<>();
        while (true) {
            PythonToken token = peek();
            if (token.type() == PythonTokenType.END_MARKER) {
                break;
            }
            position++;
            if (token.type() == PythonTokenType.NEWLINE) {
                break;
            }
            line.add(token);
        }
        return line;
    }

    /**
     * Returns the block keyword a logical line starts with, or null for simple statements.
     */
    private String statementKeyword(List<PythonToken> line) {
        PythonToken first = line.get(0);
        if (first.type() != PythonTokenType.NAME) {
            return null;
        }
        if (first.text().equals("async")) {
            if (line.size() > 1 && Set.of("def", "for", "with").contains(line.get(1).text())) {
                return line.get(1).text();
            }
            throw new PythonSyntaxException(first.line(), "invalid syntax");
        }
        if (BLOCK_KEYWORDS.contains(first.text()) || CLAUSE_KEYWORDS.contains(first.text())) {
            return first.text();
        }
        if (SOFT_BLOCK_KEYWORDS.contains(first.text())
                && line.size() > 2
                && line.get(line.size() - 1).isOp(":")
                && !isAssignmentOrAccess(line.get(1))) {
            return first.text();
        }
        return null;
    }

    private boolean isAssignmentOrAccess(PythonToken token) {
        return token.type() == PythonTokenType.OP
                && (token.text().equals("=") || token.text().equals(".") || token.text().equals(":")
                || token.text().endsWith("="));
    }

    private PythonStatement parseCompound(List<PythonToken> line, String keyword) {
        PythonToken first = line.get(0);
        boolean async = first.text().equals("async");
        int headerStart = async ? 2 : 1;
        int colon = findHeaderColon(line, headerStart);
        if (colon < 0) {
            throw new PythonSyntaxException(line.get(line.size() - 1).line(), "expected ':'");
        }

        List<PythonToken> header = line.subList(headerStart, colon);
        List<PythonToken> inline = line.subList(colon + 1, line.size());
        List<PythonStatement> body = parseSuite(inline, keyword, first.line());

        return switch (keyword) {
            case "class" -> parseClassHeader(header, first.line(), body);
            case "def" -> parseFunctionHeader(header, first.line(), async, body);
            default -> {
                checkClauseHeader(keyword, header, first.line());
                yield new CompoundStatement(first.line(), keyword, body);
            }
        };
    }

    private List<PythonStatement> parseSuite(List<PythonToken> inline, String keyword, int headerLine) {
        if (!inline.isEmpty()) {
            if (peek().type() == PythonTokenType.INDENT) {
                throw new PythonSyntaxException(peek().line(), "unexpected indent");
            }
            return parseSimpleStatements(inline);
        }

        PythonToken next = peek();
        if (next.type() != PythonTokenType.INDENT) {
            throw new PythonSyntaxException(
                    next.line(),
                    "expected an indented block after '" + keyword + "' statement on line " + headerLine);
        }
        position++;
        return parseStatements(true);
    }

    private int findHeaderColon(List<PythonToken> line, int start) {
        int depth = 0;
        int pendingLambdas = 0;
        for (int index = start; index < line.size(); index++) {
            PythonToken token = line.get(index);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            } else if (depth == 0 && token.isKeyword("lambda")) {
                pendingLambdas++;
            } else if (depth == 0 && token.isOp(":")) {
                if (pendingLambdas > 0) {
                    pendingLambdas--;
                } else {
                    return index;
                }
            }
        }
        return -1;
    }

    private ClassDefinition parseClassHeader(List<PythonToken> header, int line, List<PythonStatement> body) {
        if (header.isEmpty() || !header.get(0).isIdentifier()) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        String name = header.get(0).text();
        List<String> bases = new ArrayList<>();
        if (header.size() > 1) {
            if (!header.get(1).isOp("(") || !header.get(header.size() - 1).isOp(")")
                    || closingIndex(header, 1) != header.size() - 1) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
            for (List<PythonToken> argument : splitTopLevel(header.subList(2, header.size() - 1), ",")) {
                if (argument.isEmpty()) {
                    continue;
                }
                checkExpression(argument, line);
                if (argument.get(0).isOp("*") || argument.get(0).isOp("**") || containsTopLevel(argument, "=")) {
                    continue;
                }
                bases.add(argument.stream().map(PythonToken::text).collect(Collectors.joining()));
            }
        }
        return new ClassDefinition(line, name, bases, body);
    }

    private FunctionDefinition parseFunctionHeader(
            List<PythonToken> header,
            int line,
            boolean async,
            List<PythonStatement> body) {
        if (header.isEmpty() || !header.get(0).isIdentifier()) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        if (header.size() < 3 || !header.get(1).isOp("(")) {
            throw new PythonSyntaxException(line, "expected '('");
        }
        int closing = closingIndex(header, 1);
        if (closing < 0) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        List<PythonToken> returns = header.subList(closing + 1, header.size());
        if (!returns.isEmpty()) {
            if (!returns.get(0).isOp("->") || returns.size() < 2) {
                throw new PythonSyntaxException(line, "expected ':'");
            }
            checkExpression(returns.subList(1, returns.size()), line);
        }
        return new FunctionDefinition(line, header.get(0).text(), async, body);
    }

    private void checkClauseHeader(String keyword, List<PythonToken> header, int line) {
        switch (keyword) {
            case "else", "try", "finally" -> {
                if (!header.isEmpty()) {
                    throw new PythonSyntaxException(line, "expected ':'");
                }
            }
            case "except" -> {
                if (!header.isEmpty()) {
                    List<PythonToken> exceptionTypes = header.get(0).isOp("*")
                            ? header.subList(1, header.size())
                            : header;
                    checkExpression(exceptionTypes, line);
                }
            }
            case "for" -> {
                int inIndex = indexOfTopLevelKeyword(header, "in");
                if (inIndex <= 0 || inIndex == header.size() - 1) {
                    throw new PythonSyntaxException(line, "invalid syntax");
                }
                checkExpression(header.subList(0, inIndex), line);
                checkExpression(header.subList(inIndex + 1, header.size()), line);
            }
            default -> {
                if (header.isEmpty()) {
                    throw new PythonSyntaxException(line, "invalid syntax");
                }
                checkExpression(header, line);
            }
        }
    }

    private List<PythonStatement> parseSimpleStatements(List<PythonToken> line) {
        List<PythonStatement> statements = new ArrayList<>();
        List<List<PythonToken>> parts = splitTopLevel(line, ";");
        for (int index = 0; index < parts.size(); index++) {
            List<PythonToken> part = parts.get(index);
            if (part.isEmpty()) {
                if (index == parts.size() - 1 && index > 0) {
                    continue;
                }
                throw new PythonSyntaxException(line.get(0).line(), "invalid syntax");
            }
            statements.add(parseSimpleStatement(part));
        }
        return statements;
    }

    private PythonStatement parseSimpleStatement(List<PythonToken> statement) {
        PythonToken first = statement.get(0);
        if (first.isKeyword("import")) {
            return parseImport(statement);
        }
        if (first.isKeyword("from")) {
            return parseImportFrom(statement);
        }
        if (first.type() == PythonTokenType.NAME
                && (BLOCK_KEYWORDS.contains(first.text()) || CLAUSE_KEYWORDS.contains(first.text())
                || first.text().equals("async"))) {
            throw new PythonSyntaxException(first.line(), "invalid syntax");
        }
        if (first.isKeyword() && !STATEMENT_START_KEYWORDS.contains(first.text())) {
            throw new PythonSyntaxException(first.line(), "invalid syntax");
        }
        checkExpression(statement, first.line());
        return new SimpleStatement(first.line(), statement);
    }

    private ImportStatement parseImport(List<PythonToken> statement) {
        int line = statement.get(0).line();
        List<String> modules = new ArrayList<>();
        for (List<PythonToken> alias : splitTopLevel(statement.subList(1, statement.size()), ",")) {
            modules.add(parseAliasedName(alias, line, true));
        }
        return new ImportStatement(line, modules);
    }

    private ImportFromStatement parseImportFrom(List<PythonToken> statement) {
        int line = statement.get(0).line();
        int index = 1;
        StringBuilder module = new StringBuilder();
        while (index < statement.size() && (statement.get(index).isOp(".") || statement.get(index).isOp("..."))) {
            module.append(statement.get(index).text());
            index++;
        }

        int importIndex = index;
        while (importIndex < statement.size() && !statement.get(importIndex).isKeyword("import")) {
            importIndex++;
        }
        if (importIndex >= statement.size() || importIndex == statement.size() - 1) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        if (importIndex > index) {
            module.append(parseDottedName(statement.subList(index, importIndex), line));
        }
        if (module.length() == 0) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }

        List<PythonToken> targets = statement.subList(importIndex + 1, statement.size());
        List<String> names = new ArrayList<>();
        if (targets.size() == 1 && targets.get(0).isOp("*")) {
            names.add("*");
            return new ImportFromStatement(line, module.toString(), names);
        }

        boolean parenthesized = targets.get(0).isOp("(");
        if (parenthesized) {
            if (!targets.get(targets.size() - 1).isOp(")") || targets.size() < 3) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
            targets = targets.subList(1, targets.size() - 1);
        }
        List<List<PythonToken>> aliases = splitTopLevel(targets, ",");
        for (int aliasIndex = 0; aliasIndex < aliases.size(); aliasIndex++) {
            List<PythonToken> alias = aliases.get(aliasIndex);
            if (alias.isEmpty() && parenthesized && aliasIndex == aliases.size() - 1 && aliasIndex > 0) {
                continue;
            }
            names.add(parseAliasedName(alias, line, false));
        }
        return new ImportFromStatement(line, module.toString(), names);
    }

    private String parseAliasedName(List<PythonToken> alias, int line, boolean dotted) {
        if (alias.isEmpty()) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        int asIndex = -1;
        for (int index = 0; index < alias.size(); index++) {
            if (alias.get(index).isKeyword("as")) {
                asIndex = index;
                break;
            }
        }
        List<PythonToken> nameTokens = asIndex < 0 ? alias : alias.subList(0, asIndex);
        if (asIndex >= 0 && (asIndex != alias.size() - 2 || !alias.get(asIndex + 1).isIdentifier())) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        if (!dotted && (nameTokens.size() != 1 || !nameTokens.get(0).isIdentifier())) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        return parseDottedName(nameTokens, line);
    }

    private String parseDottedName(List<PythonToken> nameTokens, int line) {
        if (nameTokens.isEmpty() || nameTokens.size() % 2 == 0) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }
        StringBuilder name = new StringBuilder();
        for (int index = 0; index < nameTokens.size(); index++) {
            PythonToken token = nameTokens.get(index);
            boolean valid = index % 2 == 0 ? token.isIdentifier() : token.isOp(".");
            if (!valid) {
                throw new PythonSyntaxException(line, "invalid syntax");
            }
            name.append(token.text());
        }
        return name.toString();
    }

    /**
     * Token-level well-formedness of an expression or simple statement.
     */
    private void checkExpression(List<PythonToken> expression, int line) {
        if (expression.isEmpty()) {
            throw new PythonSyntaxException(line, "invalid syntax");
        }

        PythonToken first = expression.get(0);
        if (first.type() == PythonTokenType.OP && !EXPRESSION_START_OPERATORS.contains(first.text())) {
            throw new PythonSyntaxException(first.line(), "invalid syntax");
        }

        PythonToken last = expression.get(expression.size() - 1);
        if ((last.type() == PythonTokenType.OP && DANGLING_OPERATORS.contains(last.text()))
                || (last.type() == PythonTokenType.NAME && DANGLING_KEYWORDS.contains(last.text()))) {
            throw new PythonSyntaxException(last.line(), "invalid syntax");
        }

        for (int index = 0; index + 1 < expression.size(); index++) {
            PythonToken current = expression.get(index);
            PythonToken following = expression.get(index + 1);
            boolean adjacentStrings = current.type() == PythonTokenType.STRING
                    && following.type() == PythonTokenType.STRING;
            if (endsOperand(current) && startsOperand(following) && !adjacentStrings) {
                throw new PythonSyntaxException(following.line(), "invalid syntax");
            }
        }
        checkOperatorPlacement(expression);
    }

    /**
     * Rejects operators that have no operand between them and the next operator, such as
     * {@code f(a=)}, {@code [1,, 2]} or {@code (1 +)}. Slices and star-unpacking stay legal.
     */
    private void checkOperatorPlacement(List<PythonToken> expression) {
        Deque<String> openBrackets = new ArrayDeque<>();
        for (int index = 0; index + 1 < expression.size(); index++) {
            PythonToken current = expression.get(index);
            if (current.type() != PythonTokenType.OP) {
                continue;
            }
            if (OPENING_BRACKETS.contains(current.text())) {
                openBrackets.push(current.text());
            } else if (CLOSING_BRACKETS.contains(current.text()) && !openBrackets.isEmpty()) {
                openBrackets.pop();
            }
            PythonToken following = expression.get(index + 1);
            if (following.type() == PythonTokenType.OP
                    && !operatorMayFollow(current.text(), following.text(), openBrackets.peek())) {
                throw new PythonSyntaxException(following.line(), "invalid syntax");
            }
        }
    }

    private boolean operatorMayFollow(String previous, String next, String innermostBracket) {
        boolean inSubscript = "[".equals(innermostBracket);
        boolean closesBracket = CLOSING_BRACKETS.contains(next);
        if (previous.equals(".")) {
            return false;
        }
        if (previous.equals(",") && next.equals(",")) {
            return false;
        }
        if (inSubscript && next.equals(":") && (previous.equals("[") || previous.equals(",") || previous.equals(":"))) {
            return true;
        }
        if (inSubscript && previous.equals(":") && (next.equals("]") || next.equals(",") || next.equals(":"))) {
            return true;
        }
        if (OPENING_BRACKETS.contains(previous)) {
            return EXPRESSION_START_OPERATORS.contains(next) || closesBracket;
        }
        if (previous.equals(",")) {
            return innermostBracket == null
                    || EXPRESSION_START_OPERATORS.contains(next)
                    || closesBracket
                    || next.equals("/");
        }
        if (DANGLING_OPERATORS.contains(previous)) {
            if (closesBracket) {
                return false;
            }
            // bare '*' and '/' separate keyword-only and positional-only lambda parameters
            if (next.equals(",")) {
                return previous.equals("*") || previous.equals("/");
            }
            if (next.equals(":") && previous.equals("/")) {
                return true;
            }
            return EXPRESSION_START_OPERATORS.contains(next);
        }
        return true;
    }

    private boolean endsOperand(PythonToken token) {
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case NAME -> token.isIdentifier() || OPERAND_KEYWORDS.contains(token.text());
            case OP -> token.text().equals(")") || token.text().equals("]") || token.text().equals("}");
            default -> false;
        };
    }

    private boolean startsOperand(PythonToken token) {
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case NAME -> token.isIdentifier()
                    || OPERAND_KEYWORDS.contains(token.text())
                    || token.text().equals("lambda")
                    || token.text().equals("await");
            default -> false;
        };
    }

    private List<List<PythonToken>> splitTopLevel(List<PythonToken> tokens, String separator) {
        List<List<PythonToken>> parts = new ArrayList<>();
        List<PythonToken> current = new ArrayList<>();
        int depth = 0;
        for (PythonToken token : tokens) {
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            }
            if (depth == 0 && token.isOp(separator)) {
                parts.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        parts.add(current);
        return parts;
    }

    private boolean containsTopLevel(List<PythonToken> tokens, String operator) {
        return splitTopLevel(tokens, operator).size() > 1;
    }

    private int indexOfTopLevelKeyword(List<PythonToken> tokens, String keyword) {
        int depth = 0;
        for (int index = 0; index < tokens.size(); index++) {
            PythonToken token = tokens.get(index);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            } else if (depth == 0 && token.isKeyword(keyword)) {
                return index;
            }
        }
        return -1;
    }

    private int closingIndex(List<PythonToken> tokens, int openIndex) {
        int depth = 0;
        for (int index = openIndex; index < tokens.size(); index++) {
            PythonToken token = tokens.get(index);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
        }
        return -1;
    }

    private boolean isDecorator(PythonToken token) {
        return token.isOp("@");
    }

    private void closeChain(ClauseChain chain) {
        if (chain != null && chain.root.equals("try") && !chain.hasHandler) {
            throw new PythonSyntaxException(chain.line, "expected 'except' or 'finally' block");
        }
    }

    private PythonToken peek() {
        return tokens.get(position);
    }

    /**
     * Tracks which clause may follow an if/for/while/try statement.
     */
    private static final class ClauseChain {

        private final String root;
        private final int line;
        private String last;
        private boolean hasHandler;

        private ClauseChain(String root, int line) {
            this.root = root;
            this.line = line;
            this.last = root;
        }

        private boolean accepts(String clause) {
            return switch (clause) {
                case "elif" -> root.equals("if") && (last.equals("if") || last.equals("elif"));
                case "else" -> (root.equals("if") && (last.equals("if") || last.equals("elif")))
                        || ((root.equals("for") || root.equals("while")) && last.equals(root))
                        || (root.equals("try") && last.equals("except"));
                case "except" -> root.equals("try") && (last.equals("try") || last.equals("except"));
                case "finally" -> root.equals("try")
                        && (last.equals("try") || last.equals("except") || last.equals("else"));
                default -> false;
            };
        }

        private void advance(String clause) {
            last = clause;
            if (clause.equals("except") || clause.equals("finally")) {
                hasHandler = true;
            }
        }
    }
}
