package org.codesonify.analysis.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The Lexer converts raw source text into a flat sequence of typed tokens.
 * <p>
 * It is a best-effort scanner rather than a language front end: the text is processed line by line,
 * each line is split on whitespace and a fixed punctuation class, and every fragment is classified by
 * a fixed priority of rules. Nesting depth is tracked by counting brackets per line.
 * <p>
 * A Lexer instance is single-use and not thread-safe; create one per input.
 */
public class Lexer {

    private static final String PUNCTUATION = "{}()[];,.:=<>+-*/!&|^~?@#$%";
    private static final String OPEN_BRACKETS = "{([";
    private static final String CLOSE_BRACKETS = "})]";

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern OPERATOR = Pattern.compile("[=+\\-*/%<>!&|^~?]+");
    private static final Pattern ENDS_WITH_WORD_CHAR = Pattern.compile(".*\\w\\s*$");

    private static final String[] COMMENT_MARKERS = {"//", "#", "--", "/*", "*"};

    /** Keywords that declare a function; the identifier right after them is its name, not a call. */
    private static final Set<String> FUNCTION_DECLARATORS = Set.of("function", "def", "fn", "func");

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
            // Functions
            Map.entry("function", TokenKind.FUNCTION), Map.entry("def", TokenKind.FUNCTION),
            Map.entry("fn", TokenKind.FUNCTION), Map.entry("func", TokenKind.FUNCTION),
            Map.entry("async", TokenKind.FUNCTION), Map.entry("await", TokenKind.FUNCTION),
            Map.entry("lambda", TokenKind.FUNCTION),
            // Loops
            Map.entry("for", TokenKind.LOOP), Map.entry("while", TokenKind.LOOP),
            Map.entry("do", TokenKind.LOOP), Map.entry("foreach", TokenKind.LOOP),
            Map.entry("loop", TokenKind.LOOP), Map.entry("each", TokenKind.LOOP),
            Map.entry("map", TokenKind.LOOP), Map.entry("filter", TokenKind.LOOP),
            Map.entry("reduce", TokenKind.LOOP), Map.entry("forEach", TokenKind.LOOP),
            // Conditionals
            Map.entry("if", TokenKind.CONDITIONAL), Map.entry("else", TokenKind.CONDITIONAL),
            Map.entry("elif", TokenKind.CONDITIONAL), Map.entry("switch", TokenKind.CONDITIONAL),
            Map.entry("case", TokenKind.CONDITIONAL), Map.entry("match", TokenKind.CONDITIONAL),
            Map.entry("when", TokenKind.CONDITIONAL), Map.entry("unless", TokenKind.CONDITIONAL),
            Map.entry("ternary", TokenKind.CONDITIONAL),
            // Variables
            Map.entry("var", TokenKind.VARIABLE), Map.entry("let", TokenKind.VARIABLE),
            Map.entry("const", TokenKind.VARIABLE), Map.entry("val", TokenKind.VARIABLE),
            Map.entry("mut", TokenKind.VARIABLE), Map.entry("static", TokenKind.VARIABLE),
            // Classes
            Map.entry("class", TokenKind.CLASS), Map.entry("struct", TokenKind.CLASS),
            Map.entry("interface", TokenKind.CLASS), Map.entry("enum", TokenKind.CLASS),
            Map.entry("trait", TokenKind.CLASS), Map.entry("type", TokenKind.CLASS),
            // Imports
            Map.entry("import", TokenKind.IMPORT), Map.entry("require", TokenKind.IMPORT),
            Map.entry("use", TokenKind.IMPORT), Map.entry("using", TokenKind.IMPORT),
            Map.entry("include", TokenKind.IMPORT), Map.entry("from", TokenKind.IMPORT),
            // Return
            Map.entry("return", TokenKind.RETURN_STMT), Map.entry("yield", TokenKind.RETURN_STMT),
            Map.entry("throw", TokenKind.RETURN_STMT),
            // Other keywords
            Map.entry("new", TokenKind.KEYWORD), Map.entry("this", TokenKind.KEYWORD),
            Map.entry("self", TokenKind.KEYWORD), Map.entry("super", TokenKind.KEYWORD),
            Map.entry("null", TokenKind.KEYWORD), Map.entry("nil", TokenKind.KEYWORD),
            Map.entry("true", TokenKind.KEYWORD), Map.entry("false", TokenKind.KEYWORD),
            Map.entry("undefined", TokenKind.KEYWORD), Map.entry("try", TokenKind.KEYWORD),
            Map.entry("catch", TokenKind.KEYWORD), Map.entry("finally", TokenKind.KEYWORD),
            Map.entry("public", TokenKind.KEYWORD), Map.entry("private", TokenKind.KEYWORD),
            Map.entry("protected", TokenKind.KEYWORD), Map.entry("export", TokenKind.KEYWORD),
            Map.entry("default", TokenKind.KEYWORD), Map.entry("extends", TokenKind.KEYWORD),
            Map.entry("implements", TokenKind.KEYWORD), Map.entry("abstract", TokenKind.KEYWORD),
            Map.entry("override", TokenKind.KEYWORD)
    );

    private final List<String> lines;
    private final List<Token> tokens = new ArrayList<>();
    private int depth = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.lines = splitLines(source);
    }

    /**
     * Splits text into lines on {@code '\n'}, keeping trailing empty lines.
     * An empty text has no lines at all.
     *
     * @param source The text to split.
     * @return The lines of the text, without line terminators.
     */
    public static List<String> splitLines(String source) {
        if (source.isEmpty()) {
            return List.of();
        }
        return List.of(source.split("\n", -1));
    }

    /**
     * Returns the lines this lexer operates on.
     * @return An unmodifiable list of lines.
     */
    public List<String> getLines() {
        return lines;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens in source order.
     */
    public List<Token> scanTokens() {
        for (int index = 0; index < lines.size(); index++) {
            scanLine(lines.get(index), index + 1);
        }
        return List.copyOf(tokens);
    }

    private void scanLine(String line, int lineNumber) {
        String trimmed = trim(line);

        if (trimmed.isEmpty()) {
            tokens.add(new Token(TokenKind.WHITESPACE, "", lineNumber, 0, depth));
            return;
        }

        if (isCommentLine(trimmed)) {
            tokens.add(new Token(TokenKind.COMMENT, trimmed, lineNumber, line.indexOf(trimmed.charAt(0)), depth));
            return;
        }

        int opens = count(trimmed, OPEN_BRACKETS);
        int closes = count(trimmed, CLOSE_BRACKETS);

        int column = leadingBlanks(line);
        Token previous = null;
        for (String fragment : fragments(trimmed)) {
            TokenKind kind = classify(fragment, line, previous);
            Token token = new Token(kind, fragment, lineNumber, column, depth);
            tokens.add(token);
            previous = token;
            column += fragment.length() + 1;
        }

        depth = Math.max(0, depth + opens - closes);
    }

    private TokenKind classify(String fragment, String line, Token previous) {
        char first = fragment.charAt(0);
        if (first == '\'' || first == '"' || first == '`') {
            return TokenKind.STRING;
        }
        if (NUMBER.matcher(fragment).matches()) {
            return TokenKind.NUMBER;
        }
        if (OPERATOR.matcher(fragment).matches()) {
            return TokenKind.OPERATOR;
        }
        if (fragment.length() == 1 && OPEN_BRACKETS.indexOf(first) >= 0) {
            return TokenKind.BRACKET_OPEN;
        }
        if (fragment.length() == 1 && CLOSE_BRACKETS.indexOf(first) >= 0) {
            return TokenKind.BRACKET_CLOSE;
        }
        TokenKind keyword = KEYWORDS.get(fragment);
        if (keyword != null) {
            return keyword;
        }
        if (ENDS_WITH_WORD_CHAR.matcher(fragment).matches() && line.contains(fragment + "(")) {
            // "function add(" declares add; the structure takes its name from the following unknown token.
            if (previous != null && previous.kind() == TokenKind.FUNCTION
                    && FUNCTION_DECLARATORS.contains(previous.text())) {
                return TokenKind.UNKNOWN;
            }
            return TokenKind.FUNCTION;
        }
        return TokenKind.UNKNOWN;
    }

    /**
     * Splits a trimmed line into fragments. Whitespace separates fragments and is dropped,
     * every punctuation character is a fragment of its own.
     */
    private static List<String> fragments(String trimmed) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (isBlank(c)) {
                flush(current, result);
            } else if (PUNCTUATION.indexOf(c) >= 0) {
                flush(current, result);
                result.add(String.valueOf(c));
            } else {
                current.append(c);
            }
        }
        flush(current, result);
        return result;
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }

    /**
     * Blank characters are ASCII tab through carriage return, the byte order mark and every Unicode space
     * separator, so a no-break space counts as whitespace.
     */
    static boolean isBlank(char c) {
        return (c >= '\t' && c <= '\r') || c == '\uFEFF' || Character.isSpaceChar(c);
    }

    static String trim(String text) {
        int begin = leadingBlanks(text);
        int end = text.length();
        while (end > begin && isBlank(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(begin, end);
    }

    private static int leadingBlanks(String text) {
        int i = 0;
        while (i < text.length() && isBlank(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isCommentLine(String trimmed) {
        for (String marker : COMMENT_MARKERS) {
            if (trimmed.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }

    private static int count(String text, String characters) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (characters.indexOf(text.charAt(i)) >= 0) n++;
        }
        return n;
    }
}
