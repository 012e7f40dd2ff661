package dumb.prover;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the s-expression wire format.
 * <p>
 * A backslash escapes the next character. {@code \\ \' \"} and the control codes {@code b f t n r v a} are
 * decoded; any other escaped character keeps its backslash. Inside a quoted literal an escaped double quote
 * stays escaped and the literal's own quotes are kept in the atom content.
 */
public class SexpParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private SexpParser(Reader reader) {
        this.reader = reader;
    }

    /**
     * Parses text holding exactly one s-expression.
     */
    public static Sexp parse(String text) throws ParseException {
        var nodes = parseAll(text);
        if (nodes.size() > 1)
            throw new ParseException("Expected a single s-expression but found " + nodes.size(), abbreviate(text));
        return nodes.get(0);
    }

    /**
     * Parses every top-level s-expression in the text. Fails if there are none.
     */
    public static List<Sexp> parseAll(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new SexpParser(reader);
            var nodes = new ArrayList<Sexp>();
            parser.skipWhitespace();
            while (parser.peek() != -1) {
                nodes.add(parser.parseNode());
                parser.skipWhitespace();
            }
            if (nodes.isEmpty()) throw new ParseException("No s-expression found", abbreviate(text));
            return nodes;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    /**
     * Whether {@code \c} is a decoded escape sequence.
     */
    public static boolean isEscapeCode(int c) {
        return switch (c) {
            case '\\', '\'', '"', 'b', 'f', 't', 'n', 'r', 'v', 'a' -> true;
            default -> false;
        };
    }

    private static String abbreviate(String text) {
        return text.length() > CONTEXT_BUFFER_SIZE ? text.substring(0, CONTEXT_BUFFER_SIZE) + "..." : text;
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", ((actual == -1) ? "EOF" : "'" + (char) actual + "'"));
        }
    }

    private void skipWhitespace() throws IOException {
        while (peek() != -1 && Character.isWhitespace(peek())) {
            consumeChar();
        }
    }

    private Sexp parseNode() throws IOException, ParseException {
        skipWhitespace();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing s-expression");
        return switch (c) {
            case '(' -> parseList();
            case ')' -> throw createParseException("Unbalanced parentheses: unexpected ')'");
            case '"' -> parseQuotedAtom();
            default -> parseToken();
        };
    }

    private Sexp.Lst parseList() throws IOException, ParseException {
        consumeChar('(');
        var children = new ArrayList<Sexp>();
        skipWhitespace();
        while (peek() != ')') {
            if (peek() == -1) throw createParseException("Unbalanced parentheses: unexpected EOF inside list");
            children.add(parseNode());
            skipWhitespace();
        }
        consumeChar(')');
        return children.isEmpty() ? Sexp.Lst.EMPTY : new Sexp.Lst(children);
    }

    private Sexp.Atom parseQuotedAtom() throws IOException, ParseException {
        consumeChar('"');
        var sb = new StringBuilder().append('"');
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside quoted atom");
            if (peek() == '\\') {
                consumeChar('\\');
                var escaped = consumeChar();
                if (escaped == -1) throw createParseException("Unexpected EOF inside quoted atom");
                appendEscape(sb, (char) escaped, true);
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        return Sexp.Atom.of(sb.append('"').toString());
    }

    private Sexp.Atom parseToken() throws IOException {
        var sb = new StringBuilder();
        while (peek() != -1) {
            var c = peek();
            if (c == '\\') {
                consumeChar();
                var escaped = consumeChar();
                if (escaped == -1) sb.append('\\');
                else appendEscape(sb, (char) escaped, false);
            } else if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') {
                break;
            } else {
                sb.append((char) consumeChar());
            }
        }
        return Sexp.Atom.of(sb.toString());
    }

    private static void appendEscape(StringBuilder sb, char escaped, boolean quoted) {
        switch (escaped) {
            case '\\' -> sb.append('\\');
            case '\'' -> sb.append('\'');
            case '"' -> sb.append(quoted ? "\\\"" : "\"");
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 't' -> sb.append('\t');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 'v' -> sb.append('\u000B');
            case 'a' -> sb.append('\u0007');
            default -> sb.append('\\').append(escaped);
        }
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
