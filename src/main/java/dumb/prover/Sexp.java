package dumb.prover;

import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable s-expression: either an {@link Atom} or a {@link Lst} of child expressions.
 * <p>
 * Atoms parsed from a quoted literal keep their surrounding quotes (and any escaped inner quotes), so
 * {@code "a b"} and {@code a} are distinct atoms. {@link #toSexp()} prints a form that {@link SexpParser}
 * reads back to an equal tree, except that an empty atom comes back as the quoted atom {@code ""} and an
 * unquoted atom holding a space or a bare parenthesis comes back quoted.
 */
sealed public interface Sexp permits Sexp.Atom, Sexp.Lst {

    String toSexp();

    /**
     * The content of the leftmost atom, or the empty string for an empty list.
     */
    String head();

    int height();

    int numNodes();

    int numLeaves();

    boolean containsAtom(String value);

    JSONObject toJson();

    default boolean isAtom() {
        return this instanceof Atom;
    }

    default boolean isList() {
        return this instanceof Lst;
    }

    default Atom asAtom() {
        if (this instanceof Atom a) return a;
        throw new IllegalSexpOperationException("Cannot get the content of an s-exp list: " + toSexp());
    }

    default Lst asList() {
        if (this instanceof Lst l) return l;
        throw new IllegalSexpOperationException("Cannot get the children of an s-exp atom: " + toSexp());
    }

    /**
     * Shorthand for {@code asList().get(index)}.
     */
    default Sexp get(int index) {
        return asList().get(index);
    }

    default int size() {
        return this instanceof Lst l ? l.children.size() : 0;
    }

    /**
     * The string content of this atom.
     */
    default String content() {
        return asAtom().value();
    }

    default String prettyFormat() {
        return prettyFormat(Integer.MAX_VALUE);
    }

    default String prettyFormat(int maxDepth) {
        return prettyFormat(this, maxDepth, 0).strip();
    }

    private static String prettyFormat(Sexp sexp, int maxDepth, int depth) {
        if (sexp instanceof Atom a) return a.value();
        var l = (Lst) sexp;
        if (l.children.isEmpty()) return "()";
        if (maxDepth == 0) return " ... ";
        return "\n" + "  ".repeat(depth) + l.children.stream()
                .map(c -> prettyFormat(c, maxDepth - 1, depth + 1))
                .collect(Collectors.joining(" ", "(", ")"));
    }

    static Atom atom(String value) {
        return Atom.of(value);
    }

    static Lst list(Sexp... children) {
        return new Lst(children);
    }

    static Lst list(List<? extends Sexp> children) {
        return new Lst(children);
    }

    final class Lst implements Sexp {
        public static final Lst EMPTY = new Lst(List.of());

        public final List<Sexp> children;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String sexpStringCache;
        private volatile int heightCache = -1, nodesCache = -1, leavesCache = -1;

        public Lst(List<? extends Sexp> children) {
            this.children = List.copyOf(children);
        }

        public Lst(Sexp... children) {
            this(List.of(children));
        }

        @Override
        public Sexp get(int index) {
            if (index < 0) index += children.size();
            if (index < 0 || index >= children.size())
                throw new IllegalSexpOperationException("Cannot get child (" + index + "), this list only has " + children.size() + " children: " + toSexp());
            return children.get(index);
        }

        /**
         * The first child list tagged with the given atom, e.g. {@code (str "msg")} for tag {@code str}.
         */
        public @Nullable Lst field(String tag) {
            for (var c : children) {
                if (c instanceof Lst l && !l.children.isEmpty() && l.children.get(0) instanceof Atom a && a.value().equals(tag))
                    return l;
            }
            return null;
        }

        /**
         * The second element of {@link #field(String)}, if present.
         */
        public @Nullable Sexp fieldValue(String tag) {
            var f = field(tag);
            return f == null || f.children.size() < 2 ? null : f.children.get(1);
        }

        @Override
        public String head() {
            return children.isEmpty() ? "" : children.get(0).head();
        }

        @Override
        public String toSexp() {
            if (sexpStringCache == null) {
                var sb = new StringBuilder("(");
                var lastIsAtom = false;
                for (var c : children) {
                    if (c instanceof Atom) {
                        if (lastIsAtom) sb.append(' ');
                        lastIsAtom = true;
                    } else {
                        lastIsAtom = false;
                    }
                    sb.append(c.toSexp());
                }
                sexpStringCache = sb.append(')').toString();
            }
            return sexpStringCache;
        }

        @Override
        public int height() {
            if (heightCache == -1) heightCache = 1 + children.stream().mapToInt(Sexp::height).max().orElse(0);
            return heightCache;
        }

        @Override
        public int numNodes() {
            if (nodesCache == -1) nodesCache = 1 + children.stream().mapToInt(Sexp::numNodes).sum();
            return nodesCache;
        }

        @Override
        public int numLeaves() {
            if (leavesCache == -1) leavesCache = children.stream().mapToInt(Sexp::numLeaves).sum();
            return leavesCache;
        }

        @Override
        public boolean containsAtom(String value) {
            return children.stream().anyMatch(c -> c.containsAtom(value));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && children.equals(that.children));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = children.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return toSexp();
        }

        @Override
        public JSONObject toJson() {
            var jsonChildren = new JSONArray();
            children.forEach(c -> jsonChildren.put(c.toJson()));
            return new JSONObject()
                    .put("type", "list")
                    .put("children", jsonChildren)
                    .put("sexp", toSexp());
        }
    }

    record Atom(String value) implements Sexp {
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return value.length() > 64 ? new Atom(value) : internCache.computeIfAbsent(value, Atom::new);
        }

        /**
         * Whether this atom was read from a quoted literal (its content is wrapped in double quotes).
         */
        public boolean isQuoted() {
            return value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"';
        }

        /**
         * The content without surrounding quotes and with retained {@code \"} escapes resolved.
         */
        public String unquoted() {
            return isQuoted() ? value.substring(1, value.length() - 1).replace("\\\"", "\"") : value;
        }

        @Override
        public String head() {
            return value;
        }

        @Override
        public String toSexp() {
            if (isQuoted()) return '"' + escape(value.substring(1, value.length() - 1)) + '"';
            var bare = value.isEmpty() ? null : escapeBare(value);
            return bare != null ? bare : '"' + escape(value) + '"';
        }

        @Override
        public int height() {
            return 0;
        }

        @Override
        public int numNodes() {
            return 1;
        }

        @Override
        public int numLeaves() {
            return 1;
        }

        @Override
        public boolean containsAtom(String v) {
            return value.equals(v);
        }

        @Override
        public String toString() {
            return toSexp();
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "atom")
                    .put("value", value)
                    .put("sexp", toSexp());
        }

        /**
         * Escapes the inside of a quoted literal. A backslash already pairing with a quote stays as is.
         */
        private static String escape(String s) {
            var sb = new StringBuilder(s.length() + 8);
            for (var i = 0; i < s.length(); i++) {
                var c = s.charAt(i);
                if (c == '\\') {
                    var next = i + 1 < s.length() ? s.charAt(i + 1) : 0;
                    if (next == '"') {
                        sb.append("\\\"");
                        i++;
                    } else if (next != 0 && !SexpParser.isEscapeCode(next)) {
                        sb.append('\\');
                    } else {
                        sb.append("\\\\");
                    }
                } else if (c == '"') {
                    sb.append("\\\"");
                } else {
                    appendControl(sb, c);
                }
            }
            return sb.toString();
        }

        /**
         * Escapes an unquoted token, or returns null when it needs quoting.
         */
        private static @Nullable String escapeBare(String s) {
            var sb = new StringBuilder(s.length() + 8);
            var loneBackslash = false;
            for (var i = 0; i < s.length(); i++) {
                var c = s.charAt(i);
                var afterLone = loneBackslash;
                loneBackslash = false;
                if (c == '\\') {
                    var next = i + 1 < s.length() ? s.charAt(i + 1) : 0;
                    if (next != 0 && !SexpParser.isEscapeCode(next)) {
                        sb.append('\\');
                        loneBackslash = true;
                    } else {
                        sb.append("\\\\");
                    }
                } else if (c == '"') {
                    sb.append("\\\"");
                } else if (afterLone) {
                    sb.append(c);
                } else if (c == '(' || c == ')' || (Character.isWhitespace(c) && controlEscape(c) == 0)) {
                    return null;
                } else {
                    appendControl(sb, c);
                }
            }
            return sb.toString();
        }

        private static void appendControl(StringBuilder sb, char c) {
            var e = controlEscape(c);
            if (e != 0) sb.append('\\').append(e);
            else sb.append(c);
        }

        private static char controlEscape(char c) {
            return switch (c) {
                case '\n' -> 'n';
                case '\t' -> 't';
                case '\r' -> 'r';
                case '\b' -> 'b';
                case '\f' -> 'f';
                case '\u000B' -> 'v';
                case '\u0007' -> 'a';
                default -> 0;
            };
        }
    }
}
