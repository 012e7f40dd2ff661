package dumb.prover.session;

import dumb.prover.Sexp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the identifiers referenced by a serialized AST.
 */
public final class Identifiers {

    private static final String ID = "\\(\\s*Id\\s+[^)\\s]+\\)";

    private static final Pattern ID_PATTERN = Pattern.compile("\\(\\s*Id\\s+(?<id>[^)\\s]+)\\)");

    private static final String DIRPATH = "\\(\\s*DirPath\\s*\\((?<dirPath>(?:\\s*" + ID + ")*)\\)\\s*\\)";

    private static final String CONTEXT = "(?:(?<cPatAtom>\\(\\s*CPatAtom\\s*\\(\\s*\\(\\s*\\(\\s*v\\s*)"
            + "|(?<cRef>\\(\\s*CRef\\s*\\(\\s*\\(\\s*v\\s*))?";

    private static final String SER_QUALID = CONTEXT + "\\(\\s*Ser_Qualid\\s*" + DIRPATH
            + "\\s*\\(\\s*Id\\s+(?<qualid>[^)\\s]+)\\)\\s*\\)";

    private static final String LOC = "\\(\\s*loc\\s*\\(\\(\\(\\s*fname\\s+ToplevelInput\\)\\s*\\(\\s*line_nb\\s+\\d+\\)\\s*"
            + "\\(\\s*bol_pos\\s+\\d+\\)\\s*\\(\\s*line_nb_last\\s+\\d+\\)\\s*\\(\\s*bol_pos_last\\s+\\d+\\)\\s*"
            + "\\(\\s*bp\\s+\\d+\\)\\s*\\(\\s*ep\\s+\\d+\\)\\)\\)\\)";

    private static final String LIDENT = "\\(\\s*v\\s*\\(\\s*Id\\s+(?<lident>[^)\\s]+)\\)\\s*\\)\\s*(?=" + LOC + ")";

    private static final String LNAME = "\\(\\s*v\\s*\\(\\s*Name\\s*\\(\\s*Id\\s+(?<lname>[^)\\s]+)\\)\\s*\\)\\s*\\)\\s*(?=" + LOC + ")";

    static final Pattern IDENT_PATTERN = Pattern.compile(SER_QUALID + "|" + LIDENT + "|" + LNAME);

    private Identifiers() {
    }

    /**
     * Every identifier of the AST in order of appearance.
     */
    public static List<Identifier> findAll(String ast) {
        var result = new ArrayList<Identifier>();
        var m = IDENT_PATTERN.matcher(ast);
        while (m.find()) result.add(of(m));
        return result;
    }

    public static List<Identifier> findAll(Sexp ast) {
        return findAll(ast.toSexp());
    }

    private static Identifier of(Matcher m) {
        var qualid = m.group("qualid");
        if (qualid != null) {
            var parts = new ArrayList<String>();
            var ids = ID_PATTERN.matcher(m.group("dirPath"));
            while (ids.find()) parts.add(unquote(ids.group("id")));
            parts.add(unquote(qualid));
            IdentType type;
            if (m.group("cPatAtom") != null) type = IdentType.CPAT_ATOM;
            else if (m.group("cRef") != null) type = IdentType.CREF;
            else type = IdentType.SER_QUALID;
            return new Identifier(type, String.join(".", parts));
        }
        var lident = m.group("lident");
        if (lident != null) return new Identifier(IdentType.LIDENT, unquote(lident));
        return new Identifier(IdentType.LNAME, unquote(m.group("lname")));
    }

    static String unquote(String s) {
        return s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"") ? s.substring(1, s.length() - 1) : s;
    }

    /**
     * The serialized form an identifier takes inside an AST.
     */
    public static String toSexp(Identifier ident) {
        if (ident.type().isQualidFamily()) {
            var parts = Arrays.asList(ident.string().split("\\."));
            var dirpath = new StringBuilder("(DirPath(");
            for (var d : parts.subList(0, parts.size() - 1)) dirpath.append(idOf(d));
            dirpath.append("))");
            var sexp = "(Ser_Qualid" + dirpath + idOf(parts.get(parts.size() - 1)) + ")";
            return switch (ident.type()) {
                case CPAT_ATOM -> "(CPatAtom(((v" + sexp;
                case CREF -> "(CRef((v" + sexp;
                default -> sexp;
            };
        }
        var id = idOf(ident.string());
        return ident.type() == IdentType.LIDENT ? "(v" + id + ")" : "(v(Name" + id + "))";
    }

    private static String idOf(String s) {
        return "(Id " + Sexp.atom(s).toSexp() + ")";
    }
}
