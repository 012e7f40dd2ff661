package dumb.prover.extract;

import dumb.prover.IllegalSexpOperationException;
import dumb.prover.Sexp;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads the command type, attributes and control flags out of a Vernacular AST.
 * <p>
 * Two shapes are understood. Older assistants serialize {@code ((v (VernacExpr flags expr)) (loc ..))}, with
 * control flags as wrapping constructors; newer ones serialize
 * {@code ((v ((control ..) (attrs ..) (expr expr))) (loc ..))}.
 */
public final class VernacAnalyzer {

    private static final Set<String> SYNTAX_WRAPPERS = Set.of("VernacSynPure", "VernacSynterp");

    private VernacAnalyzer() {
    }

    /**
     * @throws IllegalSexpOperationException if the AST is not a Vernacular command
     */
    public static VernacInfo analyze(Sexp ast) {
        try {
            return analyzeControl(unlocate(ast));
        } catch (IllegalSexpOperationException e) {
            throw new IllegalSexpOperationException("Not a Vernacular command: " + ast.toSexp());
        }
    }

    /**
     * Strips a {@code ((v X) (loc ..))} wrapper.
     */
    private static Sexp unlocate(Sexp sexp) {
        if (sexp.isList() && sexp.size() == 2 && sexp.get(0).isList() && sexp.get(0).size() == 2
                && sexp.get(0).get(0).isAtom() && sexp.get(0).get(0).content().equals("v")
                && sexp.get(1).isList() && sexp.get(1).head().equals("loc"))
            return sexp.get(0).get(1);
        return sexp;
    }

    private static VernacInfo analyzeControl(Sexp vc) {
        if (vc.head().equals("control")) {
            var fields = vc.asList();
            var expr = require(fields.fieldValue("expr"), vc);
            if (expr.isList() && expr.get(0).isAtom() && SYNTAX_WRAPPERS.contains(expr.get(0).content()))
                expr = expr.get(1);
            var attrs = fields.fieldValue("attrs");
            var control = fields.fieldValue("control");
            var flags = new ArrayList<String>();
            if (control != null)
                for (var c : control.asList().children) flags.add(flagName(c.head()));
            return expression(expr, flags, attrs != null ? attributes(attrs) : List.of());
        }
        var tag = vc.get(0).content();
        if (tag.equals("VernacExpr"))
            return expression(vc.get(2), List.of(), attributes(vc.get(1)));

        // an older control wrapper around the actual command
        var inner = analyzeControl(unlocate(vc.get(vc.size() - 1)));
        var flags = new ArrayList<String>();
        flags.add(flagName(tag));
        flags.addAll(inner.controlFlags());
        return new VernacInfo(inner.vernacType(), inner.extendType(), flags, inner.attributes());
    }

    private static VernacInfo expression(Sexp expr, List<String> controlFlags, List<String> attributes) {
        var type = expr.isList() ? expr.get(0).content() : expr.content();
        String extend = null;
        if (type.equals("VernacExtend")) {
            var name = expr.get(1);
            if (name.get(0).isAtom()) extend = name.get(0).content();
            else extend = require(name.asList().fieldValue("ext_entry"), expr).content();
        }
        return new VernacInfo(type, extend, controlFlags, attributes);
    }

    /**
     * Flattens a list of {@code vernac_flag}s.
     */
    static List<String> attributes(Sexp flags) {
        var result = new ArrayList<String>();
        for (var flag : flags.asList().children) {
            flag = unlocate(flag);
            var attribute = flag.get(0).content();
            if (flag.size() > 1 && flag.get(1).isList()) {
                var value = flag.get(1);
                switch (value.get(0).content()) {
                    case "VernacFlagLeaf" -> {
                        var leaf = value.get(1);
                        if (leaf.isList()) leaf = leaf.get(1);
                        attribute += "=" + (leaf.isAtom() ? leaf.content() : leaf.toSexp());
                    }
                    case "VernacFlagList" -> attribute += " (" + String.join(",", attributes(value.get(1))) + ")";
                    default -> {
                    }
                }
            }
            result.add(attribute);
        }
        return result;
    }

    private static String flagName(String constructor) {
        for (var prefix : List.of("Control", "Vernac"))
            if (constructor.startsWith(prefix) && constructor.length() > prefix.length())
                return constructor.substring(prefix.length());
        return constructor;
    }

    private static Sexp require(@Nullable Sexp s, Sexp context) {
        if (s == null) throw new IllegalSexpOperationException("Missing field in " + context.toSexp());
        return s;
    }
}
