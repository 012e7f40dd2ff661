package dumb.prover.session;

import dumb.prover.Sexp;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Fully qualifies the identifiers of an AST so that it stays unambiguous outside the session.
 * <p>
 * Names bound inside the AST (located ids and names) shadow globals for the rest of that AST and are qualified
 * with the module path. Other names are resolved through the locate oracle and memoized in a cache shared across
 * ASTs; the owner of the cache evicts entries whenever a name is redefined.
 */
public class IdentifierQualifier {
    private final Function<String, @Nullable String> locate;
    private final Map<String, String> globalCache;
    private final String modpath;
    private final String toppath;

    /**
     * @param locate      fully qualified spelling of a name, or null if the name is unknown
     * @param globalCache memo of qualified spellings, updated in place
     * @param modpath     logical path substituted for {@code toppath}
     * @param toppath     logical path the session gives to its own definitions
     */
    public IdentifierQualifier(Function<String, @Nullable String> locate, Map<String, String> globalCache,
                               String modpath, String toppath) {
        this.locate = locate;
        this.globalCache = globalCache;
        this.modpath = modpath;
        this.toppath = toppath;
    }

    public List<Identifier> qualifyAll(Sexp ast) {
        return qualifyAll(ast.toSexp());
    }

    public List<Identifier> qualifyAll(String ast) {
        var locals = new HashSet<String>();
        var result = new ArrayList<Identifier>();
        for (var ident : Identifiers.findAll(ast)) result.add(qualify(ident, locals));
        return result;
    }

    Identifier qualify(Identifier ident, Set<String> locals) {
        var name = ident.string();
        var type = ident.type();
        if (type == IdentType.LIDENT || type == IdentType.LNAME) locals.add(name);

        if (locals.contains(name) && type != IdentType.CPAT_ATOM)
            return new Identifier(type, modpath + "." + name);

        var cached = globalCache.get(name);
        if (cached != null) return new Identifier(type, cached);

        var qualified = locate.apply(name);
        if (qualified == null) qualified = name;
        if (type == IdentType.CPAT_ATOM && qualified.indexOf('.') < 0) {
            // unknown globally, so the pattern binds it
            locals.add(qualified);
            return new Identifier(type, modpath + "." + qualified);
        }
        if (qualified.startsWith(toppath + "."))
            qualified = modpath + qualified.substring(toppath.length());
        globalCache.put(name, qualified);
        return new Identifier(type, qualified);
    }
}
