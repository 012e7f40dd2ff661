package dumb.prover.session;

import dumb.prover.SexpParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    private static String loc(int bp, int ep) {
        return "(loc(((fname ToplevelInput)(line_nb 1)(bol_pos 0)(line_nb_last 1)(bol_pos_last 0)(bp " + bp + ")(ep " + ep + "))))";
    }

    private static String ref(String dirpath, String id) {
        return "(CRef((v(Ser_Qualid(DirPath(" + dirpath + "))(Id " + id + ")))" + loc(0, 1) + ")())";
    }

    /**
     * Roughly {@code Lemma foo (n : nat) : match n with x => x end = Coq.Init.Datatypes.O.}
     */
    private static final String AST = "(VernacStartTheoremProof Lemma(((((v(Id foo))" + loc(6, 9) + ")())"
            + "((CLocalAssum(((v(Name(Id n)))" + loc(11, 12) + "))(Default Explicit)" + ref("", "nat") + "))"
            + "(CCases((v(CPatAtom(((v(Ser_Qualid(DirPath())(Id x)))" + loc(30, 31) + "))))" + ref("", "n")
            + ref("(Id Datatypes)(Id Init)(Id Coq)", "O") + ")))))";

    @Test
    void findsIdentifiersInOrder() {
        assertEquals(List.of(
                new Identifier(IdentType.LIDENT, "foo"),
                new Identifier(IdentType.LNAME, "n"),
                new Identifier(IdentType.CREF, "nat"),
                new Identifier(IdentType.CPAT_ATOM, "x"),
                new Identifier(IdentType.CREF, "n"),
                new Identifier(IdentType.CREF, "Datatypes.Init.Coq.O")), Identifiers.findAll(AST));
    }

    @Test
    void acceptsParsedAsts() throws SexpParser.ParseException {
        assertEquals(Identifiers.findAll(AST), Identifiers.findAll(SexpParser.parse(AST)));
    }

    @Test
    void bareIdsWithoutLocationAreNotBindings() {
        assertTrue(Identifiers.findAll("(VernacProof((v(Id foo))(loc())))").isEmpty());
    }

    @Test
    void quotedIdsAreUnquoted() {
        assertEquals(List.of(new Identifier(IdentType.SER_QUALID, "A.b")),
                Identifiers.findAll("(Ser_Qualid(DirPath((Id \"A\")))(Id \"b\"))"));
    }

    @Test
    void serializesIdentifiers() {
        assertEquals("(Ser_Qualid(DirPath((Id Coq)(Id Init)))(Id nat))",
                Identifiers.toSexp(new Identifier(IdentType.SER_QUALID, "Coq.Init.nat")));
        assertEquals("(CRef((v(Ser_Qualid(DirPath())(Id nat))",
                Identifiers.toSexp(new Identifier(IdentType.CREF, "nat")));
        assertEquals("(v(Id foo))", Identifiers.toSexp(new Identifier(IdentType.LIDENT, "foo")));
        assertEquals("(v(Name(Id n)))", Identifiers.toSexp(new Identifier(IdentType.LNAME, "n")));
    }

    @Test
    void qualifiesAgainstTheSession() {
        var queried = new ArrayList<String>();
        var cache = new HashMap<String, String>();
        var known = Map.of("nat", "Coq.Init.Datatypes.nat", "n", "SerTop.n");
        var qualifier = new IdentifierQualifier(name -> {
            queried.add(name);
            return known.get(name);
        }, cache, "M", "SerTop");

        var ids = qualifier.qualifyAll(AST).stream().map(Identifier::string).toList();
        assertEquals(List.of("M.foo", "M.n", "Coq.Init.Datatypes.nat", "M.x", "M.n", "Datatypes.Init.Coq.O"), ids);
        assertEquals(List.of("nat", "x", "Datatypes.Init.Coq.O"), queried);
        assertEquals("Coq.Init.Datatypes.nat", cache.get("nat"));
        assertFalse(cache.containsKey("x"));

        queried.clear();
        qualifier.qualifyAll(AST);
        assertEquals(List.of("x"), queried);
    }

    @Test
    void localShadowingLastsOnlyForOneAst() {
        var qualifier = new IdentifierQualifier(name -> "SerTop." + name, new HashMap<>(), "M", "SerTop");
        var locals = new HashSet<String>();
        assertEquals("M.y", qualifier.qualify(new Identifier(IdentType.LIDENT, "y"), locals).string());
        assertEquals("M.y", qualifier.qualify(new Identifier(IdentType.CREF, "y"), locals).string());
        assertEquals(List.of(new Identifier(IdentType.SER_QUALID, "M.y")),
                qualifier.qualifyAll("(Ser_Qualid(DirPath())(Id y))"));
    }

    @Test
    void unknownGlobalsKeepTheirSpelling() {
        var qualifier = new IdentifierQualifier(name -> null, new HashMap<>(), "M", "SerTop");
        assertEquals("mystery", qualifier.qualifyAll("(Ser_Qualid(DirPath())(Id mystery))").get(0).string());
    }
}
