package dumb.prover.extract;

import dumb.prover.Location;
import dumb.prover.session.Goal;
import dumb.prover.session.Goals;
import dumb.prover.session.IdentType;
import dumb.prover.session.Identifier;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandRecordsTest {

    @TempDir
    Path dir;

    private static VernacSentence sentence(String text, int line, int lineLast, int beg, @Nullable Goals goals,
                                           Identifier... ids) {
        return new VernacSentence(text, "((v(VernacExpr()(Foo)))(loc()))", List.of(ids),
                new Location("a.v", line, beg, lineLast, beg, beg, beg + text.length()), "Foo", goals, List.of());
    }

    private static final Goals TRUE = new Goals(List.of(new Goal(3, "True", "(Ind True)", List.of())),
            List.of(), List.of(), List.of());

    private static final CommandRecord LEMMA = new CommandRecord(List.of("foo"), null,
            sentence("Lemma foo : True.", 0, 0, 0, null, new Identifier(IdentType.SER_QUALID, "Coq.Init.Logic.True")),
            List.of(List.of(sentence("Proof.", 1, 1, 18, TRUE), sentence("trivial.", 1, 1, 25, TRUE),
                    sentence("Qed.", 3, 3, 36, TRUE))));

    private static final CommandRecord DEFINITION = new CommandRecord(List.of("x"),
            sentence("Definition x := 1.", 4, 5, 41, null, new Identifier(IdentType.LIDENT, "a.x")));

    @Test
    void jsonKeepsEverything() throws Exception {
        var records = List.of(LEMMA, DEFINITION);
        var json = CommandRecords.toJson(records);
        assertTrue(json.contains("\"identifiers\""));
        assertEquals(records, CommandRecords.fromJson(json));
    }

    @Test
    void filesRoundTrip() throws Exception {
        var file = dir.resolve("a.json");
        CommandRecords.write(file, List.of(DEFINITION, LEMMA));
        assertEquals(List.of(DEFINITION, LEMMA), CommandRecords.read(file));
    }

    @Test
    void proofsCanBeAttachedLater() {
        var record = new CommandRecord(List.of("x"), DEFINITION.command());
        var patched = record.withProof(List.of(sentence("Next Obligation.", 6, 6, 60, null)));
        assertEquals(1, patched.proofs().size());
        assertEquals("Next Obligation.", patched.proofText());
        assertTrue(record.proofs().isEmpty());
        assertNotEquals(record, patched);
    }

    @Test
    void recordsCannotBeChangedThroughTheirProofs() {
        var block = new ArrayList<>(LEMMA.proofs().get(0));
        var record = new CommandRecord(List.of("foo"), null, LEMMA.command(), List.of(block));
        block.clear();
        assertEquals(3, record.proofs().get(0).size());
        assertThrows(UnsupportedOperationException.class, () -> record.proofs().add(List.of()));
        assertThrows(UnsupportedOperationException.class, () -> record.proofs().get(0).clear());
        assertEquals(LEMMA.hashCode(), record.hashCode());
    }

    @Test
    void textAndLocations() {
        assertEquals("Lemma foo : True.\nProof.\ntrivial.\nQed.", LEMMA.allText());
        assertEquals("Proof.\ntrivial.\nQed.", LEMMA.proofText());
        assertEquals("", DEFINITION.proofText());
        var span = LEMMA.spanningLocation();
        assertEquals(0, span.lineno());
        assertEquals(3, span.linenoLast());
        assertEquals(40, span.endCharno());
        assertTrue(LEMMA.compareTo(DEFINITION) < 0);
        assertEquals(Set.of("Coq.Init.Logic.True"), LEMMA.referencedIdentifiers());
    }

    @Test
    void sentencesAreInDocumentOrder() {
        var all = CommandRecords.sentences(List.of(DEFINITION, LEMMA));
        assertEquals(List.of("Lemma foo : True.", "Proof.", "trivial.", "Qed.", "Definition x := 1."),
                all.stream().map(VernacSentence::text).toList());
    }

    @Test
    void documentTextKeepsLines() {
        var text = CommandRecords.toDocumentText(List.of(DEFINITION, LEMMA));
        assertEquals(String.join("\n", "Lemma foo : True.", "Proof. trivial.", "", "Qed.", "Definition x", ":= 1."), text);
    }

    @Test
    void splitSpreadsWordsEvenly() {
        assertEquals(List.of("a b c", "d e"), CommandRecords.split(new String[]{"a", "b", "c", "d", "e"}, 2));
        assertEquals(List.of("a", "", ""), CommandRecords.split(new String[]{"a"}, 3));
        assertEquals(List.of("a b"), CommandRecords.split(new String[]{"a", "b"}, 1));
    }
}
