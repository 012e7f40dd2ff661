package dumb.prover.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static dumb.prover.session.Patterns.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternsTest {

    @Test
    void obligationsNameTheirProgram() {
        var m = OBLIGATION_ID_PATTERN.matcher("f_obligation_12");
        assertTrue(m.matches());
        assertEquals("f", m.group("proofId"));
        assertFalse(OBLIGATION_ID_PATTERN.matcher("f_obligation_").matches());
    }

    @Test
    void subproofsNameTheirOwner() {
        var m = SUBPROOF_ID_PATTERN.matcher("my_lemma_subproof0");
        assertTrue(m.matches());
        assertEquals("my_lemma", m.group("proofId"));
        assertTrue(SUBPROOF_ID_PATTERN.matcher("foo_subproof").matches());
    }

    @ParameterizedTest
    @ValueSource(strings = {"internal_eq_rew", "internal_eq_rew_r_dep", "internal_True_case"})
    void rewriteSchemes(String id) {
        assertTrue(REWRITE_SCHEME_ID_PATTERN.matcher(id).matches());
    }

    @Test
    void addedStates() {
        var m = ADDED_STATE_PATTERN.matcher("(Answer 2(Added 17((fname ToplevelInput))NewTip))");
        assertTrue(m.find());
        assertEquals("17", m.group("stateId"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Save foo.", "Save   foo_bar' .", "Save x1."})
    void saveCommands(String cmd) {
        assertTrue(SAVE_PATTERN.matcher(cmd).matches());
    }

    @Test
    void saveNeedsAName() {
        assertFalse(SAVE_PATTERN.matcher("Save.").matches());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Set Printing All.", "Unset Printing Notations.", "Set Printing Depth 50."})
    void printingOptions(String cmd) {
        assertTrue(PRINTING_OPTIONS_PATTERN.matcher(cmd).find());
    }

    @Test
    void otherOptionsAreNotPrintingOptions() {
        assertFalse(PRINTING_OPTIONS_PATTERN.matcher("Set Implicit Arguments.").find());
        assertFalse(PRINTING_OPTIONS_PATTERN.matcher("Lemma Set_Printing : True.").find());
    }

    @Test
    void unicodeIdentifiers() {
        assertTrue(IDENT_PATTERN.matcher("αβ_1'").matches());
        assertFalse(IDENT_PATTERN.matcher("1abc").matches());
    }

    @Test
    void settings() {
        assertEquals(new Setting("Printing Depth", "999999"), Setting.parse("Printing Depth is 999999"));
        var off = Setting.parse("  Program Mode is off ");
        assertNotNull(off);
        assertFalse(off.isOn());
        assertTrue(off.isFlag());
        assertNull(Setting.parse("nothing to see"));
    }
}
