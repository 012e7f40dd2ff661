package dumb.prover.session;

import dumb.prover.SexpParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.prover.session.ScriptedTransport.*;
import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private ScriptedTransport transport;
    private Session session;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        session = new Session(new SessionConfig().withPrintingOptions(List.of()), transport);
    }

    @Test
    void printingOptionsAreAppliedAtStartup() {
        var t = new ScriptedTransport().expectExecute("Set Printing Depth 999999.", 1);
        var s = new Session(new SessionConfig().withPrintingOptions(List.of("Set Printing Depth 999999.")), t);
        assertTrue(t.isDone());
        assertEquals(List.of(), s.frames());
    }

    @Test
    void sendCollectsAnswersAndMessages() {
        transport.expect(vernac("Print foo."), ack(), notice("foo = 1\n     : nat"), answer("(ObjList())"), completed());
        var reply = session.send(vernac("Print foo."));
        assertEquals(3, reply.responses().size());
        assertEquals(List.of("foo = 1\n     : nat"), reply.feedback());
        assertTrue(reply.raw().startsWith("(Answer 1 Ack)\0"));
    }

    @Test
    void nonMessageFeedbackIsIgnored() {
        transport.expect(vernac("Check I."), ack(),
                "(Feedback((doc_id 0)(span_id 1)(route 0)(contents Processed)))", notice("I\n     : True"), completed());
        assertEquals(List.of("I\n     : True"), session.queryVernac("Check I."));
    }

    @Test
    void assistantErrorInterruptsSend() {
        transport.expect(vernac("Print nothing."), ack(), exn("nothing not a defined object."), completed());
        var e = assertThrows(AssistantException.class, () -> session.queryVernac("Print nothing."));
        assertEquals("nothing not a defined object.", e.errorMessage());
        assertTrue(e.fullSexp().startsWith("(CoqExn"));
        assertEquals(vernac("Print nothing."), e.query());
    }

    @Test
    void leftoverUnitsOfAFailedRequestAreDiscarded() {
        transport.expect(vernac("Print nothing."), ack(), exn("boom"), notice("late"), completed())
                .expect(vernac("Print foo."), "(Answer 2 Ack)", notice("foo"), "(Answer 2 Completed)");
        assertThrows(AssistantException.class, () -> session.queryVernac("Print nothing."));
        assertEquals(List.of("foo"), session.queryVernac("Print foo."));
    }

    @Test
    void quietFeedbackIsDroppedUnlessVerbose() {
        transport.expectExecute("Compute 1.", 2, notice("= 1"), message("Warning", "careful"), message("Info", "fyi"));
        var result = session.execute("Compute 1.", false, false);
        assertEquals(List.of("careful"), result.feedback());
        assertNull(result.ast());

        transport.expectExecute("Compute 2.", 3, notice("= 2"));
        assertEquals(List.of("= 2"), session.execute("Compute 2.", false, true).feedback());
    }

    @Test
    void timeoutIsFatalForTheRequest() {
        transport.expect(vernac("Slow."), ack());
        assertThrows(AssistantTimeoutException.class, () -> session.queryVernac("Slow."));
        assertFalse(session.isAlive());
    }

    @Test
    void lateUnitsOfATimedOutRequestAreNeverReadAsAnAnswer() {
        transport.expect(vernac("Slow."), ack());
        assertThrows(AssistantTimeoutException.class, () -> session.queryVernac("Slow."));
        transport.expect(vernac("Print foo."), ack(), notice("stale"), completed(),
                "(Answer 2 Ack)", notice("foo"), "(Answer 2 Completed)");
        assertThrows(SessionClosedException.class, () -> session.queryVernac("Print foo."));
    }

    @Test
    void malformedUnitIsAProtocolViolation() {
        transport.expect(vernac("Bad."), ack(), "(Answer 1 (ObjList");
        assertThrows(ProtocolViolationException.class, () -> session.queryVernac("Bad."));
        assertFalse(session.isAlive());
        assertThrows(SessionClosedException.class, () -> session.queryVernac("Print foo."));
    }

    @Test
    void assistantExitIsAProtocolViolation() {
        transport.expect(vernac("Quit."), ack(), EOF);
        assertThrows(ProtocolViolationException.class, () -> session.queryVernac("Quit."));
        assertThrows(SessionClosedException.class, () -> session.queryVernac("Print foo."));
    }

    @Test
    void multiLineRequestsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> session.send("(Query ()\nGoals)"));
    }

    @Test
    void executeRegistersStateBeforeRunning() {
        session.push();
        transport.expect("(Add () \"exact I.\")", ack(), added(5), completed())
                .expect("(Exec 5)", ack(), exn("In environment ..."), completed());
        assertThrows(AssistantException.class, () -> session.execute("exact I.", false, true));
        assertEquals(List.of(List.of(5)), session.frames());

        transport.expect("(Cancel (5))", ack(), answer("(Canceled(5))"), completed());
        session.pop();
        assertEquals(List.of(List.of()), session.frames());
        assertTrue(transport.isDone());
    }

    @Test
    void failedAddRegistersNothing() {
        session.push();
        transport.expect("(Add () \"Lemma.\")", ack(), exn("Syntax error"), completed());
        assertThrows(AssistantException.class, () -> session.execute("Lemma.", false, true));
        assertEquals(List.of(List.of()), session.frames());
    }

    @Test
    void popNCancelsTheUnionOfTheTopFrames() {
        session.push();
        transport.expectExecute("Definition a := 1.", 2).expectExecute("Definition b := 2.", 3);
        session.execute("Definition a := 1.", false, false);
        session.execute("Definition b := 2.", false, false);
        session.push();
        transport.expectExecute("Definition c := 3.", 4);
        session.execute("Definition c := 3.", false, false);
        assertEquals(List.of(List.of(2, 3), List.of(4)), session.frames());

        assertThrows(IndexOutOfBoundsException.class, () -> session.popN(3));

        transport.expect("(Cancel (4 2 3))", ack(), answer("(Canceled(2 3 4))"), completed());
        session.popN(2);
        assertEquals(List.of(List.of()), session.frames());
        assertTrue(transport.isDone());
    }

    @Test
    void popOfEmptyFramesSendsNothing() {
        session.push();
        session.push();
        session.popN(2);
        assertEquals(List.of(List.of()), session.frames());
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void pullFoldsAFrameIntoTheOneBelow() {
        session.push();
        transport.expectExecute("Definition a := 1.", 2);
        session.execute("Definition a := 1.", false, false);
        session.push();
        transport.expectExecute("Definition b := 2.", 3);
        session.execute("Definition b := 2.", false, false);

        assertEquals(1, session.pull());
        assertEquals(List.of(List.of(2, 3)), session.frames());
        assertThrows(IndexOutOfBoundsException.class, () -> session.pull(0));
        assertThrows(IndexOutOfBoundsException.class, () -> session.pull(1));
        assertThrows(IndexOutOfBoundsException.class, () -> session.pull(-2));
    }

    @Test
    void pullByNonNegativeIndex() {
        session.push();
        session.push();
        session.push();
        assertEquals(0, session.pull(1));
        assertEquals(2, session.frames().size());
    }

    @Test
    void tryExecuteRollsBackRejectedCommands() {
        session.push();
        transport.expect("(Add () \"Admitted.\")", ack(), added(7), completed())
                .expect("(Exec 7)", ack(), exn("No focused proof"), completed())
                .expect("(Cancel (7))", ack(), answer("(Canceled(7))"), completed());
        assertNull(session.tryExecute("Admitted.", false, false));
        assertEquals(List.of(List.of()), session.frames());

        transport.expectExecute("Definition d := 0.", 8);
        assertNotNull(session.tryExecute("Definition d := 0.", false, false));
        assertEquals(List.of(List.of(8)), session.frames());
        assertTrue(transport.isDone());
    }

    @Test
    void astsAreParsedAndCached() throws SexpParser.ParseException {
        var ast = "((v((control())(attrs())(expr(VernacStartTheoremProof Lemma))))(loc()))";
        transport.expect("(Parse () \"Lemma foo : True.\")", ack(), answer("(ObjList((CoqAst" + ast + ")))"), completed());
        assertEquals(SexpParser.parse(ast), session.queryAst("Lemma foo : True."));
        assertEquals(SexpParser.parse(ast), session.queryAst("Lemma foo : True."));
        assertEquals(1, transport.sent.size());
    }

    @Test
    void executeWithAstParsesBeforeRunning() {
        var ast = "((v((control())(attrs())(expr(VernacProof()))))(loc()))";
        transport.expect("(Add () \"Proof.\")", ack(), added(4), completed())
                .expect("(Parse () \"Proof.\")", ack(), answer("(ObjList((CoqAst" + ast + ")))"), completed())
                .expect("(Exec 4)", ack(), completed());
        var result = session.execute("Proof.", true, true);
        assertEquals("v", result.ast().head());
    }

    private static String print(String sexp) {
        return "(Print ((pp ((pp_format PpStr)))) (CoqConstr " + sexp + "))";
    }

    private static String goal(int id, String ty, String hyps) {
        return "((info((evar(Ser_Evar " + id + "))(name())))(ty" + ty + ")(hyp(" + hyps + ")))";
    }

    @Test
    void goalsAreDeserialized() {
        var g5 = goal(5, "(Ind True)", "(((Id n))()(Ind nat))(((Id m)(Id k))((Rel 1))(Ind nat))");
        var g6 = goal(6, "(Ind False)", "");
        var reply = "(ObjList((CoqGoal((goals(" + g5 + "))(stack(((" + g6 + ")())))(shelf())(given_up())))))";
        transport.expect("(Query () Goals)", ack(), answer(reply), completed())
                .expect(print("(Ind nat)"), ack(), answer("(ObjList((CoqString nat)))"), completed())
                .expect(print("(Rel 1)"), ack(), answer("(ObjList((CoqString\"  3 \")))"), completed())
                .expect(print("(Ind True)"), ack(), answer("(ObjList((CoqString True)))"), completed())
                .expect(print("(Ind False)"), ack(), answer("(ObjList((CoqString False)))"), completed());

        var goals = session.queryGoals();
        assertTrue(transport.isDone());
        assertNotNull(goals);
        assertEquals(1, goals.foreground().size());
        var g = goals.foreground().get(0);
        assertEquals(5, g.id());
        assertEquals("True", g.type());
        assertEquals("(Ind True)", g.sexp());
        assertEquals(List.of(
                new Hypothesis(List.of("k", "m"), "3", "nat", "(Ind nat)"),
                new Hypothesis(List.of("n"), null, "nat", "(Ind nat)")), g.hypotheses());
        assertEquals(1, goals.backgroundDepth());
        assertEquals(6, goals.background().get(0).left().get(0).id());
        assertTrue(goals.background().get(0).right().isEmpty());
        assertTrue(goals.shelved().isEmpty());
    }

    @Test
    void noGoalsOutsideProofMode() {
        transport.expect("(Query () Goals)", ack(), answer("(ObjList())"), completed());
        assertNull(session.queryGoals());
        transport.expect("(Query () Goals)", ack(), answer("(ObjList())"), completed());
        assertFalse(session.hasOpenGoals());
    }

    @Test
    void printConstrNormalizesSpacesAndCaches() {
        transport.expect(print("(Ind nat)"), ack(), answer("(ObjList((CoqString\"forall  x,\\n  x\")))"), completed());
        assertEquals("forall x, x", session.printConstr("(Ind nat)"));
        assertEquals("forall x, x", session.printConstr("(Ind nat)"));
        assertEquals(1, transport.sent.size());
    }

    @Test
    void printConstrOfUnknownTermIsNull() {
        transport.expect(print("(Const bad)"), ack(), exn("Not_found"), completed());
        assertNull(session.printConstr("(Const bad)"));
        transport.expect(print("(Const worse)"), ack(), exn("Anomaly"), completed());
        assertThrows(AssistantException.class, () -> session.printConstr("(Const worse)"));
    }

    @Test
    void localIdsComeFromPrintAll() {
        var listing = String.join("\n",
                ">>>>>>> Library SerTop",
                "foo : True",
                "Inductive color : Set :=  Red : color | Blue : color",
                "  | Green : color",
                "For seq: Argument scopes are [list_scope]",
                "*** [ A : Set ]",
                "bar' : nat -> nat");
        transport.expect(vernac("Print All."), ack(), notice(listing), completed());
        assertEquals(List.of("SerTop", "foo", "color", "A", "bar'"), session.getLocalIds());
    }

    @Test
    void conjectureIdIsTheFirstShownConjecture() {
        transport.expect(vernac("Show Conjectures."), ack(), notice("foo bar\nbaz"), completed());
        assertEquals("foo", session.getConjectureId());

        transport.expect(vernac("Show Conjectures."), ack(), completed());
        assertNull(session.getConjectureId());

        transport.expect(vernac("Show Conjectures."), ack(), exn("No proof-editing in progress."), completed());
        assertNull(session.getConjectureId());
    }

    @Test
    void settingsAreParsed() {
        transport.expect(vernac("Test Program Mode."), ack(), notice("Program Mode is on"), completed());
        var setting = session.querySetting("Program Mode");
        assertEquals(new Setting("Program Mode", "on"), setting);
        assertTrue(setting.isOn());
        assertTrue(setting.isFlag());
    }

    @Test
    void fullQualidsComeFromLocate() {
        transport.expect(vernac("Locate I."), ack(), notice(
                "Constructor Coq.Init.Logic.I\n  (shorter name to refer to it in current context is I)\nConstant SerTop.I"), completed());
        assertEquals(List.of("Coq.Init.Logic.I", "SerTop.I"), session.queryFullQualids("I"));

        transport.expect(vernac("Locate zzz."), ack(), notice("No object of basename zzz"), completed());
        assertNull(session.queryFullQualid("zzz"));

        assertThrows(IllegalArgumentException.class, () -> session.queryFullQualids("\"_ + _\""));
    }

    @Test
    void qualidsRetryWithoutTheTopPrefix() {
        var located = "(ObjList((CoqQualId((v(Ser_Qualid(DirPath((Id Datatypes)(Id Init)(Id Coq)))(Id nat)))(loc())))))";
        transport.expect("(Query () (Locate \"SerTop.nat\"))", ack(), answer("(ObjList())"), completed())
                .expect("(Query () (Locate \"nat\"))", ack(), answer(located), completed());
        assertEquals(List.of("Coq.Init.Datatypes.nat"), session.queryQualids("SerTop.nat"));
    }

    @Test
    void closeIsIdempotent() {
        session.close();
        session.close();
        assertEquals(1, transport.closeCount);
        assertTrue(session.isDead());
        assertThrows(SessionClosedException.class, () -> session.queryVernac("Print foo."));
    }

    @Test
    void commandsAreEscaped() {
        assertEquals("Notation \\\"x\\\" := (a \\\\ b).\\n", Session.escape("Notation \"x\" := (a \\ b).\n"));
    }
}
