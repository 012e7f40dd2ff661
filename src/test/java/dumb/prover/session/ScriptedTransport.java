package dumb.prover.session;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * An in-memory assistant that answers each expected request with canned units.
 * An exhausted unit queue behaves like an assistant that never answers.
 */
class ScriptedTransport implements Transport {
    static final String EOF = "<eof>";

    private record Expectation(String request, List<String> units) {
    }

    final List<String> sent = new ArrayList<>();
    private final Deque<Expectation> expectations = new ArrayDeque<>();
    private final Deque<String> pending = new ArrayDeque<>();
    private boolean closed = false;
    int closeCount = 0;

    ScriptedTransport expect(String request, String... units) {
        expectations.add(new Expectation(request, List.of(units)));
        return this;
    }

    /**
     * An {@code Add} answered with the given state id, followed by an {@code Exec} that completes.
     */
    ScriptedTransport expectExecute(String cmd, int stateId, String... execFeedback) {
        expect("(Add () \"" + Session.escape(cmd) + "\")", ack(), added(stateId), completed());
        var exec = new ArrayList<String>();
        exec.add(ack());
        exec.addAll(List.of(execFeedback));
        exec.add(completed());
        return expect("(Exec " + stateId + ")", exec.toArray(String[]::new));
    }

    boolean isDone() {
        return expectations.isEmpty();
    }

    @Override
    public void sendLine(String line) {
        if (closed) throw new IllegalStateException("closed");
        sent.add(line);
        var next = expectations.poll();
        if (next == null) throw new AssertionError("Unexpected request " + line);
        if (!next.request.equals(line)) throw new AssertionError("Expected request " + next.request + " but got " + line);
        pending.addAll(next.units);
    }

    @Override
    public @Nullable String readUnit(Duration timeout) throws TimeoutException {
        var unit = pending.poll();
        if (unit == null) throw new TimeoutException();
        return unit.equals(EOF) ? null : unit;
    }

    @Override
    public boolean isAlive() {
        return !closed;
    }

    @Override
    public void close() {
        closeCount++;
        closed = true;
    }

    static String ack() {
        return "(Answer 1 Ack)";
    }

    static String completed() {
        return "(Answer 1 Completed)";
    }

    static String answer(String body) {
        return "(Answer 1" + body + ")";
    }

    static String added(int stateId) {
        return "(Answer 1(Added " + stateId + "((fname ToplevelInput)(line_nb 1)(bol_pos 0)(line_nb_last 1)(bol_pos_last 0)(bp 0)(ep 5))NewTip))";
    }

    static String exn(String msg) {
        return "(Answer 1(CoqExn((loc())(stm_ids())(backtrace(Backtrace()))(exn(Failure \"x\"))(pp(Pp_string x))(str \"" + Session.escape(msg) + "\"))))";
    }

    static String message(String level, String text) {
        return "(Feedback((doc_id 0)(span_id 1)(route 0)(contents(Message(level " + level + ")(loc())(pp(Pp_string x))(str \""
                + Session.escape(text) + "\")))))";
    }

    static String notice(String text) {
        return message("Notice", text);
    }

    static String vernac(String cmd) {
        return "(Query () (Vernac \"" + Session.escape(cmd) + "\"))";
    }
}
