package dumb.prover.session;

import dumb.prover.IllegalSexpOperationException;
import dumb.prover.Sexp;
import dumb.prover.SexpParser;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * An interactive session with one assistant process speaking the s-expression protocol.
 * <p>
 * A checkpoint stack records which states were added since each {@link #push()} so they can be cancelled
 * together. Command ASTs and printed kernel terms are cached for the life of the session.
 * <p>
 * Not thread-safe; one session owns its process exclusively.
 */
public class Session implements Assistant {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    /**
     * Feedback levels that are dropped from non-verbose executions.
     */
    private static final Set<String> QUIET_LEVELS = Set.of("Debug", "Info", "Notice");

    private final SessionConfig config;
    private final Transport transport;
    private final List<List<Integer>> frameStack = new ArrayList<>();
    private final Map<String, Sexp> astCache;
    private final Map<String, String> constrCache;
    private boolean dead = false;

    /**
     * Starts the configured assistant process.
     */
    public static Session start(SessionConfig config) throws IOException {
        return new Session(config, new ProcessTransport(config.command(), config.workingDirectory()));
    }

    /**
     * Opens a session over an already running assistant and applies the configured printing options.
     */
    public Session(SessionConfig config, Transport transport) {
        this.config = config;
        this.transport = transport;
        this.astCache = boundedCache(config.cacheCapacity());
        this.constrCache = boundedCache(config.cacheCapacity());
        try {
            for (var option : config.printingOptions()) execute(option, false, false);
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        logger.info("Session started with {} printing options", config.printingOptions().size());
    }

    private static <K, V> Map<K, V> boundedCache(int capacity) {
        return new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * The answer to one request: the {@code Answer} units (starting with the acknowledgement), the text of the
     * feedback messages and the raw protocol text.
     */
    public record Reply(List<Sexp> responses, List<String> feedback, String raw) {
    }

    public Reply send(String request) {
        return send(request, true);
    }

    /**
     * Writes one request and reads units until it completes.
     * <p>
     * Units arriving before this request's acknowledgement belong to earlier requests and are discarded.
     *
     * @throws AssistantException        if the assistant answers with an exception
     * @throws AssistantTimeoutException if the answer does not complete within the configured timeout
     * @throws ProtocolViolationException if a unit is malformed or the assistant exits
     * @throws SessionClosedException     if an earlier request timed out or broke the protocol
     */
    public Reply send(String request, boolean verbose) {
        ensureAlive();
        if (request.indexOf('\n') >= 0 || request.indexOf('\r') >= 0)
            throw new IllegalArgumentException("A request must fit on one line: " + request);
        logger.debug("-> {}", request);
        try {
            transport.sendLine(request);
            return readReply(request, verbose);
        } catch (IOException e) {
            dead = true;
            throw new ProtocolViolationException("Cannot write to the assistant: " + e.getMessage(), e);
        } catch (AssistantTimeoutException | ProtocolViolationException e) {
            // late units of this request would be read as the answer to the next one
            dead = true;
            throw e;
        }
    }

    private Reply readReply(String request, boolean verbose) {
        var deadline = System.nanoTime() + config.timeout().toNanos();
        var responses = new ArrayList<Sexp>();
        var feedback = new ArrayList<String>();
        var raw = new StringBuilder();
        String answerId = null;
        while (true) {
            var unit = readUnit(request, deadline);
            var start = protocolStart(unit);
            if (start < 0) {
                if (!unit.isBlank()) logger.debug("Ignoring non-protocol output: {}", unit);
                continue;
            }
            unit = unit.substring(start).strip();
            var sexp = parseUnit(unit);
            logger.debug("<- {}", unit);

            if (answerId == null) {
                if (isAck(sexp)) {
                    answerId = sexp.get(1).content();
                    responses.add(sexp);
                    raw.append(unit).append('\0');
                } else {
                    logger.debug("Discarding unit of an earlier request: {}", unit);
                }
                continue;
            }
            raw.append(unit).append('\0');

            try {
                if (sexp.head().equals("Feedback")) {
                    var msg = message(sexp, verbose);
                    if (msg != null) feedback.add(msg);
                    continue;
                }
                if (!sexp.get(1).content().equals(answerId))
                    throw new ProtocolViolationException("Answer " + sexp.get(1).content() + " interleaved with answer " + answerId + ": " + unit);
                var body = sexp.get(2);
                if (body.isAtom() && body.content().equals("Completed")) {
                    responses.add(sexp);
                    return new Reply(responses, feedback, raw.toString());
                }
                if (body.isList() && body.head().equals("CoqExn")) throw assistantError(body, request);
                responses.add(sexp);
            } catch (IllegalSexpOperationException e) {
                throw new ProtocolViolationException("Unexpected unit shape: " + unit, e);
            }
        }
    }

    private String readUnit(String request, long deadline) {
        var remaining = deadline - System.nanoTime();
        try {
            if (remaining <= 0) throw new TimeoutException();
            var unit = transport.readUnit(Duration.ofNanos(remaining));
            if (unit == null) {
                throw new ProtocolViolationException("The assistant exited while answering " + request);
            }
            return unit;
        } catch (TimeoutException e) {
            logger.error("No complete answer to {} within {}s", request, config.timeoutSeconds());
            throw new AssistantTimeoutException("No complete answer to " + request + " within " + config.timeoutSeconds() + "s");
        } catch (IOException e) {
            throw new ProtocolViolationException("Cannot read from the assistant: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantTimeoutException("Interrupted while waiting for an answer to " + request);
        }
    }

    private static int protocolStart(String unit) {
        var a = unit.indexOf("(Answer");
        var f = unit.indexOf("(Feedback");
        if (a < 0) return f;
        if (f < 0) return a;
        return Math.min(a, f);
    }

    private static Sexp parseUnit(String unit) {
        try {
            return SexpParser.parse(unit);
        } catch (SexpParser.ParseException e) {
            throw new ProtocolViolationException("Malformed unit: " + e.getMessage(), e);
        }
    }

    private static boolean isAck(Sexp sexp) {
        return sexp.isList() && sexp.size() == 3 && sexp.head().equals("Answer")
                && sexp.get(2).isAtom() && sexp.get(2).content().equals("Ack");
    }

    /**
     * The text of a feedback message, or null if the feedback is not a (kept) message.
     */
    private static @Nullable String message(Sexp feedback, boolean verbose) {
        var contents = feedback.get(1).asList().fieldValue("contents");
        if (contents == null || !contents.isList() || contents.size() == 0 || !contents.head().equals("Message"))
            return null;
        var fields = contents.asList();
        var level = fields.fieldValue("level");
        if (!verbose && level != null && QUIET_LEVELS.contains(level.content())) return null;
        var str = fields.fieldValue("str");
        if (str == null || !str.isAtom())
            throw new ProtocolViolationException("Feedback message without text: " + feedback.toSexp());
        return str.asAtom().unquoted();
    }

    private static AssistantException assistantError(Sexp coqExn, String request) {
        var fullSexp = coqExn.toSexp();
        String msg = null;
        if (coqExn.size() > 1 && coqExn.get(1).isList()) {
            var str = coqExn.get(1).asList().fieldValue("str");
            if (str != null && str.isAtom()) msg = str.asAtom().unquoted();
        }
        return new AssistantException(msg != null ? msg : fullSexp, fullSexp, request);
    }

    /**
     * Escapes a command for embedding in a quoted request string.
     */
    public static String escape(String cmd) {
        var sb = new StringBuilder(cmd.length() + 8);
        for (var i = 0; i < cmd.length(); i++) {
            var c = cmd.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String normalizeSpaces(String s) {
        return s.strip().replaceAll("\\s+", " ");
    }

    private void ensureAlive() {
        if (dead) throw new SessionClosedException();
    }

    /**
     * Adds a command and records its state in the top checkpoint.
     *
     * @return the new state id
     */
    public int add(String cmd) {
        var reply = send("(Add () \"" + escape(cmd) + "\")");
        var m = Patterns.ADDED_STATE_PATTERN.matcher(reply.raw());
        Integer stateId = null;
        while (m.find()) stateId = Integer.parseInt(m.group("stateId"));
        if (stateId == null) throw new ProtocolViolationException("No state added for " + cmd + ": " + reply.raw());
        if (!frameStack.isEmpty()) frameStack.get(frameStack.size() - 1).add(stateId);
        return stateId;
    }

    @Override
    public Execution execute(String cmd, boolean wantAst, boolean verbose) {
        var stateId = add(cmd);
        var ast = wantAst ? queryAst(cmd) : null;
        var reply = send("(Exec " + stateId + ")", verbose);
        return new Execution(reply.responses(), reply.feedback(), ast);
    }

    @Override
    public @Nullable Execution tryExecute(String cmd, boolean wantAst, boolean verbose) {
        push();
        try {
            var result = execute(cmd, wantAst, verbose);
            pull();
            return result;
        } catch (AssistantException e) {
            logger.warn("'{}' was rejected and rolled back: {}", cmd, e.errorMessage());
            pop();
            return null;
        }
    }

    public void cancel(Collection<Integer> states) {
        if (states.isEmpty()) return;
        send("(Cancel (" + states.stream().map(String::valueOf).collect(Collectors.joining(" ")) + "))");
    }

    @Override
    public void push() {
        frameStack.add(new ArrayList<>());
    }

    @Override
    public void popN(int n) {
        if (n < 0) throw new IllegalArgumentException("Cannot pop a negative number of frames: " + n);
        if (n > frameStack.size())
            throw new IndexOutOfBoundsException("Cannot pop " + n + " frames; exceeds stack size " + frameStack.size());
        var states = new ArrayList<Integer>();
        for (var i = 0; i < n; i++) states.addAll(frameStack.remove(frameStack.size() - 1));
        cancel(states);
        if (frameStack.isEmpty()) push();
    }

    @Override
    public int pull(int index) {
        var num = frameStack.size();
        if (index >= num || index < -num)
            throw new IndexOutOfBoundsException("Frame " + index + " is out of bounds [" + -num + ", " + (num - 1) + "]");
        var pos = index >= 0 ? index : num + index;
        if (pos == 0) throw new IndexOutOfBoundsException("Frame " + index + " has no frame below it");
        var states = frameStack.remove(pos);
        frameStack.get(pos - 1).addAll(states);
        return states.size();
    }

    /**
     * A copy of the checkpoint stack, bottom first.
     */
    public List<List<Integer>> frames() {
        return frameStack.stream().map(List::copyOf).toList();
    }

    @Override
    public Sexp queryAst(String cmd) {
        var cached = astCache.get(cmd);
        if (cached != null) return cached;
        var reply = send("(Parse () \"" + escape(cmd) + "\")");
        try {
            var obj = reply.responses().get(1).get(2).get(1).get(0);
            if (!obj.head().equals("CoqAst")) throw new ProtocolViolationException("Expected an AST: " + obj.toSexp());
            var ast = obj.get(1);
            // some protocol versions wrap the located AST once more
            if (!ast.head().equals("v")) ast = ast.get(1);
            astCache.put(cmd, ast);
            return ast;
        } catch (IllegalSexpOperationException | IndexOutOfBoundsException e) {
            throw new ProtocolViolationException("Unexpected reply to Parse: " + reply.raw(), e);
        }
    }

    /**
     * Prints a serialized kernel term, or returns null if the assistant cannot resolve it.
     */
    public @Nullable String printConstr(String sexp) {
        var cached = constrCache.get(sexp);
        if (cached != null) return cached;
        Reply reply;
        try {
            reply = send("(Print ((pp ((pp_format PpStr)))) (CoqConstr " + sexp + "))");
        } catch (AssistantException e) {
            if (e.errorMessage().equals("Not_found")) return null;
            throw e;
        }
        try {
            var constr = reply.responses().get(1).get(2).get(1).get(0).get(1);
            var printed = normalizeSpaces(constr.asAtom().unquoted());
            constrCache.put(sexp, printed);
            return printed;
        } catch (IllegalSexpOperationException | IndexOutOfBoundsException e) {
            throw new ProtocolViolationException("Unexpected reply to Print: " + reply.raw(), e);
        }
    }

    public @Nullable String printConstr(Sexp sexp) {
        return printConstr(sexp.toSexp());
    }

    /**
     * Runs a query command and returns its messages.
     */
    public List<String> queryVernac(String cmd) {
        return send("(Query () (Vernac \"" + escape(cmd) + "\"))").feedback();
    }

    private Sexp goalsObjects() {
        var reply = send("(Query () Goals)");
        try {
            var objList = reply.responses().get(1).get(2);
            if (!objList.head().equals("ObjList")) throw new ProtocolViolationException("Expected ObjList: " + reply.raw());
            return objList.get(1);
        } catch (IllegalSexpOperationException | IndexOutOfBoundsException e) {
            throw new ProtocolViolationException("Unexpected reply to a goals query: " + reply.raw(), e);
        }
    }

    public boolean hasOpenGoals() {
        return goalsObjects().size() > 0;
    }

    public boolean isInProofMode() {
        return !dead && hasOpenGoals();
    }

    @Override
    public @Nullable Goals queryGoals() {
        var objs = goalsObjects();
        if (objs.size() == 0) return null;
        try {
            var fields = objs.get(0).get(1);
            var fg = goals(fields.get(0).get(1));
            var background = new ArrayList<Goals.Level>();
            for (var pair : fields.get(1).get(1).asList().children)
                background.add(new Goals.Level(goals(pair.get(0)), goals(pair.get(1))));
            var shelved = goals(fields.get(2).get(1));
            var abandoned = goals(fields.get(3).get(1));
            var result = new Goals(fg, background, shelved, abandoned);
            return result.isEmpty() ? null : result;
        } catch (IllegalSexpOperationException e) {
            throw new ProtocolViolationException("Unexpected goals: " + objs.toSexp(), e);
        }
    }

    private List<Goal> goals(Sexp goalsSexp) {
        var goals = new ArrayList<Goal>();
        for (var g : goalsSexp.asList().children) {
            var hypotheses = new ArrayList<Hypothesis>();
            for (var h : g.get(2).get(1).asList().children) {
                var idents = new ArrayList<String>();
                for (var ident : h.get(0).asList().children) idents.add(0, ident.get(1).content());
                String term = null;
                if (h.get(1).size() > 0 && !h.get(1).get(0).equals(Sexp.Lst.EMPTY))
                    term = printed(h.get(1).get(0).toSexp());
                var typeSexp = h.get(2).toSexp();
                hypotheses.add(0, new Hypothesis(idents, term, printed(typeSexp), typeSexp));
            }
            var typeSexp = g.get(1).get(1).toSexp();
            var id = Integer.parseInt(g.get(0).get(1).get(0).get(1).get(1).content());
            goals.add(new Goal(id, printed(typeSexp), typeSexp, hypotheses));
        }
        return goals;
    }

    private String printed(String sexp) {
        var s = printConstr(sexp);
        return s != null ? s : sexp;
    }

    @Override
    public List<String> getLocalIds() {
        var ids = new ArrayList<String>();
        for (var msg : queryVernac("Print All.")) {
            for (var line : msg.split("\n")) {
                var m = Patterns.PRINT_ALL_IDENT_PATTERN.matcher(line);
                if (m.find()) {
                    ids.add(m.group("library") != null ? m.group("library") : m.group("ident"));
                    continue;
                }
                var n = Patterns.NAMED_DEF_ASSUM_PATTERN.matcher(line);
                if (n.find()) ids.add(n.group("ident"));
            }
        }
        return ids;
    }

    @Override
    public @Nullable String getConjectureId() {
        List<String> feedback;
        try {
            feedback = queryVernac("Show Conjectures.");
        } catch (AssistantException e) {
            return null;
        }
        if (feedback.isEmpty()) return null;
        var first = feedback.get(0).strip();
        return first.isEmpty() ? null : first.split("\\s+")[0];
    }

    @Override
    public @Nullable Setting querySetting(String name) {
        for (var msg : queryVernac("Test " + name + ".")) {
            for (var line : msg.split("\n")) {
                var setting = Setting.parse(line);
                if (setting != null) return setting;
            }
        }
        return null;
    }

    /**
     * Every fully qualified spelling consistent with the given name.
     *
     * @throws IllegalArgumentException for a notation
     */
    public List<String> queryFullQualids(String qualid) {
        if (qualid.startsWith("\"") || qualid.endsWith("\""))
            throw new IllegalArgumentException("Cannot qualify notation " + qualid);
        var feedback = queryVernac("Locate " + qualid + ".");
        if (feedback.isEmpty() || feedback.get(0).startsWith("No object of basename")) return List.of();
        var qualids = new ArrayList<String>();
        for (var line : feedback.get(0).split("\n")) {
            line = line.strip();
            if (line.isEmpty() || line.startsWith("(")) continue;
            var parts = line.split("\\s+");
            if (parts.length > 1) qualids.add(parts[1]);
        }
        return qualids;
    }

    @Override
    public @Nullable String queryFullQualid(String qualid) {
        var qualids = queryFullQualids(qualid);
        return qualids.isEmpty() ? null : qualids.get(0);
    }

    /**
     * Minimally qualified spellings that refer to the same objects as the given name in the current scope.
     */
    public List<String> queryQualids(String qualid) {
        var located = locate(qualid);
        var top = config.topLogical() + ".";
        if (located.size() == 0 && qualid.startsWith(top)) located = locate(qualid.substring(top.length()));
        var qualids = new ArrayList<String>();
        try {
            for (var qid : located.asList().children) {
                var q = qid.get(1).get(0).get(1);
                if (!q.get(1).head().equals("DirPath")) throw new ProtocolViolationException("Expected a DirPath: " + q.toSexp());
                var parts = new ArrayList<String>();
                for (var d : q.get(1).get(1).asList().children) parts.add(0, d.get(1).content());
                parts.add(q.get(2).get(1).content());
                qualids.add(String.join(".", parts));
            }
        } catch (IllegalSexpOperationException e) {
            throw new ProtocolViolationException("Unexpected reply to Locate: " + located.toSexp(), e);
        }
        return qualids;
    }

    public @Nullable String queryQualid(String qualid) {
        var qualids = queryQualids(qualid);
        return qualids.isEmpty() ? null : qualids.get(0);
    }

    private Sexp locate(String qualid) {
        var reply = send("(Query () (Locate \"" + escape(qualid) + "\"))");
        try {
            return reply.responses().get(1).get(2).get(1);
        } catch (IllegalSexpOperationException | IndexOutOfBoundsException e) {
            throw new ProtocolViolationException("Unexpected reply to Locate: " + reply.raw(), e);
        }
    }

    @Override
    public String topLogical() {
        return config.topLogical();
    }

    public SessionConfig config() {
        return config;
    }

    @Override
    public boolean isAlive() {
        return !dead && transport.isAlive();
    }

    public boolean isDead() {
        return !isAlive();
    }

    @Override
    public void close() {
        if (dead && !transport.isAlive()) return;
        dead = true;
        transport.close();
        logger.info("Session shut down");
    }
}
