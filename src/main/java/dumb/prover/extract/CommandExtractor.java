package dumb.prover.extract;

import dumb.prover.Location;
import dumb.prover.Sexp;
import dumb.prover.session.Assistant;
import dumb.prover.session.AssistantException;
import dumb.prover.session.AssistantTimeoutException;
import dumb.prover.session.GoalState;
import dumb.prover.session.Goals;
import dumb.prover.session.GoalsDiff;
import dumb.prover.session.Identifier;
import dumb.prover.session.IdentifierQualifier;
import dumb.prover.session.ProtocolViolationException;
import dumb.prover.session.Session;
import dumb.prover.session.SessionClosedException;
import dumb.prover.session.SessionConfig;
import dumb.prover.util.Alignment;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

import static dumb.prover.session.Patterns.*;

/**
 * Groups the sentences of a document into commands by running them through an assistant.
 * <p>
 * Each sentence is executed in turn and the assistant's view before and after it (the open conjecture, the
 * visible identifiers, the goals) decides whether the sentence starts a conjecture, continues or closes a proof,
 * contributes to a program's obligations, or stands alone. A command is recorded once everything it owns has been
 * seen, so the proof of a lemma appears in the same record as its statement even when other commands are nested
 * inside the proof.
 * <p>
 * The extraction relies on a few properties of the assistant: a conjecture's name is not reported as defined
 * before its proof ends; no command both ends one proof and starts another; the conjecture being proved is the
 * first one listed; and programs only enter proof mode once the proof of one of their obligations begins.
 * <p>
 * An extractor works on one document and is not thread-safe.
 */
public class CommandExtractor {
    private static final Logger logger = LoggerFactory.getLogger(CommandExtractor.class);

    private static final Pattern PROGRAM_ATTRIBUTE = Pattern.compile("[Pp]rogram");

    private final Assistant assistant;
    private final ExtractorConfig config;
    private final IdentifierQualifier qualifier;

    private final List<CommandRecord> extracted = new ArrayList<>();
    private final List<VernacSentence> programs = new ArrayList<>();
    private final Map<String, VernacSentence> conjectures = new LinkedHashMap<>();
    private final Map<String, List<VernacSentence>> partialProofStacks = new LinkedHashMap<>();
    private final Map<String, String> obligationMap = new HashMap<>();
    private final Map<String, List<FinishedBlock>> finishedProofStacks = new LinkedHashMap<>();
    private final Map<String, String> expandedIds = new HashMap<>();
    private final Map<String, CommandRecord> definedLemmas = new HashMap<>();
    private List<String> localIds = new ArrayList<>();

    private @Nullable String preProofId;
    private @Nullable String postProofId;
    private @Nullable Goals preGoals;
    private @Nullable Goals postGoals;

    private record FinishedBlock(String id, List<VernacSentence> block) {
    }

    private record Executed(List<String> feedback, Sexp ast) {
    }

    public CommandExtractor(Assistant assistant, ExtractorConfig config) {
        this.assistant = assistant;
        this.config = config;
        this.qualifier = new IdentifierQualifier(assistant::queryFullQualid, expandedIds, config.modpath(),
                assistant.topLogical());
        // lets the first command be rolled back, and keeps the document's own path from looking new
        assistant.push();
        localIds.add(assistant.topLogical());
    }

    /**
     * Starts an assistant, extracts a whole document and shuts the assistant down.
     */
    public static List<CommandRecord> extract(SessionConfig sessionConfig, ExtractorConfig config,
                                              List<Sentence> sentences) throws IOException {
        try (var session = Session.start(sessionConfig)) {
            return new CommandExtractor(session, config).extract(sentences);
        }
    }

    /**
     * Extracts every sentence and checks that nothing is left half-extracted.
     *
     * @throws AssistantException               if the assistant rejects a sentence
     * @throws AssistantTimeoutException        if a sentence does not finish in time
     * @throws ExtractionInconsistencyException if the sentences could not be grouped into commands
     */
    public List<CommandRecord> extract(List<Sentence> sentences) {
        logger.info("Extracting {} sentences into {}", sentences.size(), config.modpath());
        for (var s : sentences) extract(s);
        if (isPendingExtraction()) {
            var e = new ExtractionInconsistencyException("Unfinished extraction of " + pendingSentences().size()
                    + " sentences; open conjectures " + conjectures.keySet() + ", proofs " + partialProofStacks.keySet()
                    + ", obligations of " + finishedProofStacks.keySet() + ", " + programs.size() + " programs");
            logger.error("{}", e.getMessage());
            throw e;
        }
        logger.info("Extracted {} commands from {} sentences", extracted.size(), sentences.size());
        return extractedCommands();
    }

    /**
     * Extracts one sentence, attributing any failure to it.
     */
    public void extract(Sentence sentence) {
        try {
            extractSentence(sentence);
        } catch (AssistantException e) {
            logger.error("'{}' at {} failed: {}", sentence.text(), sentence.location(), e.errorMessage());
            throw e.at(sentence.location(), sentence.text());
        } catch (AssistantTimeoutException e) {
            logger.error("'{}' at {} timed out", sentence.text(), sentence.location());
            throw e.at(sentence.location(), sentence.text());
        } catch (ProtocolViolationException e) {
            logger.error("'{}' at {} broke the protocol: {}", sentence.text(), sentence.location(), e.getMessage());
            throw e.at(sentence.location(), sentence.text());
        } catch (SessionClosedException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Cannot extract '{}' at {}", sentence.text(), sentence.location(), e);
            throw new ExtractionInconsistencyException(String.valueOf(e.getMessage()), sentence.location(),
                    sentence.text(), e);
        }
    }

    private void extractSentence(Sentence s) {
        var text = s.text();
        var executed = executeCommand(text);
        // qualify before the new ids shadow anything in the cache
        List<Identifier> identifiers = config.extractQualifiedIdents() ? qualifier.qualifyAll(executed.ast) : List.of();
        var ids = updateIds();
        var proofIdChanged = !Objects.equals(postProofId, preProofId);

        GoalState goals = config.useGoalsDiff() && preGoals != null && postGoals != null
                ? GoalsDiff.compute(preGoals, postGoals) : postGoals;
        preGoals = postGoals;

        var vernac = VernacAnalyzer.analyze(executed.ast);
        var commandType = vernac.commandType();
        var kind = vernac.kind();
        var aborted = kind == CommandKind.ABORT;
        var program = vernac.hasAttributeMatching(PROGRAM_ATTRIBUTE);
        if (!program && kind == CommandKind.PROGRAM_CAPABLE) {
            var mode = assistant.querySetting("Program Mode");
            if (mode == null) throw new ExtractionInconsistencyException("Program Mode is not a known flag");
            program = mode.isOn();
        }
        var post = postProofId;
        var subproof = post != null && ids.stream().anyMatch(i -> isSubproofOf(post, i));
        var sentence = new VernacSentence(text, executed.ast.toSexp(), identifiers, s.location(), commandType, goals,
                executed.feedback);
        logger.debug("{} ({}): new ids {}, conjecture {} -> {}", text, commandType, ids, preProofId, postProofId);

        if (program) {
            // programs do not enter proof mode, so the open conjecture says nothing here
            var completed = startProgram(sentence, ids);
            if (completed != null) recordCommand(completed);
        } else if (proofIdChanged) {
            refreshGoals();
            if ((!ids.isEmpty() || aborted) && preProofId != null) {
                var pre = preProofId;
                var stack = partialProofStacks.get(pre);
                if (stack != null) {
                    stack.add(sentence);
                    var lemma = concludeProof(ids, aborted);
                    if (lemma != null) recordCommand(lemma);
                    if (postProofId != null && !partialProofStacks.containsKey(postProofId))
                        throw new ExtractionInconsistencyException("A command cannot both end the proof of " + pre
                                + " and start " + postProofId);
                    return;
                }
                if (handleAnomalousProof(pre, sentence)) return;
            }
            if (postProofId == null)
                throw new ExtractionInconsistencyException("Proof mode of " + preProofId
                        + " ended without concluding a known conjecture");
            var resumed = partialProofStacks.get(postProofId);
            if (resumed == null) startProofBlock(sentence);
            else resumed.add(sentence); // a delayed proof
        } else if (post != null && (ids.isEmpty() || subproof)) {
            var stack = partialProofStacks.get(post);
            if (stack != null) {
                refreshGoals();
                stack.add(sentence);
            } else {
                if (!definedLemmas.containsKey(post))
                    throw new ExtractionInconsistencyException(post + " is open but neither in progress nor defined");
                handleAnomalousProof(post, sentence);
            }
        } else {
            // outside of any proof, or a definition made as a side effect
            var command = processDefinedObligations(sentence, ids);
            recordCommand(command != null ? command : new CommandRecord(ids, sentence));
        }
    }

    private Executed executeCommand(String cmd) {
        var save = SAVE_PATTERN.matcher(cmd);
        var admitQed = config.admitOpaqueProofs() && cmd.equals("Qed.");
        var defineSaved = config.admitOpaqueProofs() && save.matches();
        if (admitQed || defineSaved) assistant.push();

        Executed executed;
        if (PRINTING_OPTIONS_PATTERN.matcher(cmd).find()) {
            executed = new Executed(List.of(), assistant.queryAst(cmd));
        } else {
            var result = assistant.execute(cmd, true, true);
            executed = new Executed(result.feedback(), Objects.requireNonNull(result.ast(), "no AST for " + cmd));
        }

        // opaque proofs can make the environment unprintable, so keep verified ones admitted instead
        if (admitQed) {
            assistant.pop();
            if (assistant.tryExecute("Admitted.", false, false) == null) assistant.execute(cmd, false, false);
        } else if (defineSaved) {
            assistant.pop();
            var ident = save.group("ident");
            assistant.push();
            if (assistant.tryExecute("Defined " + ident + ".", false, false) == null
                    || assistant.tryExecute("Opaque " + ident + ".", false, false) == null) {
                assistant.pop();
                assistant.execute(cmd, false, false);
            } else {
                assistant.pull();
            }
        }
        return executed;
    }

    private void refreshGoals() {
        if (config.extractGoals()) postGoals = assistant.queryGoals();
    }

    /**
     * Refreshes the visible identifiers and the open conjecture.
     *
     * @return the identifiers the last command introduced
     */
    private List<String> updateIds() {
        var current = assistant.getLocalIds();
        var before = lastComponents(localIds);
        var after = lastComponents(current);
        var alignment = Alignment.align(indices(before), indices(after),
                (i, j) -> before.get(i).equals(after.get(j)) ? 0 : 1, i -> 0.25);
        var ids = Alignment.trailingInsertions(alignment).stream().map(current::get).toList();
        localIds = current;
        for (var id : ids) expandedIds.remove(id);
        preProofId = postProofId;
        postProofId = assistant.getConjectureId();
        return ids;
    }

    private static List<String> lastComponents(List<String> ids) {
        return ids.stream().map(id -> id.substring(id.lastIndexOf('.') + 1)).toList();
    }

    private static List<Integer> indices(List<?> l) {
        return IntStream.range(0, l.size()).boxed().toList();
    }

    private @Nullable CommandRecord startProgram(VernacSentence sentence, List<String> ids) {
        var candidates = ids.stream().filter(id -> !OBLIGATION_ID_PATTERN.matcher(id).matches()).toList();
        if (candidates.size() > 1)
            throw new ExtractionInconsistencyException("A program can only define itself and its obligations, got " + ids);
        if (candidates.isEmpty()) {
            // some obligations remain
            programs.add(sentence);
            return null;
        }
        return new CommandRecord(ids, sentence);
    }

    private void startProofBlock(VernacSentence sentence) {
        var id = Objects.requireNonNull(postProofId);
        if (CommandKind.of(sentence.commandType()) == CommandKind.OBLIGATIONS) {
            var m = OBLIGATION_ID_PATTERN.matcher(id);
            if (!m.matches()) throw new ExtractionInconsistencyException("Cannot parse obligation id " + id);
            var programId = m.group("proofId");
            obligationMap.put(id, programId);
            partialProofStacks.computeIfAbsent(id, k -> new ArrayList<>()).add(sentence);
            ensureProgramIsConjecture(programId);
        } else {
            if (conjectures.containsKey(id))
                throw new ExtractionInconsistencyException("The proof of " + id + " has already been started");
            conjectures.put(id, sentence);
            partialProofStacks.put(id, new ArrayList<>());
        }
    }

    /**
     * Closes the proof of {@link #preProofId}, together with any other conjecture the last command completed.
     *
     * @return the finished command, or null if more obligations remain or the proof was aborted
     */
    private @Nullable CommandRecord concludeProof(List<String> ids, boolean aborted) {
        var pre = Objects.requireNonNull(preProofId);
        var closed = new LinkedHashSet<>(ids);
        closed.add(pre);
        var finishedId = obligationMap.getOrDefault(pre, pre);
        var finished = finishedProofStacks.computeIfAbsent(finishedId, k -> new ArrayList<>());
        for (var id : closed) {
            // an obligation solved automatically has no proof of its own
            var block = partialProofStacks.remove(id);
            finished.add(new FinishedBlock(id, block != null ? block : List.of()));
        }

        var obligation = obligationMap.containsKey(pre);
        if (obligation && !localIds.contains(finishedId)) return null;

        var blocks = finishedProofStacks.remove(finishedId);
        var statement = conjectures.remove(finishedId);
        if (statement == null)
            throw new ExtractionInconsistencyException("No statement recorded for " + finishedId);
        if (aborted && !obligation) {
            logger.info("Dropping aborted proof of {}", finishedId);
            return null;
        }

        var uids = new LinkedHashSet<String>();
        var proofs = new ArrayList<List<VernacSentence>>();
        for (var b : blocks) {
            uids.add(b.id);
            if (!b.block.isEmpty()) proofs.add(b.block);
        }
        uids.remove(finishedId);
        uids.add(finishedId);
        var lemma = new CommandRecord(List.copyOf(uids), null, statement, proofs);
        for (var id : uids) definedLemmas.put(id, lemma);
        return lemma;
    }

    /**
     * Programs do not enter proof mode until an obligation's proof starts, so their statement is only promoted to
     * a conjecture once an obligation names it.
     */
    private void ensureProgramIsConjecture(String programId) {
        if (conjectures.containsKey(programId)) return;
        for (var i = programs.size() - 1; i >= 0; i--) {
            var candidate = programs.get(i);
            if (wholeWord(programId).matcher(candidate.text()).find()) {
                conjectures.put(programId, candidate);
                programs.remove(i);
                return;
            }
        }
        throw new ExtractionInconsistencyException("No pending program declares " + programId);
    }

    private static Pattern wholeWord(String id) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_'])" + Pattern.quote(id) + "(?![\\p{L}\\p{N}_'])");
    }

    private @Nullable CommandRecord processDefinedObligations(VernacSentence sentence, List<String> ids) {
        String programId = null;
        for (var id : ids) {
            var m = OBLIGATION_ID_PATTERN.matcher(id);
            if (!m.matches()) continue;
            // only the first obligation gets the sentence as its proof
            if (programId == null) partialProofStacks.computeIfAbsent(id, k -> new ArrayList<>()).add(sentence);
            programId = m.group("proofId");
            obligationMap.put(id, programId);
        }
        if (programId == null) return null;
        ensureProgramIsConjecture(programId);
        if (!ids.contains(programId)) return null;
        // the program itself is now defined
        if (preProofId == null) preProofId = programId;
        return concludeProof(ids, false);
    }

    /**
     * Copes with a conjecture reported open although it was already defined.
     *
     * @return whether the conjecture was indeed defined, in which case the sentence was attached to it
     */
    private boolean handleAnomalousProof(String proofId, VernacSentence sentence) {
        var extra = OBLIGATION_ID_PATTERN.matcher(proofId).matches() ? " Is there an extra 'Next Obligation.'?" : "";
        logger.warn("Anomaly detected. '{}' is an open conjecture but is also already defined.{}", proofId, extra);
        var lemma = definedLemmas.get(proofId);
        if (lemma == null) return false;
        var patched = lemma.withProof(List.of(sentence));
        var index = indexOf(lemma);
        if (index < 0) throw new ExtractionInconsistencyException(proofId + " is defined but was never extracted");
        extracted.set(index, patched);
        for (var id : patched.identifiers()) definedLemmas.put(id, patched);
        return true;
    }

    private int indexOf(CommandRecord command) {
        for (var i = extracted.size() - 1; i >= 0; i--)
            if (extracted.get(i) == command) return i;
        return -1;
    }

    private void recordCommand(CommandRecord command) {
        extracted.add(command);
        assistant.push();
    }

    /**
     * What a rollback undid.
     *
     * @param commands  extracted commands that were rolled back, in order of extraction
     * @param sentences sentences that were rolled back without belonging to a rolled back command, in document order
     */
    public record Rollback(List<CommandRecord> commands, List<Sentence> sentences) {
    }

    /**
     * Undoes the last {@code numCommands} commands. A command still being extracted counts as one and goes first,
     * and commands nested inside a rolled back command go with it. The assistant is left as it was right after the
     * last remaining command.
     *
     * @throws IndexOutOfBoundsException if {@code numCommands} is negative or exceeds the number of commands
     */
    public Rollback rollback(int numCommands) {
        var pendingCommand = isPendingExtraction();
        var total = extracted.size() + (pendingCommand ? 1 : 0);
        if (numCommands < 0 || numCommands > total)
            throw new IndexOutOfBoundsException("Cannot roll back " + numCommands + " of " + total + " commands");
        if (numCommands == 0) return new Rollback(List.of(), List.of());

        var pending = new ArrayList<Sentence>();
        var keep = extracted.size();
        Location earliest = null;
        for (var i = 0; i < numCommands; i++) {
            if (i == 0 && pendingCommand) {
                pending.addAll(pendingSentences());
                if (!pending.isEmpty()) earliest = pending.get(0).location();
            } else {
                keep--;
                earliest = earlier(earliest, extracted.get(keep).location());
            }
            // completed while a rolled back command was open
            while (keep > 0 && earliest != null && extracted.get(keep - 1).location().compareTo(earliest) > 0) keep--;
        }

        var commands = List.copyOf(extracted.subList(keep, extracted.size()));
        logger.info("Rolling back {} commands and {} pending sentences", commands.size(), pending.size());
        assistant.popN(commands.size() + 1);
        assistant.push();
        extracted.subList(keep, extracted.size()).clear();
        definedLemmas.values().removeIf(r -> commands.stream().anyMatch(c -> c == r));
        conjectures.clear();
        partialProofStacks.clear();
        finishedProofStacks.clear();
        programs.clear();
        var kept = new HashSet<String>();
        extracted.forEach(c -> kept.addAll(c.identifiers()));
        obligationMap.keySet().retainAll(kept);
        expandedIds.clear();

        postProofId = null;
        preGoals = null;
        postGoals = null;
        updateIds();
        if (postProofId != null)
            throw new ExtractionInconsistencyException("Rolled back to a command boundary but " + postProofId
                    + " is still open");
        return new Rollback(commands, pending);
    }

    private static Location earlier(@Nullable Location a, Location b) {
        return a == null || b.compareTo(a) < 0 ? b : a;
    }

    /**
     * Undoes the last {@code numSentences} sentences. Whole commands are rolled back until enough sentences are
     * undone, then the earliest of them are extracted again, so a command may end up partially rolled back.
     *
     * @throws IndexOutOfBoundsException if {@code numSentences} is negative or exceeds the extracted sentences
     */
    public Rollback rollbackSentences(int numSentences) {
        var total = extractedSentences().size();
        if (numSentences < 0 || numSentences > total)
            throw new IndexOutOfBoundsException("Cannot roll back " + numSentences + " of " + total + " sentences");
        var commands = new ArrayList<CommandRecord>();
        var undone = new ArrayList<Sentence>();
        while (undone.size() < numSentences) {
            var r = rollback(1);
            commands.addAll(0, r.commands());
            undone.addAll(r.sentences());
            for (var c : r.commands()) c.sentences().forEach(s -> undone.add(s.sentence()));
        }
        undone.sort(null);
        var replayed = List.copyOf(undone.subList(0, undone.size() - numSentences));
        for (var s : replayed) extract(s);

        var replayedSet = new HashSet<>(replayed);
        var rolledBack = commands.stream()
                .filter(c -> c.sentences().stream().noneMatch(s -> replayedSet.contains(s.sentence())))
                .toList();
        var sentences = new ArrayList<>(undone.subList(replayed.size(), undone.size()));
        for (var c : rolledBack) c.sentences().forEach(s -> sentences.remove(s.sentence()));
        return new Rollback(rolledBack, sentences);
    }

    /**
     * Rolls back every sentence that begins at or after the start of {@code location}.
     *
     * @throws IllegalArgumentException if the location is in another document
     */
    public Rollback rollbackToLocation(Location location) {
        var sentences = extractedSentences();
        for (var s : sentences) {
            if (!s.location().filename().equals(location.filename()))
                throw new IllegalArgumentException("Location " + location + " is not in " + s.location().filename());
        }
        var count = (int) sentences.stream().filter(s -> s.location().begCharno() >= location.begCharno()).count();
        return rollbackSentences(count);
    }

    /**
     * Whether {@code id} names a lemma generated while proving {@code proofId}, such as the result of
     * {@code abstract} or an on-demand rewriting scheme.
     */
    public static boolean isSubproofOf(String proofId, String id) {
        var m = SUBPROOF_ID_PATTERN.matcher(id);
        if (m.matches()) {
            var owner = m.group("proofId");
            return owner.equals(proofId) || owner.equals("legacy_pe");
        }
        return REWRITE_SCHEME_ID_PATTERN.matcher(id).matches();
    }

    /**
     * The completed commands in order of completion.
     */
    public List<CommandRecord> extractedCommands() {
        return List.copyOf(extracted);
    }

    /**
     * Sentences belonging to commands that are not complete yet, in document order.
     */
    public List<Sentence> pendingSentences() {
        var pending = new ArrayList<Sentence>();
        conjectures.values().forEach(s -> pending.add(s.sentence()));
        partialProofStacks.values().forEach(b -> b.forEach(s -> pending.add(s.sentence())));
        finishedProofStacks.values().forEach(f -> f.forEach(b -> b.block.forEach(s -> pending.add(s.sentence()))));
        programs.forEach(s -> pending.add(s.sentence()));
        pending.sort(null);
        return pending;
    }

    /**
     * Extracted and pending sentences in document order.
     */
    public List<Sentence> extractedSentences() {
        var all = new ArrayList<Sentence>();
        for (var s : CommandRecords.sentences(extracted)) all.add(s.sentence());
        all.addAll(pendingSentences());
        return all;
    }

    public boolean isPendingExtraction() {
        return !conjectures.isEmpty() || !partialProofStacks.isEmpty() || !finishedProofStacks.isEmpty()
                || !programs.isEmpty();
    }

    /**
     * Identifiers visible in the assistant after the last sentence.
     */
    public List<String> localIds() {
        return List.copyOf(localIds);
    }
}
