package dumb.prover.extract;

import com.fasterxml.jackson.annotation.JsonCreator;
import dumb.prover.Location;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One extracted command: its defining sentence and, for conjectures, the proof blocks that closed it
 * (one block per obligation for programs).
 *
 * @param identifiers  names the command defines, the main one last; empty for commands that define nothing
 * @param commandError the assistant's error if the command failed, otherwise null
 */
public record CommandRecord(List<String> identifiers, @Nullable String commandError, VernacSentence command,
                            List<List<VernacSentence>> proofs) implements Comparable<CommandRecord> {

    @JsonCreator
    public CommandRecord {
        identifiers = List.copyOf(identifiers);
        proofs = proofs.stream().<List<VernacSentence>>map(List::copyOf).toList();
    }

    public CommandRecord(List<String> identifiers, VernacSentence command) {
        this(identifiers, null, command, List.of());
    }

    /**
     * A copy of this command with one more proof block, found after the command was recorded.
     */
    public CommandRecord withProof(List<VernacSentence> block) {
        var blocks = new ArrayList<>(proofs);
        blocks.add(block);
        return new CommandRecord(identifiers, commandError, command, blocks);
    }

    public String commandType() {
        return command.commandType();
    }

    public Location location() {
        return command.location();
    }

    /**
     * The location covering the command and all of its proofs.
     */
    public Location spanningLocation() {
        var span = command.location();
        for (var block : proofs)
            for (var s : block) span = span.union(s.location());
        return span;
    }

    /**
     * The command and its proof sentences in document order.
     */
    public List<VernacSentence> sentences() {
        var all = new ArrayList<VernacSentence>();
        all.add(command);
        proofs.forEach(all::addAll);
        all.sort(null);
        return all;
    }

    public String allText() {
        return sentences().stream().map(VernacSentence::text).collect(Collectors.joining("\n"));
    }

    /**
     * The text of the proofs, or an empty string if there are none.
     */
    public String proofText() {
        return proofs.stream().flatMap(List::stream).sorted().map(VernacSentence::text).collect(Collectors.joining("\n"));
    }

    public Set<String> referencedIdentifiers() {
        var ids = new LinkedHashSet<String>();
        for (var s : sentences()) ids.addAll(s.referencedIdentifiers());
        return ids;
    }

    @Override
    public int compareTo(CommandRecord o) {
        return spanningLocation().compareTo(o.spanningLocation());
    }

    @Override
    public String toString() {
        return "CommandRecord(" + identifiers + ", " + command + (commandError != null ? ", error=" + commandError : "") + ")";
    }
}
