package dumb.prover.extract;

import dumb.prover.Location;
import dumb.prover.session.GoalState;
import dumb.prover.session.Identifier;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An executed sentence together with what the assistant reported about it.
 *
 * @param ast                   serialized AST of the sentence
 * @param qualifiedIdentifiers  fully qualified identifiers of the AST in order of appearance
 * @param commandType           Vernacular type of the command, e.g. {@code VernacStartTheoremProof}, or the name of
 *                              the extension for plugin commands
 * @param goals                 goals open before the sentence ran, in full or as a difference from the previous
 *                              sentence's goals
 * @param feedback              messages the assistant emitted while running the sentence
 */
public record VernacSentence(String text, String ast, List<Identifier> qualifiedIdentifiers, Location location,
                             String commandType, @Nullable GoalState goals, List<String> feedback)
        implements Comparable<VernacSentence> {

    public VernacSentence {
        qualifiedIdentifiers = List.copyOf(qualifiedIdentifiers);
        feedback = List.copyOf(feedback);
    }

    public Set<String> referencedIdentifiers() {
        var ids = new LinkedHashSet<String>();
        for (var i : qualifiedIdentifiers) ids.add(i.string());
        return ids;
    }

    public Sentence sentence() {
        return new Sentence(text, location);
    }

    @Override
    public int compareTo(VernacSentence o) {
        return location.compareTo(o.location);
    }

    @Override
    public String toString() {
        return "VernacSentence(" + text + " @ " + location + ")";
    }
}
