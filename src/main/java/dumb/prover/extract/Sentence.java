package dumb.prover.extract;

import dumb.prover.Location;

/**
 * One sentence of a source document as split by the caller, with whitespace already normalized.
 */
public record Sentence(String text, Location location) implements Comparable<Sentence> {

    @Override
    public int compareTo(Sentence o) {
        return location.compareTo(o.location);
    }
}
