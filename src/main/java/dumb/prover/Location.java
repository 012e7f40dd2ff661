package dumb.prover;

import java.util.Comparator;

/**
 * A span of a source document. Line numbers are 0-based offsets as the assistant reports them;
 * {@code bolPos} fields are the character offsets of the first and last line starts and the char numbers are
 * absolute, end-exclusive offsets.
 */
public record Location(String filename, int lineno, int bolPos, int linenoLast, int bolPosLast,
                       int begCharno, int endCharno) implements Comparable<Location> {

    private static final Comparator<Location> ORDER = Comparator.comparing(Location::filename)
            .thenComparingInt(Location::begCharno)
            .thenComparingInt(Location::endCharno);

    public Location {
        if (endCharno < begCharno)
            throw new IllegalArgumentException("Location ends before it begins: " + begCharno + ">" + endCharno);
    }

    /**
     * The smallest location covering both this and another location of the same file.
     */
    public Location union(Location other) {
        if (!filename.equals(other.filename))
            throw new IllegalArgumentException("Cannot span locations of different files: " + filename + ", " + other.filename);
        var first = begCharno <= other.begCharno ? this : other;
        var last = endCharno >= other.endCharno ? this : other;
        return new Location(filename, first.lineno, first.bolPos, last.linenoLast, last.bolPosLast,
                first.begCharno, last.endCharno);
    }

    public boolean contains(Location other) {
        return filename.equals(other.filename) && begCharno <= other.begCharno && other.endCharno <= endCharno;
    }

    @Override
    public int compareTo(Location o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return filename + ":" + (lineno + 1) + ":" + (begCharno - bolPos) + "-" + (linenoLast + 1) + ":" + (endCharno - bolPosLast);
    }
}
