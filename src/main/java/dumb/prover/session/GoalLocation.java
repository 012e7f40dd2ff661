package dumb.prover.session;

import java.util.Comparator;

/**
 * Addresses one goal of a {@link Goals} snapshot. {@code depth} and {@code right} only matter for background
 * goals, where they select the focus level and which side of the focused goals the goal sits on.
 */
public record GoalLocation(GoalType category, int depth, int index, boolean right) implements Comparable<GoalLocation> {

    private static final Comparator<GoalLocation> ORDER = Comparator.comparing(GoalLocation::category)
            .thenComparingInt(GoalLocation::depth)
            .thenComparing(GoalLocation::right)
            .thenComparingInt(GoalLocation::index);

    public static GoalLocation of(GoalType category, int index) {
        return new GoalLocation(category, 0, index, false);
    }

    @Override
    public int compareTo(GoalLocation o) {
        return ORDER.compare(this, o);
    }
}
