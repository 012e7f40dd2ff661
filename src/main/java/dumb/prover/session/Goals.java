package dumb.prover.session;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A snapshot of every unfinished goal.
 * <p>
 * {@code background} holds one {@link Level} per enclosing focus, innermost first; each level lists the goals
 * left and right of the focused ones.
 */
public record Goals(List<Goal> foreground, List<Level> background, List<Goal> shelved, List<Goal> abandoned)
        implements GoalState {

    public static final Goals NONE = new Goals(List.of(), List.of(), List.of(), List.of());

    public Goals {
        foreground = List.copyOf(foreground);
        background = List.copyOf(background);
        shelved = List.copyOf(shelved);
        abandoned = List.copyOf(abandoned);
    }

    public record Level(List<Goal> left, List<Goal> right) {
        public Level {
            left = List.copyOf(left);
            right = List.copyOf(right);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return foreground.isEmpty() && shelved.isEmpty() && abandoned.isEmpty()
                && background.stream().allMatch(l -> l.left.isEmpty() && l.right.isEmpty());
    }

    @JsonIgnore
    public int backgroundDepth() {
        return background.size();
    }

    /**
     * Every goal keyed by its location, in location order.
     */
    public Map<GoalLocation, Goal> locations() {
        var m = new LinkedHashMap<GoalLocation, Goal>();
        put(m, GoalType.FOREGROUND, 0, false, foreground);
        for (var d = 0; d < background.size(); d++) {
            put(m, GoalType.BACKGROUND, d, false, background.get(d).left);
            put(m, GoalType.BACKGROUND, d, true, background.get(d).right);
        }
        put(m, GoalType.SHELVED, 0, false, shelved);
        put(m, GoalType.ABANDONED, 0, false, abandoned);
        return m;
    }

    private static void put(Map<GoalLocation, Goal> m, GoalType type, int depth, boolean right, List<Goal> goals) {
        for (var i = 0; i < goals.size(); i++)
            m.put(new GoalLocation(type, depth, i, right), goals.get(i));
    }

    /**
     * Rebuilds a snapshot from located goals. Indices within each list must be contiguous from zero.
     */
    public static Goals fromLocations(Map<GoalLocation, Goal> located, int backgroundDepth) {
        SortedMap<GoalLocation, Goal> sorted = new TreeMap<>(located);
        var fg = new ArrayList<Goal>();
        var shelved = new ArrayList<Goal>();
        var abandoned = new ArrayList<Goal>();
        var lefts = new ArrayList<List<Goal>>();
        var rights = new ArrayList<List<Goal>>();
        for (var d = 0; d < backgroundDepth; d++) {
            lefts.add(new ArrayList<>());
            rights.add(new ArrayList<>());
        }
        for (var e : sorted.entrySet()) {
            var loc = e.getKey();
            var target = switch (loc.category()) {
                case FOREGROUND -> fg;
                case SHELVED -> shelved;
                case ABANDONED -> abandoned;
                case BACKGROUND -> {
                    if (loc.depth() >= backgroundDepth)
                        throw new IllegalArgumentException("Background goal " + loc + " is deeper than " + backgroundDepth);
                    yield loc.right() ? rights.get(loc.depth()) : lefts.get(loc.depth());
                }
            };
            if (loc.index() != target.size())
                throw new IllegalArgumentException("Goal locations are not contiguous at " + loc);
            target.add(e.getValue());
        }
        var background = new ArrayList<Level>(backgroundDepth);
        for (var d = 0; d < backgroundDepth; d++) background.add(new Level(lefts.get(d), rights.get(d)));
        return new Goals(fg, background, shelved, abandoned);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        var n = foreground.size();
        sb.append(n).append(n == 1 ? " goal" : " goals");
        for (var i = 0; i < n; i++) {
            sb.append("\n\n");
            if (i == 0) sb.append(foreground.get(i));
            else sb.append("goal ").append(i + 1).append(" (").append(foreground.get(i).id()).append(") is:\n")
                    .append(foreground.get(i).type());
        }
        var unfocused = background.stream().mapToInt(l -> l.left.size() + l.right.size()).sum();
        if (unfocused > 0) sb.append("\n\n").append(unfocused).append(" unfocused");
        if (!shelved.isEmpty()) sb.append("\n").append(shelved.size()).append(" shelved");
        if (!abandoned.isEmpty()) sb.append("\n").append(abandoned.size()).append(" admitted");
        return sb.toString();
    }
}
