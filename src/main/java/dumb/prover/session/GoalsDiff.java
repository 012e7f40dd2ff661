package dumb.prover.session;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The change between two goal snapshots. Goals that stay at the same location are left implicit.
 * <p>
 * For any snapshots {@code a} and {@code b}, {@code GoalsDiff.compute(a, b).patch(a)} equals {@code b}.
 */
public record GoalsDiff(List<Added> added, List<GoalLocation> removed, List<Move> moved, int depthDelta)
        implements GoalState {

    public GoalsDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        moved = List.copyOf(moved);
    }

    /**
     * A goal new to the snapshot, with every location it occupies.
     */
    public record Added(Goal goal, List<GoalLocation> locations) {
        public Added {
            locations = List.copyOf(locations);
        }
    }

    public record Move(GoalLocation from, GoalLocation to) {
    }

    public static GoalsDiff compute(Goals before, Goals after) {
        var beforeLocs = before.locations();
        var afterLocs = after.locations();
        var consumed = new HashSet<GoalLocation>();
        var pending = new ArrayList<Map.Entry<GoalLocation, Goal>>();

        for (var e : afterLocs.entrySet()) {
            if (e.getValue().equals(beforeLocs.get(e.getKey()))) consumed.add(e.getKey());
            else pending.add(e);
        }

        var moved = new ArrayList<Move>();
        var added = new LinkedHashMap<Goal, List<GoalLocation>>();
        for (var e : pending) {
            GoalLocation source = null;
            for (var b : beforeLocs.entrySet()) {
                if (!consumed.contains(b.getKey()) && b.getValue().equals(e.getValue())) {
                    source = b.getKey();
                    break;
                }
            }
            if (source != null) {
                consumed.add(source);
                moved.add(new Move(source, e.getKey()));
            } else {
                added.computeIfAbsent(e.getValue(), g -> new ArrayList<>()).add(e.getKey());
            }
        }

        var removed = beforeLocs.keySet().stream().filter(l -> !consumed.contains(l)).toList();
        var addedList = added.entrySet().stream().map(e -> new Added(e.getKey(), e.getValue())).toList();
        return new GoalsDiff(addedList, removed, moved, after.backgroundDepth() - before.backgroundDepth());
    }

    public Goals patch(Goals before) {
        var beforeLocs = before.locations();
        var dropped = new HashSet<>(removed);
        moved.forEach(m -> dropped.add(m.from()));

        var result = new TreeMap<GoalLocation, Goal>();
        beforeLocs.forEach((loc, g) -> {
            if (!dropped.contains(loc)) result.put(loc, g);
        });
        for (var m : moved) {
            var g = beforeLocs.get(m.from());
            if (g == null) throw new IllegalArgumentException("No goal at " + m.from() + " to move");
            result.put(m.to(), g);
        }
        for (var a : added) {
            for (var loc : a.locations()) result.put(loc, a.goal());
        }
        return Goals.fromLocations(result, before.backgroundDepth() + depthDelta);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && moved.isEmpty() && depthDelta == 0;
    }
}
