package dumb.prover.util;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.ToDoubleBiFunction;
import java.util.function.ToDoubleFunction;

/**
 * Global sequence alignment under caller-supplied costs.
 * <p>
 * The search expands cheapest cells first, so closely matching sequences are aligned in near-linear time. Among
 * equally cheap cells the one furthest along both sequences is expanded first, which makes ties resolve towards
 * the end of the sequences.
 */
public final class Alignment {

    /**
     * One column of an alignment. A null side means the element of the other side was skipped.
     */
    public record Pair<T>(@Nullable T left, @Nullable T right) {
    }

    private record Cell(double cost, int x, int y) {
    }

    private static final Comparator<Cell> ORDER = Comparator.comparingDouble(Cell::cost)
            .thenComparing((p, q) -> Integer.compare(q.x(), p.x()))
            .thenComparing((p, q) -> Integer.compare(q.y(), p.y()));

    private Alignment() {
    }

    /**
     * @param align cost of pairing two elements; must be non-negative
     * @param skip  cost of leaving an element unpaired; must be non-negative
     */
    public static <T> List<Pair<T>> align(List<T> a, List<T> b, ToDoubleBiFunction<T, T> align, ToDoubleFunction<T> skip) {
        var n = a.size();
        var m = b.size();
        var cost = new double[n + 1][m + 1];
        for (var row : cost) Arrays.fill(row, Double.POSITIVE_INFINITY);
        var back = new int[n + 1][m + 1][];
        cost[0][0] = 0;

        var heap = new PriorityQueue<>(ORDER);
        heap.add(new Cell(0, 0, 0));
        while (!heap.isEmpty()) {
            var c = heap.poll();
            var x = c.x;
            var y = c.y;
            if (x == n && y == m) break;
            if (c.cost > cost[x][y]) continue;
            if (x < n) relax(cost, back, heap, x, y, x + 1, y, skip.applyAsDouble(a.get(x)));
            if (x < n && y < m) relax(cost, back, heap, x, y, x + 1, y + 1, align.applyAsDouble(a.get(x), b.get(y)));
            if (y < m) relax(cost, back, heap, x, y, x, y + 1, skip.applyAsDouble(b.get(y)));
        }

        var result = new ArrayList<Pair<T>>(Math.max(n, m));
        int x = n, y = m;
        while (x != 0 || y != 0) {
            var prev = back[x][y];
            int px = prev[0], py = prev[1];
            result.add(new Pair<>(px < x ? a.get(px) : null, py < y ? b.get(py) : null));
            x = px;
            y = py;
        }
        Collections.reverse(result);
        return result;
    }

    private static void relax(double[][] cost, int[][][] back, PriorityQueue<Cell> heap,
                              int x, int y, int nx, int ny, double step) {
        var c = cost[x][y] + step;
        if (c < cost[nx][ny]) {
            cost[nx][ny] = c;
            back[nx][ny] = new int[]{x, y};
            heap.add(new Cell(c, nx, ny));
        }
    }

    /**
     * The elements of {@code b} after the last element of {@code a} that found a partner, i.e. what {@code b}
     * appends to {@code a}.
     */
    public static <T> List<T> trailingInsertions(List<Pair<T>> alignment) {
        var inserted = new ArrayList<T>();
        for (var i = alignment.size() - 1; i >= 0; i--) {
            var p = alignment.get(i);
            if (p.left() != null) break;
            inserted.add(p.right());
        }
        Collections.reverse(inserted);
        return inserted;
    }
}
