package dumb.prover.session;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An open goal. The id is the assistant's evar number and is stable for the life of the goal.
 */
public record Goal(int id, String type, String sexp, List<Hypothesis> hypotheses) {

    public static final String RULE = "______________________________________";

    public Goal {
        hypotheses = List.copyOf(hypotheses);
    }

    @Override
    public String toString() {
        var hyps = hypotheses.stream().map(Hypothesis::toString).collect(Collectors.joining("\n"));
        return String.join("\n", hyps, RULE, type);
    }
}
