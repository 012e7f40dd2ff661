package dumb.prover.session;

import dumb.prover.Sexp;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of executing one command: the answer units, the feedback messages and, if requested, the command's AST.
 */
public record Execution(List<Sexp> responses, List<String> feedback, @Nullable Sexp ast) {

    public Execution {
        responses = List.copyOf(responses);
        feedback = List.copyOf(feedback);
    }
}
