package dumb.prover.session;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One entry of a goal's local context: the names it binds, an optional body and its type.
 * {@code sexp} is the serialized kernel type.
 */
public record Hypothesis(List<String> idents, @Nullable String term, String type, String sexp) {

    public Hypothesis {
        idents = List.copyOf(idents);
    }

    @Override
    public String toString() {
        var value = term != null ? " := " + term : "";
        return String.join(",", idents) + value + " : " + type;
    }
}
