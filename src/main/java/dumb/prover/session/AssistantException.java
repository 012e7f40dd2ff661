package dumb.prover.session;

import dumb.prover.Location;
import dumb.prover.ProverException;
import org.jetbrains.annotations.Nullable;

/**
 * The assistant rejected a request.
 * <p>
 * {@link #errorMessage()} is the assistant's own text and {@link #fullSexp()} the raw exception s-expression.
 * When raised while extracting a document the sentence text and its location are attached.
 */
public class AssistantException extends ProverException {
    private final String errorMessage;
    private final String fullSexp;
    private final @Nullable Location location;
    private final @Nullable String sentenceText;
    private final @Nullable String query;

    public AssistantException(String errorMessage, String fullSexp) {
        this(errorMessage, fullSexp, null, null, null, null);
    }

    public AssistantException(String errorMessage, String fullSexp, @Nullable String query) {
        this(errorMessage, fullSexp, null, null, query, null);
    }

    public AssistantException(String errorMessage, String fullSexp, @Nullable Location location,
                              @Nullable String sentenceText, @Nullable String query, @Nullable Throwable cause) {
        super(describe(errorMessage, location, sentenceText), cause);
        this.errorMessage = errorMessage;
        this.fullSexp = fullSexp;
        this.location = location;
        this.sentenceText = sentenceText;
        this.query = query;
    }

    private static String describe(String errorMessage, @Nullable Location location, @Nullable String sentenceText) {
        if (sentenceText == null) return errorMessage;
        var where = location != null ? " at " + location : "";
        return errorMessage + " (while executing '" + sentenceText + "'" + where + ")";
    }

    /**
     * A copy of this error attributed to the sentence that caused it.
     */
    public AssistantException at(@Nullable Location location, String sentenceText) {
        return new AssistantException(errorMessage, fullSexp, location, sentenceText, query, this);
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String fullSexp() {
        return fullSexp;
    }

    public @Nullable Location location() {
        return location;
    }

    public @Nullable String sentenceText() {
        return sentenceText;
    }

    public @Nullable String query() {
        return query;
    }
}
