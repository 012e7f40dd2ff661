package dumb.prover.extract;

import dumb.prover.Location;
import dumb.prover.ProverException;
import org.jetbrains.annotations.Nullable;

/**
 * The extractor's bookkeeping no longer agrees with what the assistant reports. Not recoverable.
 */
public class ExtractionInconsistencyException extends ProverException {
    private final @Nullable Location location;
    private final @Nullable String sentenceText;

    public ExtractionInconsistencyException(String message) {
        this(message, null, null, null);
    }

    public ExtractionInconsistencyException(String message, @Nullable Location location, @Nullable String sentenceText,
                                            @Nullable Throwable cause) {
        super(sentenceText == null ? message
                : message + " (while extracting '" + sentenceText + "'" + (location != null ? " at " + location : "") + ")", cause);
        this.location = location;
        this.sentenceText = sentenceText;
    }

    public @Nullable Location location() {
        return location;
    }

    public @Nullable String sentenceText() {
        return sentenceText;
    }
}
