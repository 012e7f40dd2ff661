package dumb.prover.session;

import dumb.prover.Location;
import dumb.prover.ProverException;
import org.jetbrains.annotations.Nullable;

/**
 * No terminating response arrived within the configured timeout. The session is closed afterwards.
 */
public class AssistantTimeoutException extends ProverException {
    private final @Nullable Location location;
    private final @Nullable String sentenceText;

    public AssistantTimeoutException(String message) {
        this(message, null, null, null);
    }

    public AssistantTimeoutException(String message, @Nullable Location location, @Nullable String sentenceText,
                                     @Nullable Throwable cause) {
        super(sentenceText == null ? message
                : message + " (while executing '" + sentenceText + "'" + (location != null ? " at " + location : "") + ")", cause);
        this.location = location;
        this.sentenceText = sentenceText;
    }

    /**
     * A copy of this timeout attributed to the sentence that was running.
     */
    public AssistantTimeoutException at(@Nullable Location location, String sentenceText) {
        return new AssistantTimeoutException(getMessage(), location, sentenceText, this);
    }

    public @Nullable Location location() {
        return location;
    }

    public @Nullable String sentenceText() {
        return sentenceText;
    }
}
