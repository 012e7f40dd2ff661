package dumb.prover.session;

import dumb.prover.Location;
import dumb.prover.ProverException;
import org.jetbrains.annotations.Nullable;

/**
 * The assistant sent data that does not follow the wire protocol. The session cannot be trusted afterwards.
 */
public class ProtocolViolationException extends ProverException {
    private final @Nullable Location location;
    private final @Nullable String sentenceText;

    public ProtocolViolationException(String message) {
        this(message, null, null, null);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ProtocolViolationException(String message, @Nullable Location location, @Nullable String sentenceText,
                                      @Nullable Throwable cause) {
        super(sentenceText == null ? message
                : message + " (while executing '" + sentenceText + "'" + (location != null ? " at " + location : "") + ")", cause);
        this.location = location;
        this.sentenceText = sentenceText;
    }

    public ProtocolViolationException at(@Nullable Location location, String sentenceText) {
        return new ProtocolViolationException(getMessage(), location, sentenceText, this);
    }

    public @Nullable Location location() {
        return location;
    }

    public @Nullable String sentenceText() {
        return sentenceText;
    }
}
