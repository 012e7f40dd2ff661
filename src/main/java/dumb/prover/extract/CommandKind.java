package dumb.prover.extract;

/**
 * The few command classes the extractor treats specially.
 */
public enum CommandKind {
    /**
     * Leaves proof mode without defining anything.
     */
    ABORT,
    /**
     * Definitions and fixpoints, which become programs when {@code Program Mode} is set.
     */
    PROGRAM_CAPABLE,
    /**
     * Opens the proof of a pending obligation ({@code Next Obligation.}, {@code Obligation n.}).
     */
    OBLIGATIONS,
    OTHER;

    public static CommandKind of(String commandType) {
        return switch (commandType) {
            case "VernacAbort", "VernacAbortAll" -> ABORT;
            case "VernacDefinition", "VernacFixpoint", "VernacCoFixpoint" -> PROGRAM_CAPABLE;
            case "Obligations" -> OBLIGATIONS;
            default -> OTHER;
        };
    }
}
