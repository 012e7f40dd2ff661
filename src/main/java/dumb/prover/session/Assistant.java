package dumb.prover.session;

import dumb.prover.Sexp;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The operations of an interactive proof-assistant session that command extraction relies on.
 * <p>
 * Every method blocks until the assistant has fully answered. {@link AssistantException} signals a rejected
 * command; the checkpoint methods let callers undo what was executed since a {@link #push()}.
 */
public interface Assistant extends AutoCloseable {

    /**
     * Adds and executes a command. The new state is recorded in the top checkpoint before it runs.
     *
     * @param wantAst whether to also return the command's AST
     * @param verbose whether to keep informational feedback, not only warnings and errors
     */
    Execution execute(String cmd, boolean wantAst, boolean verbose);

    /**
     * Executes under a fresh checkpoint, rolling back and returning null if the assistant rejects the command.
     */
    @Nullable Execution tryExecute(String cmd, boolean wantAst, boolean verbose);

    Sexp queryAst(String cmd);

    /**
     * The open goals, or null outside of proof mode.
     */
    @Nullable Goals queryGoals();

    /**
     * The identifiers defined in the session, in definition order.
     */
    List<String> getLocalIds();

    /**
     * The conjecture currently being proved, if any.
     */
    @Nullable String getConjectureId();

    @Nullable Setting querySetting(String name);

    @Nullable String queryFullQualid(String qualid);

    void push();

    default void pop() {
        popN(1);
    }

    /**
     * Rolls back everything executed since the {@code n}th most recent {@link #push()}.
     *
     * @throws IndexOutOfBoundsException if fewer than {@code n} checkpoints exist
     */
    void popN(int n);

    /**
     * Discards a checkpoint without rolling anything back, folding its states into the one below.
     *
     * @param index frame index; negative values count from the top
     * @return the number of states folded
     */
    int pull(int index);

    default int pull() {
        return pull(-1);
    }

    /**
     * The logical path of the interactive document, e.g. {@code SerTop}.
     */
    String topLogical();

    boolean isAlive();

    @Override
    void close();
}
