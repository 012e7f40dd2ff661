package dumb.prover.session;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A bidirectional channel to one assistant process: single-line requests out, NUL-separated response units in.
 */
public interface Transport extends AutoCloseable {

    void sendLine(String line) throws IOException;

    /**
     * Blocks for the next response unit (without its NUL terminator).
     *
     * @return the unit, or null once the assistant has closed its output
     * @throws TimeoutException if nothing arrives in time
     */
    @Nullable String readUnit(Duration timeout) throws IOException, TimeoutException, InterruptedException;

    boolean isAlive();

    /**
     * Sends end-of-input and releases the process. Repeated calls have no effect.
     */
    @Override
    void close();
}
