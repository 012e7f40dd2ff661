package dumb.prover.session;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the assistant as a child process. A daemon thread splits its standard output on NUL characters into a
 * queue of response units; standard error is drained to the debug log.
 */
public class ProcessTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(ProcessTransport.class);
    private static final String EOF = new String("<eof>");

    private final Process process;
    private final Writer input;
    private final BlockingQueue<String> units = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ProcessTransport(List<String> command, @Nullable String workingDirectory) throws IOException {
        var pb = new ProcessBuilder(command);
        if (workingDirectory != null) pb.directory(new java.io.File(workingDirectory));
        process = pb.start();
        input = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
        logger.info("Started assistant process {} (pid {})", command, process.pid());

        var stdout = new Thread(() -> readUnits(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)),
                "assistant-stdout-" + process.pid());
        stdout.setDaemon(true);
        stdout.start();

        var stderr = new Thread(this::drainErrors, "assistant-stderr-" + process.pid());
        stderr.setDaemon(true);
        stderr.start();
    }

    private void readUnits(Reader reader) {
        var sb = new StringBuilder();
        try (reader) {
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\0') {
                    units.add(sb.toString());
                    sb.setLength(0);
                } else {
                    sb.append((char) c);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) logger.warn("Error reading assistant output: {}", e.getMessage());
        } finally {
            if (!sb.toString().isBlank()) units.add(sb.toString());
            units.add(EOF);
        }
    }

    private void drainErrors() {
        try (var err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = err.readLine()) != null) {
                logger.debug("assistant stderr: {}", line);
            }
        } catch (IOException e) {
            if (!closed.get()) logger.debug("Error reading assistant stderr: {}", e.getMessage());
        }
    }

    @Override
    public void sendLine(String line) throws IOException {
        if (closed.get()) throw new SessionClosedException();
        input.write(line);
        input.write('\n');
        input.flush();
    }

    @Override
    public @Nullable String readUnit(Duration timeout) throws TimeoutException, InterruptedException {
        var unit = units.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (unit == null) throw new TimeoutException("No response from assistant within " + timeout);
        if (unit == EOF) {
            units.add(EOF);
            return null;
        }
        return unit;
    }

    @Override
    public boolean isAlive() {
        return !closed.get() && process.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            input.close();
        } catch (IOException e) {
            logger.debug("Error closing assistant input: {}", e.getMessage());
        }
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        logger.info("Assistant process {} terminated", process.pid());
    }
}
