package dumb.prover.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.prover.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * How to start and talk to the assistant.
 *
 * @param command          process command line; must select NUL-terminated output
 * @param printingOptions  commands executed right after start-up so printed terms are stable and fully explicit
 * @param topLogical       logical path the assistant gives to the interactive document
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionConfig(
        @JsonProperty("command") List<String> command,
        @JsonProperty("workingDirectory") @Nullable String workingDirectory,
        @JsonProperty("timeoutSeconds") int timeoutSeconds,
        @JsonProperty("cacheCapacity") int cacheCapacity,
        @JsonProperty("printingOptions") List<String> printingOptions,
        @JsonProperty("topLogical") String topLogical
) {
    public static final List<String> DEFAULT_COMMAND = List.of("sertop", "--implicit", "--print0");
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_CACHE_CAPACITY = 4096;
    public static final String DEFAULT_TOP_LOGICAL = "SerTop";
    public static final List<String> DEFAULT_PRINTING_OPTIONS = List.of(
            "Unset Printing Notations.",
            "Unset Printing Wildcard.",
            "Set Printing Coercions.",
            "Unset Printing Allow Match Default Clause.",
            "Unset Printing Factorizable Match Patterns.",
            "Unset Printing Compact Contexts.",
            "Set Printing Implicit.",
            "Set Printing Depth 999999.",
            "Unset Printing Records.");

    public SessionConfig {
        command = List.copyOf(command);
        printingOptions = List.copyOf(printingOptions);
        if (command.isEmpty()) throw new IllegalArgumentException("Empty assistant command");
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("Timeout must be positive: " + timeoutSeconds);
    }

    @JsonCreator
    public SessionConfig(
            @JsonProperty("command") List<String> command,
            @JsonProperty("workingDirectory") @Nullable String workingDirectory,
            @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
            @JsonProperty("cacheCapacity") Integer cacheCapacity,
            @JsonProperty("printingOptions") List<String> printingOptions,
            @JsonProperty("topLogical") String topLogical
    ) {
        this(
                command != null ? command : DEFAULT_COMMAND,
                workingDirectory,
                timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS,
                cacheCapacity != null ? cacheCapacity : DEFAULT_CACHE_CAPACITY,
                printingOptions != null ? printingOptions : DEFAULT_PRINTING_OPTIONS,
                topLogical != null ? topLogical : DEFAULT_TOP_LOGICAL
        );
    }

    public SessionConfig() {
        this(DEFAULT_COMMAND, null, DEFAULT_TIMEOUT_SECONDS, DEFAULT_CACHE_CAPACITY, DEFAULT_PRINTING_OPTIONS, DEFAULT_TOP_LOGICAL);
    }

    public static SessionConfig load(Path path) throws IOException {
        var config = Json.load(path, SessionConfig.class);
        return config != null ? config : new SessionConfig();
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public SessionConfig withTimeoutSeconds(int seconds) {
        return new SessionConfig(command, workingDirectory, seconds, cacheCapacity, printingOptions, topLogical);
    }

    public SessionConfig withPrintingOptions(List<String> options) {
        return new SessionConfig(command, workingDirectory, timeoutSeconds, cacheCapacity, options, topLogical);
    }
}
