package dumb.prover.extract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.prover.util.Json;

import java.io.IOException;
import java.nio.file.Path;

/**
 * What a {@link CommandExtractor} records besides the commands themselves.
 *
 * @param modpath                logical path of the extracted document; replaces the session's top-level path in
 *                               qualified identifiers
 * @param extractGoals           whether to attach goals to proof sentences
 * @param extractQualifiedIdents whether to fully qualify the identifiers of every sentence
 * @param useGoalsDiff           whether to store goals as a difference from the previous sentence's goals
 * @param admitOpaqueProofs      whether to re-run verified opaque proofs as admitted, keeping the environment
 *                               printable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractorConfig(
        @JsonProperty("modpath") String modpath,
        @JsonProperty("extractGoals") boolean extractGoals,
        @JsonProperty("extractQualifiedIdents") boolean extractQualifiedIdents,
        @JsonProperty("useGoalsDiff") boolean useGoalsDiff,
        @JsonProperty("admitOpaqueProofs") boolean admitOpaqueProofs
) {
    public static final String DEFAULT_MODPATH = "SerTop";

    public ExtractorConfig {
        if (modpath.isBlank()) throw new IllegalArgumentException("Empty module path");
    }

    @JsonCreator
    public ExtractorConfig(
            @JsonProperty("modpath") String modpath,
            @JsonProperty("extractGoals") Boolean extractGoals,
            @JsonProperty("extractQualifiedIdents") Boolean extractQualifiedIdents,
            @JsonProperty("useGoalsDiff") Boolean useGoalsDiff,
            @JsonProperty("admitOpaqueProofs") Boolean admitOpaqueProofs
    ) {
        this(
                modpath != null ? modpath : DEFAULT_MODPATH,
                extractGoals == null || extractGoals,
                extractQualifiedIdents == null || extractQualifiedIdents,
                useGoalsDiff == null || useGoalsDiff,
                admitOpaqueProofs == null || admitOpaqueProofs
        );
    }

    public ExtractorConfig() {
        this(DEFAULT_MODPATH, true, true, true, true);
    }

    public static ExtractorConfig load(Path path) throws IOException {
        var config = Json.load(path, ExtractorConfig.class);
        return config != null ? config : new ExtractorConfig();
    }

    public ExtractorConfig withModpath(String modpath) {
        return new ExtractorConfig(modpath, extractGoals, extractQualifiedIdents, useGoalsDiff, admitOpaqueProofs);
    }

    public ExtractorConfig withGoals(boolean extractGoals, boolean useGoalsDiff) {
        return new ExtractorConfig(modpath, extractGoals, extractQualifiedIdents, useGoalsDiff, admitOpaqueProofs);
    }

    public ExtractorConfig withQualifiedIdents(boolean extractQualifiedIdents) {
        return new ExtractorConfig(modpath, extractGoals, extractQualifiedIdents, useGoalsDiff, admitOpaqueProofs);
    }

    public ExtractorConfig withAdmitOpaqueProofs(boolean admitOpaqueProofs) {
        return new ExtractorConfig(modpath, extractGoals, extractQualifiedIdents, useGoalsDiff, admitOpaqueProofs);
    }
}
