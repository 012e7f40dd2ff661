package dumb.prover.session;

import java.util.regex.Pattern;

/**
 * Small grammars for the assistant's textual and wire output.
 */
public final class Patterns {

    /**
     * A single unqualified identifier.
     */
    public static final String IDENT = "[\\p{L}_][\\p{L}\\p{N}_'\\x{00A0}]*";

    public static final Pattern IDENT_PATTERN = Pattern.compile(IDENT);

    /**
     * State id announced in reply to an {@code Add} request.
     */
    public static final Pattern ADDED_STATE_PATTERN = Pattern.compile("\\(Added (?<stateId>\\d+)");

    /**
     * Name generated for an obligation of the program {@code proofId}. Use with {@code matches()}.
     */
    public static final Pattern OBLIGATION_ID_PATTERN = Pattern.compile("(?<proofId>" + IDENT + ")_obligation_\\d+");

    /**
     * Name of an auxiliary lemma generated inside the proof of {@code proofId}, e.g. by {@code abstract}.
     */
    public static final Pattern SUBPROOF_ID_PATTERN = Pattern.compile("(?<proofId>" + IDENT + ")_subproof\\d*");

    /**
     * Names of rewriting schemes the assistant defines on demand while a proof is open.
     */
    public static final Pattern REWRITE_SCHEME_ID_PATTERN = Pattern.compile(
            "internal_" + IDENT + "_(?:rew|rew_r|rew_dep|rew_r_dep|rew_fwd_dep|rew_fwd_r_dep|case|case_r)");

    /**
     * One entry of the {@code Print All.} listing: either a library/module header or a top-level declaration.
     * Indented lines (constructors, continuations) do not match.
     */
    public static final Pattern PRINT_ALL_IDENT_PATTERN = Pattern.compile(
            "^(?:>>>>>>> (?:Library|Module Type|Module|Interactive Module Type|Interactive Module) (?<library>\\S+)"
                    + "|(?:(?:Inductive|CoInductive|Record|Structure|Variant|Class) )?(?<ident>" + IDENT + ")\\s*:)");

    /**
     * A section variable in the {@code Print All.} listing, e.g. {@code *** [ A : Set ]}.
     */
    public static final Pattern NAMED_DEF_ASSUM_PATTERN = Pattern.compile("^\\*\\*\\* \\[ (?<ident>" + IDENT + ") :");

    /**
     * Reply to {@code Test <setting>.}, e.g. {@code Program Mode is off}.
     */
    public static final Pattern SETTING_PATTERN = Pattern.compile("^(?<name>.+?) is (?<value>.+)$");

    /**
     * {@code Save id.}, which ends an opaque proof under a new name.
     */
    public static final Pattern SAVE_PATTERN = Pattern.compile("^Save\\s+(?<ident>" + IDENT + ")\\s*\\.$");

    /**
     * Commands altering printing options, which would change the printed forms extraction relies on.
     */
    public static final Pattern PRINTING_OPTIONS_PATTERN = Pattern.compile("^(?:Set|Unset)\\s+Printing\\s+.*\\.");

    private Patterns() {
    }
}
