package dumb.prover.session;

/**
 * The syntactic context an identifier appears in within a serialized AST.
 * <p>
 * Variants of {@link #SER_QUALID} precede it so that {@link #isQualidFamily()} is an ordinal comparison.
 */
public enum IdentType {
    /**
     * A qualified id inside a pattern, e.g. {@code p} in {@code S p}. May bind a new name.
     */
    CPAT_ATOM,
    /**
     * A reference to a qualified id, e.g. the type of a binder.
     */
    CREF,
    /**
     * A plain qualified id.
     */
    SER_QUALID,
    /**
     * A located id, as in theorem statements. Never qualified.
     */
    LIDENT,
    /**
     * A located name, as in definitions and binders. Never qualified.
     */
    LNAME;

    public boolean isQualidFamily() {
        return ordinal() <= SER_QUALID.ordinal();
    }
}
