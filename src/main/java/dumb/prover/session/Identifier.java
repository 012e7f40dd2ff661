package dumb.prover.session;

/**
 * An identifier referenced by a command, with the context it appeared in.
 */
public record Identifier(IdentType type, String string) {

    @Override
    public String toString() {
        return string;
    }
}
