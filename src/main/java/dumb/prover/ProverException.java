package dumb.prover;

/**
 * Base of the unchecked errors raised while talking to the assistant or extracting commands.
 */
public class ProverException extends RuntimeException {

    public ProverException(String message) {
        super(message);
    }

    public ProverException(String message, Throwable cause) {
        super(message, cause);
    }
}
