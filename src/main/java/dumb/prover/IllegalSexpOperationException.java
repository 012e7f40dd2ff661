package dumb.prover;

/**
 * Raised when an s-expression does not have the shape an accessor expects.
 */
public class IllegalSexpOperationException extends ProverException {

    public IllegalSexpOperationException(String message) {
        super(message);
    }
}
