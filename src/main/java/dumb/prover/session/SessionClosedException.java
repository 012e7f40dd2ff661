package dumb.prover.session;

import dumb.prover.ProverException;

public class SessionClosedException extends ProverException {

    public SessionClosedException() {
        super("The session has been terminated");
    }
}
