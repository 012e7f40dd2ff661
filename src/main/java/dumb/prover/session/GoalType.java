package dumb.prover.session;

public enum GoalType {
    FOREGROUND, BACKGROUND, SHELVED, ABANDONED
}
