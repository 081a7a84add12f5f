package com.fritter.freet.domain;

public enum AuditState {
    NONE,
    TESTING,
    PASSED,
    FAILED;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED;
    }
}
