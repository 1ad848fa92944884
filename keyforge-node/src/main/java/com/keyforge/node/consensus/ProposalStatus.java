package com.keyforge.node.consensus;

public enum ProposalStatus {
    OPEN,
    APPROVED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
