package com.safepocket.categorizer.transfer;

public enum TransferSignal {
    EXCLUDED_COUNTERPARTY(false),
    EXCLUDED_TYPE(false),
    OWN_ACCOUNT(true),
    SELF_TRANSFER(true),
    KEYWORD(true),
    NONE(false);

    private final boolean internal;

    TransferSignal(boolean internal) {
        this.internal = internal;
    }

    public boolean internal() {
        return internal;
    }
}
