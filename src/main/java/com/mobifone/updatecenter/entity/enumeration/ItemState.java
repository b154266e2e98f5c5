package com.mobifone.updatecenter.entity.enumeration;

public enum ItemState {
    QUEUED,
    INSTALLING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(ItemState next) {
        return switch (this) {
            case QUEUED -> next == INSTALLING || next == SKIPPED;
            case INSTALLING -> next.isTerminal();
            default -> false;
        };
    }
}
