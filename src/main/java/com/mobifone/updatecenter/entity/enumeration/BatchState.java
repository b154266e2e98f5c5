package com.mobifone.updatecenter.entity.enumeration;

public enum BatchState {
    DRAFT,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    PARTIAL,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == PARTIAL || this == CANCELLED;
    }

    public boolean canTransitionTo(BatchState next) {
        return switch (this) {
            case DRAFT -> next == SCHEDULED || next == IN_PROGRESS;
            case SCHEDULED -> next == IN_PROGRESS;
            case IN_PROGRESS -> next.isTerminal();
            default -> false;
        };
    }
}
