package me.maxih.kdeconnect_relay.api;

public enum PairState {
    NOT_PAIRED, REQUESTED, PAIRED;

    // Staying in the same state is legal, that is how re-delivered packets look.
    public boolean canTransitionTo(PairState next) {
        if (next == this) return true;
        return switch (this) {
            case NOT_PAIRED -> next == REQUESTED;
            case REQUESTED -> true;
            case PAIRED -> next == NOT_PAIRED;
        };
    }
}
