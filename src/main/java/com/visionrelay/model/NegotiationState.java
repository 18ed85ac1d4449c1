package com.visionrelay.model;

/**
 * Per-room offer/answer progress used to validate negotiation messages.
 */
public enum NegotiationState {
    AWAITING_OFFER,
    OFFERED,
    ANSWERED;

    /**
     * An offer is always accepted; a repeated offer restarts the exchange.
     */
    public NegotiationState onOffer() {
        return OFFERED;
    }

    public boolean acceptsAnswer() {
        return this != AWAITING_OFFER;
    }

    public NegotiationState onAnswer() {
        if (!acceptsAnswer()) {
            throw new IllegalStateException("Answer received in state " + this);
        }
        return ANSWERED;
    }
}
