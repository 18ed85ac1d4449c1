package com.visionrelay.dto;

import com.visionrelay.model.NegotiationState;

/**
 * Signaling summary of one room, without SDP or candidate contents.
 */
public record RoomStatusResponse(
        String roomId,
        boolean hasOffer,
        boolean hasAnswer,
        int offerCandidates,
        int answerCandidates,
        boolean phoneConnected,
        boolean desktopConnected,
        String cameraType,
        NegotiationState negotiationState,
        long createdAt) {
}
