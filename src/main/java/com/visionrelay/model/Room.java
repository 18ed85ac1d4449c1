package com.visionrelay.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signaling state of one room for the lifetime of its session.
 *
 * Holds the last offer/answer SDP (last write wins), the append-only ICE
 * candidate lists of each side and the connected flags of both roles.
 * Instances are not thread-safe on their own: callers mutate a room while
 * holding its monitor, which is also how a purge is made visible.
 */
public class Room {
    private final String roomId;
    private final long createdAt;

    private JsonNode offerSdp;
    private JsonNode answerSdp;
    private final List<JsonNode> offerCandidates = new ArrayList<>();
    private final List<JsonNode> answerCandidates = new ArrayList<>();

    private boolean phoneConnected;
    private boolean desktopConnected;
    private String cameraType;

    private NegotiationState negotiationState = NegotiationState.AWAITING_OFFER;
    private boolean purged;

    public Room(String roomId) {
        this.roomId = roomId;
        this.createdAt = System.currentTimeMillis();
    }

    /**
     * SDP published by the given role: the phone's offer or the desktop's answer.
     */
    public JsonNode getSdpFrom(PeerRole role) {
        return role == PeerRole.PHONE ? offerSdp : answerSdp;
    }

    /**
     * Candidates published by the given role, in arrival order.
     */
    public List<JsonNode> getCandidatesFrom(PeerRole role) {
        List<JsonNode> candidates = role == PeerRole.PHONE ? offerCandidates : answerCandidates;
        return Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public void appendCandidate(PeerRole from, JsonNode candidate) {
        if (from == PeerRole.PHONE) {
            offerCandidates.add(candidate);
        } else {
            answerCandidates.add(candidate);
        }
    }

    public boolean isConnected(PeerRole role) {
        return role == PeerRole.PHONE ? phoneConnected : desktopConnected;
    }

    public void setConnected(PeerRole role, boolean connected) {
        if (role == PeerRole.PHONE) {
            phoneConnected = connected;
        } else {
            desktopConnected = connected;
        }
    }

    /**
     * No role is connected any more.
     */
    public boolean isEmpty() {
        return !phoneConnected && !desktopConnected;
    }

    // Getters and setters
    public String getRoomId() {
        return roomId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public JsonNode getOfferSdp() {
        return offerSdp;
    }

    public void setOfferSdp(JsonNode offerSdp) {
        this.offerSdp = offerSdp;
    }

    public JsonNode getAnswerSdp() {
        return answerSdp;
    }

    public void setAnswerSdp(JsonNode answerSdp) {
        this.answerSdp = answerSdp;
    }

    public boolean isPhoneConnected() {
        return phoneConnected;
    }

    public boolean isDesktopConnected() {
        return desktopConnected;
    }

    public String getCameraType() {
        return cameraType;
    }

    public void setCameraType(String cameraType) {
        this.cameraType = cameraType;
    }

    public NegotiationState getNegotiationState() {
        return negotiationState;
    }

    public void setNegotiationState(NegotiationState negotiationState) {
        this.negotiationState = negotiationState;
    }

    public boolean isPurged() {
        return purged;
    }

    /**
     * Mark this instance as removed from its store. A purged room is never reused;
     * a later reference to the same id creates a fresh room.
     */
    public void markPurged() {
        this.purged = true;
    }
}
