package com.visionrelay.dto;

/**
 * Server-wide counters returned by {@code GET /api/status}.
 */
public record RelayStatusResponse(int rooms, int connections, int sessions, boolean modelLoaded,
                                  InferenceStats inference) {

    public record InferenceStats(long submitted, long completed, long dropped, long timedOut,
                                 long cancelled, int queued, int active) {
    }
}
