package com.visionrelay.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one frame-for-inference request. Timestamps are epoch milliseconds.
 * {@code error} is omitted from the JSON form when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FrameResult(
        @JsonProperty("frame_id") String frameId,
        @JsonProperty("capture_ts") double captureTs,
        @JsonProperty("recv_ts") double recvTs,
        @JsonProperty("inference_ts") double inferenceTs,
        @JsonProperty("detections") List<Detection> detections,
        @JsonProperty("error") String error) {

    public FrameResult {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public static FrameResult of(String frameId, double captureTs, double recvTs, double inferenceTs,
                                 List<Detection> detections) {
        return new FrameResult(frameId, captureTs, recvTs, inferenceTs, detections, null);
    }

    /**
     * Result with no detections and the given error text.
     */
    public static FrameResult degraded(String frameId, double captureTs, double recvTs, double inferenceTs,
                                       String error) {
        return new FrameResult(frameId, captureTs, recvTs, inferenceTs, List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
