package com.visionrelay.service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.socket.CloseStatus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.dto.RoomStatusResponse;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.model.MessageType;
import com.visionrelay.model.PeerConnection;
import com.visionrelay.model.PeerRole;
import com.visionrelay.model.Room;
import com.visionrelay.validation.InputValidator;

/**
 * Relays join/offer/answer/ice-candidate traffic between the two roles of a room.
 *
 * Every operation runs under the room's monitor, so a signal and a join of the
 * opposite role are ordered: the signal is either stored before the join and
 * replayed as backlog, or forwarded live after it, never both. Rooms share no
 * lock with each other.
 */
@Service
public class SignalingRelayService {

    private static final Logger logger = LoggerFactory.getLogger(SignalingRelayService.class);

    private final RoomStateStore roomStore;
    private final ConnectionRegistry connectionRegistry;
    private final SignalingPayloadFactory payloadFactory;
    private final InputValidator inputValidator;
    private final List<RoomLifecycleListener> lifecycleListeners;
    private final boolean enforceRoles;

    public SignalingRelayService(RoomStateStore roomStore,
                                 ConnectionRegistry connectionRegistry,
                                 SignalingPayloadFactory payloadFactory,
                                 InputValidator inputValidator,
                                 List<RoomLifecycleListener> lifecycleListeners,
                                 VisionRelayProperties properties) {
        this.roomStore = roomStore;
        this.connectionRegistry = connectionRegistry;
        this.payloadFactory = payloadFactory;
        this.inputValidator = inputValidator;
        this.lifecycleListeners = lifecycleListeners;
        this.enforceRoles = properties.getSignaling().isEnforceRoles();
    }

    /**
     * Register a socket in a room role, notify the desktop about the phone and
     * replay the opposite role's stored SDP and candidates to the joiner.
     *
     * @return the validated membership of the connection
     * @throws ProtocolViolationException on a missing room id or an unknown role
     */
    public Membership handleJoin(PeerConnection connection, String roomId, String roleName, String cameraType) {
        String validRoomId = inputValidator.requireRoomId(roomId);
        PeerRole role = inputValidator.requireRole(roleName);
        String validCameraType = inputValidator.cameraTypeOrNull(cameraType);

        withRoom(validRoomId, room -> {
            PeerConnection previous = connectionRegistry.register(validRoomId, role, connection);
            if (previous != null && previous != connection) {
                logger.info("🔄 Replacing {} socket {} in room {} with {}",
                        role, previous.getId(), validRoomId, connection.getId());
                previous.close(CloseStatus.GOING_AWAY);
            }
            room.setConnected(role, true);

            if (role == PeerRole.PHONE) {
                if (validCameraType != null) {
                    room.setCameraType(validCameraType);
                }
                connectionRegistry.find(validRoomId, PeerRole.DESKTOP).ifPresent(desktop ->
                        deliver(desktop, validRoomId, PeerRole.DESKTOP,
                                payloadFactory.phoneJoined(validRoomId, room.getCameraType())));
            } else if (room.isPhoneConnected() || room.getCameraType() != null) {
                deliver(connection, validRoomId, PeerRole.DESKTOP,
                        payloadFactory.phoneJoined(validRoomId, room.getCameraType()));
            }

            logger.info("✅ {} joined room {} ({})", role, validRoomId, connection.getId());
            replayBacklog(room, role, connection);
            return null;
        });
        return new Membership(validRoomId, role);
    }

    /**
     * Store an offer, answer or candidate and forward it to the opposite role if connected.
     *
     * @param message the inbound record; only its sdp or candidate field is kept
     * @throws ProtocolViolationException when role checks are enforced and the sender may not send this type
     */
    public void handleSignal(String roomId, PeerRole role, MessageType type, JsonNode message) {
        if (!type.isSignal()) {
            throw new IllegalArgumentException("Not a signaling message type: " + type);
        }

        withRoom(roomId, room -> {
            if (enforceRoles) {
                checkTransition(room, role, type);
            }

            JsonNode value;
            switch (type) {
                case OFFER -> {
                    value = message.get("sdp");
                    room.setOfferSdp(value);
                    room.setNegotiationState(room.getNegotiationState().onOffer());
                }
                case ANSWER -> {
                    value = message.get("sdp");
                    room.setAnswerSdp(value);
                    if (room.getNegotiationState().acceptsAnswer()) {
                        room.setNegotiationState(room.getNegotiationState().onAnswer());
                    }
                }
                default -> {
                    value = message.get("candidate");
                    room.appendCandidate(role, value);
                }
            }

            ObjectNode payload = payloadFactory.signal(type, roomId, value);
            PeerRole target = role.opposite();
            Optional<PeerConnection> peer = connectionRegistry.find(roomId, target);
            if (peer.isPresent()) {
                deliver(peer.get(), roomId, target, payload);
            } else {
                logger.debug("📥 Stored {} from {} in room {} ({} not connected)", type, role, roomId, target);
            }
            return null;
        });
    }

    /**
     * Release the role slot held by this connection and purge the room once
     * neither role is connected. A connection that no longer holds its slot
     * (it was replaced) changes nothing.
     */
    public void handleDisconnect(PeerConnection connection, String roomId, PeerRole role) {
        Optional<Room> found = roomStore.findRoom(roomId);
        if (found.isEmpty()) {
            return;
        }
        Room room = found.get();
        boolean purged;
        synchronized (room) {
            if (room.isPurged() || !connectionRegistry.unregister(roomId, role, connection)) {
                logger.debug("Stale disconnect of {} socket {} in room {}", role, connection.getId(), roomId);
                return;
            }
            room.setConnected(role, false);
            logger.info("🚪 {} left room {}", role, roomId);

            purged = roomStore.purgeIfEmpty(roomId);
            if (purged) {
                connectionRegistry.removeRoom(roomId);
            }
        }
        if (purged) {
            for (RoomLifecycleListener listener : lifecycleListeners) {
                listener.onRoomPurged(roomId);
            }
        }
    }

    /**
     * Snapshot of a room for the status API.
     */
    public Optional<RoomStatusResponse> describeRoom(String roomId) {
        return roomStore.findRoom(roomId).map(room -> {
            synchronized (room) {
                return new RoomStatusResponse(
                        room.getRoomId(),
                        hasValue(room.getOfferSdp()),
                        hasValue(room.getAnswerSdp()),
                        room.getCandidatesFrom(PeerRole.PHONE).size(),
                        room.getCandidatesFrom(PeerRole.DESKTOP).size(),
                        room.isPhoneConnected(),
                        room.isDesktopConnected(),
                        room.getCameraType(),
                        room.getNegotiationState(),
                        room.getCreatedAt());
            }
        });
    }

    /**
     * Desktop gets the phone's offer then offer-side candidates; phone gets the
     * desktop's answer then answer-side candidates. SDP always precedes candidates.
     */
    private void replayBacklog(Room room, PeerRole role, PeerConnection connection) {
        PeerRole source = role.opposite();
        String roomId = room.getRoomId();
        MessageType sdpType = source == PeerRole.PHONE ? MessageType.OFFER : MessageType.ANSWER;

        JsonNode sdp = room.getSdpFrom(source);
        if (hasValue(sdp) && !deliver(connection, roomId, role, payloadFactory.signal(sdpType, roomId, sdp))) {
            return;
        }

        List<JsonNode> candidates = room.getCandidatesFrom(source);
        for (JsonNode candidate : candidates) {
            if (!deliver(connection, roomId, role, payloadFactory.signal(MessageType.ICE_CANDIDATE, roomId, candidate))) {
                return;
            }
        }
        if (hasValue(sdp) || !candidates.isEmpty()) {
            logger.info("📤 Replayed backlog to {} in room {} (sdp: {}, candidates: {})",
                    role, roomId, hasValue(sdp), candidates.size());
        }
    }

    private void checkTransition(Room room, PeerRole role, MessageType type) {
        if (type == MessageType.OFFER && role != PeerRole.PHONE) {
            throw new ProtocolViolationException(ErrorCode.SIG_001, "only phone may send offer");
        }
        if (type == MessageType.ANSWER) {
            if (role != PeerRole.DESKTOP) {
                throw new ProtocolViolationException(ErrorCode.SIG_001, "only desktop may send answer");
            }
            if (!room.getNegotiationState().acceptsAnswer()) {
                throw new ProtocolViolationException(ErrorCode.SIG_002, "room " + room.getRoomId());
            }
        }
    }

    private boolean deliver(PeerConnection target, String roomId, PeerRole targetRole, ObjectNode payload) {
        if (target.send(payloadFactory.serialize(payload))) {
            logger.debug("📨 Relayed {} to {} in room {}", payload.path("type").asText(), targetRole, roomId);
            return true;
        }
        logger.warn("Failed to relay {} to {} in room {}", payload.path("type").asText(), targetRole, roomId);
        return false;
    }

    /**
     * Run the action on a live (not purged) room while holding its monitor.
     * A room purged between lookup and locking is replaced by a fresh one.
     */
    private <T> T withRoom(String roomId, Function<Room, T> action) {
        while (true) {
            Room room = roomStore.getOrCreateRoom(roomId);
            synchronized (room) {
                if (!room.isPurged()) {
                    return action.apply(room);
                }
            }
        }
    }

    private static boolean hasValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        return !node.isTextual() || !node.asText().isEmpty();
    }

    /**
     * Room and role a connection joined as.
     */
    public record Membership(String roomId, PeerRole role) {
    }
}
