package com.visionrelay.service;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.dto.RoomStatusResponse;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.model.MessageType;
import com.visionrelay.model.NegotiationState;
import com.visionrelay.model.PeerRole;
import com.visionrelay.model.RecordingPeerConnection;
import com.visionrelay.validation.InputValidator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalingRelayServiceTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final List<String> purgedRooms = new ArrayList<>();

    private InMemoryRoomStateStore store;
    private ConnectionRegistry registry;
    private SignalingRelayService relay;

    @BeforeEach
    void setUp() {
        relay = newRelay(true);
    }

    private SignalingRelayService newRelay(boolean enforceRoles) {
        VisionRelayProperties properties = new VisionRelayProperties();
        properties.getSignaling().setEnforceRoles(enforceRoles);
        store = new InMemoryRoomStateStore();
        registry = new ConnectionRegistry();
        RoomLifecycleListener listener = purgedRooms::add;
        return new SignalingRelayService(store, registry, new SignalingPayloadFactory(mapper),
                new InputValidator(), List.of(listener), properties);
    }

    private ObjectNode offer(String sdp) {
        return mapper.createObjectNode().put("type", "offer").put("sdp", sdp);
    }

    private ObjectNode answer(String sdp) {
        return mapper.createObjectNode().put("type", "answer").put("sdp", sdp);
    }

    private ObjectNode candidate(String value) {
        ObjectNode message = mapper.createObjectNode().put("type", "ice-candidate");
        message.putObject("candidate").put("candidate", value).put("sdpMid", "0");
        return message;
    }

    @Test
    void lateDesktopReceivesJoinNoticeThenOfferThenCandidatesInOrder() {
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        relay.handleJoin(phone, "abc", "phone", "rear");
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("v=0 offer"));
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.ICE_CANDIDATE, candidate("c1"));
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.ICE_CANDIDATE, candidate("c2"));

        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(desktop, "abc", "desktop", null);

        List<JsonNode> received = desktop.messages();
        assertEquals(List.of("join", "offer", "ice-candidate", "ice-candidate"), desktop.types());
        assertEquals("phone", received.get(0).get("role").asText());
        assertEquals("rear", received.get(0).get("cameraType").asText());
        assertEquals("v=0 offer", received.get(1).get("sdp").asText());
        assertEquals("c1", received.get(2).get("candidate").get("candidate").asText());
        assertEquals("c2", received.get(3).get("candidate").get("candidate").asText());
        assertTrue(phone.types().isEmpty());
    }

    @Test
    void desktopFirstGetsLiveForwardsWithoutDuplicates() {
        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(desktop, "abc", "desktop", null);
        assertTrue(desktop.types().isEmpty());

        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        relay.handleJoin(phone, "abc", "phone", "front");
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("sdp-1"));
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.ICE_CANDIDATE, candidate("c1"));

        assertEquals(List.of("join", "offer", "ice-candidate"), desktop.types());
        assertEquals("front", desktop.messages().get(0).get("cameraType").asText());
    }

    @Test
    void answerAndDesktopCandidatesAreReplayedToReconnectingPhone() {
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(phone, "abc", "phone", null);
        relay.handleJoin(desktop, "abc", "desktop", null);
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("o"));
        relay.handleDisconnect(phone, "abc", PeerRole.PHONE);
        relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.ANSWER, answer("a"));
        relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.ICE_CANDIDATE, candidate("d1"));

        RecordingPeerConnection phoneAgain = new RecordingPeerConnection("phone-2");
        relay.handleJoin(phoneAgain, "abc", "phone", null);

        assertEquals(List.of("answer", "ice-candidate"), phoneAgain.types());
        assertEquals("a", phoneAgain.messages().get(0).get("sdp").asText());
    }

    @Test
    void lastOfferWins() {
        relay.handleJoin(new RecordingPeerConnection("phone"), "abc", "phone", null);
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("first"));
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("second"));

        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(desktop, "abc", "desktop", null);

        assertEquals(List.of("join", "offer"), desktop.types());
        assertEquals("second", desktop.messages().get(1).get("sdp").asText());
    }

    @Test
    void roomIsPurgedOnlyWhenBothRolesLeave() {
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(phone, "abc", "phone", "rear");
        relay.handleJoin(desktop, "abc", "desktop", null);
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("o"));

        relay.handleDisconnect(phone, "abc", PeerRole.PHONE);
        assertTrue(store.findRoom("abc").isPresent());
        assertTrue(purgedRooms.isEmpty());

        relay.handleDisconnect(desktop, "abc", PeerRole.DESKTOP);
        assertTrue(store.findRoom("abc").isEmpty());
        assertEquals(List.of("abc"), purgedRooms);
        assertEquals(0, registry.connectionCount());

        // Same id afterwards starts from scratch
        RecordingPeerConnection newDesktop = new RecordingPeerConnection("desktop-2");
        relay.handleJoin(newDesktop, "abc", "desktop", null);
        assertTrue(newDesktop.types().isEmpty());
    }

    @Test
    void replacedSocketDisconnectIsStale() {
        RecordingPeerConnection first = new RecordingPeerConnection("phone-1");
        RecordingPeerConnection second = new RecordingPeerConnection("phone-2");
        relay.handleJoin(first, "abc", "phone", null);
        relay.handleJoin(second, "abc", "phone", null);

        assertEquals(CloseStatus.GOING_AWAY, first.getCloseStatus());

        relay.handleDisconnect(first, "abc", PeerRole.PHONE);

        assertTrue(store.findRoom("abc").isPresent());
        assertTrue(relay.describeRoom("abc").orElseThrow().phoneConnected());
        assertTrue(purgedRooms.isEmpty());
    }

    @Test
    void closedSocketSkippedByForwardStillReleasesItsRole() {
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(phone, "abc", "phone", null);
        relay.handleJoin(desktop, "abc", "desktop", null);

        // Phone is closing: the desktop's candidate is stored but not delivered
        phone.close(CloseStatus.POLICY_VIOLATION);
        relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.ICE_CANDIDATE, candidate("d1"));
        assertTrue(phone.types().isEmpty());

        relay.handleDisconnect(phone, "abc", PeerRole.PHONE);
        assertFalse(relay.describeRoom("abc").orElseThrow().phoneConnected());

        relay.handleDisconnect(desktop, "abc", PeerRole.DESKTOP);
        assertTrue(store.findRoom("abc").isEmpty());
        assertEquals(List.of("abc"), purgedRooms);
        assertEquals(0, registry.connectionCount());
    }

    @Test
    void joinRejectsMissingRoomIdAndUnknownRole() {
        RecordingPeerConnection connection = new RecordingPeerConnection("c");

        ProtocolViolationException noRoom = assertThrows(ProtocolViolationException.class,
                () -> relay.handleJoin(connection, "", "phone", null));
        assertEquals(ErrorCode.JOIN_001, noRoom.getErrorCode());

        ProtocolViolationException badRole = assertThrows(ProtocolViolationException.class,
                () -> relay.handleJoin(connection, "abc", "viewer", null));
        assertEquals(ErrorCode.JOIN_002, badRole.getErrorCode());

        assertEquals(0, store.roomCount());
    }

    @Test
    void roleChecksRejectOutOfTurnSignals() {
        relay.handleJoin(new RecordingPeerConnection("phone"), "abc", "phone", null);
        relay.handleJoin(new RecordingPeerConnection("desktop"), "abc", "desktop", null);

        ProtocolViolationException desktopOffer = assertThrows(ProtocolViolationException.class,
                () -> relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.OFFER, offer("x")));
        assertEquals(ErrorCode.SIG_001, desktopOffer.getErrorCode());

        ProtocolViolationException earlyAnswer = assertThrows(ProtocolViolationException.class,
                () -> relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.ANSWER, answer("x")));
        assertEquals(ErrorCode.SIG_002, earlyAnswer.getErrorCode());

        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("o"));
        relay.handleSignal("abc", PeerRole.DESKTOP, MessageType.ANSWER, answer("a"));
        assertEquals(NegotiationState.ANSWERED, relay.describeRoom("abc").orElseThrow().negotiationState());
    }

    @Test
    void roleChecksCanBeDisabled() {
        SignalingRelayService lenient = newRelay(false);
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        lenient.handleJoin(phone, "abc", "phone", null);

        lenient.handleSignal("abc", PeerRole.DESKTOP, MessageType.ANSWER, answer("early"));

        assertEquals(List.of("answer"), phone.types());
    }

    @Test
    void failedForwardIsStillStoredAndReplayed() {
        RecordingPeerConnection phone = new RecordingPeerConnection("phone");
        RecordingPeerConnection desktop = new RecordingPeerConnection("desktop");
        relay.handleJoin(phone, "abc", "phone", null);
        relay.handleJoin(desktop, "abc", "desktop", null);
        desktop.failWrites();

        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("o"));

        RecordingPeerConnection replacement = new RecordingPeerConnection("desktop-2");
        relay.handleJoin(replacement, "abc", "desktop", null);
        assertEquals(List.of("join", "offer"), replacement.types());
    }

    @Test
    void describeRoomSummarizesState() {
        relay.handleJoin(new RecordingPeerConnection("phone"), "abc", "phone", "rear");
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.OFFER, offer("o"));
        relay.handleSignal("abc", PeerRole.PHONE, MessageType.ICE_CANDIDATE, candidate("c1"));

        RoomStatusResponse status = relay.describeRoom("abc").orElseThrow();

        assertTrue(status.hasOffer());
        assertFalse(status.hasAnswer());
        assertEquals(1, status.offerCandidates());
        assertEquals(0, status.answerCandidates());
        assertTrue(status.phoneConnected());
        assertFalse(status.desktopConnected());
        assertEquals("rear", status.cameraType());
        assertEquals(NegotiationState.OFFERED, status.negotiationState());
        assertTrue(relay.describeRoom("missing").isEmpty());
    }
}
