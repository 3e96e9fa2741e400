package com.sessiongate.gateway.http;

import com.sessiongate.protocol.loopback.LoopbackConnector;
import com.sessiongate.registry.SessionRegistry;
import com.sessiongate.shared.config.GatewayConfig;
import com.sessiongate.shared.error.AlreadyActiveException;
import com.sessiongate.shared.error.QueueFullException;
import com.sessiongate.shared.error.SessionNotConnectedException;
import com.sessiongate.shared.error.SessionNotFoundException;
import com.sessiongate.shared.model.SessionOptions;
import com.sessiongate.shared.model.SessionSnapshot;
import com.sessiongate.shared.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class SessionControllerTest {

    private SessionRegistry registry;
    private LoopbackConnector loopback;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        loopback = mock(LoopbackConnector.class);
        mvc = MockMvcBuilders
                .standaloneSetup(new SessionController(registry, loopback, GatewayConfig.defaults()))
                .setControllerAdvice(new ErrorResponseAdvice())
                .build();
    }

    private static SessionSnapshot snapshot(String id, SessionState state) {
        return new SessionSnapshot(id, state, Instant.parse("2026-02-20T00:00:00Z"), 0, 0, null, null, 0);
    }

    @Test
    void startReturnsCreatedSnapshot() throws Exception {
        when(registry.startSession(eq("t1"), any(SessionOptions.class))).thenReturn(snapshot("t1", SessionState.INITIALIZING));

        mvc.perform(post("/v1/sessions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"t1\",\"allowBuffering\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("t1"))
                .andExpect(jsonPath("$.state").value("INITIALIZING"));

        verify(registry).startSession(eq("t1"), argThat(SessionOptions::allowBuffering));
    }

    @Test
    void secondStartIsConflict() throws Exception {
        when(registry.startSession(eq("t1"), any())).thenThrow(new AlreadyActiveException("t1"));

        mvc.perform(post("/v1/sessions").contentType(MediaType.APPLICATION_JSON).content("{\"sessionId\":\"t1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_ACTIVE"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(registry.getStatus("ghost")).thenThrow(new SessionNotFoundException("ghost"));

        mvc.perform(get("/v1/sessions/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void stopPassesLogoutFlag() throws Exception {
        when(registry.stopSession("t1", true)).thenReturn(snapshot("t1", SessionState.TERMINATED));

        mvc.perform(delete("/v1/sessions/t1").param("logout", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("TERMINATED"));
    }

    @Test
    void listReturnsEverySession() throws Exception {
        when(registry.listSessions()).thenReturn(Stream.of(
                snapshot("a", SessionState.CONNECTED), snapshot("b", SessionState.PAIRING)));

        mvc.perform(get("/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].state").value("PAIRING"));
    }

    @Test
    void sendIsAcceptedOrMapsTypedFailures() throws Exception {
        when(registry.sendMessage("t1", "peer", "hi", "k1")).thenReturn(new CompletableFuture<>());
        when(registry.sendMessage("t1", "peer", "hi", "k2")).thenThrow(new SessionNotConnectedException("t1"));
        when(registry.sendMessage("t1", "peer", "hi", "k3")).thenThrow(new QueueFullException("t1", 10));

        mvc.perform(post("/v1/sessions/t1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"peer\",\"content\":\"hi\",\"idempotencyKey\":\"k1\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"));
        mvc.perform(post("/v1/sessions/t1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"peer\",\"content\":\"hi\",\"idempotencyKey\":\"k2\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SESSION_NOT_CONNECTED"));
        mvc.perform(post("/v1/sessions/t1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"peer\",\"content\":\"hi\",\"idempotencyKey\":\"k3\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("QUEUE_FULL"));
    }

    @Test
    void sendWithoutContentIsBadRequest() throws Exception {
        mvc.perform(post("/v1/sessions/t1/messages").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"peer\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pairingChallengeAndConfirmation() throws Exception {
        when(registry.pairingChallenge("t1")).thenReturn("123456");
        when(registry.getStatus("t1")).thenReturn(snapshot("t1", SessionState.PAIRING));
        when(loopback.confirmPairing("t1", "123456")).thenReturn(true);

        mvc.perform(get("/v1/sessions/t1/pairing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge").value("123456"));
        mvc.perform(post("/v1/sessions/t1/pairing").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\" 123456 \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paired").value(true));
    }
}
