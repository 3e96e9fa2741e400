package com.sessiongate.gateway.http;

import com.sessiongate.protocol.loopback.LoopbackConnector;
import com.sessiongate.registry.SessionRegistry;
import com.sessiongate.shared.config.GatewayConfig;
import com.sessiongate.shared.model.SessionOptions;
import com.sessiongate.shared.model.SessionSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/sessions")
public class SessionController {

    public record StartRequest(String sessionId, Boolean allowBuffering, Map<String, String> metadata) {}

    public record SendRequest(String target, String content, String idempotencyKey) {}

    private final SessionRegistry registry;
    private final LoopbackConnector loopback;
    private final boolean defaultBuffering;

    public SessionController(SessionRegistry registry, LoopbackConnector loopback, GatewayConfig config) {
        this.registry = registry;
        this.loopback = loopback;
        this.defaultBuffering = config.outbound().allowBuffering();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionSnapshot start(@RequestBody StartRequest request) {
        var buffering = request.allowBuffering() != null ? request.allowBuffering() : defaultBuffering;
        return registry.startSession(request.sessionId(), new SessionOptions(buffering, request.metadata()));
    }

    @DeleteMapping("/{sessionId}")
    public SessionSnapshot stop(@PathVariable String sessionId,
                                @RequestParam(defaultValue = "false") boolean logout) throws InterruptedException {
        return registry.stopSession(sessionId, logout);
    }

    @GetMapping("/{sessionId}")
    public SessionSnapshot status(@PathVariable String sessionId) {
        return registry.getStatus(sessionId);
    }

    @GetMapping
    public List<SessionSnapshot> list() {
        return registry.listSessions().toList();
    }

    @GetMapping("/{sessionId}/pairing")
    public Map<String, Object> pairingChallenge(@PathVariable String sessionId) {
        // challenge is null outside PAIRING
        var body = new HashMap<String, Object>();
        body.put("sessionId", sessionId);
        body.put("challenge", registry.pairingChallenge(sessionId));
        return body;
    }

    @PostMapping("/{sessionId}/pairing")
    public Map<String, Object> confirmPairing(@PathVariable String sessionId, @RequestBody Map<String, String> body) {
        registry.getStatus(sessionId);
        var code = body.getOrDefault("code", "");
        return Map.of("sessionId", sessionId, "paired", loopback.confirmPairing(sessionId, code.trim()));
    }

    @PostMapping("/{sessionId}/messages")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> send(@PathVariable String sessionId, @RequestBody SendRequest request) {
        if (request.target() == null || request.content() == null) {
            throw new IllegalArgumentException("target and content are required");
        }
        registry.sendMessage(sessionId, request.target(), request.content(), request.idempotencyKey());
        var body = new HashMap<String, Object>();
        body.put("sessionId", sessionId);
        body.put("idempotencyKey", request.idempotencyKey());
        body.put("status", "queued");
        return body;
    }
}
