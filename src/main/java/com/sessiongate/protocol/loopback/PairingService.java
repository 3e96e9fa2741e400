package com.sessiongate.protocol.loopback;

import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class PairingService {

    private final SecureRandom random = new SecureRandom();
    // code -> session id
    private final Map<String, String> pendingCodes = new ConcurrentHashMap<>();

    public String generateCode(String sessionId) {
        String code;
        do {
            code = String.format("%06d", random.nextInt(1_000_000));
        } while (pendingCodes.putIfAbsent(code, sessionId) != null);
        return code;
    }

    /** Consumes the code only if it was generated for the given session. Returns true on success. */
    public boolean consumeCode(String code, String expectedSessionId) {
        return pendingCodes.remove(code, expectedSessionId);
    }

    public void revoke(String sessionId) {
        pendingCodes.values().removeIf(sessionId::equals);
    }
}
