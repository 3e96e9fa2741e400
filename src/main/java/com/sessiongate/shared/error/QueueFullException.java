package com.sessiongate.shared.error;

public class QueueFullException extends GatewayException {
    public QueueFullException(String sessionId, int capacity) {
        super(ErrorCode.QUEUE_FULL, sessionId,
                "Outbound queue full for session " + sessionId + " (capacity " + capacity + ")");
    }
}
