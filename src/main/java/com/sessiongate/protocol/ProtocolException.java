package com.sessiongate.protocol;

public class ProtocolException extends Exception {

    private final boolean loggedOut;

    public ProtocolException(String message) {
        this(message, false, null);
    }

    public ProtocolException(String message, boolean loggedOut, Throwable cause) {
        super(message, cause);
        this.loggedOut = loggedOut;
    }

    /** True when the remote refused the credentials, i.e. the device was unlinked. */
    public boolean loggedOut() {
        return loggedOut;
    }
}
