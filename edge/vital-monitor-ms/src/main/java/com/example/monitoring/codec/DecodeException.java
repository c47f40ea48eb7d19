package com.example.monitoring.codec;

public class DecodeException extends Exception {

    public enum Reason {
        AUTHENTICATION_FAILED,
        CORRUPT_FRAME,
        MALFORMED_PACKET
    }

    private final Reason reason;

    public DecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
