package com.example.chat.shared.util;

public final class Constants {

    private Constants() {}

    /** Close code sent when the bearer credential is missing or rejected. */
    public static final int CLOSE_AUTHENTICATION_FAILED = 4001;

    public static final String GENERIC_ERROR_MESSAGE = "Internal server error";

    public enum ConnectionState {
        CONNECTING,
        OPEN,
        CLOSED
    }

    public enum MessageStatus {
        DELIVERED,
        READ
    }

    public enum GeofenceTransition {
        ENTER,
        EXIT;

        public String wireName() {
            return name().toLowerCase();
        }
    }
}
