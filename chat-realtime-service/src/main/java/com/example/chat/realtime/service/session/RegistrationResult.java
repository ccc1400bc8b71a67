package com.example.chat.realtime.service.session;

import lombok.Value;

@Value
public class RegistrationResult {
    ConnectionHandle handle;
    /** True when this was the user's first open connection. */
    boolean becameOnline;

    public String getConnectionId() {
        return handle.getConnectionId();
    }
}
