package com.example.chat.realtime.service.dispatch;

import com.example.chat.realtime.service.session.ConnectionHandle;

import java.util.Set;

/**
 * Who an {@link OutboundEvent} goes to.
 */
public sealed interface EventAddress {

    /** Every open connection of one user. */
    record User(String userId) implements EventAddress {
    }

    /** Every open connection of each listed user; each user is written once. */
    record Users(Set<String> userIds) implements EventAddress {
        public Users {
            userIds = Set.copyOf(userIds);
        }
    }

    /** Every open connection of every room member except {@code excludeUserId} (may be null). */
    record Room(String roomId, String excludeUserId) implements EventAddress {
    }

    /** Exactly one connection. Used for replies such as pong, error and acks. */
    record Connection(ConnectionHandle handle) implements EventAddress {
    }
}
