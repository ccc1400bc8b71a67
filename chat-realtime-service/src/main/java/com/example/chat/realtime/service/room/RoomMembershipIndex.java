package com.example.chat.realtime.service.room;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which users are currently viewing which chat rooms.
 * <p>
 * Both directions of the index are guarded by one monitor. Every read returns a fresh,
 * mutable snapshot that callers may iterate or trim without holding the lock. Membership is
 * independent of connections: it survives a disconnect and is only cleared by an explicit leave.
 */
@Component
@Slf4j
public class RoomMembershipIndex {

    private final Object lock = new Object();
    private final Map<String, Set<String>> membersByRoom = new HashMap<>();
    private final Map<String, Set<String>> roomsByUser = new HashMap<>();

    /**
     * @return true if the user was not yet a member
     */
    public boolean join(String roomId, String userId) {
        boolean added;
        synchronized (lock) {
            added = membersByRoom.computeIfAbsent(roomId, key -> new HashSet<>()).add(userId);
            if (added) {
                roomsByUser.computeIfAbsent(userId, key -> new HashSet<>()).add(roomId);
            }
        }
        if (added) {
            log.debug("User {} joined room {}", userId, roomId);
        }
        return added;
    }

    /**
     * @return true if the user was a member
     */
    public boolean leave(String roomId, String userId) {
        boolean removed;
        synchronized (lock) {
            removed = removeFrom(membersByRoom, roomId, userId);
            if (removed) {
                removeFrom(roomsByUser, userId, roomId);
            }
        }
        if (removed) {
            log.debug("User {} left room {}", userId, roomId);
        }
        return removed;
    }

    public Set<String> membersOf(String roomId) {
        synchronized (lock) {
            Set<String> members = membersByRoom.get(roomId);
            return members == null ? new HashSet<>() : new HashSet<>(members);
        }
    }

    public Set<String> roomsContaining(String userId) {
        synchronized (lock) {
            Set<String> rooms = roomsByUser.get(userId);
            return rooms == null ? new HashSet<>() : new HashSet<>(rooms);
        }
    }

    public boolean isMember(String roomId, String userId) {
        synchronized (lock) {
            Set<String> members = membersByRoom.get(roomId);
            return members != null && members.contains(userId);
        }
    }

    /**
     * Everyone who shares at least one room with the user, each listed once, without the user.
     */
    public Set<String> peersOf(String userId) {
        Set<String> peers = new HashSet<>();
        synchronized (lock) {
            Set<String> rooms = roomsByUser.get(userId);
            if (rooms != null) {
                for (String roomId : rooms) {
                    peers.addAll(membersByRoom.getOrDefault(roomId, Set.of()));
                }
            }
        }
        peers.remove(userId);
        return peers;
    }

    public int roomCount() {
        synchronized (lock) {
            return membersByRoom.size();
        }
    }

    private static boolean removeFrom(Map<String, Set<String>> index, String key, String value) {
        Set<String> values = index.get(key);
        if (values == null || !values.remove(value)) {
            return false;
        }
        if (values.isEmpty()) {
            index.remove(key);
        }
        return true;
    }
}
