package com.chipilink.server.ws;

import com.chipilink.server.model.LocalizedText;
import com.chipilink.server.model.RealtimeMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live client connections, their room memberships and user association.
 * <p>
 * Every admitted connection gets a stable numeric handle; the room and user indices hold
 * handles only, so removing a connection never leaves a dangling reference behind.
 * All index updates happen under one lock that is never held while sending.
 * <p>
 * Delivery is best effort and at most once. Each send runs on the send pool and is bounded
 * by the send timeout; a connection whose send fails or times out is unregistered and closed,
 * and the remaining targets are unaffected.
 * <p>
 * The send pool never queues: a send either starts on an idle or new worker right away, so its
 * timeout only covers its own I/O, or it is skipped once {@code maxSendThreads} workers are busy.
 * A skipped send leaves the connection registered.
 */
public class ConnectionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final String GLOBAL_ROOM = RoomCatalog.GLOBAL.roomName();
    public static final int DEFAULT_MAX_SEND_THREADS = 256;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Member> arena = new HashMap<>();
    private final Map<String, Long> handles = new HashMap<>();
    private final Map<String, Set<Long>> rooms = new HashMap<>();
    private final Map<String, Set<Long>> users = new HashMap<>();
    private long nextHandle = 1;

    private final ObjectMapper mapper;
    private final Duration sendTimeout;
    private final ThreadPoolExecutor sendPool;

    public ConnectionRegistry(ObjectMapper mapper, int sendThreads, Duration sendTimeout) {
        this(mapper, sendThreads, Math.max(sendThreads, DEFAULT_MAX_SEND_THREADS), sendTimeout);
    }

    /**
     * @param sendThreads    workers kept alive while idle
     * @param maxSendThreads upper bound on concurrent sends, stalled ones included
     */
    public ConnectionRegistry(ObjectMapper mapper, int sendThreads, int maxSendThreads, Duration sendTimeout) {
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
        this.mapper = mapper;
        this.sendTimeout = sendTimeout;
        int core = Math.max(1, sendThreads);
        AtomicInteger seq = new AtomicInteger();
        this.sendPool = new ThreadPoolExecutor(core, Math.max(core, maxSendThreads),
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "ws-sender-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------- membership

    public boolean register(ClientConnection connection, String userId) {
        return register(connection, userId, LocalizedText.DEFAULT_LANGUAGE);
    }

    /**
     * Admits a connection and joins it to {@code global}.
     *
     * @return false if a connection with the same id is already registered
     */
    public boolean register(ClientConnection connection, String userId, String language) {
        String id = connection.id();
        String user = blankToNull(userId);
        String lang = LocalizedText.isSupported(language) ? language : LocalizedText.DEFAULT_LANGUAGE;
        lock.lock();
        try {
            if (handles.containsKey(id)) {
                log.warn("[REGISTER] connection={} already registered, ignored", id);
                return false;
            }
            long handle = nextHandle++;
            Member member = new Member(handle, connection, user, lang, Instant.now());
            arena.put(handle, member);
            handles.put(id, handle);
            if (user != null) {
                users.computeIfAbsent(user, k -> new LinkedHashSet<>()).add(handle);
            }
            addToRoom(member, GLOBAL_ROOM);
        } finally {
            lock.unlock();
        }
        log.info("[REGISTER] connection={} user={} lang={}", id, user, lang);
        return true;
    }

    /** @return true if membership changed; false if already a member or the connection is unknown */
    public boolean joinRoom(String connectionId, String room) {
        if (room == null || room.isBlank()) {
            return false;
        }
        boolean joined;
        lock.lock();
        try {
            Member member = memberOf(connectionId);
            joined = member != null && addToRoom(member, room);
        } finally {
            lock.unlock();
        }
        if (joined) {
            log.info("[JOIN] connection={} room={}", connectionId, room);
        }
        return joined;
    }

    /** @return true if membership changed */
    public boolean leaveRoom(String connectionId, String room) {
        boolean left;
        lock.lock();
        try {
            Member member = memberOf(connectionId);
            left = member != null && removeFromRoom(member, room);
        } finally {
            lock.unlock();
        }
        if (left) {
            log.info("[LEAVE] connection={} room={}", connectionId, room);
        }
        return left;
    }

    /**
     * Removes the connection from every room and from the user index. Idempotent.
     *
     * @return true if the connection was registered
     */
    public boolean unregister(String connectionId) {
        Member member;
        lock.lock();
        try {
            Long handle = handles.remove(connectionId);
            if (handle == null) {
                return false;
            }
            member = arena.remove(handle);
            for (String room : List.copyOf(member.rooms)) {
                removeFromRoom(member, room);
            }
            if (member.userId != null) {
                Set<Long> sessions = users.get(member.userId);
                if (sessions != null) {
                    sessions.remove(handle);
                    if (sessions.isEmpty()) {
                        users.remove(member.userId);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("[UNREGISTER] connection={} user={} connectedFor={}s",
                connectionId, member.userId, Duration.between(member.connectedAt, Instant.now()).toSeconds());
        return true;
    }

    public boolean isRegistered(String connectionId) {
        lock.lock();
        try {
            return handles.containsKey(connectionId);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> roomsOf(String connectionId) {
        lock.lock();
        try {
            Member member = memberOf(connectionId);
            return member == null ? Set.of() : Set.copyOf(member.rooms);
        } finally {
            lock.unlock();
        }
    }

    public int roomSize(String room) {
        lock.lock();
        try {
            Set<Long> members = rooms.get(room);
            return members == null ? 0 : members.size();
        } finally {
            lock.unlock();
        }
    }

    public int connectionCountOf(String userId) {
        lock.lock();
        try {
            Set<Long> sessions = users.get(userId);
            return sessions == null ? 0 : sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public RegistryStats stats() {
        lock.lock();
        try {
            List<RegistryStats.RoomStat> roomStats = new ArrayList<>(rooms.size());
            rooms.forEach((name, members) -> roomStats.add(new RegistryStats.RoomStat(name, members.size())));
            roomStats.sort(Comparator.comparing(RegistryStats.RoomStat::name));
            return new RegistryStats(arena.size(), rooms.size(), users.size(), roomStats);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- delivery

    public int broadcastToRoom(String room, RealtimeMessage message) {
        return broadcastToRoom(room, message, Set.of());
    }

    /**
     * Delivers to every member of {@code room} except connections of {@code excludeUserIds}.
     *
     * @return number of connections that accepted the frame
     */
    public int broadcastToRoom(String room, RealtimeMessage message, Collection<String> excludeUserIds) {
        List<Member> targets = new ArrayList<>();
        lock.lock();
        try {
            Set<Long> members = rooms.get(room);
            if (members != null) {
                for (Long handle : members) {
                    Member m = arena.get(handle);
                    if (m != null && (m.userId == null || excludeUserIds == null || !excludeUserIds.contains(m.userId))) {
                        targets.add(m);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        if (targets.isEmpty()) {
            log.debug("[BROADCAST] room={} type={} no members", room, message.type());
            return 0;
        }
        int delivered = deliver(targets, message);
        log.info("[BROADCAST] room={} type={} delivered={}/{}", room, message.type(), delivered, targets.size());
        return delivered;
    }

    /**
     * Delivers to every live connection of the user. A user without connections is a no-op.
     *
     * @return number of connections that accepted the frame
     */
    public int sendToUser(String userId, RealtimeMessage message) {
        if (userId == null) {
            return 0;
        }
        List<Member> targets = new ArrayList<>();
        lock.lock();
        try {
            Set<Long> sessions = users.get(userId);
            if (sessions != null) {
                for (Long handle : sessions) {
                    Member m = arena.get(handle);
                    if (m != null) {
                        targets.add(m);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        if (targets.isEmpty()) {
            log.debug("[UNICAST] user={} type={} no live connection", userId, message.type());
            return 0;
        }
        int delivered = deliver(targets, message);
        log.info("[UNICAST] user={} type={} delivered={}/{}", userId, message.type(), delivered, targets.size());
        return delivered;
    }

    public int sendToUsers(Collection<String> userIds, RealtimeMessage message) {
        int delivered = 0;
        for (String userId : new LinkedHashSet<>(userIds)) {
            delivered += sendToUser(userId, message);
        }
        return delivered;
    }

    /** Sends to a single connection, e.g. a reply to a client command. */
    public boolean sendToConnection(String connectionId, RealtimeMessage message) {
        Member target;
        lock.lock();
        try {
            target = memberOf(connectionId);
        } finally {
            lock.unlock();
        }
        return target != null && deliver(List.of(target), message) == 1;
    }

    private int deliver(List<Member> targets, RealtimeMessage message) {
        Map<String, String> frames = new HashMap<>();
        List<CompletableFuture<Void>> sends = new ArrayList<>(targets.size());
        for (Member member : targets) {
            String frame;
            try {
                frame = frames.computeIfAbsent(member.language, lang -> render(message, lang));
            } catch (UncheckedIOException | IllegalArgumentException e) {
                log.error("[RENDER] type={} could not be serialized", message.type(), e);
                return 0;
            }
            sends.add(send(member, frame));
        }

        int delivered = 0;
        for (int i = 0; i < targets.size(); i++) {
            Member member = targets.get(i);
            try {
                sends.get(i).join();
                delivered++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof UncheckedIOException) {
                    cause = cause.getCause();
                }
                if (cause instanceof RejectedExecutionException) {
                    log.warn("[SEND-SKIP] connection={} user={} no send worker free (busy={})",
                            member.connection.id(), member.userId, sendPool.getActiveCount());
                    continue;
                }
                if (cause instanceof TimeoutException) {
                    log.warn("[SEND-FAIL] connection={} user={} timed out after {}ms",
                            member.connection.id(), member.userId, sendTimeout.toMillis());
                } else {
                    log.warn("[SEND-FAIL] connection={} user={} {}", member.connection.id(), member.userId, String.valueOf(cause));
                }
                drop(member);
            }
        }
        return delivered;
    }

    private CompletableFuture<Void> send(Member member, String frame) {
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    member.connection.send(frame);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, sendPool).orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void drop(Member member) {
        if (unregister(member.connection.id())) {
            member.connection.close();
        }
    }

    private String render(RealtimeMessage message, String language) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("type", message.type());
        frame.set("payload", mapper.valueToTree(message.payload()));
        if (message.message() != null) {
            frame.set("message", mapper.valueToTree(message.message()));
            frame.put("text", message.message().in(language));
        }
        frame.put("timestamp", Instant.now().toString());
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ---------------------------------------------------------------- index helpers (lock held)

    private Member memberOf(String connectionId) {
        Long handle = handles.get(connectionId);
        return handle == null ? null : arena.get(handle);
    }

    private boolean addToRoom(Member member, String room) {
        if (!member.rooms.add(room)) {
            return false;
        }
        rooms.computeIfAbsent(room, k -> new LinkedHashSet<>()).add(member.handle);
        return true;
    }

    private boolean removeFromRoom(Member member, String room) {
        if (!member.rooms.remove(room)) {
            return false;
        }
        Set<Long> members = rooms.get(room);
        if (members != null) {
            members.remove(member.handle);
            if (members.isEmpty()) {
                rooms.remove(room);
            }
        }
        return true;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @Override
    public void close() {
        sendPool.shutdownNow();
    }

    private static final class Member {
        final long handle;
        final ClientConnection connection;
        final String userId;
        final String language;
        final Instant connectedAt;
        final Set<String> rooms = new LinkedHashSet<>();

        Member(long handle, ClientConnection connection, String userId, String language, Instant connectedAt) {
            this.handle = handle;
            this.connection = connection;
            this.userId = userId;
            this.language = language;
            this.connectedAt = connectedAt;
        }
    }
}
