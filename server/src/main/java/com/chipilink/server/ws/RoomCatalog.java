package com.chipilink.server.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed set of rooms known to the front end. Rooms that are not client-joinable can only be
 * entered through server-side calls (e.g. the auth layer granting {@code admin}).
 */
public enum RoomCatalog {
    GLOBAL("global", "All connected clients", true),
    ADMIN("admin", "Staff dashboard: orders, requests, wallet and activity feed", false),
    STORE("store", "Store catalog and order updates", true),
    RAPIDPIN("rapidpin", "Rapid Pin challenges, likes and comments", true),
    COMMUNITY("community", "Community posts and feed", true),
    PINPANCLUB("pinpanclub", "PinPanClub matches and rankings", true),
    WALLET("wallet", "Wallet operations (staff)", false),
    CRM("crm", "CRM conversations (staff)", false);

    private final String roomName;
    private final String description;
    private final boolean clientJoinable;

    RoomCatalog(String roomName, String description, boolean clientJoinable) {
        this.roomName = roomName;
        this.description = description;
        this.clientJoinable = clientJoinable;
    }

    public String roomName() {
        return roomName;
    }

    public String description() {
        return description;
    }

    public boolean clientJoinable() {
        return clientJoinable;
    }

    public static Optional<RoomCatalog> byName(String name) {
        return Arrays.stream(values()).filter(r -> r.roomName.equals(name)).findFirst();
    }

    public static boolean isClientJoinable(String name) {
        return byName(name).map(RoomCatalog::clientJoinable).orElse(false);
    }

    public static List<Entry> entries() {
        return Arrays.stream(values())
                .map(r -> new Entry(r.roomName, r.description, r.clientJoinable))
                .toList();
    }

    public record Entry(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("client_joinable") boolean clientJoinable) {
    }
}
