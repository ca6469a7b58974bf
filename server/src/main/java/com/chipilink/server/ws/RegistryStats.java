package com.chipilink.server.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot returned by {@link ConnectionRegistry#stats()}.
 */
public record RegistryStats(
        @JsonProperty("total_connections") int totalConnections,
        @JsonProperty("total_rooms") int totalRooms,
        @JsonProperty("total_users") int totalUsers,
        @JsonProperty("rooms") List<RoomStat> rooms) {

    public RegistryStats {
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
    }

    public record RoomStat(
            @JsonProperty("name") String name,
            @JsonProperty("member_count") int memberCount) {
    }
}
