package com.chipilink.server.http;

import com.chipilink.server.ws.ConnectionRegistry;
import com.chipilink.server.ws.FakeConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InternalControllerTest {

    private static final String AUTH = "Bearer test-token";

    private final ObjectMapper mapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(mapper, 2, Duration.ofSeconds(1));
        mockMvc = MockMvcBuilders.standaloneSetup(new InternalController(registry, "test-token")).build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void broadcastWithoutValidTokenIsRejected() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"notice\",\"room\":\"global\"}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"notice\",\"room\":\"global\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void broadcastToRoomSkipsExcludedUsers() throws Exception {
        FakeConnection a = new FakeConnection("a");
        FakeConnection b = new FakeConnection("b");
        registry.register(a, "u1", "en");
        registry.register(b, "u2", "en");

        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"maintenance","room":"global","exclude_user_ids":["u2"],
                                 "payload":{"minutes":5},
                                 "message":{"es":"Mantenimiento","en":"Maintenance","zh":"维护"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(1));

        assertThat(a.frames()).hasSize(1);
        assertThat(a.last().get("type").asText()).isEqualTo("maintenance");
        assertThat(a.last().get("text").asText()).isEqualTo("Maintenance");
        assertThat(a.last().get("payload").get("minutes").asInt()).isEqualTo(5);
        assertThat(b.frames()).isEmpty();
    }

    @Test
    void broadcastToUserReachesAllSessions() throws Exception {
        registry.register(new FakeConnection("a"), "u1");
        registry.register(new FakeConnection("b"), "u1");

        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"notice\",\"user_id\":\"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(2));
    }

    @Test
    void broadcastNeedsExactlyOneTarget() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"notice\",\"room\":\"global\",\"user_id\":\"u1\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"notice\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/internal/broadcast")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room\":\"global\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void staffRoomMembershipIsGrantedServerSide() throws Exception {
        registry.register(new FakeConnection("c1"), "staff-1");

        mockMvc.perform(post("/internal/connections/c1/rooms/admin").header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
        assertThat(registry.roomsOf("c1")).contains("admin");

        mockMvc.perform(post("/internal/connections/c1/rooms/admin").header("Authorization", AUTH))
                .andExpect(jsonPath("$.changed").value(false));

        mockMvc.perform(delete("/internal/connections/c1/rooms/admin").header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
        assertThat(registry.roomsOf("c1")).containsExactly("global");
    }

    @Test
    void membershipForUnknownConnectionIsNotFound() throws Exception {
        mockMvc.perform(post("/internal/connections/ghost/rooms/admin").header("Authorization", AUTH))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/internal/connections/ghost/rooms/admin"))
                .andExpect(status().isUnauthorized());
    }
}
