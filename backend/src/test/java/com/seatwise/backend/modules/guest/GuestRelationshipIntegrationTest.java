package com.seatwise.backend.modules.guest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seatwise.backend.support.AbstractPostgresIntegrationTest;
import com.seatwise.backend.support.SeatingFixtures;
import com.seatwise.backend.support.TestTokens;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class GuestRelationshipIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private SeatingFixtures fixtures;
    private String adminToken;
    private UUID clientId;
    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        fixtures = new SeatingFixtures(jdbcTemplate);
        UUID companyId = UUID.randomUUID();
        clientId = fixtures.client(companyId, "Choi Wedding");
        alice = fixtures.guest(clientId, "Alice", "Kim");
        bob = fixtures.guest(clientId, "Bob", "Lee");
        adminToken = TestTokens.bearer(TestTokens.admin(companyId));
    }

    @Test
    void addingSamePairTwiceUpdatesInPlaceAndReactivates() throws Exception {
        String firstId = addConflict(alice, bob, "LOW", "old grudge");

        mockMvc.perform(delete("/clients/{clientId}/guest-conflicts/{id}", clientId, firstId)
                        .header("Authorization", adminToken))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/clients/{clientId}/guest-conflicts", clientId).header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        String secondId = addConflict(bob, alice, "CRITICAL", "new grudge");

        assertThat(secondId).isEqualTo(firstId);
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM guest_conflict WHERE client_id = ?", Integer.class, clientId);
        assertThat(rows).isEqualTo(1);

        mockMvc.perform(get("/clients/{clientId}/guest-conflicts", clientId).header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].severity").value("CRITICAL"))
                .andExpect(jsonPath("$[0].reason").value("new grudge"))
                .andExpect(jsonPath("$[0].active").value(true));
    }

    @Test
    void preferenceDefaultsApply() throws Exception {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("guestOneId", alice.toString());
        body.put("guestTwoId", bob.toString());

        mockMvc.perform(post("/clients/{clientId}/guest-preferences", clientId)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body.toString()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.preferenceType").value("TOGETHER"))
                .andExpect(jsonPath("$.strength").value("PREFERRED"));
    }

    @Test
    void selfPairAndForeignGuestAreRejected() throws Exception {
        ObjectNode self = objectMapper.createObjectNode();
        self.put("guestOneId", alice.toString());
        self.put("guestTwoId", alice.toString());
        mockMvc.perform(post("/clients/{clientId}/guest-conflicts", clientId)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(self.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SELF_RELATIONSHIP"));

        UUID otherClient = fixtures.client(UUID.randomUUID(), "Someone else");
        UUID stranger = fixtures.guest(otherClient, "Eve", "Park");
        ObjectNode foreign = objectMapper.createObjectNode();
        foreign.put("guestOneId", alice.toString());
        foreign.put("guestTwoId", stranger.toString());
        mockMvc.perform(post("/clients/{clientId}/guest-conflicts", clientId)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(foreign.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GUEST_NOT_FOUND"));
    }

    @Test
    void otherCompanyCannotReadRelationships() throws Exception {
        String outsider = TestTokens.bearer(TestTokens.admin(UUID.randomUUID()));

        mockMvc.perform(get("/clients/{clientId}/guest-conflicts", clientId).header("Authorization", outsider))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CLIENT_ACCESS_DENIED"));
    }

    private String addConflict(UUID one, UUID two, String severity, String reason) throws Exception {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("guestOneId", one.toString());
        body.put("guestTwoId", two.toString());
        body.put("severity", severity);
        body.put("reason", reason);
        String response = mockMvc.perform(post("/clients/{clientId}/guest-conflicts", clientId)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body.toString()))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(response).path("id").asText();
    }
}
