package com.example.giftgroupservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP round trip through security, controllers, services and the error handler.
 *
 * Scenario: Alice leads "Family Cabin"; Bob and Carol join with their own lists;
 * Carol reserves Bob's skis.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class GiftGroupApiTest {

    private static final long ALICE = 501L;
    private static final long BOB = 502L;
    private static final long CAROL = 503L;
    private static final long STRANGER = 599L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${jwt.secret}")
    private String jwtSecret;

    private long groupId;
    private long bobListId;
    private long skisId;

    @BeforeEach
    void setUp() throws Exception {
        register(ALICE, "alice");
        register(BOB, "bob");
        register(CAROL, "carol");

        long aliceList = idOf(perform(post("/api/lists"), ALICE, Map.of("name", "Alice wishes"), 201));
        groupId = idOf(perform(post("/api/groups"), ALICE,
                Map.of("name", "Family Cabin", "selectedListId", aliceList), 201));

        bobListId = idOf(perform(post("/api/lists"), BOB, Map.of("name", "Bob wishes"), 201));
        skisId = idOf(perform(post("/api/lists/" + bobListId + "/items"), BOB,
                Map.of("name", "Skis", "highPriority", true), 201));
        joinAndApprove(BOB, bobListId);

        long carolList = idOf(perform(post("/api/lists"), CAROL, Map.of("name", "Carol wishes"), 201));
        joinAndApprove(CAROL, carolList);
    }

    @Test
    void missingToken_isRejected() throws Exception {
        mockMvc.perform(get("/api/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTHENTICATION_REQUIRED"));
    }

    @Test
    void badToken_isRejected() throws Exception {
        mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID"));
    }

    @Test
    void unregisteredIdentity_cannotCreateLists() throws Exception {
        mockMvc.perform(authorized(post("/api/lists"), STRANGER, Map.of("name", "Nope")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("PROFILE_NOT_REGISTERED"));
    }

    @Test
    void profile_returnsRegisteredUser() throws Exception {
        mockMvc.perform(authorized(get("/api/users/me"), BOB, null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("bob"))
                .andExpect(jsonPath("$.email").value("bob@example.com"));
    }

    @Test
    void claim_thenOthersSeeItReserved() throws Exception {
        mockMvc.perform(authorized(post(claimPath()), CAROL, null))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome").value("APPLIED"));

        mockMvc.perform(authorized(get("/api/groups/" + groupId), ALICE, null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claimedItemIds", hasItem((int) skisId)))
                .andExpect(jsonPath("$.myClaimedItemIds", not(hasItem((int) skisId))));

        mockMvc.perform(authorized(get("/api/claims/mine"), CAROL, null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].itemName").value("Skis"))
                .andExpect(jsonPath("$[0].recipientId").value((int) BOB));
    }

    @Test
    void secondClaim_isConflict() throws Exception {
        mockMvc.perform(authorized(post(claimPath()), CAROL, null))
                .andExpect(status().isCreated());

        mockMvc.perform(authorized(post(claimPath()), ALICE, null))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ITEM_ALREADY_CLAIMED"));
    }

    @Test
    void claimingOwnItem_isForbidden() throws Exception {
        mockMvc.perform(authorized(post(claimPath()), BOB, null))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CANNOT_CLAIM_OWN_ITEM"));
    }

    @Test
    void leaderLeaving_isUnprocessable() throws Exception {
        mockMvc.perform(authorized(post("/api/groups/" + groupId + "/leave"), ALICE, null))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("LEADER_CANNOT_LEAVE"));
    }

    @Test
    void kick_removesMemberAndTheirClaims() throws Exception {
        mockMvc.perform(authorized(post(claimPath()), CAROL, null))
                .andExpect(status().isCreated());

        mockMvc.perform(authorized(delete("/api/groups/" + groupId + "/members/" + CAROL), ALICE, null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("APPLIED"))
                .andExpect(jsonPath("$.cascade.claims.length()").value(1));

        mockMvc.perform(authorized(get("/api/groups/" + groupId), CAROL, null))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_APPROVED_MEMBER"));
    }

    @Test
    void unknownGroup_isNotFound() throws Exception {
        mockMvc.perform(authorized(get("/api/groups/999999"), ALICE, null))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("GROUP_NOT_FOUND"));
    }

    @Test
    void blankListName_isValidationError() throws Exception {
        mockMvc.perform(authorized(post("/api/lists"), BOB, Map.of("name", " ")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errors.name").exists());
    }

    @Test
    void malformedBody_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/lists")
                        .header(HttpHeaders.AUTHORIZATION, bearer(BOB))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    private String claimPath() {
        return "/api/groups/" + groupId + "/items/" + skisId + "/claim";
    }

    private void register(long userId, String username) throws Exception {
        perform(post("/api/users/me"), userId,
                Map.of("username", username, "email", username + "@example.com"), 201);
    }

    private void joinAndApprove(long userId, long listId) throws Exception {
        mockMvc.perform(authorized(post("/api/groups/join"), userId,
                        Map.of("groupIdentifier", String.valueOf(groupId), "selectedListId", listId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PENDING_REQUEST"));

        mockMvc.perform(authorized(post("/api/groups/" + groupId + "/members/" + userId + "/approve"), ALICE, null))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("APPROVED"));
    }

    private MvcResult perform(MockHttpServletRequestBuilder request, long userId, Object body,
                              int expectedStatus) throws Exception {
        return mockMvc.perform(authorized(request, userId, body))
                .andExpect(status().is(expectedStatus))
                .andReturn();
    }

    private MockHttpServletRequestBuilder authorized(MockHttpServletRequestBuilder request, long userId,
                                                     Object body) throws Exception {
        request.header(HttpHeaders.AUTHORIZATION, bearer(userId));
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
        }
        return request;
    }

    private long idOf(MvcResult result) throws Exception {
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("id").asLong();
    }

    private String bearer(long userId) {
        Instant now = Instant.now();
        String token = Jwts.builder()
                .subject(String.valueOf(userId))
                .claim("userId", userId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(1, ChronoUnit.HOURS)))
                .signWith(Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8)))
                .compact();
        return "Bearer " + token;
    }
}
