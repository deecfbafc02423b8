package dev.pekelund.shop.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest(properties = {
    "storefront.security.fallback-users[0].username=alice",
    "storefront.security.fallback-users[0].password=alice-secret",
    "storefront.security.fallback-users[1].username=bob",
    "storefront.security.fallback-users[1].password=bob-secret"
})
@AutoConfigureMockMvc
class StorefrontApiIntegrationTests {

    private static final RequestPostProcessor ALICE = httpBasic("alice", "alice-secret");
    private static final RequestPostProcessor BOB = httpBasic("bob", "bob-secret");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void anonymousCallsAreUnauthorized() throws Exception {
        mockMvc.perform(get("/api/addresses"))
            .andExpect(status().isUnauthorized())
            .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void paymentMethodDefaultLifecycle() throws Exception {
        String first = addCard(ALICE, "4242", true);
        String second = addCard(ALICE, "1881", false);

        mockMvc.perform(put("/api/payment-methods/" + second + "/default").with(ALICE))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/payment-methods").with(ALICE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(second))
            .andExpect(jsonPath("$[0].isDefault").value(true))
            .andExpect(jsonPath("$[1].isDefault").value(false));

        mockMvc.perform(delete("/api/payment-methods/" + second).with(ALICE))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/payment-methods/default").with(ALICE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(first));

        mockMvc.perform(delete("/api/payment-methods/" + first).with(ALICE))
            .andExpect(status().isConflict());
        mockMvc.perform(get("/api/payment-methods").with(ALICE))
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void collectionsArePrivateToTheirOwner() throws Exception {
        String cardId = addCard(BOB, "0005", true);

        mockMvc.perform(get("/api/payment-methods").with(ALICE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + cardId + "')]").isEmpty());
        mockMvc.perform(put("/api/payment-methods/" + cardId + "/default").with(ALICE))
            .andExpect(status().isNotFound());
    }

    @Test
    void checkoutUsesDefaultAddress() throws Exception {
        String body = """
            {"label":"%s","street":"Storgatan 1","city":"Lund","region":"Skåne","postalCode":"222 22",
             "country":"SE","makeDefault":%s}
            """;
        String response = mockMvc.perform(post("/api/addresses").with(BOB)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.formatted("Home", "true")))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String homeId = objectMapper.readTree(response).get("id").asText();
        mockMvc.perform(post("/api/addresses").with(BOB)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.formatted("Work", "false")))
            .andExpect(status().isCreated());

        String selection = mockMvc.perform(get("/api/checkout/selection").with(BOB))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        JsonNode node = objectMapper.readTree(selection);
        assertThat(node.get("address").get("id").asText()).isEqualTo(homeId);
    }

    private String addCard(RequestPostProcessor user, String last4, boolean makeDefault) throws Exception {
        String response = mockMvc.perform(post("/api/payment-methods").with(user)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cardType\":\"visa\",\"last4\":\"" + last4
                    + "\",\"expiryMonth\":12,\"expiryYear\":2099,\"makeDefault\":" + makeDefault + "}"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asText();
    }
}
