package dev.pekelund.shop.web;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.shop.address.Address;
import dev.pekelund.shop.checkout.CheckoutSelection;
import dev.pekelund.shop.checkout.CheckoutSelectionService;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CheckoutControllerTests {

    private MockMvc mockMvc;

    @Mock
    private CheckoutSelectionService checkoutSelectionService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CheckoutController(checkoutSelectionService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void reportsIncompleteSelectionWithoutCard() throws Exception {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        Address address = new Address("a1", "owner-1", "Home", "Storgatan 1", "Lund", "Skåne", "222 22", "SE", true,
            null, null, now, now);
        when(checkoutSelectionService.currentSelection()).thenReturn(new CheckoutSelection(address, null));

        mockMvc.perform(get("/api/checkout/selection"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.address.id").value("a1"))
            .andExpect(jsonPath("$.paymentMethod").doesNotExist())
            .andExpect(jsonPath("$.complete").value(false));
    }
}
