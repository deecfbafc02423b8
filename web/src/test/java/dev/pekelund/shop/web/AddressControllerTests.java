package dev.pekelund.shop.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.shop.address.Address;
import dev.pekelund.shop.address.AddressDraft;
import dev.pekelund.shop.address.AddressService;
import dev.pekelund.shop.auth.NotAuthenticatedException;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.ItemNotFoundException;
import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.store.DocumentStoreException;
import dev.pekelund.shop.subscription.Subscription;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AddressControllerTests {

    private MockMvc mockMvc;

    @Mock
    private AddressService addressService;

    @Mock
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AddressController(addressService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void listsAddressesWithDefaultFlag() throws Exception {
        when(addressService.getMyAddresses()).thenReturn(List.of(address("a1", true), address("a2", false)));

        mockMvc.perform(get("/api/addresses"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("a1"))
            .andExpect(jsonPath("$[0].isDefault").value(true))
            .andExpect(jsonPath("$[0].postalCode").value("222 22"))
            .andExpect(jsonPath("$[1].isDefault").value(false));
    }

    @Test
    void createsAddressAndReturnsItsId() throws Exception {
        when(addressService.addAddress(any(AddressDraft.class), eq(true))).thenReturn("new-id");

        mockMvc.perform(post("/api/addresses")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"label":"Home","street":"Storgatan 1","city":"Lund","region":"Skåne",
                     "postalCode":"222 22","country":"SE","makeDefault":true}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("new-id"));
    }

    @Test
    void rejectsIncompleteAddress() throws Exception {
        mockMvc.perform(post("/api/addresses")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"label\":\"Home\",\"city\":\"Lund\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.path").value("/api/addresses"));
    }

    @Test
    void patchPassesOnlyTheSuppliedFields() throws Exception {
        mockMvc.perform(patch("/api/addresses/a1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"city\":\"Malmö\",\"isDefault\":true}"))
            .andExpect(status().isNoContent());

        verify(addressService).updateAddress("a1", Map.of("city", "Malmö", "isDefault", true));
    }

    @Test
    void invalidPatchIsBadRequest() throws Exception {
        doThrow(new ItemValidationException("zipCode", "Unknown address field 'zipCode'"))
            .when(addressService).updateAddress(eq("a1"), any());

        mockMvc.perform(patch("/api/addresses/a1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"zipCode\":\"222 22\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown address field 'zipCode'"));
    }

    @Test
    void setDefaultOnMissingAddressIsNotFound() throws Exception {
        doThrow(new ItemNotFoundException(CollectionKind.ADDRESSES, "nope"))
            .when(addressService).setDefaultAddress("nope");

        mockMvc.perform(put("/api/addresses/nope/default"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"))
            .andExpect(jsonPath("$.message").value("Address not found: nope"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/addresses/a1"))
            .andExpect(status().isNoContent());

        verify(addressService).deleteAddress("a1");
    }

    @Test
    void missingPrincipalIsUnauthorized() throws Exception {
        when(addressService.getMyAddresses()).thenThrow(new NotAuthenticatedException());

        mockMvc.perform(get("/api/addresses"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void storeFailureIsServiceUnavailable() throws Exception {
        when(addressService.getMyAddresses()).thenThrow(new DocumentStoreException("Failed to load"));

        mockMvc.perform(get("/api/addresses"))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void streamSendsSnapshotEvents() throws Exception {
        when(addressService.subscribeMyAddresses(any(), any())).thenAnswer(invocation -> {
            Consumer<List<Address>> onSnapshot = invocation.getArgument(0);
            onSnapshot.accept(List.of(address("a1", true)));
            return subscription;
        });

        MvcResult result = mockMvc.perform(get("/api/addresses/stream"))
            .andExpect(request().asyncStarted())
            .andReturn();

        assertThat(result.getResponse().getContentAsString())
            .contains("event:snapshot")
            .contains("\"id\":\"a1\"");
    }

    @Test
    void streamEndsWithErrorEventWhenListenerFails() throws Exception {
        when(addressService.subscribeMyAddresses(any(), any())).thenAnswer(invocation -> {
            Consumer<Throwable> onError = invocation.getArgument(1);
            onError.accept(new IllegalStateException("listener failed"));
            return subscription;
        });

        MvcResult result = mockMvc.perform(get("/api/addresses/stream"))
            .andExpect(request().asyncStarted())
            .andReturn();

        assertThat(result.getResponse().getContentAsString())
            .contains("event:error")
            .contains("listener failed");
        verify(subscription).unsubscribe();
    }

    private static Address address(String id, boolean isDefault) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        return new Address(id, "owner-1", "Home", "Storgatan 1", "Lund", "Skåne", "222 22", "SE", isDefault,
            null, null, now, now);
    }
}
