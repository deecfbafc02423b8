package dev.pekelund.shop.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.shop.address.Address;
import java.time.Instant;

public record AddressResponse(
    String id,
    String label,
    String street,
    String city,
    String region,
    String postalCode,
    String country,
    @JsonProperty("isDefault") boolean isDefault,
    Double latitude,
    Double longitude,
    Instant createdAt,
    Instant updatedAt
) {

    public static AddressResponse from(Address address) {
        return new AddressResponse(
            address.id(),
            address.label(),
            address.street(),
            address.city(),
            address.region(),
            address.postalCode(),
            address.country(),
            address.isDefault(),
            address.latitude(),
            address.longitude(),
            address.createdAt(),
            address.updatedAt());
    }
}
