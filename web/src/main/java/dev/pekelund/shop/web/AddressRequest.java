package dev.pekelund.shop.web;

import dev.pekelund.shop.address.AddressDraft;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public record AddressRequest(
    @NotBlank String label,
    @NotBlank String street,
    @NotBlank String city,
    @NotBlank String region,
    @NotBlank String postalCode,
    @NotBlank String country,
    @DecimalMin("-90") @DecimalMax("90") Double latitude,
    @DecimalMin("-180") @DecimalMax("180") Double longitude,
    boolean makeDefault
) {

    public AddressDraft toDraft() {
        return new AddressDraft(label, street, city, region, postalCode, country, latitude, longitude);
    }
}
