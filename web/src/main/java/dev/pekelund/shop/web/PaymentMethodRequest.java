package dev.pekelund.shop.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * A new saved card. Full card numbers are never accepted; only the last four digits.
 */
public record PaymentMethodRequest(
    @NotBlank String cardType,
    @NotNull @Pattern(regexp = "\\d{4}", message = "must be exactly four digits") String last4,
    @NotNull @Min(1) @Max(12) Integer expiryMonth,
    @NotNull @Min(1000) @Max(9999) Integer expiryYear,
    String holderName,
    boolean makeDefault
) {
}
