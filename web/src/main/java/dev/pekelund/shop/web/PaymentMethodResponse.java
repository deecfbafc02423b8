package dev.pekelund.shop.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.shop.payment.PaymentMethod;
import java.time.Instant;

public record PaymentMethodResponse(
    String id,
    String cardType,
    String last4,
    int expiryMonth,
    int expiryYear,
    String expiry,
    String holderName,
    @JsonProperty("isDefault") boolean isDefault,
    Instant createdAt,
    Instant updatedAt
) {

    public static PaymentMethodResponse from(PaymentMethod method) {
        return new PaymentMethodResponse(
            method.id(),
            method.cardType().storedValue(),
            method.last4(),
            method.expiryMonth(),
            method.expiryYear(),
            method.expiryLabel(),
            method.holderName(),
            method.isDefault(),
            method.createdAt(),
            method.updatedAt());
    }
}
