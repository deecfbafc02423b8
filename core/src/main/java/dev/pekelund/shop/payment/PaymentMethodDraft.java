package dev.pekelund.shop.payment;

public record PaymentMethodDraft(
    CardType cardType,
    String last4,
    Integer expiryMonth,
    Integer expiryYear,
    String holderName
) {
}
