package dev.pekelund.shop.payment;

import dev.pekelund.shop.collection.CollectionItem;
import java.time.Instant;
import java.time.YearMonth;

/**
 * A saved card. Only the last four digits are ever stored.
 */
public record PaymentMethod(
    String id,
    String ownerId,
    CardType cardType,
    String last4,
    int expiryMonth,
    int expiryYear,
    String holderName,
    boolean isDefault,
    Instant createdAt,
    Instant updatedAt
) implements CollectionItem {

    public YearMonth expiry() {
        return YearMonth.of(expiryYear, expiryMonth);
    }

    /**
     * @return the card's expiry formatted as {@code MM/YY}
     */
    public String expiryLabel() {
        return String.format("%02d/%02d", expiryMonth, expiryYear % 100);
    }

    public boolean isExpired(YearMonth current) {
        return expiry().isBefore(current);
    }

    public PaymentMethod withDefault(boolean makeDefault) {
        return new PaymentMethod(id, ownerId, cardType, last4, expiryMonth, expiryYear, holderName, makeDefault,
            createdAt, updatedAt);
    }
}
