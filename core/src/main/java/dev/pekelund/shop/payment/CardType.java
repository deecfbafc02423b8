package dev.pekelund.shop.payment;

import java.util.Locale;

public enum CardType {
    VISA,
    MASTERCARD,
    AMEX,
    DISCOVER;

    public String storedValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for blank or unsupported values
     */
    public static CardType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("A card type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CardType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported card type: " + value);
    }
}
