package dev.pekelund.shop.address;

import dev.pekelund.shop.collection.CollectionItem;
import java.time.Instant;

public record Address(
    String id,
    String ownerId,
    String label,
    String street,
    String city,
    String region,
    String postalCode,
    String country,
    boolean isDefault,
    Double latitude,
    Double longitude,
    Instant createdAt,
    Instant updatedAt
) implements CollectionItem {

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public Address withDefault(boolean makeDefault) {
        return new Address(id, ownerId, label, street, city, region, postalCode, country, makeDefault,
            latitude, longitude, createdAt, updatedAt);
    }
}
