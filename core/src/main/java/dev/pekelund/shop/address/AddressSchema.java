package dev.pekelund.shop.address;

import dev.pekelund.shop.collection.CollectionFields;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.CollectionSchema;
import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.store.StoredDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Maps addresses to {@code users/{owner}/addresses} documents. Patch keys use the {@link Address} component
 * names; a few are stored under different field names.
 */
public class AddressSchema implements CollectionSchema<Address, AddressDraft> {

    static final String NAME = "name";
    static final String STREET = "street";
    static final String CITY = "city";
    static final String STATE = "state";
    static final String ZIP_CODE = "zipCode";
    static final String COUNTRY = "country";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final String OWNER_ID = "ownerId";

    private static final Map<String, String> TEXT_FIELDS = Map.of(
        "label", NAME,
        "street", STREET,
        "city", CITY,
        "region", STATE,
        "postalCode", ZIP_CODE,
        "country", COUNTRY);

    @Override
    public CollectionKind kind() {
        return CollectionKind.ADDRESSES;
    }

    @Override
    public Map<String, Object> toFields(AddressDraft draft) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(NAME, requireText("label", draft.label()));
        fields.put(STREET, requireText("street", draft.street()));
        fields.put(CITY, requireText("city", draft.city()));
        fields.put(STATE, requireText("region", draft.region()));
        fields.put(ZIP_CODE, requireText("postalCode", draft.postalCode()));
        fields.put(COUNTRY, requireText("country", draft.country()));
        validateCoordinates(draft.latitude(), draft.longitude());
        fields.put(LATITUDE, draft.latitude());
        fields.put(LONGITUDE, draft.longitude());
        return fields;
    }

    @Override
    public Map<String, Object> validatePatch(Map<String, Object> patch) {
        Map<String, Object> fields = new LinkedHashMap<>();
        boolean hasLatitude = patch.containsKey("latitude");
        boolean hasLongitude = patch.containsKey("longitude");
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            String key = entry.getKey();
            String storedName = TEXT_FIELDS.get(key);
            if (storedName != null) {
                if (!(entry.getValue() instanceof String || entry.getValue() == null)) {
                    throw new ItemValidationException(key, "Field '" + key + "' must be text");
                }
                fields.put(storedName, requireText(key, (String) entry.getValue()));
            } else if (!LATITUDE.equals(key) && !LONGITUDE.equals(key)) {
                throw new ItemValidationException(key, "Unknown address field '" + key + "'");
            }
        }
        if (hasLatitude || hasLongitude) {
            if (hasLatitude != hasLongitude) {
                throw new ItemValidationException("latitude", "Latitude and longitude must be updated together");
            }
            Double latitude = toCoordinate("latitude", patch.get("latitude"));
            Double longitude = toCoordinate("longitude", patch.get("longitude"));
            validateCoordinates(latitude, longitude);
            fields.put(LATITUDE, latitude);
            fields.put(LONGITUDE, longitude);
        }
        return fields;
    }

    @Override
    public Address fromDocument(StoredDocument document) {
        String street = document.getString(STREET);
        String city = document.getString(CITY);
        if (!StringUtils.hasText(street) || !StringUtils.hasText(city)) {
            throw new ItemValidationException("Address document " + document.id() + " has no street or city");
        }
        return new Address(
            document.id(),
            document.getString(OWNER_ID),
            document.getString(NAME),
            street,
            city,
            document.getString(STATE),
            document.getString(ZIP_CODE),
            document.getString(COUNTRY),
            document.getBoolean(CollectionFields.IS_DEFAULT),
            document.getDouble(LATITUDE),
            document.getDouble(LONGITUDE),
            document.getInstant(CollectionFields.CREATED_AT),
            document.getInstant(CollectionFields.UPDATED_AT));
    }

    private static String requireText(String field, String value) {
        if (!StringUtils.hasText(value)) {
            throw new ItemValidationException(field, "Field '" + field + "' is required");
        }
        return value.trim();
    }

    private static Double toCoordinate(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ItemValidationException(field, "Field '" + field + "' must be a number");
    }

    private static void validateCoordinates(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return;
        }
        if (latitude == null || longitude == null) {
            throw new ItemValidationException("latitude", "Latitude and longitude must be given together");
        }
        if (latitude.isNaN() || latitude < -90 || latitude > 90) {
            throw new ItemValidationException("latitude", "Latitude must be between -90 and 90");
        }
        if (longitude.isNaN() || longitude < -180 || longitude > 180) {
            throw new ItemValidationException("longitude", "Longitude must be between -180 and 180");
        }
    }
}
