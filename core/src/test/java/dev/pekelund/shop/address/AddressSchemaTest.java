package dev.pekelund.shop.address;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.shop.collection.ItemValidationException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AddressSchemaTest {

    private final AddressSchema schema = new AddressSchema();

    @Test
    void draftIsTrimmedAndStoredUnderDocumentFieldNames() {
        Map<String, Object> fields = schema.toFields(
            new AddressDraft(" Home ", "Storgatan 1 ", "Lund", "Skåne", "222 22", " SE", 55.7, 13.19));

        assertThat(fields)
            .containsEntry("name", "Home")
            .containsEntry("street", "Storgatan 1")
            .containsEntry("state", "Skåne")
            .containsEntry("zipCode", "222 22")
            .containsEntry("country", "SE")
            .containsEntry("latitude", 55.7)
            .containsEntry("longitude", 13.19);
    }

    @Test
    void requiredFieldsMustHaveText() {
        assertThatThrownBy(() -> schema.toFields(new AddressDraft("Home", " ", "Lund", "Skåne", "222 22", "SE")))
            .isInstanceOfSatisfying(ItemValidationException.class,
                ex -> assertThat(ex.getField()).isEqualTo("street"));
    }

    @Test
    void coordinatesMustComeInPairsWithinRange() {
        assertThatThrownBy(() -> schema.toFields(
            new AddressDraft("Home", "Storgatan 1", "Lund", "Skåne", "222 22", "SE", 55.7, null)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.toFields(
            new AddressDraft("Home", "Storgatan 1", "Lund", "Skåne", "222 22", "SE", 91.0, 13.0)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.validatePatch(Map.of("longitude", 200.0, "latitude", 10.0)))
            .isInstanceOf(ItemValidationException.class);
    }

    @Test
    void patchMapsFieldNamesAndAllowsClearingCoordinates() {
        Map<String, Object> patch = new HashMap<>();
        patch.put("region", " Halland ");
        patch.put("postalCode", "302 30");
        patch.put("latitude", null);
        patch.put("longitude", null);

        assertThat(schema.validatePatch(patch))
            .containsEntry("state", "Halland")
            .containsEntry("zipCode", "302 30")
            .containsEntry("latitude", null)
            .containsEntry("longitude", null);
    }

    @Test
    void patchRejectsUnknownFieldsAndBlankValues() {
        assertThatThrownBy(() -> schema.validatePatch(Map.of("zipCode", "222 22")))
            .isInstanceOf(ItemValidationException.class)
            .hasMessageContaining("Unknown address field");
        assertThatThrownBy(() -> schema.validatePatch(Map.of("city", "")))
            .isInstanceOf(ItemValidationException.class);
    }
}
