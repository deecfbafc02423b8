package dev.pekelund.shop.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.store.StoredDocument;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PaymentMethodSchemaTest {

    private final PaymentMethodSchema schema =
        new PaymentMethodSchema(Clock.fixed(Instant.parse("2024-05-15T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void draftIsStoredWithStringExpiryAndLowercaseType() {
        Map<String, Object> fields = schema.toFields(
            new PaymentMethodDraft(CardType.MASTERCARD, "5454", 3, 2027, "  Ada Lovelace "));

        assertThat(fields)
            .containsEntry("cardType", "mastercard")
            .containsEntry("last4", "5454")
            .containsEntry("expiryMonth", "03")
            .containsEntry("expiryYear", "2027")
            .containsEntry("cardholderName", "Ada Lovelace");
        assertThat(schema.ownerField()).isEqualTo("userId");
    }

    @Test
    void holderNameIsOptional() {
        Map<String, Object> fields = schema.toFields(new PaymentMethodDraft(CardType.VISA, "4242", 12, 2030, " "));

        assertThat(fields).doesNotContainKey("cardholderName");
    }

    @Test
    void rejectsMalformedCards() {
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(null, "4242", 1, 2030, null)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(CardType.VISA, "424", 1, 2030, null)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(CardType.VISA, "42a2", 1, 2030, null)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(CardType.VISA, "4242", 13, 2030, null)))
            .isInstanceOf(ItemValidationException.class);
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(CardType.VISA, "4242", 1, 30, null)))
            .isInstanceOf(ItemValidationException.class);
    }

    @Test
    void expiryIsCheckedAgainstTheClock() {
        assertThatThrownBy(() -> schema.toFields(new PaymentMethodDraft(CardType.AMEX, "0005", 4, 2024, null)))
            .isInstanceOf(ItemValidationException.class)
            .hasMessageContaining("expired");

        assertThat(schema.toFields(new PaymentMethodDraft(CardType.AMEX, "0005", 5, 2024, null)))
            .containsEntry("expiryMonth", "05");
    }

    @Test
    void cardTypeAndLast4CannotBePatched() {
        assertThatThrownBy(() -> schema.validatePatch(Map.of("last4", "1111")))
            .isInstanceOf(ItemValidationException.class)
            .hasMessageContaining("cannot be changed");
        assertThatThrownBy(() -> schema.validatePatch(Map.of("cardType", "visa")))
            .isInstanceOf(ItemValidationException.class);
    }

    @Test
    void patchNormalizesExpiry() {
        assertThat(schema.validatePatch(Map.of("expiryMonth", 7, "expiryYear", "2031", "holderName", " Grace ")))
            .containsEntry("expiryMonth", "07")
            .containsEntry("expiryYear", "2031")
            .containsEntry("cardholderName", "Grace");
        assertThatThrownBy(() -> schema.validatePatch(Map.of("expiryMonth", 1, "expiryYear", 2024)))
            .isInstanceOf(ItemValidationException.class);
    }

    @Test
    void partialExpiryPatchIsCheckedAgainstStoredExpiry() {
        StoredDocument stored = new StoredDocument("c1", Map.of(
            "userId", "owner-1",
            "cardType", "visa",
            "last4", "4242",
            "expiryMonth", "12",
            "expiryYear", "2024"));

        assertThatThrownBy(() -> schema.validatePatch(stored, Map.of("expiryMonth", 1)))
            .isInstanceOf(ItemValidationException.class)
            .hasMessageContaining("expired");
        assertThat(schema.validatePatch(stored, Map.of("expiryMonth", 6)))
            .containsEntry("expiryMonth", "06");

        StoredDocument march = new StoredDocument("c2", Map.of("expiryMonth", "03", "expiryYear", "2026"));
        assertThatThrownBy(() -> schema.validatePatch(march, Map.of("expiryYear", 2024)))
            .isInstanceOf(ItemValidationException.class);
        assertThat(schema.validatePatch(march, Map.of("holderName", "Grace")))
            .containsOnlyKeys("cardholderName");
    }

    @Test
    void documentIsDecodedFromStoredStrings() {
        PaymentMethod card = schema.fromDocument(new StoredDocument("c1", Map.of(
            "userId", "owner-1",
            "cardType", "discover",
            "last4", "6011",
            "expiryMonth", "09",
            "expiryYear", "2029",
            "isDefault", true)));

        assertThat(card.cardType()).isEqualTo(CardType.DISCOVER);
        assertThat(card.ownerId()).isEqualTo("owner-1");
        assertThat(card.expiryMonth()).isEqualTo(9);
        assertThat(card.expiryLabel()).isEqualTo("09/29");
        assertThat(card.isDefault()).isTrue();
        assertThat(card.createdAt()).isNull();
    }

    @Test
    void unknownCardTypeMakesDocumentUnreadable() {
        assertThatThrownBy(() -> schema.fromDocument(new StoredDocument("c1", Map.of("cardType", "diners"))))
            .isInstanceOf(ItemValidationException.class);
    }
}
