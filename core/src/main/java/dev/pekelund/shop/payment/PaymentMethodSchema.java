package dev.pekelund.shop.payment;

import dev.pekelund.shop.collection.CollectionFields;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.CollectionSchema;
import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.store.StoredDocument;
import java.time.Clock;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Maps saved cards to {@code users/{owner}/paymentMethods} documents. The expiry is stored as a two digit
 * month and a four digit year, both as strings; the owner lives in {@code userId}.
 */
public class PaymentMethodSchema implements CollectionSchema<PaymentMethod, PaymentMethodDraft> {

    static final String USER_ID = "userId";
    static final String CARD_TYPE = "cardType";
    static final String LAST4 = "last4";
    static final String EXPIRY_MONTH = "expiryMonth";
    static final String EXPIRY_YEAR = "expiryYear";
    static final String CARDHOLDER_NAME = "cardholderName";

    private static final Pattern LAST4_PATTERN = Pattern.compile("\\d{4}");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,4}");

    private final Clock clock;

    public PaymentMethodSchema(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CollectionKind kind() {
        return CollectionKind.PAYMENT_METHODS;
    }

    @Override
    public String ownerField() {
        return USER_ID;
    }

    @Override
    public Map<String, Object> toFields(PaymentMethodDraft draft) {
        if (draft.cardType() == null) {
            throw new ItemValidationException(CARD_TYPE, "A card type is required");
        }
        String last4 = draft.last4() != null ? draft.last4().trim() : null;
        if (last4 == null || !LAST4_PATTERN.matcher(last4).matches()) {
            throw new ItemValidationException(LAST4, "The last four digits must be exactly four digits");
        }
        int month = requireMonth(draft.expiryMonth());
        int year = requireYear(draft.expiryYear());
        requireNotExpired(month, year);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CARD_TYPE, draft.cardType().storedValue());
        fields.put(LAST4, last4);
        fields.put(EXPIRY_MONTH, formatMonth(month));
        fields.put(EXPIRY_YEAR, String.valueOf(year));
        String holderName = trimToNull(draft.holderName());
        if (holderName != null) {
            fields.put(CARDHOLDER_NAME, holderName);
        }
        return fields;
    }

    @Override
    public Map<String, Object> validatePatch(Map<String, Object> patch) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Integer month = null;
        Integer year = null;
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            String key = entry.getKey();
            switch (key) {
                case CARD_TYPE, LAST4 -> throw new ItemValidationException(key,
                    "Field '" + key + "' cannot be changed once the card is saved");
                case EXPIRY_MONTH -> month = requireMonth(toInteger(key, entry.getValue()));
                case EXPIRY_YEAR -> year = requireYear(toInteger(key, entry.getValue()));
                case "holderName" -> {
                    if (!(entry.getValue() instanceof String || entry.getValue() == null)) {
                        throw new ItemValidationException(key, "Field 'holderName' must be text");
                    }
                    fields.put(CARDHOLDER_NAME, trimToNull((String) entry.getValue()));
                }
                default -> throw new ItemValidationException(key, "Unknown payment method field '" + key + "'");
            }
        }
        if (month != null && year != null) {
            requireNotExpired(month, year);
        } else if (year != null && year < YearMonth.now(clock).getYear()) {
            throw new ItemValidationException(EXPIRY_YEAR, "The card has expired");
        }
        if (month != null) {
            fields.put(EXPIRY_MONTH, formatMonth(month));
        }
        if (year != null) {
            fields.put(EXPIRY_YEAR, String.valueOf(year));
        }
        return fields;
    }

    /**
     * Also rejects a patch that, merged with the stored expiry, leaves the card expired.
     */
    @Override
    public Map<String, Object> validatePatch(StoredDocument current, Map<String, Object> patch) {
        Map<String, Object> fields = validatePatch(patch);
        boolean monthChanged = fields.containsKey(EXPIRY_MONTH);
        boolean yearChanged = fields.containsKey(EXPIRY_YEAR);
        if (monthChanged != yearChanged) {
            int month = monthChanged
                ? Integer.parseInt((String) fields.get(EXPIRY_MONTH))
                : parseStored(current, EXPIRY_MONTH);
            int year = yearChanged
                ? Integer.parseInt((String) fields.get(EXPIRY_YEAR))
                : parseStored(current, EXPIRY_YEAR);
            requireNotExpired(month, year);
        }
        return fields;
    }

    @Override
    public PaymentMethod fromDocument(StoredDocument document) {
        CardType cardType;
        try {
            cardType = CardType.fromValue(document.getString(CARD_TYPE));
        } catch (IllegalArgumentException ex) {
            throw new ItemValidationException(CARD_TYPE, ex.getMessage());
        }
        return new PaymentMethod(
            document.id(),
            document.getString(USER_ID),
            cardType,
            document.getString(LAST4),
            parseStored(document, EXPIRY_MONTH),
            parseStored(document, EXPIRY_YEAR),
            document.getString(CARDHOLDER_NAME),
            document.getBoolean(CollectionFields.IS_DEFAULT),
            document.getInstant(CollectionFields.CREATED_AT),
            document.getInstant(CollectionFields.UPDATED_AT));
    }

    private void requireNotExpired(int month, int year) {
        if (YearMonth.of(year, month).isBefore(YearMonth.now(clock))) {
            throw new ItemValidationException(EXPIRY_YEAR, "The card has expired");
        }
    }

    private static int requireMonth(Integer month) {
        if (month == null || month < 1 || month > 12) {
            throw new ItemValidationException(EXPIRY_MONTH, "The expiry month must be between 1 and 12");
        }
        return month;
    }

    private static int requireYear(Integer year) {
        if (year == null || year < 1000 || year > 9999) {
            throw new ItemValidationException(EXPIRY_YEAR, "The expiry year must have four digits");
        }
        return year;
    }

    private static Integer toInteger(String field, Object value) {
        if (value instanceof Integer integer) {
            return integer;
        }
        if (value instanceof Number number && number.doubleValue() == number.intValue()) {
            return number.intValue();
        }
        if (value instanceof String text && DIGITS.matcher(text.trim()).matches()) {
            return Integer.valueOf(text.trim());
        }
        throw new ItemValidationException(field, "Field '" + field + "' must be a whole number");
    }

    private static int parseStored(StoredDocument document, String field) {
        Object value = document.get(field);
        try {
            return toInteger(field, value);
        } catch (ItemValidationException ex) {
            throw new ItemValidationException(field, "Payment method document " + document.id()
                + " has an unreadable " + field);
        }
    }

    private static String formatMonth(int month) {
        return String.format("%02d", month);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
