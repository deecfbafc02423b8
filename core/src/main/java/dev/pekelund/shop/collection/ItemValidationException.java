package dev.pekelund.shop.collection;

public class ItemValidationException extends CollectionException {

    private final String field;

    public ItemValidationException(String message) {
        this(null, message);
    }

    public ItemValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return the offending field, or {@code null} when the problem is not tied to one field
     */
    public String getField() {
        return field;
    }
}
