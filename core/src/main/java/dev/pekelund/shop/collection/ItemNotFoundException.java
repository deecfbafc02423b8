package dev.pekelund.shop.collection;

public class ItemNotFoundException extends CollectionException {

    private final CollectionKind kind;
    private final String itemId;

    public ItemNotFoundException(CollectionKind kind, String itemId) {
        super(capitalize(kind.label()) + " not found: " + itemId);
        this.kind = kind;
        this.itemId = itemId;
    }

    public CollectionKind getKind() {
        return kind;
    }

    public String getItemId() {
        return itemId;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
