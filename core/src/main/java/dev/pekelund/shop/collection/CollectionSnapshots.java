package dev.pekelund.shop.collection;

import dev.pekelund.shop.store.StoredDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw store documents into the ordered item list observers see.
 */
public final class CollectionSnapshots {

    private static final Logger log = LoggerFactory.getLogger(CollectionSnapshots.class);

    private CollectionSnapshots() {
    }

    /**
     * Decodes and orders documents, skipping any that cannot be read as an item.
     */
    public static <T extends CollectionItem> List<T> decode(CollectionSchema<T, ?> schema,
                                                            List<StoredDocument> documents) {
        List<T> items = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            try {
                items.add(schema.fromDocument(document));
            } catch (ItemValidationException ex) {
                log.warn("Skipping unreadable {} document {}: {}", schema.kind().label(), document.id(),
                    ex.getMessage());
            }
        }
        items.sort(schema.kind().order());
        return Collections.unmodifiableList(items);
    }
}
