package dev.pekelund.shop.batch;

import dev.pekelund.shop.store.CollectionPath;
import dev.pekelund.shop.store.DocumentStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Commits a {@link WriteBatchPlan} as a single all-or-nothing unit.
 *
 * <p>There is no retry and no isolation between separate commits: two plans computed from the same read
 * by different processes may both land. Callers own both concerns.
 */
@Component
public class TransactionalBatchWriter {

    /**
     * Upper bound on writes per commit, matching the Firestore batch limit.
     */
    public static final int MAX_WRITES_PER_BATCH = 500;

    private static final Logger log = LoggerFactory.getLogger(TransactionalBatchWriter.class);

    private final DocumentStore documentStore;

    public TransactionalBatchWriter(DocumentStore documentStore) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
    }

    /**
     * @return the number of writes committed
     */
    public int commit(CollectionPath path, WriteBatchPlan plan) {
        Objects.requireNonNull(path, "path");
        if (plan == null || plan.isEmpty()) {
            log.debug("Nothing to commit for {}", path);
            return 0;
        }
        if (plan.size() > MAX_WRITES_PER_BATCH) {
            throw new IllegalArgumentException("A batch holds at most " + MAX_WRITES_PER_BATCH
                + " writes but " + plan.size() + " were planned for " + path);
        }

        long started = System.nanoTime();
        documentStore.batchUpdate(path, plan.writes());
        if (log.isDebugEnabled()) {
            log.debug("Committed {} writes to {} in {} ms", plan.size(), path,
                (System.nanoTime() - started) / 1_000_000);
        }
        return plan.size();
    }
}
