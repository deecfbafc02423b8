package dev.pekelund.shop.optimistic;

import dev.pekelund.shop.collection.CollectionItem;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side view of a collection that applies predicted edits before the store confirms them.
 *
 * <p>A failed mutation is not rolled back. The predicted state stays until the next snapshot replaces
 * it, since snapshots are always authoritative.
 *
 * @param <T> item type
 */
public class OptimisticMutationQueue<T extends CollectionItem> {

    private static final Logger log = LoggerFactory.getLogger(OptimisticMutationQueue.class);

    private final Executor executor;
    private final List<Consumer<List<T>>> viewListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final Object lock = new Object();
    private List<T> state = List.of();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public OptimisticMutationQueue(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Applies {@code prediction} to the local state right away, then runs {@code mutation} on the executor.
     * Mutations run one at a time in submission order; a failed mutation does not hold back the next one.
     *
     * @return a future that completes once the mutation has finished; it never completes exceptionally
     */
    public CompletableFuture<Void> submit(UnaryOperator<List<T>> prediction, Runnable mutation) {
        Objects.requireNonNull(prediction, "prediction");
        Objects.requireNonNull(mutation, "mutation");

        List<T> predicted;
        CompletableFuture<Void> previous;
        CompletableFuture<Void> turn = new CompletableFuture<>();
        synchronized (lock) {
            predicted = freeze(prediction.apply(new ArrayList<>(state)));
            state = predicted;
            previous = tail;
            tail = turn;
        }
        pending.incrementAndGet();
        publish(predicted);

        CompletableFuture<Void> execution = previous.thenRunAsync(mutation, executor);
        execution.whenComplete((ignored, failure) -> turn.complete(null));
        return execution.handle((ignored, failure) -> {
            pending.decrementAndGet();
            if (failure != null) {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause()
                    : failure;
                log.warn("Optimistic mutation failed; keeping predicted state until the next snapshot: {}",
                    cause.getMessage());
            }
            return null;
        });
    }

    /**
     * Replaces the local state with an authoritative snapshot.
     */
    public void onSnapshot(List<T> snapshot) {
        List<T> next = freeze(snapshot);
        synchronized (lock) {
            state = next;
        }
        publish(next);
    }

    /**
     * Keeps the last known state; the view shows stale data rather than nothing.
     */
    public void onError(Throwable error) {
        log.warn("Snapshot stream failed; keeping last known state: {}",
            error != null ? error.getMessage() : "unknown error");
    }

    public List<T> currentState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Registers a listener for every new local view.
     *
     * @return a handle that removes the listener
     */
    public Runnable addViewListener(Consumer<List<T>> listener) {
        Objects.requireNonNull(listener, "listener");
        viewListeners.add(listener);
        return () -> viewListeners.remove(listener);
    }

    public int pendingMutations() {
        return pending.get();
    }

    /**
     * Prediction that applies {@code change} to the item with the given id.
     */
    public static <T extends CollectionItem> UnaryOperator<List<T>> replacing(String id, UnaryOperator<T> change) {
        return items -> {
            List<T> result = new ArrayList<>(items.size());
            for (T item : items) {
                result.add(item.id().equals(id) ? change.apply(item) : item);
            }
            return result;
        };
    }

    /**
     * Prediction that drops the item with the given id.
     */
    public static <T extends CollectionItem> UnaryOperator<List<T>> removing(String id) {
        return items -> {
            List<T> result = new ArrayList<>(items);
            result.removeIf(item -> item.id().equals(id));
            return result;
        };
    }

    private void publish(List<T> view) {
        for (Consumer<List<T>> listener : viewListeners) {
            listener.accept(view);
        }
    }

    private List<T> freeze(List<T> items) {
        return items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
    }
}
