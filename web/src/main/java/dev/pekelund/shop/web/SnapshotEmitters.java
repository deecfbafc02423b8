package dev.pekelund.shop.web;

import dev.pekelund.shop.subscription.Subscription;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Bridges a collection subscription to a server-sent event stream. Every snapshot is sent as a
 * {@code snapshot} event holding the full list; a listener failure is sent as an {@code error} event and
 * ends the stream.
 */
final class SnapshotEmitters {

    static final String SNAPSHOT_EVENT = "snapshot";
    static final String ERROR_EVENT = "error";

    private static final Logger log = LoggerFactory.getLogger(SnapshotEmitters.class);

    private SnapshotEmitters() {
    }

    @FunctionalInterface
    interface Subscriber<T> {
        Subscription subscribe(Consumer<List<T>> onSnapshot, Consumer<Throwable> onError);
    }

    static <T, R> SseEmitter open(Subscriber<T> subscriber, Function<T, R> mapper) {
        SseEmitter emitter = new SseEmitter(0L);
        AtomicReference<Subscription> subscription = new AtomicReference<>();
        AtomicBoolean closed = new AtomicBoolean(false);

        Runnable release = () -> {
            if (closed.compareAndSet(false, true)) {
                Subscription current = subscription.get();
                if (current != null) {
                    current.unsubscribe();
                }
            }
        };

        Subscription opened = subscriber.subscribe(
            items -> {
                if (closed.get()) {
                    return;
                }
                List<R> payload = items.stream().map(mapper).toList();
                try {
                    emitter.send(SseEmitter.event().name(SNAPSHOT_EVENT).data(payload));
                } catch (IOException | IllegalStateException ex) {
                    log.debug("Snapshot stream closed by client: {}", ex.getMessage());
                    release.run();
                    emitter.completeWithError(ex);
                }
            },
            error -> {
                try {
                    emitter.send(SseEmitter.event().name(ERROR_EVENT)
                        .data(Map.of("message", String.valueOf(error.getMessage()))));
                    emitter.complete();
                } catch (IOException | IllegalStateException ex) {
                    emitter.completeWithError(ex);
                } finally {
                    release.run();
                }
            });
        subscription.set(opened);
        if (closed.get()) {
            opened.unsubscribe();
        }

        emitter.onCompletion(release);
        emitter.onTimeout(release);
        emitter.onError(error -> release.run());
        return emitter;
    }
}
