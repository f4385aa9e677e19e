package in.spreadarb.service.core;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Typed event channel between the engine and its observers.
 *
 * Events are dispatched on a single daemon thread, so listeners see them in publish
 * order and never run on a poller or execution thread. Each listener call is isolated:
 * an exception is logged and the remaining listeners still receive the event.
 */
public final class EngineEventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EngineEventBus.class);

    private final List<EngineEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;
    private final ExecutorService ownedExecutor;

    public EngineEventBus() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "engine-events");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = ownedExecutor;
    }

    private EngineEventBus(Executor dispatcher) {
        this.ownedExecutor = null;
        this.dispatcher = dispatcher;
    }

    /**
     * Bus that dispatches on the publishing thread.
     */
    public static EngineEventBus direct() {
        return new EngineEventBus(Runnable::run);
    }

    public void addListener(EngineEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(EngineEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Deliver an event to every listener.
     */
    public void publish(EventType type, Consumer<EngineEventListener> event) {
        try {
            dispatcher.execute(() -> deliver(type, event));
        } catch (RejectedExecutionException e) {
            log.debug("[EVENTS] Bus closed, dropping {} event", type);
        }
    }

    private void deliver(EventType type, Consumer<EngineEventListener> event) {
        for (EngineEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.error("[EVENTS] Listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), type, e.getMessage(), e);
            }
        }
    }

    /**
     * Stop the dispatcher after delivering already published events.
     */
    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[EVENTS] Dispatcher did not drain in time, forcing shutdown");
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
