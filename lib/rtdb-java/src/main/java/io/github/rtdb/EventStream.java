package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.errors.StreamTerminatedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Streaming state of one reference: at most one live session and the listeners attached to it.
 * <p>
 * One lock covers the state, the session and the registry. The connection is opened outside
 * the lock, so a concurrent {@link #stop()} can win the race, in which case the fresh
 * connection is closed straight away. Each registration has its own queue and a delivery
 * thread started with its first event; the reader only ever enqueues.
 * <p>
 * Registrations are session-scoped. Listeners added while idle join the next session, and
 * stopping or failing a session releases every registration. Stopping an idle stream
 * releases the registrations waiting for a session.
 */
final class EventStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStream.class);

    private static final long JOIN_TIMEOUT_MS = 1000;
    private static final ChangeEvent RELEASED = new ChangeEvent(EventType.KEEP_ALIVE, null, null);

    private final String location;
    private final Object lock = new Object();
    private final List<Registration> registrations = new ArrayList<>();
    private Session session;
    private StreamState state = StreamState.IDLE;

    EventStream(String location) {
        this.location = location;
    }

    /**
     * Opens a session unless one is active.
     *
     * @param connector opens the event-stream connection, throwing on failure
     * @return false if a session was already active, true if this call started one
     */
    boolean start(Supplier<InputStream> connector) {
        Session s;
        synchronized (lock) {
            if (session != null) {
                return false;
            }
            s = new Session();
            session = s;
            state = StreamState.STREAMING;
        }

        InputStream input;
        try {
            input = connector.get();
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (session == s) {
                    session = null;
                    state = StreamState.IDLE;
                }
            }
            throw e;
        }

        synchronized (lock) {
            if (session == s) {
                s.input = input;
                s.reader = new Thread(() -> readLoop(s, input), "rtdb-stream");
                s.reader.setDaemon(true);
                s.reader.start();
                LOGGER.info("streaming {}", location);
                return true;
            }
        }
        // stopped while connecting
        closeInput(input);
        return true;
    }

    /**
     * Stops the active session, if any, and releases all registrations.
     *
     * @return true if a session was stopped
     */
    boolean stop() {
        Session s;
        InputStream input;
        Thread reader;
        synchronized (lock) {
            state = StreamState.IDLE;
            releaseAll(false);
            s = session;
            if (s == null) {
                return false;
            }
            s.stopped = true;
            session = null;
            input = s.input;
            reader = s.reader;
        }

        LOGGER.info("stopped streaming {}", location);
        if (input != null) {
            closeInput(input);
        }
        if (reader != null && reader != Thread.currentThread()) {
            reader.interrupt();
            try {
                reader.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return true;
    }

    StreamState state() {
        synchronized (lock) {
            return state;
        }
    }

    ListenerRegistration addListener(EventType type, EventListener listener) {
        Registration registration = new Registration(type, listener);
        synchronized (lock) {
            registrations.add(registration);
        }
        return registration;
    }

    private void readLoop(Session s, InputStream input) {
        DatabaseException failure;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            SseFrameDecoder decoder = new SseFrameDecoder();
            String line;
            while (!s.stopped && (line = reader.readLine()) != null) {
                ChangeEvent event = decoder.accept(line);
                if (event != null && dispatch(s, event)) {
                    return;
                }
            }
            if (s.stopped) {
                return;
            }
            ChangeEvent pending = decoder.finish();
            if (pending != null && dispatch(s, pending)) {
                return;
            }
            failure = new StreamTerminatedError("stream closed by server");
        } catch (IOException e) {
            failure = TransportFailures.classify("stream " + location, e);
        }
        fail(s, failure);
    }

    /**
     * Hands an event to every matching registration.
     *
     * @return true if the event ended the session
     */
    private boolean dispatch(Session s, ChangeEvent event) {
        synchronized (lock) {
            if (session != s || s.stopped) {
                return true;
            }
            for (Registration registration : registrations) {
                registration.offer(event);
            }
        }
        if (event.getType().isTerminal()) {
            String detail = event.getData() == null ? "" : ": " + event.getData();
            fail(s, new StreamTerminatedError("stream " + event.getType().getWireName() + " by server" + detail));
            return true;
        }
        return false;
    }

    private void fail(Session s, DatabaseException error) {
        synchronized (lock) {
            if (session != s || s.stopped) {
                return;
            }
            session = null;
            state = StreamState.FAILED;
            ChangeEvent terminal = ChangeEvent.terminal(error);
            for (Registration registration : registrations) {
                registration.offer(terminal);
            }
            releaseAll(false);
        }
        LOGGER.warn("stream for {} ended: {}", location, error.getMessage());
    }

    // caller holds lock
    private void releaseAll(boolean discardPending) {
        for (Registration registration : registrations) {
            registration.release(discardPending);
        }
        registrations.clear();
    }

    private static void closeInput(InputStream input) {
        try {
            input.close();
        } catch (IOException e) {
            LOGGER.debug("closing stream connection failed: {}", e.getMessage());
        }
    }

    private static final class Session {
        private volatile boolean stopped;
        private InputStream input;
        private Thread reader;
    }

    private final class Registration implements ListenerRegistration {
        private final EventType type;
        private final EventListener listener;
        private final BlockingQueue<ChangeEvent> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean active = new AtomicBoolean(true);
        // guarded by lock
        private Thread worker;

        Registration(EventType type, EventListener listener) {
            this.type = type;
            this.listener = listener;
        }

        // caller holds lock
        void offer(ChangeEvent event) {
            if (!active.get()) {
                return;
            }
            if (type == null || type == event.getType() || event.getType() == EventType.ERROR) {
                queue.offer(event);
                if (worker == null) {
                    worker = new Thread(this::deliverLoop, "rtdb-listener");
                    worker.setDaemon(true);
                    worker.start();
                }
            }
        }

        void release(boolean discardPending) {
            if (active.compareAndSet(true, false)) {
                if (discardPending) {
                    queue.clear();
                }
                queue.offer(RELEASED);
            }
        }

        @Override
        public void remove() {
            synchronized (lock) {
                registrations.remove(this);
            }
            release(true);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        private void deliverLoop() {
            while (true) {
                ChangeEvent event;
                try {
                    event = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (event == RELEASED) {
                    return;
                }
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    LOGGER.warn("listener failed on {} event", event.getType(), e);
                }
            }
        }
    }
}
