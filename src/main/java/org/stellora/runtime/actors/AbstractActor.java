package org.stellora.runtime.actors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Base class for actors: a dedicated thread draining a bounded mailbox one message at a time.
 * <p>
 * Sequential processing is what makes per-actor state safe. Subclasses keep their state
 * private to the actor thread and expose it only through messages.
 * <p>
 * <strong>Backpressure:</strong> {@link #send(Object)} waits at most {@code sendTimeoutMs}
 * for free mailbox space and then throws {@link MailboxFullException}.
 * <p>
 * <strong>Shutdown:</strong> {@link #stop()} is cooperative. The actor finishes the message it
 * is processing, then exits; messages still queued are passed to {@link #onDiscard(Object)}
 * so that senders waiting for a reply are released.
 * <p>
 * <strong>Errors:</strong> transient problems are logged at WARN and kept via
 * {@link #recordError(String, String)}. An exception escaping {@link #handle(Object)}
 * moves the actor to {@link ActorState#ERROR}.
 *
 * @param <M> The message type.
 */
public abstract class AbstractActor<M> {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String actorName;

    private final ArrayBlockingQueue<M> mailbox;
    private final long sendTimeoutMs;
    private final long pollIntervalMs;
    private final long shutdownTimeoutMs;
    private final AtomicReference<ActorState> currentState = new AtomicReference<>(ActorState.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ConcurrentLinkedDeque<ActorError> errors = new ConcurrentLinkedDeque<>();
    private Thread actorThread;

    /**
     * @param name    The actor name, also used as thread name.
     * @param options Channel options:
     *                <ul>
     *                  <li>{@code capacity} - mailbox size (default: 64)</li>
     *                  <li>{@code sendTimeoutMs} - how long a sender waits for space (default: 1000)</li>
     *                  <li>{@code pollIntervalMs} - how often an idle actor checks for stop (default: 50)</li>
     *                  <li>{@code shutdownTimeoutMs} - grace period in {@link #stop()} (default: 5000)</li>
     *                </ul>
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    protected AbstractActor(String name, Config options) {
        this.actorName = name;
        Config defaults = ConfigFactory.parseMap(Map.of(
                "capacity", 64,
                "sendTimeoutMs", 1000,
                "pollIntervalMs", 50,
                "shutdownTimeoutMs", 5000
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            int capacity = finalConfig.getInt("capacity");
            this.sendTimeoutMs = finalConfig.getLong("sendTimeoutMs");
            this.pollIntervalMs = finalConfig.getLong("pollIntervalMs");
            this.shutdownTimeoutMs = finalConfig.getLong("shutdownTimeoutMs");
            if (capacity <= 0) {
                throw new IllegalArgumentException("Mailbox capacity must be positive for actor '" + name + "'.");
            }
            if (sendTimeoutMs < 0 || pollIntervalMs <= 0 || shutdownTimeoutMs < 0) {
                throw new IllegalArgumentException("Invalid timeouts for actor '" + name + "'.");
            }
            this.mailbox = new ArrayBlockingQueue<>(capacity);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for actor '" + name + "'", e);
        }
    }

    public final void start() {
        if (!currentState.compareAndSet(ActorState.STOPPED, ActorState.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start actor '%s' as it is already in state %s",
                    actorName, getCurrentState()));
        }
        stopRequested.set(false);
        actorThread = new Thread(this::runActor);
        actorThread.setName(actorName);
        actorThread.setDaemon(true);
        actorThread.start();
        log.debug("{} started", actorName);
    }

    /**
     * Requests a cooperative stop and waits for the actor thread to exit.
     * Stopping an actor that is not running is a no-op.
     */
    public final void stop() {
        if (getCurrentState() != ActorState.RUNNING || actorThread == null) {
            return;
        }
        stopRequested.set(true);
        try {
            actorThread.join(shutdownTimeoutMs);
            if (actorThread.isAlive()) {
                log.warn("{} did not stop within {}ms, forcing interrupt", actorName, shutdownTimeoutMs);
                actorThread.interrupt();
                actorThread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for actor shutdown", actorName);
        }
        if (actorThread.isAlive()) {
            log.error("{} thread did not stop! Forcing ERROR state.", actorName);
            currentState.set(ActorState.ERROR);
            return;
        }
        log.debug("{} stopped", actorName);
    }

    /**
     * Places a message into the mailbox, waiting for space up to the send timeout.
     *
     * @param message The message.
     * @throws MailboxFullException  if no space became available in time.
     * @throws IllegalStateException if the actor is not running.
     */
    public void send(M message) {
        if (getCurrentState() != ActorState.RUNNING || stopRequested.get()) {
            throw new IllegalStateException(String.format("Actor '%s' is not accepting messages (state %s)",
                    actorName, getCurrentState()));
        }
        boolean accepted;
        try {
            accepted = mailbox.offer(message, sendTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailboxFullException("Interrupted while sending to '" + actorName + "'");
        }
        if (!accepted) {
            throw new MailboxFullException(String.format("Mailbox of '%s' is full (capacity %d)",
                    actorName, mailbox.size() + mailbox.remainingCapacity()));
        }
    }

    private void runActor() {
        try {
            while (!stopRequested.get()) {
                M message = mailbox.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (message != null) {
                    handle(message);
                }
            }
        } catch (InterruptedException e) {
            log.debug("Actor thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", actorName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(ActorState.ERROR);
        } finally {
            List<M> pending = new ArrayList<>();
            mailbox.drainTo(pending);
            pending.forEach(this::onDiscard);
            if (getCurrentState() != ActorState.ERROR) {
                currentState.set(ActorState.STOPPED);
            }
            log.debug("Actor thread for {} has terminated.", actorName);
        }
    }

    /**
     * Processes one message on the actor thread.
     *
     * @param message The message.
     * @throws Exception if processing failed fatally; the actor moves to ERROR.
     */
    protected abstract void handle(M message) throws Exception;

    /**
     * Called for every message left in the mailbox when the actor exits.
     *
     * @param message The unprocessed message.
     */
    protected void onDiscard(M message) {
    }

    /**
     * Records a transient error. Keeps at most {@link #getMaxErrors()} entries.
     *
     * @param code    Short error code.
     * @param message Description.
     */
    protected void recordError(String code, String message) {
        errors.add(new ActorError(Instant.now(), code, message));
        while (errors.size() > getMaxErrors()) {
            errors.pollFirst();
        }
    }

    protected int getMaxErrors() {
        return 1000;
    }

    public List<ActorError> getErrors() {
        return List.copyOf(errors);
    }

    public ActorState getCurrentState() {
        return currentState.get();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public int pendingMessages() {
        return mailbox.size();
    }

    public String getActorName() {
        return actorName;
    }
}
