package org.stellora.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.runtime.actors.ExplorerActor;
import org.stellora.runtime.actors.MailboxFullException;
import org.stellora.runtime.actors.PlanetActor;
import org.stellora.runtime.actors.PlanetGateway;
import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.contracts.GalaxySnapshot;
import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.explorer.Explorer;
import org.stellora.runtime.explorer.ExplorerSettings;
import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.messages.ExplorerCommand;
import org.stellora.runtime.messages.ExplorerReply;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest;
import org.stellora.runtime.model.Planet;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.spi.IRandomProvider;
import org.stellora.runtime.spi.ITickPlugin;
import org.stellora.runtime.spi.SeededRandomProvider;
import org.stellora.runtime.topology.GalaxyTopology;
import org.stellora.runtime.worldgen.CosmicEventPlugin;
import org.stellora.runtime.worldgen.ExplorerDefinition;
import org.stellora.runtime.worldgen.GalaxyDefinition;
import org.stellora.runtime.worldgen.GalaxyLoader;
import org.stellora.runtime.worldgen.PlanetDefinition;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Builds the galaxy and drives the global tick.
 * <p>
 * The orchestrator owns the topology and the actor handles. It never touches planet or
 * explorer state directly; it only sends messages and awaits replies.
 * <p>
 * Tick N:
 * <ol>
 *   <li>tick plugins run and every event they sent is acknowledged;</li>
 *   <li>planet states are queried, destroyed planets are removed from the topology;</li>
 *   <li>every live explorer receives {@code Tick(N, view)} and the orchestrator waits for all
 *       replies, so all messages of tick N are served before tick N+1 starts;</li>
 *   <li>the tick counter advances and a snapshot is published.</li>
 * </ol>
 * Explorers act concurrently unless {@code simulation.sequentialExplorers} is set, in which case
 * they act one after another in id order, which makes a run replayable from its seed.
 * <p>
 * <b>Thread safety:</b> ticks and reconfiguration are serialized by one lock, which
 * {@link #run(int)} takes per tick. {@link #snapshot()} and {@link #shutdown()} do not wait
 * for a tick in flight. Plugins call back into {@link #sendEvent(int, PlanetRequest)} on the
 * ticking thread.
 */
public class GalaxyOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GalaxyOrchestrator.class);

    private enum Lifecycle { NEW, RUNNING, SHUT_DOWN }

    private final GalaxyTopology topology = new GalaxyTopology();
    private final Int2ObjectOpenHashMap<PlanetActor> planetActors = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<ExplorerActor> explorerActors = new Int2ObjectOpenHashMap<>();
    private final IntList planetIds = new IntArrayList();
    private final IntList explorerIds = new IntArrayList();
    private final Map<Integer, PlanetType> planetTypes = new HashMap<>();
    private final Map<Integer, PlanetSnapshot> planetStates = new HashMap<>();
    private final Map<Integer, ExplorerSnapshot> explorerStates = new ConcurrentHashMap<>();
    private final List<ITickPlugin> tickPlugins = new ArrayList<>();
    private final List<CompletableFuture<PlanetReply>> pendingEvents = new ArrayList<>();
    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NEW);
    private final ReentrantLock tickLock = new ReentrantLock();
    private final IRandomProvider randomProvider;
    private final long replyTimeoutMs;
    private final long snapshotTimeoutMs;
    private final long tickTimeoutMs;
    private final boolean sequentialExplorers;
    private volatile long currentTick;
    private volatile GalaxySnapshot lastSnapshot;
    private volatile List<Integer> criticalNodes = List.of();

    /**
     * Creates planets, explorers and their mailboxes. Actors are started by {@link #start()}.
     *
     * @param galaxy         Initial galaxy.
     * @param config         The {@code stellora} configuration block.
     * @param randomProvider Root random provider.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public GalaxyOrchestrator(GalaxyDefinition galaxy, Config config, IRandomProvider randomProvider) {
        this.randomProvider = randomProvider;
        try {
            Config channels = config.getConfig("channels");
            Config simulation = config.getConfig("simulation");
            this.replyTimeoutMs = channels.getLong("replyTimeoutMs");
            this.snapshotTimeoutMs = channels.getLong("snapshotTimeoutMs");
            this.tickTimeoutMs = channels.getLong("tickTimeoutMs");
            this.sequentialExplorers = simulation.getBoolean("sequentialExplorers");

            Config planetChannel = actorOptions(channels, channels.getInt("planetCapacity"));
            Config explorerChannel = actorOptions(channels, channels.getInt("explorerCapacity"));
            int manyCellCapacity = config.getInt("planets.manyCellCapacity");
            ExplorerSettings settings = ExplorerSettings.fromConfig(config.getConfig("explorer"), replyTimeoutMs);

            createPlanets(galaxy, manyCellCapacity, planetChannel);
            createExplorers(galaxy, settings, explorerChannel);
            if (config.hasPath("tickPlugins")) {
                initializePlugins(config.getConfigList("tickPlugins"));
            }
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid orchestrator configuration: " + e.getMessage(), e);
        }
        this.criticalNodes = sorted(topology.criticalNodes());
        this.lastSnapshot = buildSnapshot();
    }

    /**
     * Builds an orchestrator from a resolved root configuration, loading the galaxy from
     * {@code stellora.galaxy} and seeding randomness from {@code stellora.simulation.seed}.
     *
     * @param root Resolved root configuration.
     * @return The orchestrator, not yet started.
     */
    public static GalaxyOrchestrator fromConfig(Config root) {
        Config stellora = root.getConfig("stellora");
        GalaxyDefinition galaxy = GalaxyLoader.fromConfig(stellora.getConfig("galaxy"));
        long seed = stellora.getLong("simulation.seed");
        return new GalaxyOrchestrator(galaxy, stellora, new SeededRandomProvider(seed));
    }

    private static Config actorOptions(Config channels, int capacity) {
        return ConfigFactory.parseMap(Map.of(
                "capacity", capacity,
                "sendTimeoutMs", channels.getLong("sendTimeoutMs"),
                "pollIntervalMs", channels.getLong("pollIntervalMs"),
                "shutdownTimeoutMs", channels.getLong("shutdownTimeoutMs")
        ));
    }

    private void createPlanets(GalaxyDefinition galaxy, int manyCellCapacity, Config channel) {
        List<PlanetDefinition> sorted = new ArrayList<>(galaxy.planets());
        sorted.sort((a, b) -> Integer.compare(a.id(), b.id()));
        for (PlanetDefinition def : sorted) {
            int charge = def.initialCharge() < 0 ? Integer.MAX_VALUE : def.initialCharge();
            Planet planet = new Planet(def.id(), def.type(), def.supportedKinds(), manyCellCapacity, charge,
                    def.inventory());
            planetActors.put(def.id(), new PlanetActor(planet, channel));
            planetIds.add(def.id());
            planetTypes.put(def.id(), def.type());
            planetStates.put(def.id(), planet.snapshot());
            topology.addNode(def.id());
        }
        for (PlanetDefinition def : sorted) {
            for (int n : def.neighbors()) {
                topology.connect(def.id(), n);
            }
        }
    }

    private void createExplorers(GalaxyDefinition galaxy, ExplorerSettings settings, Config channel) {
        List<ExplorerDefinition> sorted = new ArrayList<>(galaxy.explorers());
        sorted.sort((a, b) -> Integer.compare(a.id(), b.id()));
        PlanetGateway gateway = this::deliver;
        for (ExplorerDefinition def : sorted) {
            int life = def.life() > 0 ? def.life() : settings.life();
            Explorer explorer = new Explorer(def.id(), def.startPlanet(), def.strategy(), def.target(),
                    def.fallbackTargets(), life, def.inventory());
            explorerActors.put(def.id(), new ExplorerActor(explorer, gateway, settings, randomProvider, channel));
            explorerIds.add(def.id());
            explorerStates.put(def.id(), explorer.snapshot());
        }
    }

    private void initializePlugins(List<? extends Config> configs) {
        for (Config config : configs) {
            String className = config.getString("className");
            Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();
            try {
                Object plugin = Class.forName(className)
                        .getConstructor(IRandomProvider.class, Config.class)
                        .newInstance(randomProvider, options);
                if (plugin instanceof ITickPlugin tickPlugin) {
                    tickPlugins.add(tickPlugin);
                } else {
                    LOG.warn("Plugin {} does not implement ITickPlugin", className);
                }
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Failed to instantiate plugin: " + className, e);
            }
        }
    }

    /**
     * Routes an explorer's request to a planet mailbox. Unknown or stopped planets answer
     * PLANET_UNAVAILABLE.
     */
    private CompletableFuture<PlanetReply> deliver(int planetId, PlanetRequest request) {
        PlanetActor actor = planetActors.get(planetId);
        if (actor == null) {
            return CompletableFuture.completedFuture(PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE));
        }
        try {
            return actor.ask(request);
        } catch (IllegalStateException e) {
            return CompletableFuture.completedFuture(PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE));
        }
    }

    // ---------------------------------------------------------------- control surface

    /**
     * Starts all actors.
     *
     * @throws IllegalStateException if already started or shut down.
     */
    public void start() {
        tickLock.lock();
        try {
            if (!lifecycle.compareAndSet(Lifecycle.NEW, Lifecycle.RUNNING)) {
                throw new IllegalStateException("Cannot start orchestrator in state " + lifecycle.get());
            }
            planetActors.values().forEach(PlanetActor::start);
            explorerActors.values().forEach(ExplorerActor::start);
            LOG.info("GalaxyOrchestrator started: {} planets, {} explorers, critical nodes {}",
                    planetIds.size(), explorerIds.size(), criticalNodes);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Executes one tick.
     *
     * @return The snapshot published at the end of the tick.
     * @throws IllegalStateException if the orchestrator is not running.
     */
    public GalaxySnapshot tick() {
        tickLock.lock();
        try {
            checkRunning();
            return executeTick();
        } finally {
            tickLock.unlock();
        }
    }

    private GalaxySnapshot executeTick() {
        pendingEvents.clear();
        for (ITickPlugin plugin : tickPlugins) {
            try {
                plugin.execute(this);
            } catch (Exception e) {
                LOG.warn("Tick plugin '{}' failed at tick {}: {}",
                        plugin.getClass().getSimpleName(), currentTick, e.getMessage());
            }
        }
        acknowledgeEvents();

        refreshPlanets();

        GalaxyView view = new GalaxyView(currentTick, topology.frozenCopy(), planetStates);
        runExplorers(view);

        currentTick++;
        lastSnapshot = buildSnapshot();
        LOG.debug("Tick {} done: {} planets alive, {} explorers alive", currentTick,
                lastSnapshot.alivePlanetCount(), lastSnapshot.aliveExplorerCount());
        return lastSnapshot;
    }

    /**
     * Executes {@code ticks} ticks. The lock is released between ticks, so snapshots and
     * reconfiguration interleave with a long run. A shutdown ends the run after the current tick.
     *
     * @param ticks Number of ticks, not negative.
     * @return The snapshot after the last tick.
     * @throws IllegalStateException if the orchestrator is not running.
     */
    public GalaxySnapshot run(int ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Tick count must not be negative, got " + ticks);
        }
        checkRunning();
        GalaxySnapshot snapshot = lastSnapshot;
        for (int i = 0; i < ticks; i++) {
            tickLock.lock();
            try {
                if (!isRunning()) {
                    break;
                }
                snapshot = executeTick();
            } finally {
                tickLock.unlock();
            }
        }
        return snapshot;
    }

    private void acknowledgeEvents() {
        for (CompletableFuture<PlanetReply> event : pendingEvents) {
            try {
                event.get(replyTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.warn("Environmental event not acknowledged within {}ms at tick {}", replyTimeoutMs, currentTick);
            } catch (ExecutionException e) {
                LOG.warn("Environmental event failed at tick {}: {}", currentTick, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        pendingEvents.clear();
    }

    private void refreshPlanets() {
        Map<Integer, CompletableFuture<PlanetReply>> queries = new HashMap<>();
        for (int id : planetIds) {
            if (topology.contains(id)) {
                queries.put(id, deliverQuietly(id, new PlanetRequest.QueryState()));
            }
        }
        for (int id : planetIds) {
            CompletableFuture<PlanetReply> query = queries.get(id);
            if (query == null) {
                continue;
            }
            PlanetSnapshot state = awaitPlanet(id, query, replyTimeoutMs);
            planetStates.put(id, state);
            if (!state.alive()) {
                removeDestroyedPlanet(id);
            }
        }
    }

    private void removeDestroyedPlanet(int id) {
        boolean wasCritical = topology.criticalNodes().contains(id);
        int componentsBefore = topology.components().size();
        topology.removeNode(id);
        criticalNodes = sorted(topology.criticalNodes());
        if (wasCritical) {
            LOG.warn("Critical planet {} destroyed at tick {}: galaxy split from {} into {} components",
                    id, currentTick, componentsBefore, topology.components().size());
        } else {
            LOG.info("Planet {} removed from topology at tick {}", id, currentTick);
        }
    }

    private void runExplorers(GalaxyView view) {
        List<Integer> active = new ArrayList<>();
        for (int id : explorerIds) {
            ExplorerSnapshot state = explorerStates.get(id);
            if (state == null || state.alive()) {
                active.add(id);
            }
        }
        if (sequentialExplorers) {
            for (int id : active) {
                CompletableFuture<ExplorerReply> reply = sendTick(id, view);
                explorerStates.put(id, awaitExplorer(id, reply, tickTimeoutMs));
            }
            return;
        }
        Map<Integer, CompletableFuture<ExplorerReply>> replies = new HashMap<>();
        for (int id : active) {
            replies.put(id, sendTick(id, view));
        }
        for (int id : active) {
            explorerStates.put(id, awaitExplorer(id, replies.get(id), tickTimeoutMs));
        }
    }

    private CompletableFuture<ExplorerReply> sendTick(int explorerId, GalaxyView view) {
        return askExplorer(explorerId, reply -> new ExplorerCommand.Tick(currentTick, view, reply));
    }

    /**
     * Polls every actor for its current state. Actors that do not answer within
     * {@code channels.snapshotTimeoutMs} are reported with status UNKNOWN. Does not wait for a
     * tick in flight; an explorer busy with its tick is reported UNKNOWN.
     *
     * @return A fresh snapshot; the last published one if the orchestrator is not running.
     */
    public GalaxySnapshot snapshot() {
        if (lifecycle.get() != Lifecycle.RUNNING) {
            return lastSnapshot;
        }
        Map<Integer, CompletableFuture<PlanetReply>> planetQueries = new HashMap<>();
        for (int id : planetIds) {
            planetQueries.put(id, deliverQuietly(id, new PlanetRequest.QueryState()));
        }
        Map<Integer, CompletableFuture<ExplorerReply>> explorerQueries = new HashMap<>();
        for (int id : explorerIds) {
            explorerQueries.put(id, askExplorer(id, ExplorerCommand.Query::new));
        }
        List<PlanetSnapshot> planets = new ArrayList<>();
        for (int id : planetIds) {
            planets.add(awaitPlanet(id, planetQueries.get(id), snapshotTimeoutMs));
        }
        List<ExplorerSnapshot> explorers = new ArrayList<>();
        for (int id : explorerIds) {
            explorers.add(awaitExplorer(id, explorerQueries.get(id), snapshotTimeoutMs));
        }
        return new GalaxySnapshot(currentTick, planets, explorers, criticalNodes);
    }

    /**
     * Changes an explorer's strategy and target. Waits for a tick in flight.
     *
     * @param explorerId The explorer.
     * @param strategy   New strategy.
     * @param target     New target, a complex resource.
     * @return The explorer's reply; rejected with EXPLORER_DEAD if it has died, TIMEOUT if it did not answer.
     * @throws IllegalArgumentException if the explorer is unknown or the target is not complex.
     */
    public ExplorerReply configure(int explorerId, StrategyKind strategy, ResourceKind target) {
        if (!explorerActors.containsKey(explorerId)) {
            throw new IllegalArgumentException("Unknown explorer " + explorerId);
        }
        if (strategy == null || target == null || !target.isComplex()) {
            throw new IllegalArgumentException("Explorer target must be a complex resource, got " + target);
        }
        tickLock.lock();
        try {
            checkRunning();
            CompletableFuture<ExplorerReply> reply = askExplorer(explorerId,
                    future -> new ExplorerCommand.Reconfigure(strategy, target, future));
            ExplorerSnapshot state = awaitExplorer(explorerId, reply, replyTimeoutMs);
            explorerStates.put(explorerId, state);
            ExplorerReply answer = reply.getNow(null);
            return answer != null ? answer : ExplorerReply.rejected(RejectionReason.TIMEOUT, state);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Changes the probability-mode rates of every {@link CosmicEventPlugin}.
     *
     * @param sunrayRate   Chance per planet and tick, in {@code [0, 1]}.
     * @param asteroidRate Chance per planet and tick, in {@code [0, 1]}.
     * @return The number of plugins updated.
     */
    public int configureEvents(double sunrayRate, double asteroidRate) {
        tickLock.lock();
        try {
            int updated = 0;
            for (ITickPlugin plugin : tickPlugins) {
                if (plugin instanceof CosmicEventPlugin cosmic) {
                    cosmic.setRates(sunrayRate, asteroidRate);
                    updated++;
                }
            }
            if (updated == 0) {
                LOG.warn("No cosmic event plugin configured; event rates unchanged");
            }
            return updated;
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Stops every actor. Actors finish the message they are processing and exit.
     * Calling shutdown more than once is a no-op.
     */
    public void shutdown() {
        Lifecycle previous = lifecycle.getAndSet(Lifecycle.SHUT_DOWN);
        if (previous == Lifecycle.SHUT_DOWN) {
            return;
        }
        explorerActors.values().forEach(ExplorerActor::stop);
        planetActors.values().forEach(PlanetActor::stop);
        LOG.info("GalaxyOrchestrator shut down after {} ticks", currentTick);
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------- plugin access

    /**
     * Queues an environmental event for a planet. Called by tick plugins; the event is
     * acknowledged before explorers act in the same tick.
     *
     * @param planetId The planet.
     * @param event    A sunray or asteroid request.
     */
    public void sendEvent(int planetId, PlanetRequest event) {
        pendingEvents.add(deliverQuietly(planetId, event));
    }

    /**
     * @return Ids of planets still in the topology, ascending.
     */
    public IntList alivePlanetIds() {
        return topology.nodes();
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public List<ITickPlugin> getTickPlugins() {
        return Collections.unmodifiableList(tickPlugins);
    }

    /**
     * @return A frozen copy of the current topology.
     */
    public GalaxyTopology getTopology() {
        return topology.frozenCopy();
    }

    public GalaxySnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public boolean isRunning() {
        return lifecycle.get() == Lifecycle.RUNNING;
    }

    // Actor handles, package-private for tests.

    PlanetActor planetActor(int id) {
        return planetActors.get(id);
    }

    ExplorerActor explorerActor(int id) {
        return explorerActors.get(id);
    }

    // ---------------------------------------------------------------- helpers

    private CompletableFuture<PlanetReply> deliverQuietly(int planetId, PlanetRequest request) {
        try {
            return deliver(planetId, request);
        } catch (MailboxFullException e) {
            LOG.warn("Planet {} mailbox full: {}", planetId, e.getMessage());
            return CompletableFuture.completedFuture(PlanetReply.rejected(RejectionReason.TIMEOUT));
        }
    }

    private CompletableFuture<ExplorerReply> askExplorer(int explorerId,
            Function<CompletableFuture<ExplorerReply>, ExplorerCommand> command) {
        try {
            return explorerActors.get(explorerId).ask(command);
        } catch (MailboxFullException | IllegalStateException e) {
            LOG.warn("Explorer {} unreachable: {}", explorerId, e.getMessage());
            return new CompletableFuture<>();
        }
    }

    private PlanetSnapshot awaitPlanet(int id, CompletableFuture<PlanetReply> query, long timeoutMs) {
        try {
            PlanetReply reply = query.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (reply.state() != null) {
                return reply.state();
            }
        } catch (TimeoutException e) {
            LOG.debug("Planet {} did not answer within {}ms", id, timeoutMs);
        } catch (ExecutionException e) {
            LOG.warn("Planet {} failed to report state: {}", id, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return PlanetSnapshot.unknown(id, planetTypes.get(id));
    }

    private ExplorerSnapshot awaitExplorer(int id, CompletableFuture<ExplorerReply> reply, long timeoutMs) {
        try {
            return reply.get(timeoutMs, TimeUnit.MILLISECONDS).state();
        } catch (TimeoutException e) {
            LOG.warn("Explorer {} did not answer within {}ms at tick {}", id, timeoutMs, currentTick);
        } catch (ExecutionException e) {
            LOG.warn("Explorer {} failed: {}", id, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        ExplorerSnapshot last = explorerStates.get(id);
        return last == null
                ? ExplorerSnapshot.unknown(id, null, null)
                : ExplorerSnapshot.unknown(id, last.strategy(), last.target());
    }

    private GalaxySnapshot buildSnapshot() {
        List<PlanetSnapshot> planets = new ArrayList<>();
        for (int id : planetIds) {
            planets.add(planetStates.get(id));
        }
        List<ExplorerSnapshot> explorers = new ArrayList<>();
        for (int id : explorerIds) {
            explorers.add(explorerStates.get(id));
        }
        return new GalaxySnapshot(currentTick, planets, explorers, criticalNodes);
    }

    private static List<Integer> sorted(IntSet ids) {
        List<Integer> list = new ArrayList<>(ids);
        Collections.sort(list);
        return list;
    }

    private void checkRunning() {
        if (lifecycle.get() != Lifecycle.RUNNING) {
            throw new IllegalStateException("Orchestrator is not running (state " + lifecycle.get() + ")");
        }
    }
}
