package org.karo.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.karo.runtime.internal.EventQueue;
import org.karo.runtime.internal.MovePlan;
import org.karo.runtime.internal.MoveResolver;
import org.karo.runtime.internal.ScheduledEvent;
import org.karo.runtime.internal.SeededRandomProvider;
import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.EventKind;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.ParticleSnapshot;
import org.karo.runtime.model.ParticleSpec;
import org.karo.runtime.model.ParticleView;
import org.karo.runtime.model.SimulationSnapshot;
import org.karo.runtime.model.Trait;
import org.karo.runtime.model.TraitState;
import org.karo.runtime.model.Track;
import org.karo.runtime.model.TrackSnapshot;
import org.karo.runtime.model.TrackView;
import org.karo.runtime.model.TrajectoryEntry;
import org.karo.runtime.model.TrajectoryLog;
import org.karo.runtime.rules.RuleDispatcher;
import org.karo.runtime.rules.RuleRegistry;
import org.karo.runtime.rules.RuleRegistryLoader;
import org.karo.runtime.rules.StandardTraits;
import org.karo.runtime.spi.CollisionContext;
import org.karo.runtime.spi.ICommitObserver;
import org.karo.runtime.spi.IRandomProvider;
import org.karo.runtime.spi.LifetimeContext;
import org.karo.runtime.spi.LifetimeDecision;
import org.karo.runtime.spi.RemovalContext;
import org.karo.runtime.spi.StepContext;
import org.karo.runtime.spi.StepDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Drives the evolution of particles on a track: selects the next step, invokes
 * stepping rules, resolves conflicts through collision rules, commits the result
 * atomically and records it in the trajectory log.
 * <p>
 * Two scheduling policies are supported, fixed per simulation:
 * <ul>
 *   <li><b>Synchronous</b>: every tick, all stepping rules are evaluated against the
 *       pre-tick snapshot of the track. Requests for the same site are decided by the
 *       configured {@link TieBreak} before collision rules run; the resulting plans
 *       commit in ascending mover id at the tick boundary.</li>
 *   <li><b>Asynchronous</b>: a priority queue keyed by next-event time. Each step pops
 *       one event, evaluates that particle against the live track, resolves and
 *       commits the single change and reschedules the particle.</li>
 * </ul>
 * The outcome is determined by particle ids, trait attachment order and the seed;
 * planning threads ({@link SimulationSettings#parallelism()}) do not change it.
 * <p>
 * Run methods never throw {@link SimulationException}s. A failure halts the run, moves
 * the engine to {@link EngineState#FAILED} and is returned in the {@link RunResult}
 * together with the entries committed before it.
 * <p>
 * <b>Thread safety:</b> a simulation is driven by one thread. Only
 * {@link #requestStop()} may be called from other threads.
 */
public class Simulation implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationSettings settings;
    private final RuleRegistry registry;
    private final RuleDispatcher dispatcher;
    private final Int2ObjectSortedMap<Particle> particles = new Int2ObjectRBTreeMap<>();
    private final Track track;
    private final SeededRandomProvider random;
    private final EventQueue eventQueue = new EventQueue();
    private final TrajectoryLog trajectoryLog = new TrajectoryLog();
    private final List<ICommitObserver> observers = new CopyOnWriteArrayList<>();
    private final MoveResolver moveResolver;
    private final PlanWorkerPool workerPool;
    private final StepContext[] stepContexts;
    private final CollisionContext collisionContext = new CollisionContext();
    private final LifetimeContext lifetimeContext = new LifetimeContext();
    private final RemovalContext removalContext = new RemovalContext();

    private EngineState state = EngineState.IDLE;
    private long tick;
    private double time;
    private int nextParticleId = 1;
    private volatile boolean stopRequested;

    // Spawns requested by removal handlers during the current commit.
    private final List<ParticleSpec> pendingSpawns = new ArrayList<>();

    /**
     * Creates a simulation at tick 0. On a {@link Boundary#MARKED} track the two
     * track-end marker particles are placed on the first and last site.
     *
     * @param settings Run parameters
     * @param registry Traits and rules; frozen by this call
     */
    public Simulation(SimulationSettings settings, RuleRegistry registry) {
        this(settings, registry, true);
    }

    private Simulation(SimulationSettings settings, RuleRegistry registry, boolean placeMarkers) {
        this.settings = settings;
        this.registry = registry;
        registry.freeze();
        this.dispatcher = new RuleDispatcher(registry);
        this.track = new Track(settings.trackLength(), settings.boundary(), particles::get);
        this.random = new SeededRandomProvider(settings.seed());
        this.moveResolver = new MoveResolver(dispatcher, particles::get);

        int effectiveParallelism = settings.mode() == SchedulingMode.SYNCHRONOUS
                ? resolveParallelism(settings.parallelism()) : 1;
        this.workerPool = effectiveParallelism > 1 ? new PlanWorkerPool(effectiveParallelism) : null;
        this.stepContexts = new StepContext[effectiveParallelism];
        for (int i = 0; i < effectiveParallelism; i++) {
            stepContexts[i] = new StepContext();
        }

        if (placeMarkers && settings.boundary() == Boundary.MARKED) {
            List<TrajectoryEntry> entries = new ArrayList<>();
            createParticle(ParticleSpec.at(0).traits(StandardTraits.TRACK_END_NAME).build(), entries);
            createParticle(ParticleSpec.at(settings.trackLength() - 1).traits(StandardTraits.TRACK_END_NAME).build(), entries);
            trajectoryLog.appendAll(entries);
        }
        LOG.debug("Created {} simulation: {} sites, boundary {}, seed {}, {} planning thread(s)",
                settings.mode(), settings.trackLength(), settings.boundary(), settings.seed(), effectiveParallelism);
    }

    /**
     * Creates an empty simulation for resuming from a checkpoint. No markers are placed
     * and no events are scheduled; the caller restores particles, events and the clock
     * through the {@code restore*} methods.
     * <p>
     * <b>Internal use only:</b> see {@link org.karo.runtime.resume.SimulationRestorer}.
     *
     * @param settings Settings of the checkpointed run
     * @param registry Rules of the resumed run; must define every trait of the checkpoint
     * @param tick Tick (or processed-event count) to resume from
     * @param time Simulation time to resume from
     * @param nextParticleId The next id to assign
     * @return Simulation ready for particle restoration
     */
    public static Simulation forResume(SimulationSettings settings, RuleRegistry registry,
                                       long tick, double time, int nextParticleId) {
        Simulation simulation = new Simulation(settings, registry, false);
        simulation.tick = tick;
        simulation.time = time;
        simulation.nextParticleId = nextParticleId;
        return simulation;
    }

    /**
     * Builds a simulation from a configuration containing a {@code karo} block:
     * settings, rules and the initial particles.
     *
     * @throws ConfigurationException on invalid configuration
     */
    public static Simulation fromConfig(Config config) {
        Config karo = config.getConfig("karo");
        SimulationSettings settings = SimulationSettings.fromConfig(karo);
        RuleRegistry registry = karo.hasPath("rules") ? RuleRegistryLoader.load(karo.getConfig("rules")) : new RuleRegistry();
        Simulation simulation = new Simulation(settings, registry);
        if (karo.hasPath("particles")) {
            for (Config particle : karo.getConfigList("particles")) {
                simulation.addParticle(ParticleSpec.fromConfig(particle));
            }
        }
        LOG.info("Configured simulation with {} particles on {} sites", simulation.particles.size(), settings.trackLength());
        return simulation;
    }

    // ---------------------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------------------

    /**
     * Registers a particle between runs. The spawn is recorded in the trajectory log.
     *
     * @return the new particle's id
     * @throws ConfigurationException if a trait is unknown or state is given for an unattached trait
     * @throws BoundaryException if the site is outside the track
     * @throws SiteOccupiedException if the site is occupied
     */
    public int addParticle(ParticleSpec spec) {
        ensureIdle();
        List<TrajectoryEntry> entries = new ArrayList<>();
        Particle particle = createParticle(spec, entries);
        trajectoryLog.appendAll(entries);
        return particle.getId();
    }

    /**
     * Removes a particle between runs. Its removal handlers run and may spawn
     * replacements; all resulting changes form one commit.
     *
     * @return the committed entries
     * @throws IllegalArgumentException if no such particle exists
     */
    public List<TrajectoryEntry> removeParticle(int particleId) {
        ensureIdle();
        Particle particle = particles.get(particleId);
        if (particle == null) {
            throw new IllegalArgumentException("No particle with id " + particleId);
        }
        List<TrajectoryEntry> entries = new ArrayList<>();
        int site = particle.getSite();
        track.vacate(site);
        entries.add(TrajectoryEntry.removed(tick, time, particleId, site, EventKind.REMOVED));
        try {
            retire(particle, EventKind.REMOVED, site);
            applyPendingSpawns(entries);
        } catch (SimulationException e) {
            abortCommit(entries);
            throw e;
        }
        finishCommit(entries);
        return entries;
    }

    /**
     * Registers an observer invoked after every committed step.
     */
    public void addCommitObserver(ICommitObserver observer) {
        observers.add(observer);
    }

    public void removeCommitObserver(ICommitObserver observer) {
        observers.remove(observer);
    }

    // ---------------------------------------------------------------------------------
    // Driving
    // ---------------------------------------------------------------------------------

    /**
     * Advances by one tick (synchronous) or one event (asynchronous).
     */
    public RunResult stepOnce() {
        return drive(1, Double.POSITIVE_INFINITY);
    }

    /**
     * Advances by up to {@code steps} ticks or events.
     */
    public RunResult run(long steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be >= 0, got " + steps);
        }
        return drive(steps, Double.POSITIVE_INFINITY);
    }

    /**
     * Advances while the next step lies at or before {@code limit}: the tick number in
     * synchronous mode, the event time in asynchronous mode.
     */
    public RunResult runUntil(double limit) {
        if (Double.isNaN(limit)) {
            throw new IllegalArgumentException("limit must not be NaN");
        }
        return drive(Long.MAX_VALUE, limit);
    }

    /**
     * Asks a running simulation to stop. Honoured at the next step boundary, after
     * the current step has fully committed. Safe to call from any thread.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Releases the planning threads. Safe to call more than once.
     */
    public void shutdown() {
        if (workerPool != null) {
            workerPool.shutdown();
        }
    }

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    public void close() {
        shutdown();
    }

    private RunResult drive(long maxSteps, double limit) {
        if (state == EngineState.FAILED) {
            throw new IllegalStateException("Simulation has failed and cannot continue");
        }
        if (state == EngineState.FINISHED) {
            throw new IllegalStateException("Simulation has finished");
        }
        int start = trajectoryLog.size();
        long done = 0;
        try {
            while (true) {
                if (stopRequested) {
                    stopRequested = false;
                    LOG.info("Stop requested, halting at tick {}", tick);
                    return result(start, Termination.STOP_REQUESTED);
                }
                Termination reason = checkLimits();
                if (reason != null) {
                    state = EngineState.FINISHED;
                    LOG.info("Simulation finished at tick {} (time {}): {}", tick, time, reason);
                    return result(start, reason);
                }
                if (done >= maxSteps) {
                    return result(start, Termination.STEPS_COMPLETED);
                }
                if (nextStepTime() > limit) {
                    return result(start, Termination.TARGET_REACHED);
                }
                if (settings.mode() == SchedulingMode.SYNCHRONOUS) {
                    tickSynchronous();
                } else {
                    processEvent();
                }
                done++;
            }
        } catch (SimulationException e) {
            state = EngineState.FAILED;
            LOG.warn("Simulation halted at tick {}: {}", tick, e.getMessage());
            return new RunResult(trajectoryLog.since(start), Termination.FAILED, e);
        }
    }

    private RunResult result(int start, Termination termination) {
        return new RunResult(trajectoryLog.since(start), termination, null);
    }

    private Termination checkLimits() {
        if (getLiveParticleCount() == 0) {
            return Termination.NO_PARTICLES;
        }
        if (settings.mode() == SchedulingMode.ASYNCHRONOUS && eventQueue.isEmpty()) {
            return Termination.QUEUE_EXHAUSTED;
        }
        if (settings.maxTicks() > 0 && tick >= settings.maxTicks()) {
            return Termination.LIMIT_REACHED;
        }
        if (settings.maxTime() > 0 && nextStepTime() > settings.maxTime()) {
            return Termination.LIMIT_REACHED;
        }
        return null;
    }

    private double nextStepTime() {
        if (settings.mode() == SchedulingMode.SYNCHRONOUS) {
            return tick + 1;
        }
        ScheduledEvent next = eventQueue.peek();
        return next == null ? Double.POSITIVE_INFINITY : next.time();
    }

    // ---------------------------------------------------------------------------------
    // Synchronous tick
    // ---------------------------------------------------------------------------------

    private void tickSynchronous() {
        long nextTick = tick + 1;
        double nextTime = nextTick;

        // Plan: every stepping rule against the same pre-tick snapshot.
        state = EngineState.STEPPING;
        TrackSnapshot view = track.snapshot(particles);
        List<Particle> movers = new ArrayList<>();
        for (Particle particle : particles.values()) {
            if (dispatcher.hasStepRule(particle)) {
                movers.add(particle);
            }
        }
        int size = movers.size();
        StepDecision[] decisions = new StepDecision[size];
        @SuppressWarnings("unchecked")
        List<ParticleSpec>[] spawnRequests = new List[size];
        SimulationException[] failures = new SimulationException[size];
        PlanWorkerPool.RangeTask planTask = (from, to) -> {
            StepContext context = stepContexts[workerPool != null ? PlanWorkerPool.currentSlot() : 0];
            for (int i = from; i < to; i++) {
                Particle particle = movers.get(i);
                spawnRequests[i] = new ArrayList<>(0);
                try {
                    context.reset(particle, view, tick, time, spawnRequests[i]);
                    decisions[i] = dispatcher.dispatchStep(particle, context);
                } catch (SimulationException e) {
                    failures[i] = e;
                    return;
                }
            }
        };
        if (workerPool != null && size > 1) {
            workerPool.dispatch(size, planTask);
        } else {
            planTask.run(0, size);
        }
        // Lowest index first, so the reported failure does not depend on thread timing.
        for (SimulationException failure : failures) {
            if (failure != null) {
                throw failure;
            }
        }

        // Resolve: tie-break between requests for the same site, then collisions.
        state = EngineState.RESOLVING;
        boolean[] rejected = applyTieBreak(movers, decisions);
        List<MovePlan> plans = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Particle particle = movers.get(i);
            StepDecision decision = decisions[i];
            if (decision.getAction() == StepDecision.Action.REMOVE) {
                plans.add(moveResolver.planRemoval(particle));
            } else if (decision.getAction() == StepDecision.Action.MOVE && !rejected[i]) {
                plans.add(moveResolver.resolve(particle, decision.getDisplacement(), view, collisionContext, tick, time));
            }
        }

        // Commit in ascending mover id; a particle changes at most once per tick,
        // except that an explicit removal always takes effect.
        state = EngineState.COMMITTING;
        tick = nextTick;
        time = nextTime;
        List<TrajectoryEntry> entries = new ArrayList<>();
        try {
            IntSet touched = new IntOpenHashSet();
            for (MovePlan plan : plans) {
                if (plan.isEmpty()) {
                    continue;
                }
                if (!plan.isApplicable(track, touched)) {
                    if (plan.isSelfRemoval() && particles.containsKey(plan.getInitiatorId())) {
                        // Displaced earlier in this tick; remove it from where it ended up.
                        commitPlan(moveResolver.planRemoval(particles.get(plan.getInitiatorId())), entries, touched);
                    } else {
                        LOG.debug("Tick {}: dropped plan of particle {}, superseded by an earlier commit",
                                tick, plan.getInitiatorId());
                    }
                    continue;
                }
                commitPlan(plan, entries, touched);
            }
            for (List<ParticleSpec> requests : spawnRequests) {
                for (ParticleSpec spec : requests) {
                    spawnIfFree(spec, entries);
                }
            }
            applyPendingSpawns(entries);

            // Lifetime checks on the post-commit state.
            IntList candidates = new IntArrayList();
            for (Particle particle : particles.values()) {
                if (dispatcher.hasLifetimeRule(particle)) {
                    candidates.add(particle.getId());
                }
            }
            for (int i = 0; i < candidates.size(); i++) {
                Particle particle = particles.get(candidates.getInt(i));
                if (particle != null) {
                    checkLifetime(particle, entries);
                }
            }
            applyPendingSpawns(entries);
        } catch (SimulationException e) {
            abortCommit(entries);
            throw e;
        }

        finishCommit(entries);
    }

    /**
     * Marks every move request that lost a tie-break. Requests are grouped by target
     * site; within a group only the first particle in {@link TieBreak} order proceeds.
     */
    private boolean[] applyTieBreak(List<Particle> movers, StepDecision[] decisions) {
        boolean[] rejected = new boolean[movers.size()];
        Int2ObjectMap<IntList> byTarget = new Int2ObjectOpenHashMap<>();
        for (int i = 0; i < movers.size(); i++) {
            if (decisions[i].getAction() == StepDecision.Action.MOVE) {
                int target = movers.get(i).getSite() + decisions[i].getDisplacement();
                byTarget.computeIfAbsent(target, t -> new IntArrayList()).add(i);
            }
        }
        for (Int2ObjectMap.Entry<IntList> group : byTarget.int2ObjectEntrySet()) {
            IntList indices = group.getValue();
            if (indices.size() < 2) {
                continue;
            }
            int winner = indices.getInt(0);
            for (int k = 1; k < indices.size(); k++) {
                int candidate = indices.getInt(k);
                if (settings.tieBreak().order().compare(movers.get(candidate), movers.get(winner)) < 0) {
                    winner = candidate;
                }
            }
            for (int k = 0; k < indices.size(); k++) {
                int index = indices.getInt(k);
                if (index != winner) {
                    rejected[index] = true;
                    LOG.debug("Tick {}: particle {} lost site {} to particle {}", tick + 1,
                            movers.get(index).getId(), group.getIntKey(), movers.get(winner).getId());
                }
            }
        }
        return rejected;
    }

    // ---------------------------------------------------------------------------------
    // Asynchronous event
    // ---------------------------------------------------------------------------------

    private void processEvent() {
        ScheduledEvent event = eventQueue.poll();
        Particle particle = particles.get(event.particleId());
        if (particle == null) {
            throw new InvariantViolationException("Pending event " + event + " refers to a removed particle");
        }
        tick++;
        time = event.time();
        List<TrajectoryEntry> entries = new ArrayList<>();
        try {
            if (event.kind() == ScheduledEvent.Kind.STEP) {
                state = EngineState.STEPPING;
                List<ParticleSpec> spawnRequests = new ArrayList<>(0);
                StepContext context = stepContexts[0];
                context.reset(particle, track, tick, time, spawnRequests);
                StepDecision decision = dispatcher.dispatchStep(particle, context);

                state = EngineState.RESOLVING;
                MovePlan plan = null;
                if (decision.getAction() == StepDecision.Action.REMOVE) {
                    plan = moveResolver.planRemoval(particle);
                } else if (decision.getAction() == StepDecision.Action.MOVE) {
                    plan = moveResolver.resolve(particle, decision.getDisplacement(), track, collisionContext, tick, time);
                }

                state = EngineState.COMMITTING;
                if (plan != null && !plan.isEmpty()) {
                    IntSet touched = new IntOpenHashSet();
                    if (!plan.isApplicable(track, touched)) {
                        throw new InvariantViolationException("Plan resolved against the live track is not applicable: " + plan);
                    }
                    commitPlan(plan, entries, touched);
                }
                if (particles.containsKey(particle.getId())) {
                    double delay = decision.getDelay();
                    if (!Double.isInfinite(delay)) {
                        eventQueue.schedule(particle.getId(), ScheduledEvent.Kind.STEP, time + delay);
                    }
                    if (dispatcher.hasLifetimeRule(particle)) {
                        checkLifetime(particle, entries);
                    }
                }
                for (ParticleSpec spec : spawnRequests) {
                    spawnIfFree(spec, entries);
                }
            } else {
                state = EngineState.COMMITTING;
                checkLifetime(particle, entries);
            }
            applyPendingSpawns(entries);
        } catch (SimulationException e) {
            abortCommit(entries);
            throw e;
        }
        finishCommit(entries);
    }

    // ---------------------------------------------------------------------------------
    // Commit helpers
    // ---------------------------------------------------------------------------------

    private void commitPlan(MovePlan plan, List<TrajectoryEntry> entries, IntSet touched) {
        List<MovePlan.Op> removals = plan.applyTo(track);
        for (MovePlan.Op op : plan.getOps()) {
            touched.add(op.particleId());
            if (op.isRemoval()) {
                entries.add(TrajectoryEntry.removed(tick, time, op.particleId(), op.fromSite(), op.kind()));
            } else {
                particles.get(op.particleId()).setSite(op.toSite());
                entries.add(TrajectoryEntry.moved(tick, time, op.particleId(), op.fromSite(), op.toSite(), op.kind()));
            }
        }
        for (MovePlan.Op op : removals) {
            retire(particles.get(op.particleId()), op.kind(), op.fromSite());
        }
    }

    private void checkLifetime(Particle particle, List<TrajectoryEntry> entries) {
        lifetimeContext.reset(particle, track, tick, time);
        LifetimeDecision decision = dispatcher.dispatchLifetime(particle, lifetimeContext);
        if (decision.getVerdict() == LifetimeDecision.Verdict.EXPIRED) {
            int site = particle.getSite();
            track.vacate(site);
            entries.add(TrajectoryEntry.removed(tick, time, particle.getId(), site, EventKind.EXPIRED));
            retire(particle, EventKind.EXPIRED, site);
            return;
        }
        if (settings.mode() == SchedulingMode.ASYNCHRONOUS && decision.hasNextCheck()) {
            double at = decision.getNextCheck();
            if (!(at > time)) {
                throw new RuleException("Next lifetime check must lie after the current time " + time + ", was " + at,
                        particle.getId(), null);
            }
            if (!Double.isInfinite(at)) {
                eventQueue.schedule(particle.getId(), ScheduledEvent.Kind.LIFETIME, at);
            }
        }
    }

    /**
     * Takes a particle that has already left the track out of the registry, cancels its
     * events and runs its removal handlers.
     */
    private void retire(Particle particle, EventKind reason, int lastSite) {
        particles.remove(particle.getId());
        eventQueue.cancelAll(particle.getId());
        removalContext.reset(particle, reason, lastSite, track, tick, time, pendingSpawns);
        if (dispatcher.dispatchRemoval(particle, removalContext)) {
            LOG.debug("Removal of particle {} ({}) handled by its traits", particle.getId(), reason);
        }
    }

    private void applyPendingSpawns(List<TrajectoryEntry> entries) {
        // Spawned particles may be removed right away by their own handlers, which queue further spawns.
        while (!pendingSpawns.isEmpty()) {
            ParticleSpec spec = pendingSpawns.remove(0);
            spawnIfFree(spec, entries);
        }
    }

    private void spawnIfFree(ParticleSpec spec, List<TrajectoryEntry> entries) {
        if (track.isInBounds(spec.getSite()) && track.isOccupied(spec.getSite())) {
            LOG.debug("Tick {}: dropped spawn at occupied site {}", tick, spec.getSite());
            return;
        }
        createParticle(spec, entries);
    }

    private Particle createParticle(ParticleSpec spec, List<TrajectoryEntry> entries) {
        List<Trait> traits = registry.resolve(spec.getTraits());
        for (String trait : spec.getState().keySet()) {
            if (!spec.getTraits().contains(trait)) {
                throw new ConfigurationException("Initial state given for trait '" + trait
                        + "' which is not attached to the particle");
            }
        }
        int id = nextParticleId;
        track.place(id, spec.getSite());
        nextParticleId++;
        Particle particle = new Particle(id, spec.getSite(), traits, spec.getState(),
                random.deriveFor("particle", id), tick, time);
        particles.put(id, particle);
        entries.add(TrajectoryEntry.spawned(tick, time, id, spec.getSite()));
        if (settings.mode() == SchedulingMode.ASYNCHRONOUS) {
            scheduleInitialEvents(particle);
        }
        return particle;
    }

    private void scheduleInitialEvents(Particle particle) {
        if (dispatcher.hasStepRule(particle)) {
            double delay = dispatcher.initialDelay(particle, particle.getRandom());
            if (!Double.isInfinite(delay)) {
                eventQueue.schedule(particle.getId(), ScheduledEvent.Kind.STEP, time + delay);
            }
        }
        if (dispatcher.hasLifetimeRule(particle)) {
            eventQueue.schedule(particle.getId(), ScheduledEvent.Kind.LIFETIME, time);
        }
    }

    /**
     * Keeps the log in step with the track when a commit fails half-way: every change
     * already applied is recorded before the error propagates.
     */
    private void abortCommit(List<TrajectoryEntry> entries) {
        trajectoryLog.appendAll(entries);
        pendingSpawns.clear();
        if (!entries.isEmpty()) {
            LOG.debug("Tick {}: commit aborted after {} applied change(s)", tick, entries.size());
        }
    }

    private void finishCommit(List<TrajectoryEntry> entries) {
        trajectoryLog.appendAll(entries);
        if (settings.checkInvariants()) {
            verifyInvariants();
        }
        state = EngineState.IDLE;
        if (!observers.isEmpty()) {
            SimulationSnapshot snapshot = snapshot();
            List<TrajectoryEntry> committed = Collections.unmodifiableList(entries);
            for (ICommitObserver observer : observers) {
                try {
                    observer.onCommit(snapshot, committed);
                } catch (RuntimeException e) {
                    LOG.warn("Commit observer '{}' failed at tick {}: {}",
                            observer.getClass().getSimpleName(), tick, e.getMessage());
                }
            }
        }
    }

    /**
     * Checks that track occupancy and particle positions form a bijection.
     *
     * @throws InvariantViolationException on any mismatch
     */
    void verifyInvariants() {
        for (Particle particle : particles.values()) {
            int occupant = track.occupantAt(particle.getSite());
            if (occupant != particle.getId()) {
                throw new InvariantViolationException("Particle " + particle.getId() + " claims site "
                        + particle.getSite() + " but the track holds " + occupant + " there");
            }
        }
        int[] sites = track.toArray();
        int occupied = 0;
        for (int site = 0; site < sites.length; site++) {
            if (sites[site] == TrackView.EMPTY) {
                continue;
            }
            occupied++;
            if (!particles.containsKey(sites[site])) {
                throw new InvariantViolationException("Site " + site + " holds unknown particle " + sites[site]);
            }
        }
        if (occupied != particles.size()) {
            throw new InvariantViolationException(occupied + " occupied sites for " + particles.size() + " particles");
        }
    }

    private void ensureIdle() {
        if (state != EngineState.IDLE) {
            throw new IllegalStateException("Simulation is " + state + "; particles can only be changed between runs");
        }
    }

    private static int resolveParallelism(int configured) {
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
        }
        return configured;
    }

    // ---------------------------------------------------------------------------------
    // Restoration (used by SimulationRestorer)
    // ---------------------------------------------------------------------------------

    /**
     * Re-creates a checkpointed particle with its id, state and random stream position.
     * Nothing is logged or scheduled.
     * <p>
     * <b>Internal use only.</b>
     */
    public void restoreParticle(int id, int site, List<String> traitNames, Map<String, TraitState> traitStates,
                                byte[] randomState, long createdAtTick, double createdAtTime) {
        List<Trait> traits = registry.resolve(traitNames);
        track.place(id, site);
        IRandomProvider particleRandom = random.deriveFor("particle", id);
        particleRandom.loadState(randomState);
        particles.put(id, new Particle(id, site, traits, traitStates, particleRandom, createdAtTick, createdAtTime));
    }

    /**
     * <b>Internal use only.</b>
     */
    public void restoreEvent(ScheduledEvent event) {
        if (!particles.containsKey(event.particleId())) {
            throw new InvariantViolationException("Restored event " + event + " refers to an unknown particle");
        }
        eventQueue.restore(event);
    }

    /**
     * <b>Internal use only.</b>
     */
    public void restoreEventSequence(long nextSequence) {
        eventQueue.setNextSequence(nextSequence);
    }

    /**
     * @return pending asynchronous events in firing order
     */
    public List<ScheduledEvent> getPendingEvents() {
        return eventQueue.pending();
    }

    public long getNextEventSequence() {
        return eventQueue.getNextSequence();
    }

    public int getNextParticleId() {
        return nextParticleId;
    }

    /**
     * <b>Internal use only:</b> live particles in ascending id order, for checkpointing.
     */
    public List<Particle> getParticlesForCheckpoint() {
        return new ArrayList<>(particles.values());
    }

    // ---------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------

    public SimulationSettings getSettings() {
        return settings;
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public EngineState getState() {
        return state;
    }

    /**
     * @return ticks completed (synchronous) or events processed (asynchronous)
     */
    public long getTick() {
        return tick;
    }

    public double getTime() {
        return time;
    }

    /**
     * @return a read-only view of the live track; it changes as the simulation runs
     */
    public TrackView getTrack() {
        return track;
    }

    public Optional<ParticleView> getParticle(int id) {
        return Optional.ofNullable(particles.get(id));
    }

    /**
     * @return live particles, markers included, in ascending id order
     */
    public List<ParticleView> getParticles() {
        return new ArrayList<>(particles.values());
    }

    /**
     * @return particles that are not identifying-only
     */
    public int getLiveParticleCount() {
        int count = 0;
        for (Particle particle : particles.values()) {
            if (!particle.isIdentifyingOnly()) {
                count++;
            }
        }
        return count;
    }

    public TrajectoryLog getTrajectoryLog() {
        return trajectoryLog;
    }

    /**
     * @return an immutable picture of the current state
     */
    public SimulationSnapshot snapshot() {
        TrackSnapshot frozen = track.snapshot(particles);
        List<ParticleSnapshot> copies = new ArrayList<>(particles.size());
        for (Particle particle : particles.values()) {
            copies.add(frozen.particle(particle.getId()));
        }
        return new SimulationSnapshot(tick, time, state, frozen, copies);
    }

    @Override
    public String toString() {
        return "Simulation[" + settings.mode() + ", tick=" + tick + ", time=" + time + ", particles=" + particles.size()
                + ", track=" + Arrays.toString(track.toArray()) + "]";
    }
}
