package org.karo.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.karo.runtime.spi.IRandomProvider;

/**
 * An individually evolvable entity on the track.
 * <p>
 * Behaviour is the union of the attached traits' handlers; the trait list is fixed at
 * creation and only the trait-private state changes afterwards. Particles are owned by
 * the simulation's registry; the {@link Track} only stores their ids.
 */
public class Particle implements ParticleView {

    private final int id;
    private final List<Trait> traits;
    private final List<String> traitNames;
    private final Map<String, TraitState> states;
    private final IRandomProvider random;
    private final long createdAtTick;
    private final double createdAtTime;
    private final boolean identifyingOnly;
    private int site;

    /**
     * @param id Unique engine-assigned id
     * @param site Initial site
     * @param traits Traits in attachment order
     * @param initialState Initial state per trait name; missing traits start empty
     * @param random The particle's own random stream
     * @param createdAtTick Tick of creation
     * @param createdAtTime Simulation time of creation
     */
    public Particle(int id, int site, List<Trait> traits, Map<String, TraitState> initialState,
                    IRandomProvider random, long createdAtTick, double createdAtTime) {
        this.id = id;
        this.site = site;
        this.traits = List.copyOf(traits);
        this.random = random;
        this.createdAtTick = createdAtTick;
        this.createdAtTime = createdAtTime;
        List<String> names = new ArrayList<>(traits.size());
        Map<String, TraitState> stateMap = new LinkedHashMap<>();
        boolean onlyMarkers = !traits.isEmpty();
        for (Trait trait : traits) {
            names.add(trait.getName());
            TraitState initial = initialState.get(trait.getName());
            stateMap.put(trait.getName(), initial != null ? initial.copy() : new TraitState());
            onlyMarkers &= trait.isMarker();
        }
        this.traitNames = Collections.unmodifiableList(names);
        this.states = stateMap;
        this.identifyingOnly = onlyMarkers;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int getSite() {
        return site;
    }

    /**
     * <b>Internal use only:</b> only the engine's commit phase moves particles.
     */
    public void setSite(int site) {
        this.site = site;
    }

    public List<Trait> getTraits() {
        return traits;
    }

    @Override
    public List<String> getTraitNames() {
        return traitNames;
    }

    @Override
    public boolean hasTrait(String traitName) {
        return states.containsKey(traitName);
    }

    @Override
    public TraitStateView getState(String traitName) {
        return getMutableState(traitName);
    }

    /**
     * @throws IllegalArgumentException if the particle does not carry the trait
     */
    public TraitState getMutableState(String traitName) {
        TraitState state = states.get(traitName);
        if (state == null) {
            throw new IllegalArgumentException("Particle " + id + " has no trait '" + traitName + "'");
        }
        return state;
    }

    public IRandomProvider getRandom() {
        return random;
    }

    @Override
    public boolean isIdentifyingOnly() {
        return identifyingOnly;
    }

    @Override
    public long getCreatedAtTick() {
        return createdAtTick;
    }

    @Override
    public double getCreatedAtTime() {
        return createdAtTime;
    }

    /**
     * @return an immutable copy of the current position and trait state
     */
    public ParticleSnapshot snapshot() {
        Map<String, TraitState> copies = new LinkedHashMap<>();
        states.forEach((name, state) -> copies.put(name, state.copy()));
        return new ParticleSnapshot(id, site, traitNames, copies, identifyingOnly, createdAtTick, createdAtTime);
    }

    @Override
    public String toString() {
        return "Particle[" + id + "@" + site + " " + traitNames + "]";
    }
}
