package org.karo.runtime.model;

import java.util.List;
import java.util.Map;

/**
 * Frozen copy of a particle. Used for the pre-tick view of the track and for
 * observer snapshots.
 */
public final class ParticleSnapshot implements ParticleView {

    private final int id;
    private final int site;
    private final List<String> traitNames;
    private final Map<String, TraitState> states;
    private final boolean identifyingOnly;
    private final long createdAtTick;
    private final double createdAtTime;

    ParticleSnapshot(int id, int site, List<String> traitNames, Map<String, TraitState> states,
                     boolean identifyingOnly, long createdAtTick, double createdAtTime) {
        this.id = id;
        this.site = site;
        this.traitNames = traitNames;
        this.states = states;
        this.identifyingOnly = identifyingOnly;
        this.createdAtTick = createdAtTick;
        this.createdAtTime = createdAtTime;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int getSite() {
        return site;
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
        TraitState state = states.get(traitName);
        if (state == null) {
            throw new IllegalArgumentException("Particle " + id + " has no trait '" + traitName + "'");
        }
        return state;
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

    @Override
    public String toString() {
        return "ParticleSnapshot[" + id + "@" + site + " " + traitNames + "]";
    }
}
