package org.karo.runtime.resume;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import org.karo.runtime.EngineState;
import org.karo.runtime.Simulation;
import org.karo.runtime.SimulationSettings;
import org.karo.runtime.internal.ScheduledEvent;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.TraitState;
import org.karo.runtime.model.TraitStateView;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Converts simulations to {@link SimulationCheckpoint}s and checkpoints to and from JSON.
 * <p>
 * Doubles are written by Gson with their shortest round-trip representation, so a
 * restored run sees exactly the same clock and event times.
 */
public final class CheckpointCodec {

    public static final int FORMAT_VERSION = 1;

    private static final Gson GSON = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    private CheckpointCodec() {
    }

    /**
     * Captures the state of an idle simulation.
     *
     * @throws CheckpointException if the simulation is in the middle of a step or has failed
     */
    public static SimulationCheckpoint capture(Simulation simulation) {
        if (simulation.getState() != EngineState.IDLE && simulation.getState() != EngineState.FINISHED) {
            throw new CheckpointException("Cannot checkpoint a simulation in state " + simulation.getState());
        }
        SimulationSettings settings = simulation.getSettings();
        SimulationCheckpoint.Settings settingsData = new SimulationCheckpoint.Settings(
                settings.trackLength(),
                settings.boundary().name(),
                settings.mode().name(),
                settings.seed(),
                settings.tieBreak().name(),
                settings.parallelism(),
                settings.maxTicks(),
                settings.maxTime(),
                settings.checkInvariants());

        List<SimulationCheckpoint.ParticleData> particles = new ArrayList<>();
        for (Particle particle : simulation.getParticlesForCheckpoint()) {
            List<SimulationCheckpoint.TraitStateData> states = new ArrayList<>();
            for (String trait : particle.getTraitNames()) {
                states.add(new SimulationCheckpoint.TraitStateData(trait, encodeState(particle.getState(trait))));
            }
            particles.add(new SimulationCheckpoint.ParticleData(
                    particle.getId(),
                    particle.getSite(),
                    particle.getTraitNames(),
                    states,
                    Base64.getEncoder().encodeToString(particle.getRandom().saveState()),
                    particle.getCreatedAtTick(),
                    particle.getCreatedAtTime()));
        }

        List<SimulationCheckpoint.EventData> events = new ArrayList<>();
        for (ScheduledEvent event : simulation.getPendingEvents()) {
            events.add(new SimulationCheckpoint.EventData(event.time(), event.sequence(), event.particleId(), event.kind().name()));
        }

        return new SimulationCheckpoint(FORMAT_VERSION, settingsData, simulation.getTick(), simulation.getTime(),
                simulation.getNextParticleId(), simulation.getNextEventSequence(), particles, events);
    }

    public static String toJson(SimulationCheckpoint checkpoint) {
        return GSON.toJson(checkpoint);
    }

    /**
     * Shorthand for {@code toJson(capture(simulation))}.
     */
    public static String toJson(Simulation simulation) {
        return toJson(capture(simulation));
    }

    /**
     * @throws CheckpointException on malformed JSON or an unsupported format version
     */
    public static SimulationCheckpoint fromJson(String json) {
        SimulationCheckpoint checkpoint;
        try {
            checkpoint = GSON.fromJson(json, SimulationCheckpoint.class);
        } catch (JsonParseException e) {
            throw new CheckpointException("Malformed checkpoint: " + e.getMessage(), e);
        }
        if (checkpoint == null) {
            throw new CheckpointException("Empty checkpoint");
        }
        if (checkpoint.formatVersion() != FORMAT_VERSION) {
            throw new CheckpointException("Unsupported checkpoint format version " + checkpoint.formatVersion()
                    + " (expected " + FORMAT_VERSION + ")");
        }
        if (checkpoint.settings() == null || checkpoint.particles() == null || checkpoint.events() == null) {
            throw new CheckpointException("Checkpoint is missing settings, particles or events");
        }
        return checkpoint;
    }

    static List<SimulationCheckpoint.StateEntry> encodeState(TraitStateView state) {
        List<SimulationCheckpoint.StateEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Object> entry : state.asMap().entrySet()) {
            Object value = entry.getValue();
            String type;
            if (value instanceof Integer) {
                type = "int";
            } else if (value instanceof Long) {
                type = "long";
            } else if (value instanceof Double) {
                type = "double";
            } else if (value instanceof Boolean) {
                type = "boolean";
            } else {
                type = "string";
            }
            entries.add(new SimulationCheckpoint.StateEntry(entry.getKey(), type, String.valueOf(value)));
        }
        return entries;
    }

    static TraitState decodeState(List<SimulationCheckpoint.StateEntry> entries) {
        TraitState state = new TraitState();
        for (SimulationCheckpoint.StateEntry entry : entries) {
            try {
                switch (entry.type()) {
                    case "int" -> state.set(entry.key(), Integer.parseInt(entry.value()));
                    case "long" -> state.set(entry.key(), Long.parseLong(entry.value()));
                    case "double" -> state.set(entry.key(), Double.parseDouble(entry.value()));
                    case "boolean" -> state.set(entry.key(), Boolean.parseBoolean(entry.value()));
                    case "string" -> state.set(entry.key(), entry.value());
                    default -> throw new CheckpointException("Unknown state type '" + entry.type() + "' for key " + entry.key());
                }
            } catch (NumberFormatException e) {
                throw new CheckpointException("Invalid " + entry.type() + " value '" + entry.value() + "' for key " + entry.key(), e);
            }
        }
        return state;
    }

    static ScheduledEvent decodeEvent(SimulationCheckpoint.EventData data) {
        try {
            return new ScheduledEvent(data.time(), data.sequence(), data.particleId(), ScheduledEvent.Kind.valueOf(data.kind()));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CheckpointException("Unknown event kind '" + data.kind() + "'", e);
        }
    }
}
