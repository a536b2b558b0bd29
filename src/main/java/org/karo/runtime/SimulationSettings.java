package org.karo.runtime;

import java.util.Locale;

import org.karo.runtime.model.Boundary;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Immutable run parameters of a {@link Simulation}.
 *
 * @param trackLength Number of sites
 * @param boundary Behaviour of the track ends
 * @param mode Synchronous ticks or asynchronous events; never mixed within a run
 * @param seed Seed of the random streams
 * @param tieBreak Winner among particles requesting the same site in one tick
 * @param parallelism Planning threads for synchronous ticks: 0 = auto, 1 = sequential, N = exactly N
 * @param maxTicks Tick (or processed-event) limit, 0 = unlimited
 * @param maxTime Simulation time limit, 0 = unlimited
 * @param checkInvariants Verify occupancy against particle positions after every commit
 */
public record SimulationSettings(
        int trackLength,
        Boundary boundary,
        SchedulingMode mode,
        long seed,
        TieBreak tieBreak,
        int parallelism,
        long maxTicks,
        double maxTime,
        boolean checkInvariants) {

    public SimulationSettings {
        if (trackLength < 1) {
            throw new ConfigurationException("track.length must be positive, got " + trackLength);
        }
        if (boundary == null || mode == null || tieBreak == null) {
            throw new ConfigurationException("boundary, mode and tie-break must be set");
        }
        if (parallelism < 0) {
            throw new ConfigurationException("simulation.parallelism must be >= 0, got " + parallelism);
        }
        if (maxTicks < 0) {
            throw new ConfigurationException("simulation.max-ticks must be >= 0, got " + maxTicks);
        }
        if (Double.isNaN(maxTime) || maxTime < 0) {
            throw new ConfigurationException("simulation.max-time must be >= 0, got " + maxTime);
        }
    }

    /**
     * Reads the {@code karo} block. Missing keys take the defaults of {@code reference.conf}.
     *
     * @throws ConfigurationException on missing or invalid values
     */
    public static SimulationSettings fromConfig(Config karo) {
        try {
            Config track = karo.getConfig("track");
            Config simulation = karo.hasPath("simulation") ? karo.getConfig("simulation") : null;
            Builder builder = builder()
                    .trackLength(track.getInt("length"));
            if (track.hasPath("boundary")) {
                builder.boundary(parseEnum(Boundary.class, track.getString("boundary"), "track.boundary"));
            }
            if (simulation != null) {
                if (simulation.hasPath("mode")) {
                    builder.mode(parseEnum(SchedulingMode.class, simulation.getString("mode"), "simulation.mode"));
                }
                if (simulation.hasPath("seed")) {
                    builder.seed(simulation.getLong("seed"));
                }
                if (simulation.hasPath("tie-break")) {
                    builder.tieBreak(parseEnum(TieBreak.class, simulation.getString("tie-break"), "simulation.tie-break"));
                }
                if (simulation.hasPath("parallelism")) {
                    builder.parallelism(simulation.getInt("parallelism"));
                }
                if (simulation.hasPath("max-ticks")) {
                    builder.maxTicks(simulation.getLong("max-ticks"));
                }
                if (simulation.hasPath("max-time")) {
                    builder.maxTime(simulation.getDouble("max-time"));
                }
                if (simulation.hasPath("check-invariants")) {
                    builder.checkInvariants(simulation.getBoolean("check-invariants"));
                }
            }
            return builder.build();
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid simulation configuration: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialised with these settings
     */
    public Builder toBuilder() {
        return new Builder()
                .trackLength(trackLength)
                .boundary(boundary)
                .mode(mode)
                .seed(seed)
                .tieBreak(tieBreak)
                .parallelism(parallelism)
                .maxTicks(maxTicks)
                .maxTime(maxTime)
                .checkInvariants(checkInvariants);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown value '" + value + "' for " + key, e);
        }
    }

    public static final class Builder {
        private int trackLength = 10;
        private Boundary boundary = Boundary.CLOSED;
        private SchedulingMode mode = SchedulingMode.SYNCHRONOUS;
        private long seed = 42L;
        private TieBreak tieBreak = TieBreak.LOWEST_ID;
        private int parallelism = 1;
        private long maxTicks;
        private double maxTime;
        private boolean checkInvariants = true;

        private Builder() {
        }

        public Builder trackLength(int trackLength) {
            this.trackLength = trackLength;
            return this;
        }

        public Builder boundary(Boundary boundary) {
            this.boundary = boundary;
            return this;
        }

        public Builder mode(SchedulingMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder tieBreak(TieBreak tieBreak) {
            this.tieBreak = tieBreak;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxTicks(long maxTicks) {
            this.maxTicks = maxTicks;
            return this;
        }

        public Builder maxTime(double maxTime) {
            this.maxTime = maxTime;
            return this;
        }

        public Builder checkInvariants(boolean checkInvariants) {
            this.checkInvariants = checkInvariants;
            return this;
        }

        public SimulationSettings build() {
            return new SimulationSettings(trackLength, boundary, mode, seed, tieBreak, parallelism,
                    maxTicks, maxTime, checkInvariants);
        }
    }
}
