package org.karo.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.karo.runtime.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;

/**
 * Registration request for a new particle: initial site, trait names in attachment
 * order and initial trait-private state. Ids are assigned by the simulation.
 */
public final class ParticleSpec {

    private final int site;
    private final List<String> traits;
    private final Map<String, TraitState> state;

    private ParticleSpec(Builder builder) {
        this.site = builder.site;
        this.traits = List.copyOf(builder.traits);
        Map<String, TraitState> copy = new LinkedHashMap<>();
        builder.state.forEach((trait, values) -> copy.put(trait, values.copy()));
        this.state = Collections.unmodifiableMap(copy);
    }

    public static Builder at(int site) {
        return new Builder(site);
    }

    /**
     * Reads one entry of the {@code karo.particles} list:
     * <pre>
     * { site = 2, traits = [walker, mortal], state { mortal { lifetime = 5 } } }
     * </pre>
     *
     * @throws ConfigurationException on missing or malformed keys
     */
    public static ParticleSpec fromConfig(Config config) {
        try {
            Builder builder = at(config.getInt("site"));
            builder.traits(config.getStringList("traits").toArray(new String[0]));
            if (config.hasPath("state")) {
                ConfigObject stateObject = config.getObject("state");
                for (Map.Entry<String, ConfigValue> traitEntry : stateObject.entrySet()) {
                    if (!(traitEntry.getValue() instanceof ConfigObject values)) {
                        throw new ConfigurationException("State of trait '" + traitEntry.getKey() + "' must be an object");
                    }
                    for (Map.Entry<String, Object> value : values.unwrapped().entrySet()) {
                        builder.state(traitEntry.getKey(), value.getKey(), value.getValue());
                    }
                }
            }
            return builder.build();
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid particle definition " + config.root().render() + ": " + e.getMessage(), e);
        }
    }

    public int getSite() {
        return site;
    }

    public List<String> getTraits() {
        return traits;
    }

    /**
     * @return initial state per trait name
     */
    public Map<String, TraitState> getState() {
        return state;
    }

    @Override
    public String toString() {
        return "ParticleSpec[site=" + site + ", traits=" + traits + ", state=" + state + "]";
    }

    public static final class Builder {
        private final int site;
        private final List<String> traits = new ArrayList<>();
        private final Map<String, TraitState> state = new LinkedHashMap<>();

        private Builder(int site) {
            this.site = site;
        }

        /**
         * Appends traits; the order of calls defines attachment order.
         */
        public Builder traits(String... names) {
            Collections.addAll(traits, names);
            return this;
        }

        /**
         * Sets one initial state value of a trait; see {@link TraitState#put(String, Object)}.
         */
        public Builder state(String trait, String key, Object value) {
            state.computeIfAbsent(trait, t -> new TraitState()).put(key, value);
            return this;
        }

        public ParticleSpec build() {
            return new ParticleSpec(this);
        }
    }
}
