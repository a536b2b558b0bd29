package org.karo.runtime.rules;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

import org.karo.runtime.ConfigurationException;
import org.karo.runtime.model.Trait;
import org.karo.runtime.spi.ICollisionRule;
import org.karo.runtime.spi.ILifetimeRule;
import org.karo.runtime.spi.IRemovalHandler;
import org.karo.runtime.spi.IStepRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Builds a {@link RuleRegistry} from the {@code karo.rules} configuration block.
 * <p>
 * Each handler is given as {@code className} plus optional {@code options}. The class
 * is instantiated through a public constructor taking the options {@link Config}, or
 * failing that a public no-argument constructor:
 * <pre>
 * rules {
 *   traits {
 *     walker { step { className = "com.example.AlwaysRight" } }
 *     mortal { lifetime { className = "com.example.FixedLifetime", options { ticks = 5 } } }
 *     wall { marker = true }
 *   }
 *   global { collision { className = "com.example.AlwaysSwap" } }
 * }
 * </pre>
 */
public final class RuleRegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistryLoader.class);

    private RuleRegistryLoader() {
    }

    /**
     * @param rulesConfig The {@code karo.rules} block
     * @throws ConfigurationException on unknown classes, wrong types or malformed entries
     */
    public static RuleRegistry load(Config rulesConfig) {
        RuleRegistry registry = new RuleRegistry();
        if (rulesConfig.hasPath("traits")) {
            Config traitsConfig = rulesConfig.getConfig("traits");
            // Sorted so that registration and its logging do not depend on map ordering.
            List<String> names = new ArrayList<>(traitsConfig.root().keySet());
            names.sort(null);
            for (String name : names) {
                registry.register(loadTrait(name, traitsConfig.getConfig(quote(name))));
            }
        }
        if (rulesConfig.hasPath("global")) {
            Config global = rulesConfig.getConfig("global");
            if (global.hasPath("step")) {
                registry.setGlobalStepRule(create(global.getConfig("step"), IStepRule.class, "global step"));
            }
            if (global.hasPath("collision")) {
                registry.setGlobalCollisionRule(create(global.getConfig("collision"), ICollisionRule.class, "global collision"));
            }
            if (global.hasPath("lifetime")) {
                registry.setGlobalLifetimeRule(create(global.getConfig("lifetime"), ILifetimeRule.class, "global lifetime"));
            }
        }
        LOG.info("Loaded {} traits from configuration", registry.getTraits().size());
        return registry;
    }

    private static Trait loadTrait(String name, Config traitConfig) {
        try {
            boolean marker = traitConfig.hasPath("marker") && traitConfig.getBoolean("marker");
            boolean hasHandlers = traitConfig.hasPath("step") || traitConfig.hasPath("collision")
                    || traitConfig.hasPath("lifetime") || traitConfig.hasPath("removal");
            if (marker) {
                if (hasHandlers) {
                    throw new ConfigurationException("Marker trait '" + name + "' must not declare rules");
                }
                return Trait.marker(name);
            }
            Trait.Builder builder = Trait.behavior(name);
            if (traitConfig.hasPath("step")) {
                builder.onStep(create(traitConfig.getConfig("step"), IStepRule.class, name + ".step"));
            }
            if (traitConfig.hasPath("collision")) {
                builder.onCollision(create(traitConfig.getConfig("collision"), ICollisionRule.class, name + ".collision"));
            }
            if (traitConfig.hasPath("lifetime")) {
                builder.onLifetime(create(traitConfig.getConfig("lifetime"), ILifetimeRule.class, name + ".lifetime"));
            }
            if (traitConfig.hasPath("removal")) {
                builder.onRemoval(create(traitConfig.getConfig("removal"), IRemovalHandler.class, name + ".removal"));
            }
            return builder.build();
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid definition of trait '" + name + "': " + e.getMessage(), e);
        }
    }

    static <T> T create(Config handlerConfig, Class<T> type, String where) {
        String className = handlerConfig.getString("className");
        Config options = handlerConfig.hasPath("options") ? handlerConfig.getConfig("options") : ConfigFactory.empty();
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Class " + className + " configured for " + where + " not found", e);
        }
        if (!type.isAssignableFrom(clazz)) {
            throw new ConfigurationException("Class " + className + " configured for " + where
                    + " does not implement " + type.getSimpleName());
        }
        try {
            Object instance;
            try {
                Constructor<?> withOptions = clazz.getConstructor(Config.class);
                instance = withOptions.newInstance(options);
            } catch (NoSuchMethodException e) {
                instance = clazz.getConstructor().newInstance();
            }
            LOG.debug("Instantiated {} for {}", className, where);
            return type.cast(instance);
        } catch (InvocationTargetException e) {
            throw new ConfigurationException("Failed to instantiate " + className + " for " + where + ": "
                    + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Failed to instantiate " + className + " for " + where, e);
        }
    }

    private static String quote(String key) {
        return "\"" + key + "\"";
    }
}
