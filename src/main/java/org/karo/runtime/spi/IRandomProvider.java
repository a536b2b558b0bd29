package org.karo.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for rules and the engine.
 * <p>
 * The engine owns one base provider built from the configured seed and derives an
 * independent stream per particle with {@code deriveFor("particle", id)}. Because a
 * particle's stream depends only on the seed and its id, results do not depend on
 * evaluation order or on the number of planning threads.
 */
public interface IRandomProvider extends ISerializable {

    /**
     * @return a {@link Random} view backed by this provider's state
     */
    Random asJavaRandom();

    double nextDouble();

    int nextInt(int bound);

    /**
     * Creates an independent stream for the given context.
     *
     * @param context A label for the consumer (e.g. "particle")
     * @param salt A value distinguishing consumers within the context (e.g. the particle id)
     * @return a new provider whose sequence depends only on this provider's seed, context and salt
     */
    IRandomProvider deriveFor(String context, long salt);
}
