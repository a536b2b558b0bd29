package org.karo.runtime.internal;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.util.Random;

import org.karo.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link java.util.Random}.
 * <p>
 * Derived streams are seeded from a SplitMix64 mix of this provider's seed, the
 * context label and the salt, so they depend neither on the order in which they are
 * derived nor on how much of this stream has been consumed.
 * <p>
 * <b>Thread safety:</b> not thread-safe. Each particle owns its stream and is
 * planned by a single thread.
 */
public class SeededRandomProvider implements IRandomProvider {

    private long seed;
    private Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long mixed = mix(seed ^ mix(context.hashCode()) ^ mix(salt * 0x9E3779B97F4A7C15L));
        return new SeededRandomProvider(mixed);
    }

    /**
     * Layout: seed (8 bytes) followed by the serialized {@link Random}, which carries
     * the current position of the stream.
     */
    @Override
    public byte[] saveState() {
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeLong(seed);
            try (ObjectOutputStream objects = new ObjectOutputStream(out)) {
                objects.writeObject(random);
            }
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save random state", e);
        }
    }

    @Override
    public void loadState(byte[] state) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(state))) {
            long restoredSeed = in.readLong();
            try (ObjectInputStream objects = new ObjectInputStream(in)) {
                Random restored = (Random) objects.readObject();
                this.seed = restoredSeed;
                this.random = restored;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load random state", e);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Failed to load random state", e);
        }
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
