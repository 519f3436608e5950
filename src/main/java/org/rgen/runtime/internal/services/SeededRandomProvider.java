package org.rgen.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.rgen.runtime.spi.IRandomProvider;

import java.lang.reflect.Field;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * The generator's internal state (the {@code v} array and {@code index}) is read through
 * reflection so that {@link #saveState()} captures the exact position in the sequence. A world
 * restored from a snapshot therefore draws the same numbers the original would have drawn.
 * </p>
 * <p>
 * Child providers are derived with a SplitMix64/FNV-1a mix of seed, scope and key.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    // Resolved once; every save/load reuses them.
    private final Field vField;
    private final Field indexField;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        try {
            this.vField = rng.getClass().getSuperclass().getDeclaredField("v");
            this.indexField = rng.getClass().getSuperclass().getDeclaredField("index");
            this.vField.setAccessible(true);
            this.indexField.setAccessible(true);
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Failed to initialize RNG reflection fields", e);
        }
    }

    /**
     * @return the seed this provider was created with.
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    public static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    @Override
    public byte[] saveState() {
        try {
            int[] v = (int[]) vField.get(rng);
            int index = indexField.getInt(rng);

            // Layout: index, length, v[0..length)
            ByteBuffer buffer = ByteBuffer.allocate(8 + (v.length * 4));
            buffer.putInt(index);
            buffer.putInt(v.length);
            for (int value : v) {
                buffer.putInt(value);
            }
            return buffer.array();
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to serialize RNG state", e);
        }
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("RNG state cannot be null");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(state);
            int index = buffer.getInt();
            int length = buffer.getInt();

            int[] v = (int[]) vField.get(rng);
            if (length != v.length) {
                throw new IllegalArgumentException(
                    "RNG state has " + length + " words but generator expects " + v.length);
            }
            if (index < 0 || index >= v.length) {
                throw new IllegalArgumentException("RNG state index " + index + " is outside [0, " + v.length + ")");
            }
            for (int i = 0; i < v.length; i++) {
                v[i] = buffer.getInt();
            }
            indexField.setInt(rng, index);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("RNG state is truncated", e);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Failed to deserialize RNG state", e);
        }
    }
}
