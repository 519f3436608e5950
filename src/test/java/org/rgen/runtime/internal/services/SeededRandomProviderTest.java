package org.rgen.runtime.internal.services;

import org.rgen.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class SeededRandomProviderTest {

    private static List<Integer> draw(IRandomProvider random, int count) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(random.nextInt(1000));
        }
        return values;
    }

    @Test
    void sameSeed_producesSameSequence() {
        assertEquals(draw(new SeededRandomProvider(42), 50), draw(new SeededRandomProvider(42), 50));
        assertNotEquals(draw(new SeededRandomProvider(42), 50), draw(new SeededRandomProvider(43), 50));
    }

    @Test
    void deriveFor_isStableAndScoped() {
        SeededRandomProvider root = new SeededRandomProvider(7);
        root.nextInt(10);

        // Derivation depends on the seed only, not on how far the parent has advanced.
        assertEquals(draw(root.deriveFor("spawn", 3), 20), draw(new SeededRandomProvider(7).deriveFor("spawn", 3), 20));
        assertNotEquals(draw(root.deriveFor("spawn", 3), 20), draw(root.deriveFor("spawn", 4), 20));
        assertNotEquals(draw(root.deriveFor("spawn", 3), 20), draw(root.deriveFor("world", 3), 20));
    }

    @Test
    void saveState_resumesExactSequence() {
        SeededRandomProvider original = new SeededRandomProvider(1234);
        draw(original, 777);
        byte[] state = original.saveState();

        SeededRandomProvider restored = new SeededRandomProvider(0);
        restored.loadState(state);

        assertEquals(draw(original, 100), draw(restored, 100));
        assertEquals(original.nextDouble(), restored.nextDouble());
    }

    @Test
    void loadState_rejectsInvalidState() {
        SeededRandomProvider random = new SeededRandomProvider(1);
        byte[] state = random.saveState();

        assertThrows(IllegalArgumentException.class, () -> random.loadState(null));
        assertThrows(IllegalArgumentException.class, () -> random.loadState(Arrays.copyOf(state, 20)));
        assertThrows(IllegalArgumentException.class, () -> random.loadState(new byte[] {0, 0, 0, 0, 0, 0, 0, 3}));

        byte[] farIndex = state.clone();
        farIndex[0] = 0x7f;
        assertThrows(IllegalArgumentException.class, () -> random.loadState(farIndex));
        byte[] negativeIndex = state.clone();
        negativeIndex[0] = (byte) 0xff;
        assertThrows(IllegalArgumentException.class, () -> random.loadState(negativeIndex));
    }

    @Test
    void loadState_acceptsLastValidIndex() {
        SeededRandomProvider random = new SeededRandomProvider(9);
        byte[] state = random.saveState();
        ByteBuffer.wrap(state).putInt(0, 623);

        random.loadState(state);
        assertTrue(random.nextInt(10) >= 0);
    }

    @Test
    void nextIntBetween_staysInclusive() {
        SeededRandomProvider random = new SeededRandomProvider(5);
        for (int i = 0; i < 500; i++) {
            int value = random.nextIntBetween(-2, 2);
            assertTrue(value >= -2 && value <= 2);
        }
        assertThrows(IllegalArgumentException.class, () -> random.nextIntBetween(3, 2));
    }

    @Test
    void hashString_isStable() {
        assertEquals(SeededRandomProvider.hashString("forge"), SeededRandomProvider.hashString("forge"));
        assertNotEquals(SeededRandomProvider.hashString("forge"), SeededRandomProvider.hashString("tavern"));
        assertEquals(0L, SeededRandomProvider.hashString(null));
    }
}
