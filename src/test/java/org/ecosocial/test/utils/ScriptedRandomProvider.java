package org.ecosocial.test.utils;

import java.util.ArrayDeque;
import java.util.Deque;

import org.ecosocial.runtime.spi.IRandomProvider;

/**
 * Random provider that replays scripted values and then returns zero, for tests that must
 * know exactly where a resource respawns or which personality is drawn.
 */
public final class ScriptedRandomProvider implements IRandomProvider {

    private final Deque<Integer> ints = new ArrayDeque<>();
    private final Deque<Double> doubles = new ArrayDeque<>();
    private int intCalls;
    private int doubleCalls;

    public ScriptedRandomProvider ints(int... values) {
        for (int v : values) {
            ints.add(v);
        }
        return this;
    }

    public ScriptedRandomProvider doubles(double... values) {
        for (double v : values) {
            doubles.add(v);
        }
        return this;
    }

    @Override
    public int nextInt(int bound) {
        intCalls++;
        Integer next = ints.poll();
        return next == null ? 0 : Math.floorMod(next, bound);
    }

    @Override
    public double nextDouble() {
        doubleCalls++;
        Double next = doubles.poll();
        return next == null ? 0.0 : next;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return this;
    }

    public int getIntCalls() {
        return intCalls;
    }

    public int getDoubleCalls() {
        return doubleCalls;
    }
}
