package org.ecosocial.runtime.spatial;

import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.World;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Radius-bounded neighbour lookup over the agent arena.
 * <p>
 * Returns every other agent whose Euclidean distance to the centre agent is at most the radius,
 * boundary included, in ascending id order. Callers rely on that order for their
 * "lowest id wins" tie-breaks. Distances are compared squared in integer arithmetic, so the
 * boundary test is exact.
 * <p>
 * The scan is O(N) per query. A spatial index could replace it as long as it returns the same
 * sets in the same order.
 */
public final class NeighborQuery {

    private NeighborQuery() {}

    /**
     * Collects the neighbours of an agent.
     *
     * @param world the world
     * @param center the agent whose neighbourhood is queried (never part of the result)
     * @param radius the inclusive radius
     * @return a new list of neighbour ids in ascending order
     */
    public static IntArrayList within(World world, Agent center, int radius) {
        IntArrayList result = new IntArrayList();
        collect(world, center, radius, result);
        return result;
    }

    /**
     * Collects the neighbours of an agent into a caller-owned list, which is cleared first.
     *
     * @param world the world
     * @param center the agent whose neighbourhood is queried
     * @param radius the inclusive radius
     * @param out receives neighbour ids in ascending order
     */
    public static void collect(World world, Agent center, int radius, IntArrayList out) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be >= 0, got " + radius);
        }
        out.clear();
        long radiusSquared = (long) radius * radius;
        for (Agent other : world.getAgents()) {
            if (other.getId() == center.getId()) continue;
            long dx = other.getX() - center.getX();
            long dy = other.getY() - center.getY();
            if (dx * dx + dy * dy <= radiusSquared) {
                out.add(other.getId());
            }
        }
    }
}
