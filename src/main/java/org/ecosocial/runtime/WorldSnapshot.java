package org.ecosocial.runtime;

import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.Signal;

/**
 * Detached, read-only copy of the world for display and telemetry. Changing the arrays has no
 * effect on the simulation.
 *
 * @param gridSize side length of the grid
 * @param agents agent positions as {x, y}, in id order
 * @param food resource cells as {x, y}, in enumeration order, duplicates included
 * @param obstacles obstacle cells as {x, y}
 * @param scores agent scores
 * @param health agent health values
 * @param personalities agent personalities
 * @param alliances agent alliance ids, -1 for none
 * @param foodInventory agent food inventories
 * @param communication agent signals
 * @param steps completed steps
 * @param survivalRate fraction of agents with a score above zero
 * @param cooperationEvents cumulative shares
 * @param theftEvents cumulative thefts
 * @param numAlliances alliances currently registered
 * @param avgHealth mean agent health
 */
public record WorldSnapshot(
    int gridSize,
    int[][] agents,
    int[][] food,
    int[][] obstacles,
    int[] scores,
    double[] health,
    Personality[] personalities,
    int[] alliances,
    int[] foodInventory,
    Signal[] communication,
    int steps,
    double survivalRate,
    int cooperationEvents,
    int theftEvents,
    int numAlliances,
    double avgHealth
) {}
