package org.ecosocial.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * The state of one episode: agents, resource cells, obstacle cells, the alliance registry
 * and the episode counters.
 * <p>
 * Cells are stored as flat indices ({@code y * gridSize + x}). Resource cells live in a list
 * that permits duplicates: several units may sit on one cell and a visit consumes only one of
 * them. Obstacles form a set and never change during an episode.
 */
public class World {
    private final int gridSize;
    private final List<Agent> agents;
    private final IntArrayList resources;
    private final IntOpenHashSet obstacles;
    private final AllianceManager alliances;

    private int step = 0;
    private int cooperationEvents = 0;
    private int theftEvents = 0;
    private int allianceFormations = 0;

    private World(int gridSize, List<Agent> agents, IntArrayList resources, IntOpenHashSet obstacles) {
        this.gridSize = gridSize;
        this.agents = Collections.unmodifiableList(agents);
        this.resources = resources;
        this.obstacles = obstacles;
        this.alliances = new AllianceManager(this.agents);
    }

    /**
     * Starts building a world of the given size.
     *
     * @param gridSize the side length of the square grid, must be &gt; 0
     * @return a builder
     */
    public static Builder builder(int gridSize) {
        return new Builder(gridSize);
    }

    /**
     * Assembles a world. Agents must be added in id order starting at 0.
     */
    public static final class Builder {
        private final int gridSize;
        private final List<Agent> agents = new ArrayList<>();
        private final IntArrayList resources = new IntArrayList();
        private final IntOpenHashSet obstacles = new IntOpenHashSet();

        private Builder(int gridSize) {
            if (gridSize <= 0) {
                throw new IllegalArgumentException("Grid size must be > 0, got " + gridSize);
            }
            this.gridSize = gridSize;
        }

        public Builder agent(Agent agent) {
            if (agent.getId() != agents.size()) {
                throw new IllegalArgumentException("Agents must be added in id order: expected id "
                        + agents.size() + ", got " + agent.getId());
            }
            requireInBounds(agent.getX(), agent.getY());
            agents.add(agent);
            return this;
        }

        public Builder resource(int x, int y) {
            requireInBounds(x, y);
            resources.add(y * gridSize + x);
            return this;
        }

        public Builder obstacle(int x, int y) {
            requireInBounds(x, y);
            obstacles.add(y * gridSize + x);
            return this;
        }

        public World build() {
            if (agents.isEmpty()) {
                throw new IllegalArgumentException("A world needs at least one agent");
            }
            return new World(gridSize, new ArrayList<>(agents), new IntArrayList(resources), new IntOpenHashSet(obstacles));
        }

        private void requireInBounds(int x, int y) {
            if (x < 0 || x >= gridSize || y < 0 || y >= gridSize) {
                throw new IllegalArgumentException("Position (" + x + "," + y + ") is outside a grid of size " + gridSize);
            }
        }
    }

    public int getGridSize() {
        return gridSize;
    }

    /**
     * Clamps a coordinate into [0, gridSize).
     * @param coordinate the raw coordinate
     * @return the clamped coordinate
     */
    public int clamp(int coordinate) {
        return Math.max(0, Math.min(gridSize - 1, coordinate));
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < gridSize && y >= 0 && y < gridSize;
    }

    /**
     * Converts a coordinate to its flat cell index.
     * @param x the x coordinate, in bounds
     * @param y the y coordinate, in bounds
     * @return the flat index
     */
    public int toFlatIndex(int x, int y) {
        return y * gridSize + x;
    }

    public int xOf(int flatIndex) {
        return flatIndex % gridSize;
    }

    public int yOf(int flatIndex) {
        return flatIndex / gridSize;
    }

    // ==================== Agents ====================

    /**
     * Returns the agent arena in id order.
     * @return an unmodifiable list of agents
     */
    public List<Agent> getAgents() {
        return agents;
    }

    public Agent getAgent(int id) {
        return agents.get(id);
    }

    public int getAgentCount() {
        return agents.size();
    }

    public AllianceManager getAlliances() {
        return alliances;
    }

    // ==================== Cells ====================

    /**
     * Returns whether the cell is an obstacle. Out-of-bounds cells are never obstacles.
     * @param x the x coordinate
     * @param y the y coordinate
     * @return true if the cell holds an obstacle
     */
    public boolean isObstacle(int x, int y) {
        return isInBounds(x, y) && obstacles.contains(toFlatIndex(x, y));
    }

    /**
     * Removes exactly one resource unit from the cell, the first in enumeration order.
     * Other units on the same cell are preserved.
     *
     * @param x the x coordinate
     * @param y the y coordinate
     * @return true if a unit was present and consumed
     */
    public boolean consumeResource(int x, int y) {
        return resources.rem(toFlatIndex(x, y));
    }

    /**
     * Appends a resource unit at the end of the enumeration order.
     * @param x the x coordinate
     * @param y the y coordinate
     */
    public void addResource(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IllegalArgumentException("Resource position (" + x + "," + y + ") is outside the grid");
        }
        resources.add(toFlatIndex(x, y));
    }

    /**
     * Returns the resource cells as flat indices in enumeration order, duplicates included.
     * @return an unmodifiable view of the resource list
     */
    public IntList getResourceCells() {
        return IntLists.unmodifiable(resources);
    }

    public int getResourceCount() {
        return resources.size();
    }

    /**
     * Returns the obstacle cells as flat indices in ascending order.
     * @return a sorted copy of the obstacle set
     */
    public int[] getObstacleCells() {
        int[] cells = obstacles.toIntArray();
        Arrays.sort(cells);
        return cells;
    }

    public int getObstacleCount() {
        return obstacles.size();
    }

    // ==================== Episode counters ====================

    public int getStep() {
        return step;
    }

    public void advanceStep() {
        step++;
    }

    public int getCooperationEvents() {
        return cooperationEvents;
    }

    public void recordCooperation() {
        cooperationEvents++;
    }

    public int getTheftEvents() {
        return theftEvents;
    }

    public void recordTheft() {
        theftEvents++;
    }

    public int getAllianceFormations() {
        return allianceFormations;
    }

    public void recordAllianceFormation() {
        allianceFormations++;
    }
}
