package org.ecosocial.test.utils;

import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.World;

/**
 * Shorthands for building small hand-placed worlds.
 */
public final class Worlds {

    private Worlds() {}

    public static Agent agent(int id, Personality personality, int x, int y) {
        return Agent.create(id, personality, x, y);
    }

    public static Agent agentWithFood(int id, Personality personality, int x, int y, int food) {
        return Agent.restore(id, personality).position(x, y).foodInventory(food).build();
    }

    public static World of(int gridSize, Agent... agents) {
        World.Builder builder = World.builder(gridSize);
        for (Agent agent : agents) {
            builder.agent(agent);
        }
        return builder.build();
    }
}
