package org.ecosocial.runtime.phases;

import org.ecosocial.runtime.Config;
import org.ecosocial.runtime.model.Action;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Signal;
import org.ecosocial.runtime.model.World;
import org.ecosocial.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase 1 of a step: signal reset, movement, collisions and foraging.
 * <p>
 * Agents are processed in ascending id order. A movement target is clamped to the grid.
 * Bumping into an obstacle costs health and leaves the agent in place; any other move costs
 * the step penalty, and landing on a resource cell consumes one unit, feeds the agent and
 * immediately respawns a unit at a random cell so the resource count stays constant.
 * Rewards written here overwrite the slot; the social phase adds to it afterwards.
 */
public class MovementResolver {
    private static final Logger LOG = LoggerFactory.getLogger(MovementResolver.class);

    private final IRandomProvider random;

    /**
     * @param random the episode's random source, used for resource respawn
     */
    public MovementResolver(IRandomProvider random) {
        this.random = random;
    }

    /**
     * Applies phase 1 to every agent.
     *
     * @param world the world to mutate
     * @param actions one validated action per agent
     * @param rewards per-agent rewards for this step, written in place
     */
    public void resolve(World world, Action[] actions, double[] rewards) {
        for (Agent agent : world.getAgents()) {
            int id = agent.getId();
            agent.setSignal(Signal.NONE);

            Action action = actions[id];
            if (!action.isMovement()) {
                continue;
            }

            int targetX = world.clamp(agent.getX() + action.getDx());
            int targetY = world.clamp(agent.getY() + action.getDy());

            if (world.isObstacle(targetX, targetY)) {
                agent.damage(Config.COLLISION_DAMAGE);
                rewards[id] = Config.COLLISION_REWARD;
                continue;
            }

            agent.moveTo(targetX, targetY);
            rewards[id] = Config.STEP_REWARD;

            if (world.consumeResource(targetX, targetY)) {
                agent.addFood(1);
                agent.addScore(1);
                agent.heal(Config.FOOD_HEAL);
                rewards[id] = Config.FOOD_REWARD;
                respawnResource(world);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Step={} Agent={} collected food at ({},{})", world.getStep(), id, targetX, targetY);
                }
            }
        }
    }

    private void respawnResource(World world) {
        int x = random.nextInt(world.getGridSize());
        int y = random.nextInt(world.getGridSize());
        world.addResource(x, y);
    }
}
