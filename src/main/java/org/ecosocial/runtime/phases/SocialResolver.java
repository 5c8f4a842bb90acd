package org.ecosocial.runtime.phases;

import org.ecosocial.runtime.Config;
import org.ecosocial.runtime.model.Action;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.AllianceManager;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.Signal;
import org.ecosocial.runtime.model.World;
import org.ecosocial.runtime.spatial.NeighborQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Phase 2 of a step: sharing, theft, alliance formation and help signals, followed by the
 * alliance health bonus and the global health decay.
 * <p>
 * Agents act in ascending id order. Each agent captures its radius-2 neighbourhood at the start
 * of its own turn, so it sees what lower-id agents already did in this phase. Every interaction
 * acts on the lowest-id qualifying neighbour and stops there.
 */
public class SocialResolver {
    private static final Logger LOG = LoggerFactory.getLogger(SocialResolver.class);

    private final IntArrayList neighbors = new IntArrayList();

    /**
     * Applies phase 2 and the end-of-step health adjustments.
     *
     * @param world the world to mutate
     * @param actions one validated action per agent
     * @param rewards per-agent rewards for this step, added to in place
     */
    public void resolve(World world, Action[] actions, double[] rewards) {
        for (Agent agent : world.getAgents()) {
            Action action = actions[agent.getId()];
            if (action.isMovement()) {
                continue;
            }
            NeighborQuery.collect(world, agent, Config.INTERACTION_RADIUS, neighbors);

            switch (action) {
                case SHARE -> share(world, agent, rewards);
                case STEAL -> steal(world, agent, rewards);
                case FORM_ALLIANCE -> formAlliance(world, agent, rewards);
                case SIGNAL_HELP -> signalHelp(world, agent, rewards);
                default -> throw new IllegalStateException("Unhandled social action " + action);
            }
        }

        applyAllianceBonus(world);
        for (Agent agent : world.getAgents()) {
            agent.damage(Config.HEALTH_DECAY);
        }
    }

    private void share(World world, Agent actor, double[] rewards) {
        if (actor.getPersonality() != Personality.COOPERATIVE || actor.getFoodInventory() <= 0) {
            return;
        }
        for (int k = 0; k < neighbors.size(); k++) {
            Agent other = world.getAgent(neighbors.getInt(k));
            if (other.getPersonality() == Personality.COOPERATIVE) {
                actor.removeFood(1);
                other.addFood(1);
                other.addScore(1);
                rewards[actor.getId()] += Config.SHARE_REWARD;
                rewards[other.getId()] += Config.SHARE_REWARD;
                world.recordCooperation();
                LOG.debug("Step={} Agent={} shared food with Agent={}", world.getStep(), actor.getId(), other.getId());
                return;
            }
        }
    }

    private void steal(World world, Agent actor, double[] rewards) {
        if (actor.getPersonality() != Personality.AGGRESSIVE) {
            return;
        }
        for (int k = 0; k < neighbors.size(); k++) {
            Agent victim = world.getAgent(neighbors.getInt(k));
            if (victim.getFoodInventory() > 0) {
                int stolen = Math.min(1, victim.getFoodInventory());
                victim.removeFood(stolen);
                actor.addFood(stolen);
                actor.addScore(stolen);
                rewards[actor.getId()] += Config.STEAL_REWARD;
                rewards[victim.getId()] += Config.STEAL_PENALTY;
                world.recordTheft();
                LOG.debug("Step={} Agent={} stole {} food from Agent={}", world.getStep(), actor.getId(), stolen, victim.getId());
                return;
            }
        }
    }

    private void formAlliance(World world, Agent actor, double[] rewards) {
        if (actor.getPersonality() != Personality.COOPERATIVE || actor.isAllied()) {
            return;
        }
        AllianceManager alliances = world.getAlliances();
        for (int k = 0; k < neighbors.size(); k++) {
            Agent partner = world.getAgent(neighbors.getInt(k));
            if (partner.getPersonality() != Personality.COOPERATIVE) {
                continue;
            }
            if (partner.isAllied()) {
                alliances.join(partner.getAllianceId(), actor.getId());
            } else {
                int allianceId = alliances.create(actor.getId(), partner.getId());
                world.recordAllianceFormation();
                LOG.debug("Step={} alliance {} founded by Agent={} and Agent={}", world.getStep(), allianceId, actor.getId(), partner.getId());
            }
            rewards[actor.getId()] += Config.ALLIANCE_REWARD;
            rewards[partner.getId()] += Config.ALLIANCE_REWARD;
            return;
        }
    }

    private void signalHelp(World world, Agent actor, double[] rewards) {
        actor.setSignal(Signal.HELP);
        if (!actor.isAllied()) {
            return;
        }
        // The actor is rewarded once per ally within reach, not once per signal
        IntSortedSet members = world.getAlliances().members(actor.getAllianceId());
        for (int memberId : members) {
            if (neighbors.contains(memberId)) {
                rewards[actor.getId()] += Config.HELP_REWARD;
                rewards[memberId] += Config.HELP_REWARD;
            }
        }
    }

    private static void applyAllianceBonus(World world) {
        AllianceManager alliances = world.getAlliances();
        for (int allianceId : alliances.allianceIds()) {
            IntSortedSet members = alliances.members(allianceId);
            if (members.size() < 2) continue;
            for (int memberId : members) {
                world.getAgent(memberId).heal(Config.ALLIANCE_HEALTH_BONUS);
            }
        }
    }
}
