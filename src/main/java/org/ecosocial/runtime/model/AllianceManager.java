package org.ecosocial.runtime.model;

import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * Registry of alliances for one episode and the only mutation path for agent alliance ids.
 * <p>
 * Invariants, checked after every mutation:
 * <ul>
 *   <li>every alliance has at least two members,</li>
 *   <li>member sets are pairwise disjoint,</li>
 *   <li>an agent's alliance id is set if and only if it is a member of that alliance.</li>
 * </ul>
 * Alliances only ever grow. Ids are assigned from 0 upwards and never reused.
 * <p>
 * An agent that already belongs to an alliance can neither found a new one nor join another:
 * such a request is rejected with {@link IllegalStateException} instead of merging alliances.
 */
public class AllianceManager {

    private final List<Agent> agents;
    private final Int2ObjectRBTreeMap<IntRBTreeSet> alliances = new Int2ObjectRBTreeMap<>();
    private int nextAllianceId = 0;

    /**
     * Creates an empty registry over the given agent arena.
     * @param agents the agents, indexed by id
     */
    public AllianceManager(List<Agent> agents) {
        this.agents = agents;
    }

    /**
     * Founds a new alliance with exactly two members.
     *
     * @param founderId the acting agent
     * @param partnerId the partner agent
     * @return the id of the new alliance
     * @throws IllegalArgumentException if both ids are equal or unknown
     * @throws IllegalStateException if either agent is already allied
     */
    public int create(int founderId, int partnerId) {
        if (founderId == partnerId) {
            throw new IllegalArgumentException("An alliance needs two distinct agents, got " + founderId + " twice");
        }
        Agent founder = agent(founderId);
        Agent partner = agent(partnerId);
        requireUnallied(founder);
        requireUnallied(partner);

        int allianceId = nextAllianceId++;
        IntRBTreeSet members = new IntRBTreeSet();
        members.add(founderId);
        members.add(partnerId);
        alliances.put(allianceId, members);
        founder.setAllianceId(allianceId);
        partner.setAllianceId(allianceId);

        verifyAlliance(allianceId);
        return allianceId;
    }

    /**
     * Adds an unallied agent to an existing alliance.
     *
     * @param allianceId the alliance to join
     * @param memberId the joining agent
     * @throws IllegalArgumentException if the alliance or agent does not exist
     * @throws IllegalStateException if the agent is already allied
     */
    public void join(int allianceId, int memberId) {
        IntRBTreeSet members = alliances.get(allianceId);
        if (members == null) {
            throw new IllegalArgumentException("Unknown alliance " + allianceId);
        }
        Agent member = agent(memberId);
        requireUnallied(member);

        members.add(memberId);
        member.setAllianceId(allianceId);

        verifyAlliance(allianceId);
    }

    /**
     * Returns the members of an alliance in ascending id order.
     *
     * @param allianceId the alliance id
     * @return an unmodifiable view of the member set
     * @throws IllegalArgumentException if the alliance does not exist
     */
    public IntSortedSet members(int allianceId) {
        IntRBTreeSet members = alliances.get(allianceId);
        if (members == null) {
            throw new IllegalArgumentException("Unknown alliance " + allianceId);
        }
        return IntSortedSets.unmodifiable(members);
    }

    /**
     * Returns the ids of all alliances in ascending order.
     * @return an unmodifiable view of the alliance ids
     */
    public IntSortedSet allianceIds() {
        return IntSortedSets.unmodifiable(alliances.keySet());
    }

    /**
     * Returns the alliance of an agent.
     * @param agentId the agent id
     * @return the alliance id, or {@link Agent#NO_ALLIANCE}
     */
    public int allianceOf(int agentId) {
        return agent(agentId).getAllianceId();
    }

    /**
     * Returns the number of alliances currently registered.
     * @return the alliance count
     */
    public int size() {
        return alliances.size();
    }

    /**
     * Returns the id the next created alliance will receive, which equals the number of
     * alliances ever created in this episode.
     * @return the next alliance id
     */
    public int getNextAllianceId() {
        return nextAllianceId;
    }

    /**
     * Checks the full membership invariant across all agents and alliances.
     *
     * @throws IllegalStateException if any invariant is violated
     */
    public void verifyConsistency() {
        for (Agent agent : agents) {
            int allianceId = agent.getAllianceId();
            if (allianceId == Agent.NO_ALLIANCE) {
                continue;
            }
            IntRBTreeSet members = alliances.get(allianceId);
            if (members == null || !members.contains(agent.getId())) {
                throw new IllegalStateException("Agent " + agent.getId() + " claims alliance " + allianceId
                        + " but is not one of its members");
            }
        }
        for (int allianceId : alliances.keySet()) {
            verifyAlliance(allianceId);
        }
    }

    private void verifyAlliance(int allianceId) {
        IntRBTreeSet members = alliances.get(allianceId);
        if (members.size() < 2) {
            throw new IllegalStateException("Alliance " + allianceId + " has " + members.size() + " member(s), needs at least 2");
        }
        for (int memberId : members) {
            int claimed = agent(memberId).getAllianceId();
            if (claimed != allianceId) {
                throw new IllegalStateException("Agent " + memberId + " is a member of alliance " + allianceId
                        + " but its alliance id is " + claimed);
            }
        }
    }

    private static void requireUnallied(Agent agent) {
        if (agent.isAllied()) {
            throw new IllegalStateException("Agent " + agent.getId() + " already belongs to alliance " + agent.getAllianceId());
        }
    }

    private Agent agent(int agentId) {
        if (agentId < 0 || agentId >= agents.size()) {
            throw new IllegalArgumentException("Unknown agent " + agentId);
        }
        return agents.get(agentId);
    }
}
