package org.ecosocial.runtime.model;

/**
 * A single entity living on the grid.
 * <p>
 * The id doubles as the agent's index in the world's agent list and is never reused within
 * an episode. Personality is fixed at creation; every other field is mutated only by the
 * step phases. Alliance membership is assigned exclusively through {@link AllianceManager}.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Agents are mutated only on the stepping thread; the
 * parallel encoding pass reads them after all mutation for the step is finished.
 */
public class Agent {

    /** Marker value of {@link #getAllianceId()} for an agent without an alliance. */
    public static final int NO_ALLIANCE = -1;

    /** Upper bound of {@link #getHealth()}. */
    public static final double MAX_HEALTH = 100.0;

    private final int id;
    private final Personality personality;
    private int x;
    private int y;
    private double health = MAX_HEALTH;
    private int score = 0;
    private int allianceId = NO_ALLIANCE;
    private int foodInventory = 0;
    private Signal signal = Signal.NONE;

    private Agent(int id, Personality personality, int x, int y) {
        if (id < 0) {
            throw new IllegalArgumentException("Agent id must be >= 0, got " + id);
        }
        if (personality == null) {
            throw new IllegalArgumentException("Personality must not be null");
        }
        this.id = id;
        this.personality = personality;
        this.x = x;
        this.y = y;
    }

    /**
     * Creates a fresh agent with default mutable state (health 100, score 0, empty inventory,
     * no alliance, no signal).
     *
     * @param id the agent id
     * @param personality the immutable personality
     * @param x the initial x coordinate
     * @param y the initial y coordinate
     * @return the new agent
     */
    public static Agent create(int id, Personality personality, int x, int y) {
        return new Agent(id, personality, x, y);
    }

    /**
     * Starts a builder that restores an agent with explicit mutable state, for scenario setup.
     *
     * @param id the agent id
     * @param personality the immutable personality
     * @return a builder
     */
    public static RestoreBuilder restore(int id, Personality personality) {
        return new RestoreBuilder(id, personality);
    }

    /**
     * Builder for agents with non-default state. Alliance membership is not restorable here;
     * it must be established through {@link AllianceManager}.
     */
    public static final class RestoreBuilder {
        private final int id;
        private final Personality personality;
        private int x;
        private int y;
        private double health = MAX_HEALTH;
        private int score;
        private int foodInventory;

        private RestoreBuilder(int id, Personality personality) {
            this.id = id;
            this.personality = personality;
        }

        public RestoreBuilder position(int x, int y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public RestoreBuilder health(double health) {
            this.health = health;
            return this;
        }

        public RestoreBuilder score(int score) {
            this.score = score;
            return this;
        }

        public RestoreBuilder foodInventory(int foodInventory) {
            this.foodInventory = foodInventory;
            return this;
        }

        /**
         * Builds the agent.
         *
         * @return the restored agent
         * @throws IllegalArgumentException if any value is outside its valid range
         */
        public Agent build() {
            if (health < 0.0 || health > MAX_HEALTH) {
                throw new IllegalArgumentException("Health must be in [0, " + MAX_HEALTH + "], got " + health);
            }
            if (score < 0 || foodInventory < 0) {
                throw new IllegalArgumentException("Score and food inventory must be >= 0");
            }
            Agent agent = new Agent(id, personality, x, y);
            agent.health = health;
            agent.score = score;
            agent.foodInventory = foodInventory;
            return agent;
        }
    }

    public int getId() { return id; }

    public Personality getPersonality() { return personality; }

    public int getX() { return x; }

    public int getY() { return y; }

    public double getHealth() { return health; }

    public int getScore() { return score; }

    public int getAllianceId() { return allianceId; }

    public boolean isAllied() { return allianceId != NO_ALLIANCE; }

    public int getFoodInventory() { return foodInventory; }

    public Signal getSignal() { return signal; }

    /**
     * Moves the agent. Bounds are the caller's responsibility.
     * @param newX the new x coordinate
     * @param newY the new y coordinate
     */
    public void moveTo(int newX, int newY) {
        this.x = newX;
        this.y = newY;
    }

    /**
     * Increases health, capped at {@link #MAX_HEALTH}.
     * @param amount the non-negative amount to add
     */
    public void heal(double amount) {
        this.health = Math.min(MAX_HEALTH, this.health + amount);
    }

    /**
     * Decreases health, floored at zero.
     * @param amount the non-negative amount to subtract
     */
    public void damage(double amount) {
        this.health = Math.max(0.0, this.health - amount);
    }

    /**
     * Adds to the score. Scores never decrease within an episode.
     * @param amount the amount to add
     * @throws IllegalArgumentException if amount is negative
     */
    public void addScore(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Score increment must be >= 0, got " + amount);
        }
        this.score += amount;
    }

    /**
     * Adds food units to the inventory.
     * @param amount the non-negative amount to add
     */
    public void addFood(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Food increment must be >= 0, got " + amount);
        }
        this.foodInventory += amount;
    }

    /**
     * Removes food units from the inventory.
     * @param amount the amount to remove
     * @throws IllegalStateException if the inventory holds fewer units
     */
    public void removeFood(int amount) {
        if (amount < 0 || amount > foodInventory) {
            throw new IllegalStateException("Agent " + id + " cannot give up " + amount + " food, holds " + foodInventory);
        }
        this.foodInventory -= amount;
    }

    public void setSignal(Signal signal) {
        this.signal = signal;
    }

    void setAllianceId(int allianceId) {
        this.allianceId = allianceId;
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", " + personality + ", pos=(" + x + "," + y + "), health=" + health
                + ", score=" + score + ", food=" + foodInventory + ", alliance=" + allianceId + ", signal=" + signal + "}";
    }
}
