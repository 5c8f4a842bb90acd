package org.ecosocial.runtime.model;

/**
 * The nine discrete actions an agent can take in a step.
 * Codes 0-4 are handled by the movement phase, codes 5-8 by the social phase.
 */
public enum Action {
    STAY(0, 0, 0),
    UP(1, 0, -1),
    DOWN(2, 0, 1),
    LEFT(3, -1, 0),
    RIGHT(4, 1, 0),
    SHARE(5, 0, 0),
    STEAL(6, 0, 0),
    FORM_ALLIANCE(7, 0, 0),
    SIGNAL_HELP(8, 0, 0);

    /** Smallest valid action code. */
    public static final int MIN_CODE = 0;
    /** Largest valid action code. */
    public static final int MAX_CODE = 8;

    private static final Action[] BY_CODE = values();

    private final int code;
    private final int dx;
    private final int dy;

    Action(int code, int dx, int dy) {
        this.code = code;
        this.dx = dx;
        this.dy = dy;
    }

    public int getCode() {
        return code;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    /**
     * Returns whether this action is resolved by the movement phase.
     * @return true for STAY, UP, DOWN, LEFT and RIGHT
     */
    public boolean isMovement() {
        return code <= RIGHT.code;
    }

    /**
     * Looks up an action by its wire code.
     *
     * @param code the action code
     * @return the action
     * @throws IllegalArgumentException if the code is outside [0, 8]
     */
    public static Action fromCode(int code) {
        if (code < MIN_CODE || code > MAX_CODE) {
            throw new IllegalArgumentException("Action code must be in [" + MIN_CODE + ", " + MAX_CODE + "], got " + code);
        }
        return BY_CODE[code];
    }
}
