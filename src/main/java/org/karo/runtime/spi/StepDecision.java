package org.karo.runtime.spi;

/**
 * The answer of an {@link IStepRule}.
 * <p>
 * {@link #pass()} means "no opinion" and lets the next trait answer. Every other
 * decision is definite. The optional waiting time set with {@link #after(double)} is
 * used only in asynchronous mode, where it schedules the particle's next opportunity;
 * when omitted the particle is rescheduled after {@link #DEFAULT_DELAY}.
 */
public final class StepDecision {

    /** Waiting time used when a decision does not carry one. */
    public static final double DEFAULT_DELAY = 1.0;

    public enum Action {
        PASS,
        STAY,
        MOVE,
        REMOVE
    }

    private static final StepDecision PASS = new StepDecision(Action.PASS, 0, Double.NaN);
    private static final StepDecision STAY = new StepDecision(Action.STAY, 0, Double.NaN);
    private static final StepDecision REMOVE = new StepDecision(Action.REMOVE, 0, Double.NaN);

    private final Action action;
    private final int displacement;
    private final double delay;

    private StepDecision(Action action, int displacement, double delay) {
        this.action = action;
        this.displacement = displacement;
        this.delay = delay;
    }

    public static StepDecision pass() {
        return PASS;
    }

    public static StepDecision stay() {
        return STAY;
    }

    /**
     * Requests a move to an adjacent site.
     *
     * @param displacement -1 or +1; anything else is rejected by the engine
     */
    public static StepDecision move(int displacement) {
        return new StepDecision(Action.MOVE, displacement, Double.NaN);
    }

    public static StepDecision remove() {
        return REMOVE;
    }

    /**
     * Returns a copy of this decision that carries a waiting time until the next
     * opportunity. {@link Double#POSITIVE_INFINITY} means the particle is never
     * scheduled again.
     *
     * @throws IllegalArgumentException for a NaN delay
     */
    public StepDecision after(double delay) {
        if (Double.isNaN(delay)) {
            throw new IllegalArgumentException("Delay must not be NaN");
        }
        return new StepDecision(action, displacement, delay);
    }

    public Action getAction() {
        return action;
    }

    public int getDisplacement() {
        return displacement;
    }

    public boolean hasDelay() {
        return !Double.isNaN(delay);
    }

    public double getDelay() {
        return hasDelay() ? delay : DEFAULT_DELAY;
    }

    public boolean isDefinite() {
        return action != Action.PASS;
    }

    @Override
    public String toString() {
        return action == Action.MOVE ? "MOVE(" + displacement + ")" : action.name();
    }
}
