package org.karo.runtime.spi;

/**
 * The answer of an {@link ILifetimeRule}.
 */
public final class LifetimeDecision {

    public enum Verdict {
        PASS,
        ALIVE,
        EXPIRED
    }

    private static final LifetimeDecision PASS = new LifetimeDecision(Verdict.PASS, Double.NaN);
    private static final LifetimeDecision ALIVE = new LifetimeDecision(Verdict.ALIVE, Double.NaN);
    private static final LifetimeDecision EXPIRED = new LifetimeDecision(Verdict.EXPIRED, Double.NaN);

    private final Verdict verdict;
    private final double nextCheck;

    private LifetimeDecision(Verdict verdict, double nextCheck) {
        this.verdict = verdict;
        this.nextCheck = nextCheck;
    }

    public static LifetimeDecision pass() {
        return PASS;
    }

    public static LifetimeDecision alive() {
        return ALIVE;
    }

    /**
     * The particle is alive now and should be checked again at the given absolute
     * time. Asynchronous mode schedules a lifetime event for that time.
     */
    public static LifetimeDecision aliveUntil(double time) {
        if (Double.isNaN(time)) {
            throw new IllegalArgumentException("Next check time must not be NaN");
        }
        return new LifetimeDecision(Verdict.ALIVE, time);
    }

    public static LifetimeDecision expired() {
        return EXPIRED;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean hasNextCheck() {
        return !Double.isNaN(nextCheck);
    }

    public double getNextCheck() {
        return nextCheck;
    }

    public boolean isDefinite() {
        return verdict != Verdict.PASS;
    }
}
