package org.karo.runtime;

/**
 * Thrown when a user-supplied rule fails or returns a value outside its contract.
 * <p>
 * The original exception, if any, is kept as the cause. The run that hit it halts;
 * the trajectory committed before the failing step remains available.
 */
public class RuleException extends SimulationException {

    private final int particleId;
    private final String traitName;

    /**
     * @param message Description of the contract violation
     * @param particleId The particle whose rule failed
     * @param traitName The trait the rule was bound to, or {@code null} for a global rule
     * @param cause The exception raised by the rule, or {@code null}
     */
    public RuleException(String message, int particleId, String traitName, Throwable cause) {
        super(message, cause);
        this.particleId = particleId;
        this.traitName = traitName;
    }

    public RuleException(String message, int particleId, String traitName) {
        this(message, particleId, traitName, null);
    }

    public int getParticleId() {
        return particleId;
    }

    /**
     * @return the trait name, or {@code null} when a global fallback rule failed
     */
    public String getTraitName() {
        return traitName;
    }
}
