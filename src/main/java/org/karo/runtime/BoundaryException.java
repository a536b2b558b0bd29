package org.karo.runtime;

/**
 * Thrown when a move, spawn or placement targets a site outside the track and
 * nothing on the track intercepts it. Fatal; the step is never retried.
 */
public class BoundaryException extends SimulationException {

    private final int site;

    public BoundaryException(String message, int site) {
        super(message);
        this.site = site;
    }

    public int getSite() {
        return site;
    }
}
