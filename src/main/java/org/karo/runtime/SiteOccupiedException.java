package org.karo.runtime;

/**
 * Thrown by {@link org.karo.runtime.model.Track#place(int, int)} when the target site
 * already holds a particle.
 */
public class SiteOccupiedException extends SimulationException {

    private final int site;
    private final int occupantId;

    public SiteOccupiedException(int site, int occupantId) {
        super("Site " + site + " is already occupied by particle " + occupantId);
        this.site = site;
        this.occupantId = occupantId;
    }

    public int getSite() {
        return site;
    }

    public int getOccupantId() {
        return occupantId;
    }
}
