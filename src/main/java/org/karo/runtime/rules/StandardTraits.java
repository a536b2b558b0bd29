package org.karo.runtime.rules;

import org.karo.runtime.model.Trait;

/**
 * Traits every {@link RuleRegistry} knows without registration.
 */
public final class StandardTraits {

    /** Name of the marker trait carried by the particles on both ends of a marker-bounded track. */
    public static final String TRACK_END_NAME = "track-end";

    /** Identifying-only trait of track-end marker particles. */
    public static final Trait TRACK_END = Trait.marker(TRACK_END_NAME);

    private StandardTraits() {
    }
}
