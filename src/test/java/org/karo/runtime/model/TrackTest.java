package org.karo.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.karo.runtime.BoundaryException;
import org.karo.runtime.ConfigurationException;
import org.karo.runtime.SiteOccupiedException;
import org.karo.runtime.internal.SeededRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

@Tag("unit")
class TrackTest {

    private Int2ObjectOpenHashMap<Particle> particles;
    private Track track;

    @BeforeEach
    void setUp() {
        particles = new Int2ObjectOpenHashMap<>();
        track = new Track(6, Boundary.CLOSED, particles::get);
    }

    private Particle add(int id, int site) {
        Particle particle = new Particle(id, site, List.of(), Map.of(), new SeededRandomProvider(id), 0, 0.0);
        particles.put(id, particle);
        track.place(id, site);
        return particle;
    }

    @Test
    void placeAndVacateUpdateOccupancy() {
        add(7, 3);

        assertThat(track.occupantAt(3)).isEqualTo(7);
        assertThat(track.isOccupied(3)).isTrue();
        assertThat(track.particleAt(3).getId()).isEqualTo(7);

        assertThat(track.vacate(3)).isEqualTo(7);
        assertThat(track.occupantAt(3)).isEqualTo(TrackView.EMPTY);
        assertThat(track.particleAt(3)).isNull();
        assertThat(track.vacate(3)).isEqualTo(TrackView.EMPTY);
    }

    @Test
    void placeOnOccupiedSiteFails() {
        add(1, 2);

        assertThatThrownBy(() -> track.place(2, 2))
                .isInstanceOf(SiteOccupiedException.class)
                .satisfies(e -> {
                    SiteOccupiedException occupied = (SiteOccupiedException) e;
                    assertThat(occupied.getSite()).isEqualTo(2);
                    assertThat(occupied.getOccupantId()).isEqualTo(1);
                });
    }

    @Test
    void placeOutsideTrackFails() {
        assertThatThrownBy(() -> track.place(1, 6)).isInstanceOf(BoundaryException.class);
        assertThatThrownBy(() -> track.place(1, -1)).isInstanceOf(BoundaryException.class);
    }

    @Test
    void outOfBoundsQueriesAreEmpty() {
        assertThat(track.isInBounds(-1)).isFalse();
        assertThat(track.isInBounds(6)).isFalse();
        assertThat(track.occupantAt(-1)).isEqualTo(TrackView.EMPTY);
        assertThat(track.particleAt(99)).isNull();
    }

    @Test
    void neighborsHonourBoundaries() {
        assertThat(track.neighbors(0)).containsExactly(1);
        assertThat(track.neighbors(3)).containsExactly(2, 4);
        assertThat(track.neighbors(5)).containsExactly(4);
        assertThat(new Track(1, Boundary.OPEN, particles::get).neighbors(0)).isEmpty();
    }

    @Test
    void nextEmptyFindsEndOfTrain() {
        add(1, 1);
        add(2, 2);
        add(3, 3);

        assertThat(track.nextEmpty(1, 1)).isEqualTo(4);
        assertThat(track.nextEmpty(3, -1)).isEqualTo(0);
        assertThat(track.nextEmpty(5, 1)).isEqualTo(5);

        add(4, 5);
        add(5, 4);
        assertThat(track.nextEmpty(1, 1)).isEqualTo(6);

        add(6, 0);
        assertThat(track.nextEmpty(3, -1)).isEqualTo(-1);
    }

    @Test
    void occupantsInReturnsParticlesInSiteOrder() {
        add(9, 4);
        add(3, 1);
        add(5, 2);

        List<ParticleView> inRange = track.occupantsIn(5, 1);

        assertThat(inRange).extracting(ParticleView::getId).containsExactly(3, 5, 9);
        assertThat(track.occupantsIn(-10, 0)).isEmpty();
    }

    @Test
    void snapshotIsUnaffectedByLaterChanges() {
        Particle particle = new Particle(1, 2, List.of(Trait.marker("tag")),
                Map.of("tag", new TraitState().set("age", 1)), new SeededRandomProvider(1), 0, 0.0);
        particles.put(1, particle);
        track.place(1, 2);

        TrackSnapshot snapshot = track.snapshot(particles);
        particle.getMutableState("tag").set("age", 2);
        track.vacate(2);
        track.place(1, 3);
        particle.setSite(3);

        assertThat(snapshot.occupantAt(2)).isEqualTo(1);
        assertThat(snapshot.occupantAt(3)).isEqualTo(TrackView.EMPTY);
        assertThat(snapshot.particleAt(2).getSite()).isEqualTo(2);
        assertThat(snapshot.particleAt(2).getState("tag").getInt("age", 0)).isEqualTo(1);
    }

    @Test
    void invalidLengthIsAConfigurationError() {
        assertThatThrownBy(() -> new Track(0, Boundary.CLOSED, particles::get))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new Track(1, Boundary.MARKED, particles::get))
                .isInstanceOf(ConfigurationException.class);
    }
}
