package org.karo.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TrajectoryLogTest {

    @Test
    void formatsOneTabSeparatedLinePerEntry() {
        TrajectoryLog log = new TrajectoryLog();
        log.appendAll(List.of(
                TrajectoryEntry.spawned(0, 0.0, 1, 3),
                TrajectoryEntry.moved(1, 1.5, 1, 3, 4, EventKind.MOVED),
                TrajectoryEntry.removed(2, 2.0, 1, 4, EventKind.EXITED)));

        assertThat(log.format()).isEqualTo(
                "0\t0.0\t1\t-1\t3\tSPAWNED\n"
                        + "1\t1.5\t1\t3\t4\tMOVED\n"
                        + "2\t2.0\t1\t4\t-1\tEXITED\n");
    }

    @Test
    void sinceAndForParticleReturnCopies() {
        TrajectoryLog log = new TrajectoryLog();
        log.appendAll(List.of(TrajectoryEntry.spawned(0, 0.0, 1, 0), TrajectoryEntry.spawned(0, 0.0, 2, 1)));
        List<TrajectoryEntry> tail = log.since(1);

        log.appendAll(List.of(TrajectoryEntry.moved(1, 1.0, 1, 0, 2, EventKind.MOVED)));

        assertThat(tail).containsExactly(TrajectoryEntry.spawned(0, 0.0, 2, 1));
        assertThat(log.forParticle(1)).extracting(TrajectoryEntry::kind).containsExactly(EventKind.SPAWNED, EventKind.MOVED);
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    void removalKindsAreFlagged() {
        assertThat(EventKind.EXPIRED.isRemoval()).isTrue();
        assertThat(EventKind.MERGED.isRemoval()).isTrue();
        assertThat(EventKind.PUSHED.isRemoval()).isFalse();
    }
}
