package io.certcsi.observer.observer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.Event;
import io.certcsi.observation.model.EventType;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.store.EventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class ObservationSessionTest {

  private static final Entity CLAIM = new Entity("uid-1", "pvc-1", EntityType.PVC, 1L);

  @Test
  void timestampsNeverGoBackwardsWithinASession() {
    Instant t0 = Instant.parse("2024-05-01T09:00:10Z");
    ObservationSession session = session(new ScriptedClock(t0, t0.minusSeconds(5), t0.plusSeconds(1)));

    session.recordOnce("pvc-1", CLAIM, EventType.PVC_ADDED);
    session.recordOnce("pvc-1", CLAIM, EventType.PVC_BOUND);
    session.recordOnce("pvc-1", CLAIM, EventType.PVC_DELETING_ENDED);

    assertThat(session.events()).extracting(Event::timestamp)
        .containsExactly(t0, t0, t0.plusSeconds(1));
  }

  @Test
  void recordOnceGuardsPerKeyAndType() {
    Instant t0 = Instant.parse("2024-05-01T09:00:00Z");
    ObservationSession session = session(new ScriptedClock(t0, t0, t0, t0));

    assertThat(session.recordOnce("pvc-1", CLAIM, EventType.PVC_BOUND)).isTrue();
    assertThat(session.recordOnce("pvc-1", CLAIM, EventType.PVC_BOUND)).isFalse();
    assertThat(session.recordOnce("va-1", CLAIM, EventType.PVC_ATTACH_STARTED)).isTrue();
    assertThat(session.recordOnce("va-2", CLAIM, EventType.PVC_ATTACH_STARTED)).isTrue();

    assertThat(session.events()).hasSize(3);
  }

  @Test
  void firstSeenIsStable() {
    Instant t0 = Instant.parse("2024-05-01T09:00:00Z");
    ObservationSession session = session(new ScriptedClock(t0, t0.plusSeconds(3)));

    assertThat(session.wasSeen("va-1")).isFalse();
    assertThat(session.firstSeen("va-1")).isEqualTo(t0);
    assertThat(session.firstSeen("va-1")).isEqualTo(t0);
    assertThat(session.wasSeen("va-1")).isTrue();
  }

  private static ObservationSession session(Clock clock) {
    return new ObservationSession("TestObserver", 1L, mock(EventStore.class), new HandoffRegistry(),
        clock, new ObserverMetrics(new SimpleMeterRegistry()));
  }

  private static final class ScriptedClock extends Clock {

    private final Deque<Instant> instants;

    ScriptedClock(Instant... instants) {
      this.instants = new ArrayDeque<>(List.of(instants));
    }

    @Override
    public Instant instant() {
      return instants.pop();
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }
  }
}
