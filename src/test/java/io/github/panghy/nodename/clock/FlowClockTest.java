package io.github.panghy.nodename.clock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the clock implementations.
 */
class FlowClockTest {

  @Test
  void testSystemClockFollowsWallClock() {
    FlowClock clock = FlowClock.createSystemClock();
    assertThat(clock.getClockType()).isEqualTo(ClockType.SYSTEM_TIME);

    long before = System.currentTimeMillis();
    FlowTime now = clock.now();
    long after = System.currentTimeMillis();

    assertThat(now.clockType()).isEqualTo(ClockType.SYSTEM_TIME);
    assertThat(now.toMillis()).isBetween(before, after);
  }

  @Test
  void testSteadyClockIsMonotonic() {
    FlowClock clock = FlowClock.createSteadyClock();
    assertThat(clock.getClockType()).isEqualTo(ClockType.STEADY_TIME);

    FlowTime first = clock.now();
    FlowTime second = clock.now();
    assertThat(second).isGreaterThanOrEqualTo(first);
    assertThat(second.minus(first)).isGreaterThanOrEqualTo(Duration.ZERO);
  }

  @Test
  void testSystemClockRejectsNodeTime() {
    assertThatThrownBy(() -> new SystemClock(ClockType.NODE_TIME))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testNodeClockFollowsSystemTimeByDefault() {
    NodeClock clock = FlowClock.createNodeClock();
    assertThat(clock.getClockType()).isEqualTo(ClockType.NODE_TIME);
    assertThat(clock.isOverridden()).isFalse();

    long before = System.currentTimeMillis();
    FlowTime now = clock.now();
    long after = System.currentTimeMillis();
    assertThat(now.clockType()).isEqualTo(ClockType.NODE_TIME);
    assertThat(now.toMillis()).isBetween(before, after);
  }

  @Test
  void testNodeClockOverride() {
    NodeClock clock = FlowClock.createNodeClock();
    clock.overrideTime(1_000_000_000L);
    assertThat(clock.isOverridden()).isTrue();
    assertThat(clock.now()).isEqualTo(new FlowTime(1_000_000_000L, ClockType.NODE_TIME));
    assertThat(clock.now()).isEqualTo(clock.now());

    assertThat(clock.advance(Duration.ofMillis(500)).nanoseconds()).isEqualTo(1_500_000_000L);
    assertThat(clock.now().toMillis()).isEqualTo(1500L);

    clock.clearOverride();
    assertThat(clock.isOverridden()).isFalse();
    assertThat(clock.now().toMillis()).isGreaterThan(1500L);
  }

  @Test
  void testNodeClockRejectsInvalidChanges() {
    NodeClock clock = FlowClock.createNodeClock();
    assertThatThrownBy(() -> clock.advance(Duration.ofSeconds(1)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not overridden");
    assertThatThrownBy(() -> clock.overrideTime(-1))
        .isInstanceOf(IllegalArgumentException.class);

    clock.overrideTime(0);
    assertThatThrownBy(() -> clock.advance(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(clock.now().nanoseconds()).isZero();
  }
}
