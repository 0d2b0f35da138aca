package io.github.panghy.nodename.clock;

import java.time.Instant;
import java.util.Objects;

/**
 * Clock backed directly by the JVM: wall-clock time for {@link ClockType#SYSTEM_TIME}, the
 * monotonic nano timer for {@link ClockType#STEADY_TIME}.
 */
class SystemClock implements FlowClock {

  private final ClockType clockType;

  SystemClock(ClockType clockType) {
    Objects.requireNonNull(clockType, "clockType cannot be null");
    if (clockType == ClockType.NODE_TIME) {
      throw new IllegalArgumentException("Node time is provided by NodeClock");
    }
    this.clockType = clockType;
  }

  static long systemTimeNanos() {
    Instant instant = Instant.now();
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }

  @Override
  public ClockType getClockType() {
    return clockType;
  }

  @Override
  public FlowTime now() {
    long nanos = clockType == ClockType.SYSTEM_TIME ? systemTimeNanos() : System.nanoTime();
    // nanoTime has an arbitrary origin and may be negative
    return new FlowTime(Math.max(nanos, 0L), clockType);
  }

  @Override
  public String toString() {
    return "SystemClock{" + clockType + '}';
  }
}
