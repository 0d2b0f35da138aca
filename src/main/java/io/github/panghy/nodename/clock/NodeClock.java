package io.github.panghy.nodename.clock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The {@link ClockType#NODE_TIME} clock a node starts with.
 *
 * <p>It reports the system time until {@link #overrideTime(long)} installs a fixed time. From
 * then on the time only moves through {@link #overrideTime(long)} or {@link #advance(Duration)},
 * which lets tests and replays drive a node deterministically. {@link #clearOverride()} returns
 * the clock to the system time.</p>
 *
 * <pre>{@code
 * NodeClock clock = FlowClock.createNodeClock();
 * clock.overrideTime(1_000_000_000L);
 * clock.advance(Duration.ofMillis(500));
 * clock.now().nanoseconds(); // 1_500_000_000
 * }</pre>
 */
public final class NodeClock implements FlowClock {

  private static final long NO_OVERRIDE = -1L;

  private final AtomicLong overrideNanos = new AtomicLong(NO_OVERRIDE);

  NodeClock() {
  }

  @Override
  public ClockType getClockType() {
    return ClockType.NODE_TIME;
  }

  @Override
  public FlowTime now() {
    long override = overrideNanos.get();
    return new FlowTime(override == NO_OVERRIDE ? SystemClock.systemTimeNanos() : override,
        ClockType.NODE_TIME);
  }

  /**
   * Fixes the time this clock reports.
   *
   * @param nanoseconds The time in nanoseconds since the epoch
   * @throws IllegalArgumentException if nanoseconds is negative
   */
  public void overrideTime(long nanoseconds) {
    if (nanoseconds < 0) {
      throw new IllegalArgumentException("Time cannot be negative: " + nanoseconds);
    }
    overrideNanos.set(nanoseconds);
  }

  /**
   * Moves the overridden time forward.
   *
   * @param duration The non-negative amount to advance by
   * @return The new time
   * @throws IllegalArgumentException if duration is negative
   * @throws IllegalStateException    if no override is installed
   */
  public FlowTime advance(Duration duration) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Cannot advance time by a negative amount: " + duration);
    }
    long step = duration.toNanos();
    long updated = overrideNanos.updateAndGet(current -> {
      if (current == NO_OVERRIDE) {
        throw new IllegalStateException("Time is not overridden, it follows the system time");
      }
      return Math.addExact(current, step);
    });
    return new FlowTime(updated, ClockType.NODE_TIME);
  }

  /**
   * Returns the clock to the system time.
   */
  public void clearOverride() {
    overrideNanos.set(NO_OVERRIDE);
  }

  /**
   * Determines whether a fixed time is installed.
   *
   * @return true if the time only moves when set or advanced
   */
  public boolean isOverridden() {
    return overrideNanos.get() != NO_OVERRIDE;
  }

  @Override
  public String toString() {
    return "NodeClock{overridden=" + isOverridden() + '}';
  }
}
