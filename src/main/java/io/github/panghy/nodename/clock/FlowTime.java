package io.github.panghy.nodename.clock;

import java.time.Duration;
import java.util.Objects;

/**
 * A point in time read from a {@link FlowClock}, tagged with the type of the clock it came from.
 *
 * <p>Readings of different clock types do not share an origin, so they cannot be compared or
 * subtracted.</p>
 *
 * @param nanoseconds The time in nanoseconds from the clock's origin
 * @param clockType   The type of the clock that produced the reading
 */
public record FlowTime(long nanoseconds, ClockType clockType) implements Comparable<FlowTime> {

  private static final long NANOS_PER_MILLI = 1_000_000L;

  public FlowTime {
    Objects.requireNonNull(clockType, "clockType cannot be null");
    if (nanoseconds < 0) {
      throw new IllegalArgumentException("Time cannot be negative: " + nanoseconds);
    }
  }

  /**
   * Converts the reading to milliseconds, truncating.
   *
   * @return The time in milliseconds from the clock's origin
   */
  public long toMillis() {
    return nanoseconds / NANOS_PER_MILLI;
  }

  /**
   * Computes the time elapsed from {@code earlier} to this reading.
   *
   * @param earlier A reading of the same clock type
   * @return The elapsed time, negative if {@code earlier} is actually later
   * @throws IllegalArgumentException if the clock types differ
   */
  public Duration minus(FlowTime earlier) {
    checkSameType(earlier);
    return Duration.ofNanos(nanoseconds - earlier.nanoseconds);
  }

  /**
   * Returns the reading shifted forward by {@code duration}.
   *
   * @param duration The non-negative amount to add
   * @return The later reading, of the same clock type
   * @throws IllegalArgumentException if duration is negative
   */
  public FlowTime plus(Duration duration) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Cannot add a negative duration: " + duration);
    }
    return new FlowTime(Math.addExact(nanoseconds, duration.toNanos()), clockType);
  }

  @Override
  public int compareTo(FlowTime other) {
    checkSameType(other);
    return Long.compare(nanoseconds, other.nanoseconds);
  }

  private void checkSameType(FlowTime other) {
    if (clockType != other.clockType) {
      throw new IllegalArgumentException(
          "Cannot compare times of different clock types: " + clockType + " and " + other.clockType);
    }
  }
}
