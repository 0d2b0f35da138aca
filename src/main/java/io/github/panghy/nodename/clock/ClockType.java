package io.github.panghy.nodename.clock;

/**
 * The time source a {@link FlowClock} reads.
 */
public enum ClockType {
  /**
   * Node time. Follows the system time until an override is installed, after which it only
   * moves when the override is changed. This is the type of the clock every node starts with.
   */
  NODE_TIME,

  /**
   * Wall-clock time in nanoseconds since the epoch. May jump when the system time is adjusted.
   */
  SYSTEM_TIME,

  /**
   * Monotonic time with an arbitrary origin. Only differences between readings are meaningful.
   */
  STEADY_TIME
}
