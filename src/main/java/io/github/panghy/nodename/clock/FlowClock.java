package io.github.panghy.nodename.clock;

/**
 * Time source exposed by a {@link io.github.panghy.nodename.node.FlowNode}.
 *
 * <p>Naming never depends on time. The clock travels with the node so that code holding a node
 * reads the same time the node does. A node starts with its own {@link NodeClock}; options may
 * hand it a different clock.</p>
 */
public interface FlowClock {

  /**
   * Gets the type of time this clock reports.
   *
   * @return The clock type
   */
  ClockType getClockType();

  /**
   * Reads the current time.
   *
   * @return The current time, tagged with {@link #getClockType()}
   */
  FlowTime now();

  /**
   * Creates a node-time clock that follows the system time until overridden.
   *
   * @return A new node clock
   */
  static NodeClock createNodeClock() {
    return new NodeClock();
  }

  /**
   * Creates a clock reading the system wall-clock time.
   *
   * @return A {@link ClockType#SYSTEM_TIME} clock
   */
  static FlowClock createSystemClock() {
    return new SystemClock(ClockType.SYSTEM_TIME);
  }

  /**
   * Creates a clock reading the monotonic time.
   *
   * @return A {@link ClockType#STEADY_TIME} clock
   */
  static FlowClock createSteadyClock() {
    return new SystemClock(ClockType.STEADY_TIME);
  }
}
