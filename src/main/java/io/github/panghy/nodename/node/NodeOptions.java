package io.github.panghy.nodename.node;

import io.github.panghy.nodename.clock.FlowClock;

import java.util.Objects;

/**
 * Options applied when constructing a {@link FlowNode}.
 *
 * <p>The options cover the collaborators a node consumes but does not own:</p>
 * <ul>
 *   <li>Namespace override - a namespace extracted by an external remapping mechanism. When
 *       present it replaces the namespace passed to the node constructor (default: none)</li>
 *   <li>Clock - the time source exposed by the node (default: none, each node then gets its
 *       own {@link io.github.panghy.nodename.clock.NodeClock node clock})</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * NodeOptions options = NodeOptions.builder()
 *     .namespaceOverride("/another_ns")
 *     .clock(FlowClock.createSteadyClock())
 *     .build();
 *
 * FlowNode node = FlowNode.create("my_node", "/ns", options);
 * node.getNamespace(); // "/another_ns"
 * }</pre>
 */
public class NodeOptions {

  private static final NodeOptions DEFAULT = builder().build();

  private final String namespaceOverride;
  private final FlowClock clock;

  private NodeOptions(Builder builder) {
    this.namespaceOverride = builder.namespaceOverride;
    this.clock = builder.clock;
  }

  /**
   * Gets the namespace override.
   *
   * @return The override, or null when the constructor namespace applies
   */
  public String getNamespaceOverride() {
    return namespaceOverride;
  }

  /**
   * Gets the clock nodes built with these options expose.
   *
   * @return The clock, or null when each node creates its own node clock
   */
  public FlowClock getClock() {
    return clock;
  }

  /**
   * Creates a new builder for NodeOptions.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the default options: no namespace override and a fresh node clock per node.
   *
   * @return The default options
   */
  public static NodeOptions defaultOptions() {
    return DEFAULT;
  }

  /**
   * Builder for NodeOptions.
   */
  public static class Builder {
    private String namespaceOverride;
    private FlowClock clock;

    private Builder() {
    }

    /**
     * Sets the namespace that replaces the constructor namespace. It is validated when the
     * node is constructed, exactly as if it had been passed as the namespace argument.
     *
     * @param namespaceOverride The remapped namespace, or null to clear it
     * @return This builder for chaining
     */
    public Builder namespaceOverride(String namespaceOverride) {
      this.namespaceOverride = namespaceOverride;
      return this;
    }

    /**
     * Sets the clock exposed by the node. Every node built with these options shares it.
     *
     * @param clock The clock
     * @return This builder for chaining
     * @throws NullPointerException if clock is null
     */
    public Builder clock(FlowClock clock) {
      this.clock = Objects.requireNonNull(clock, "clock cannot be null");
      return this;
    }

    /**
     * Builds the options with the specified settings.
     *
     * @return A new NodeOptions instance
     */
    public NodeOptions build() {
      return new NodeOptions(this);
    }
  }
}
