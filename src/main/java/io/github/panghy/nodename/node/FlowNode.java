package io.github.panghy.nodename.node;

import io.github.panghy.nodename.clock.FlowClock;
import io.github.panghy.nodename.clock.FlowTime;
import io.github.panghy.nodename.error.NameValidationException;
import io.github.panghy.nodename.logging.LoggerNames;
import io.github.panghy.nodename.util.LoggingUtil;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * A named node: its validated identity together with the logger and clock it was built with.
 *
 * <p>Construction validates the name and namespace through {@link NodeIdentity}. A node that
 * exists is therefore always correctly named, and its naming accessors never fail.</p>
 *
 * <p>Sub-nodes created with {@link #createSubNode(String)} are views of the same graph entity:
 * they share the parent's name, namespace, fully-qualified name, logger and clock, and differ
 * only in their {@link #getSubNamespace() sub-namespace} and
 * {@link #getEffectiveNamespace() effective namespace}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * FlowNode node = FlowNode.create("my_node", "/ns");
 * node.getFullyQualifiedName();   // "/ns/my_node"
 * node.getLogger().getName();     // "ns.my_node"
 *
 * FlowNode sensors = node.createSubNode("sensors");
 * sensors.getEffectiveNamespace(); // "/ns/sensors"
 * }</pre>
 */
public class FlowNode {

  private static final Logger LOGGER = Logger.getLogger(FlowNode.class.getName());

  private final NodeScope scope;
  private final Logger logger;
  private final FlowClock clock;

  private FlowNode(NodeScope scope, Logger logger, FlowClock clock) {
    this.scope = scope;
    this.logger = logger;
    this.clock = clock;
  }

  /**
   * Creates a node in the root namespace with default options.
   *
   * @param name The local node name
   * @return The node
   * @throws NameValidationException if the name is invalid
   */
  public static FlowNode create(String name) {
    return create(name, "", NodeOptions.defaultOptions());
  }

  /**
   * Creates a node with default options.
   *
   * @param name      The local node name
   * @param namespace The raw namespace, relative or absolute; empty for the root namespace
   * @return The node
   * @throws NameValidationException if the name or namespace is invalid
   */
  public static FlowNode create(String name, String namespace) {
    return create(name, namespace, NodeOptions.defaultOptions());
  }

  /**
   * Creates a node.
   *
   * @param name      The local node name
   * @param namespace The raw namespace, relative or absolute; empty for the root namespace
   * @param options   The node options; a namespace override in them replaces {@code namespace}
   * @return The node
   * @throws NameValidationException if the name or effective namespace is invalid
   */
  public static FlowNode create(String name, String namespace, NodeOptions options) {
    Objects.requireNonNull(options, "options cannot be null");
    NodeIdentity identity = NodeIdentity.create(name, namespace, options.getNamespaceOverride());
    FlowClock clock = options.getClock() != null ? options.getClock() : FlowClock.createNodeClock();
    FlowNode node = new FlowNode(identity, LoggerNames.loggerFor(identity), clock);
    LoggingUtil.info(LOGGER, "Created node " + identity.getFullyQualifiedName());
    return node;
  }

  /**
   * Creates a sub-node whose resources are scoped under an additional relative namespace.
   *
   * @param subNamespace The relative path to append to this node's effective namespace
   * @return The sub-node
   * @throws NameValidationException with {@code NAME_VALIDATION_ERROR} if the path is absolute,
   *                                 or {@code INVALID_NAMESPACE} if it is otherwise malformed
   */
  public FlowNode createSubNode(String subNamespace) {
    return new FlowNode(scope.createSub(subNamespace), logger, clock);
  }

  public String getName() {
    return scope.getName();
  }

  public String getNamespace() {
    return scope.getNamespace();
  }

  public String getFullyQualifiedName() {
    return scope.getFullyQualifiedName();
  }

  public String getSubNamespace() {
    return scope.getSubNamespace();
  }

  public String getEffectiveNamespace() {
    return scope.getEffectiveNamespace();
  }

  /**
   * Gets the naming scope of this node.
   *
   * @return The node identity, or the sub-identity for a sub-node
   */
  public NodeScope getScope() {
    return scope;
  }

  /**
   * Gets the logger of this node, named after its fully-qualified name.
   *
   * @return The logger
   * @see LoggerNames
   */
  public Logger getLogger() {
    return logger;
  }

  /**
   * Gets the clock of this node. Unless the options supplied one, this is a
   * {@link io.github.panghy.nodename.clock.ClockType#NODE_TIME node-time} clock owned by the node
   * and its sub-nodes.
   *
   * @return The clock
   */
  public FlowClock getClock() {
    return clock;
  }

  /**
   * Reads the current time from this node's clock.
   *
   * @return The current time, tagged with the clock's type
   */
  public FlowTime now() {
    return clock.now();
  }

  @Override
  public String toString() {
    return "FlowNode{" + scope + '}';
  }
}
