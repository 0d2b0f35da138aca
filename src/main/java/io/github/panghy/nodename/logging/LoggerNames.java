package io.github.panghy.nodename.logging;

import io.github.panghy.nodename.node.NodeScope;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Derives dotted logger names from fully-qualified node names.
 *
 * <p>The leading separator is dropped and every remaining separator becomes a dot:</p>
 * <pre>
 * "/my_node"        ->  "my_node"
 * "/ns/my_node"     ->  "ns.my_node"
 * "/my/ns/my_node"  ->  "my.ns.my_node"
 * </pre>
 *
 * <p>Sub-identities log under their node's name, since they are not separate graph entities.</p>
 */
public final class LoggerNames {

  private LoggerNames() {
    // Utility class should not be instantiated
  }

  /**
   * Maps a fully-qualified node name to a logger name.
   *
   * @param fullyQualifiedName The fully-qualified name, starting with a separator
   * @return The dotted logger name
   */
  public static String fromFullyQualifiedName(String fullyQualifiedName) {
    Objects.requireNonNull(fullyQualifiedName, "fullyQualifiedName cannot be null");
    String stripped = fullyQualifiedName.startsWith("/")
        ? fullyQualifiedName.substring(1)
        : fullyQualifiedName;
    return stripped.replace('/', '.');
  }

  /**
   * Gets the logger name for a node scope.
   *
   * @param scope The node identity or sub-identity
   * @return The dotted logger name of the node
   */
  public static String of(NodeScope scope) {
    return fromFullyQualifiedName(scope.getFullyQualifiedName());
  }

  /**
   * Gets the JUL logger for a node scope.
   *
   * @param scope The node identity or sub-identity
   * @return The logger named after the node
   */
  public static Logger loggerFor(NodeScope scope) {
    return Logger.getLogger(of(scope));
  }
}
