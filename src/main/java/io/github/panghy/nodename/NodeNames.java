package io.github.panghy.nodename;

import io.github.panghy.nodename.error.NameValidationException;
import io.github.panghy.nodename.logging.LoggerNames;
import io.github.panghy.nodename.node.NodeIdentity;
import io.github.panghy.nodename.node.NodeScope;
import io.github.panghy.nodename.node.SubIdentity;
import io.github.panghy.nodename.node.SubNamespaceComposer;
import io.github.panghy.nodename.util.LoggingUtil;
import io.github.panghy.nodename.validation.NamespaceNormalizer;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Main entry point of the node naming library.
 * Provides static methods to construct node identities, derive sub-identities and map node
 * names to logger names.
 *
 * <p>Every node in the graph has a short local name and lives in a hierarchical namespace.
 * Together they form the node's fully-qualified name, its graph-global address:</p>
 *
 * <pre>{@code
 * NodeIdentity id = NodeNames.construct("my_node", "my/ns");
 * id.getNamespace();          // "/my/ns"
 * id.getFullyQualifiedName(); // "/my/ns/my_node"
 * NodeNames.loggerName(id);   // "my.ns.my_node"
 *
 * // Scope auxiliary resources under the node without creating a new graph entity
 * SubIdentity sub = NodeNames.createSub(NodeNames.createSub(id, "a"), "b");
 * sub.getSubNamespace();       // "a/b"
 * sub.getEffectiveNamespace(); // "/my/ns/a/b"
 * }</pre>
 *
 * <h2>Errors</h2>
 *
 * <p>Malformed input is reported with a {@link NameValidationException} whose
 * {@link NameValidationException.ErrorCode error code} identifies the kind of failure. Input is
 * never silently corrected: a trailing separator, for example, is rejected rather than
 * stripped.</p>
 *
 * <p>All methods are pure and thread-safe. There is no process-wide state to initialize.</p>
 */
public final class NodeNames {

  private static final Logger LOGGER = Logger.getLogger(NodeNames.class.getName());

  private NodeNames() {
    // Utility class should not be instantiated
  }

  /**
   * Constructs a node identity.
   *
   * @param name      The local node name
   * @param namespace The raw namespace, relative or absolute; empty or null for the root
   * @return The identity
   * @throws NameValidationException if the name or namespace is invalid
   */
  public static NodeIdentity construct(String name, String namespace) {
    return NodeIdentity.create(name, namespace, null);
  }

  /**
   * Constructs a node identity, letting an externally remapped namespace replace the
   * namespace argument.
   *
   * @param name              The local node name
   * @param namespace         The raw namespace, relative or absolute; empty or null for the root
   * @param namespaceOverride The remapped namespace, or null
   * @return The identity
   * @throws NameValidationException if the name or effective namespace is invalid
   */
  public static NodeIdentity construct(String name, String namespace, String namespaceOverride) {
    return NodeIdentity.create(name, namespace, namespaceOverride);
  }

  /**
   * Constructs a node identity, returning an empty result instead of throwing when the input
   * is rejected.
   *
   * @param name              The local node name
   * @param namespace         The raw namespace
   * @param namespaceOverride The remapped namespace, or null
   * @return The identity, or empty if the name or namespace is invalid
   */
  public static Optional<NodeIdentity> tryConstruct(String name, String namespace, String namespaceOverride) {
    try {
      return Optional.of(NodeIdentity.create(name, namespace, namespaceOverride));
    } catch (NameValidationException e) {
      LoggingUtil.debug(LOGGER, "Rejected node name '" + name + "' in namespace '" +
          (namespaceOverride != null ? namespaceOverride : namespace) + "'", e);
      return Optional.empty();
    }
  }

  /**
   * Creates a sub-identity extending {@code scope} by a relative path.
   *
   * @param scope        A node identity or an existing sub-identity
   * @param subNamespace The relative path to append
   * @return The sub-identity
   * @throws NameValidationException with {@code NAME_VALIDATION_ERROR} if the path is absolute,
   *                                 or {@code INVALID_NAMESPACE} if it is otherwise malformed
   */
  public static SubIdentity createSub(NodeScope scope, String subNamespace) {
    return SubNamespaceComposer.compose(scope, subNamespace);
  }

  /**
   * Derives the dotted logger name of a node.
   *
   * @param scope A node identity or sub-identity
   * @return The logger name
   */
  public static String loggerName(NodeScope scope) {
    return LoggerNames.of(scope);
  }

  /**
   * Normalizes a raw namespace into canonical absolute form.
   *
   * @param namespace The raw namespace
   * @return The canonical namespace
   * @throws NameValidationException if the namespace is invalid
   */
  public static String normalizeNamespace(String namespace) {
    return NamespaceNormalizer.normalize(namespace);
  }
}
