package io.github.panghy.nodename.node;

import io.github.panghy.nodename.error.NameValidationException;
import io.github.panghy.nodename.util.LoggingUtil;
import io.github.panghy.nodename.validation.NamespaceNormalizer;
import io.github.panghy.nodename.validation.TokenValidator;
import io.github.panghy.nodename.validation.ValidationResult;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * The validated name and canonical namespace of a node.
 *
 * <p>A NodeIdentity is created once, when its node is constructed, and never changes
 * afterwards. All validation happens in {@link #create(String, String, String)}; an instance
 * that exists is always valid, so accessors never re-validate.</p>
 *
 * <p>The fully-qualified name is derived from the namespace and the name and cached:</p>
 * <pre>
 * namespace "/"       name "my_node"  ->  "/my_node"
 * namespace "/my/ns"  name "my_node"  ->  "/my/ns/my_node"
 * </pre>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * NodeIdentity identity = NodeIdentity.create("my_node", "my/ns");
 * identity.getNamespace();          // "/my/ns"
 * identity.getFullyQualifiedName(); // "/my/ns/my_node"
 *
 * // A remapped namespace replaces the constructor argument entirely
 * NodeIdentity remapped = NodeIdentity.create("my_node", "ns", "/another_ns");
 * remapped.getFullyQualifiedName(); // "/another_ns/my_node"
 * }</pre>
 *
 * <p>NodeIdentity instances are immutable and can be safely shared between threads.</p>
 */
public final class NodeIdentity implements NodeScope {

  private static final Logger LOGGER = Logger.getLogger(NodeIdentity.class.getName());

  private final String name;
  private final String namespace;
  private final String fullyQualifiedName;

  private NodeIdentity(String name, String namespace) {
    this.name = name;
    this.namespace = namespace;
    this.fullyQualifiedName = NamespaceNormalizer.ROOT.equals(namespace)
        ? NamespaceNormalizer.ROOT + name
        : namespace + NamespaceNormalizer.SEPARATOR + name;
  }

  /**
   * Creates an identity in the root namespace.
   *
   * @param name The local node name
   * @return The identity
   * @throws NameValidationException if the name is invalid
   */
  public static NodeIdentity create(String name) {
    return create(name, "", null);
  }

  /**
   * Creates an identity from a name and a raw namespace.
   *
   * @param name      The local node name
   * @param namespace The raw namespace, relative or absolute; empty or null for the root
   * @return The identity
   * @throws NameValidationException if the name or namespace is invalid
   */
  public static NodeIdentity create(String name, String namespace) {
    return create(name, namespace, null);
  }

  /**
   * Creates an identity from a name, a raw namespace and an optional namespace override.
   *
   * <p>When {@code namespaceOverride} is non-null it replaces {@code namespace} entirely; the
   * two are never merged. The name is validated before the namespace, so an invalid name is
   * reported even when the namespace is also invalid.</p>
   *
   * @param name              The local node name
   * @param namespace         The raw namespace, relative or absolute; empty or null for the root
   * @param namespaceOverride An externally remapped namespace, or null
   * @return The identity
   * @throws NameValidationException with {@code INVALID_NODE_NAME} if the name is invalid, or
   *                                 {@code INVALID_NAMESPACE} if the effective namespace is invalid
   * @throws NullPointerException    if name is null
   */
  public static NodeIdentity create(String name, String namespace, String namespaceOverride) {
    Objects.requireNonNull(name, "Node name cannot be null");
    String rawNamespace = namespaceOverride != null ? namespaceOverride : namespace;

    ValidationResult nameResult = TokenValidator.validate(name);
    if (!nameResult.valid()) {
      throw NameValidationException.invalidNodeName(name, nameResult.reason(), nameResult.invalidIndex());
    }
    NodeIdentity identity = new NodeIdentity(name, NamespaceNormalizer.normalize(rawNamespace));
    if (namespaceOverride != null) {
      LoggingUtil.debug(LOGGER, "Namespace of node '" + name + "' remapped from '" + namespace +
          "' to '" + identity.namespace + "'");
    }
    LoggingUtil.debug(LOGGER, "Created node identity " + identity.fullyQualifiedName);
    return identity;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getNamespace() {
    return namespace;
  }

  @Override
  public String getFullyQualifiedName() {
    return fullyQualifiedName;
  }

  /**
   * A plain node identity has no sub-namespace.
   *
   * @return The empty string
   */
  @Override
  public String getSubNamespace() {
    return "";
  }

  /**
   * A plain node identity's resources live directly in its namespace.
   *
   * @return The namespace
   */
  @Override
  public String getEffectiveNamespace() {
    return namespace;
  }

  @Override
  public NodeIdentity getRoot() {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NodeIdentity that = (NodeIdentity) o;
    return name.equals(that.name) && namespace.equals(that.namespace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, namespace);
  }

  @Override
  public String toString() {
    return fullyQualifiedName;
  }
}
