package io.github.panghy.nodename.node;

/**
 * Read-only view of a node's naming scope.
 *
 * <p>A scope is either a plain {@link NodeIdentity} or a {@link SubIdentity} derived from one.
 * Both expose the same local name, namespace and fully-qualified name as the node they belong
 * to. A sub-identity additionally carries a relative sub-namespace that extends the node's
 * namespace for the resources it owns, without creating a second graph-visible entity.</p>
 *
 * <p>The interface is sealed: a scope's name, namespace and sub-namespace are trusted when it
 * is extended, so only the two validated implementations exist. Both are immutable and can be
 * safely shared between threads.</p>
 */
public sealed interface NodeScope permits NodeIdentity, SubIdentity {

  /**
   * Gets the local name of the node.
   *
   * @return The node name
   */
  String getName();

  /**
   * Gets the canonical absolute namespace of the node.
   *
   * @return The namespace, {@code "/"} for the root namespace
   */
  String getNamespace();

  /**
   * Gets the fully-qualified name of the node, its graph-global address.
   *
   * @return The fully-qualified name
   */
  String getFullyQualifiedName();

  /**
   * Gets the relative sub-namespace of this scope.
   *
   * @return The sub-namespace, or the empty string for a plain node identity
   */
  String getSubNamespace();

  /**
   * Gets the namespace as seen by resources owned through this scope.
   *
   * @return The namespace extended by the sub-namespace, if any
   */
  String getEffectiveNamespace();

  /**
   * Gets the node identity at the root of this scope.
   *
   * @return The root identity, this instance for a plain node identity
   */
  NodeIdentity getRoot();

  /**
   * Creates a sub-identity that extends this scope by a relative path.
   *
   * @param subNamespace The relative path to append
   * @return The new sub-identity
   * @throws io.github.panghy.nodename.error.NameValidationException if the path is rejected
   * @see SubNamespaceComposer#compose(NodeScope, String)
   */
  default SubIdentity createSub(String subNamespace) {
    return SubNamespaceComposer.compose(this, subNamespace);
  }
}
