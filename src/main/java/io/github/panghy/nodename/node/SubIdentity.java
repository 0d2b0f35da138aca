package io.github.panghy.nodename.node;

import io.github.panghy.nodename.validation.NamespaceNormalizer;

import java.util.Objects;

/**
 * A node identity extended by a relative sub-namespace.
 *
 * <p>A sub-identity belongs to the same node as its {@link #getRoot() root identity}: name,
 * namespace and fully-qualified name are the root's, unchanged through any depth of chaining.
 * Only the namespace seen by owned resources (parameters, topics) differs:</p>
 * <pre>
 * root namespace "/ns", sub-namespace "a/b"  ->  effective namespace "/ns/a/b"
 * root namespace "/",   sub-namespace "a/b"  ->  effective namespace "/a/b"
 * </pre>
 *
 * <p>Instances are created by {@link SubNamespaceComposer}. They are immutable and can be
 * safely shared between threads.</p>
 */
public final class SubIdentity implements NodeScope {

  private final NodeIdentity root;
  private final String subNamespace;
  private final String effectiveNamespace;

  SubIdentity(NodeIdentity root, String subNamespace) {
    this.root = Objects.requireNonNull(root, "root cannot be null");
    this.subNamespace = Objects.requireNonNull(subNamespace, "subNamespace cannot be null");
    String namespace = root.getNamespace();
    this.effectiveNamespace = NamespaceNormalizer.ROOT.equals(namespace)
        ? NamespaceNormalizer.ROOT + subNamespace
        : namespace + NamespaceNormalizer.SEPARATOR + subNamespace;
  }

  @Override
  public String getName() {
    return root.getName();
  }

  @Override
  public String getNamespace() {
    return root.getNamespace();
  }

  @Override
  public String getFullyQualifiedName() {
    return root.getFullyQualifiedName();
  }

  @Override
  public String getSubNamespace() {
    return subNamespace;
  }

  @Override
  public String getEffectiveNamespace() {
    return effectiveNamespace;
  }

  @Override
  public NodeIdentity getRoot() {
    return root;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SubIdentity that = (SubIdentity) o;
    return root.equals(that.root) && subNamespace.equals(that.subNamespace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(root, subNamespace);
  }

  @Override
  public String toString() {
    return "SubIdentity{" +
        "node=" + root.getFullyQualifiedName() +
        ", subNamespace='" + subNamespace + '\'' +
        ", effectiveNamespace='" + effectiveNamespace + '\'' +
        '}';
  }
}
