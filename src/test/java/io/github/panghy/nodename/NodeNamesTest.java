package io.github.panghy.nodename;

import io.github.panghy.nodename.error.NameValidationException;
import io.github.panghy.nodename.node.NodeIdentity;
import io.github.panghy.nodename.node.SubIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for the NodeNames entry points.
 */
class NodeNamesTest {

  @Test
  void testNamespacedNode() {
    NodeIdentity id = NodeNames.construct("my_node", "/my/ns");
    assertThat(id.getName()).isEqualTo("my_node");
    assertThat(id.getNamespace()).isEqualTo("/my/ns");
    assertThat(id.getFullyQualifiedName()).isEqualTo("/my/ns/my_node");
    assertThat(NodeNames.loggerName(id)).isEqualTo("my.ns.my_node");
  }

  @Test
  void testRemappedNode() {
    NodeIdentity id = NodeNames.construct("my_node", "ns", "/another_ns");
    assertThat(id.getNamespace()).isEqualTo("/another_ns");
    assertThat(id.getFullyQualifiedName()).isEqualTo("/another_ns/my_node");
  }

  @Test
  void testRootNode() {
    NodeIdentity id = NodeNames.construct("my_node", "");
    assertThat(id.getNamespace()).isEqualTo("/");
    assertThat(id.getFullyQualifiedName()).isEqualTo("/my_node");
    assertThat(NodeNames.loggerName(id)).isEqualTo("my_node");
  }

  @Test
  void testInvalidNodeNameIsReportedFirst() {
    assertThatThrownBy(() -> NodeNames.construct("invalid_node?", "ns/"))
        .isInstanceOf(NameValidationException.class)
        .hasMessageContaining("invalid_node?")
        .extracting(t -> ((NameValidationException) t).getErrorCode())
        .isEqualTo(NameValidationException.ErrorCode.INVALID_NODE_NAME);
  }

  @Test
  void testTrailingSeparator() {
    assertThatThrownBy(() -> NodeNames.construct("my_node", "ns/"))
        .isInstanceOf(NameValidationException.class)
        .extracting(t -> ((NameValidationException) t).getErrorCode())
        .isEqualTo(NameValidationException.ErrorCode.INVALID_NAMESPACE);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "ns", "/my/ns"})
  void testSubNamespaceChaining(String namespace) {
    NodeIdentity n = NodeNames.construct("my_node", namespace);
    SubIdentity sub = NodeNames.createSub(NodeNames.createSub(n, "a"), "b");

    String expectedEffective = "/".equals(n.getNamespace()) ? "/a/b" : n.getNamespace() + "/a/b";
    assertThat(sub.getSubNamespace()).isEqualTo("a/b");
    assertThat(sub.getEffectiveNamespace()).isEqualTo(expectedEffective);
    assertThat(sub.getName()).isEqualTo("my_node");
    assertThat(sub.getNamespace()).isEqualTo(n.getNamespace());
    assertThat(NodeNames.loggerName(sub)).isEqualTo(NodeNames.loggerName(n));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "ns", "/my/ns"})
  void testAbsoluteSubNamespace(String namespace) {
    NodeIdentity n = NodeNames.construct("my_node", namespace);
    assertThatThrownBy(() -> NodeNames.createSub(n, "/sub_ns"))
        .isInstanceOf(NameValidationException.class)
        .extracting(t -> ((NameValidationException) t).getErrorCode())
        .isEqualTo(NameValidationException.ErrorCode.NAME_VALIDATION_ERROR);
  }

  @Test
  void testPrivateSubNamespace() {
    NodeIdentity n = NodeNames.construct("my_node", "/ns");
    assertThatThrownBy(() -> NodeNames.createSub(n, "~sub_ns"))
        .isInstanceOf(NameValidationException.class)
        .extracting(t -> ((NameValidationException) t).getErrorCode())
        .isEqualTo(NameValidationException.ErrorCode.INVALID_NAMESPACE);
  }

  @Test
  void testTryConstruct() {
    Optional<NodeIdentity> ok = NodeNames.tryConstruct("my_node", "ns", null);
    assertThat(ok).contains(NodeNames.construct("my_node", "/ns"));

    assertThat(NodeNames.tryConstruct("invalid_node?", "ns", null)).isEmpty();
    assertThat(NodeNames.tryConstruct("my_node", "ns/", null)).isEmpty();
    assertThat(NodeNames.tryConstruct("my_node", "ns/", "/fixed")).isPresent();
  }

  @Test
  void testNormalizeNamespace() {
    assertThat(NodeNames.normalizeNamespace("my/ns")).isEqualTo("/my/ns");
    assertThat(NodeNames.normalizeNamespace(NodeNames.normalizeNamespace("my/ns"))).isEqualTo("/my/ns");
  }

  @Test
  void testIdentitiesAreSafelySharedAcrossThreads() throws Exception {
    NodeIdentity id = NodeNames.construct("my_node", "/my/ns");
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<CompletableFuture<String>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        String segment = "worker_" + i;
        futures.add(CompletableFuture.supplyAsync(
            () -> id.createSub(segment).getEffectiveNamespace(), executor));
      }
      for (int i = 0; i < futures.size(); i++) {
        assertThat(futures.get(i).get()).isEqualTo("/my/ns/worker_" + i);
      }
      assertThat(id.getFullyQualifiedName()).isEqualTo("/my/ns/my_node");
    } finally {
      executor.shutdownNow();
    }
  }
}
