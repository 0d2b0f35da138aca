package io.github.panghy.nodename.node;

import io.github.panghy.nodename.clock.FlowClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for NodeOptions.
 */
class NodeOptionsTest {

  @Test
  void testDefaultOptions() {
    NodeOptions options = NodeOptions.defaultOptions();
    assertThat(options.getNamespaceOverride()).isNull();
    assertThat(options.getClock()).isNull();
    assertThat(NodeOptions.defaultOptions()).isSameAs(options);
  }

  @Test
  void testCustomOptions() {
    FlowClock clock = FlowClock.createSteadyClock();
    NodeOptions options = NodeOptions.builder()
        .namespaceOverride("/remapped")
        .clock(clock)
        .build();
    assertThat(options.getNamespaceOverride()).isEqualTo("/remapped");
    assertThat(options.getClock()).isSameAs(clock);
  }

  @Test
  void testOverrideCanBeCleared() {
    NodeOptions options = NodeOptions.builder()
        .namespaceOverride("/remapped")
        .namespaceOverride(null)
        .build();
    assertThat(options.getNamespaceOverride()).isNull();
  }

  @Test
  void testOverrideIsNotValidatedUntilNodeConstruction() {
    NodeOptions options = NodeOptions.builder().namespaceOverride("bad/").build();
    assertThat(options.getNamespaceOverride()).isEqualTo("bad/");
    assertThatThrownBy(() -> FlowNode.create("my_node", "/ns", options))
        .hasMessageContaining("must not end with a forward slash");
  }

  @Test
  void testNullClockIsRejected() {
    assertThatThrownBy(() -> NodeOptions.builder().clock(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("clock cannot be null");
  }
}
