package io.github.panghy.nodename.logging;

import io.github.panghy.nodename.node.NodeIdentity;
import io.github.panghy.nodename.node.SubIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for LoggerNames.
 */
class LoggerNamesTest {

  @ParameterizedTest
  @CsvSource({
      "'', my_node",
      "/ns, ns.my_node",
      "ns, ns.my_node",
      "/my/ns, my.ns.my_node",
      "my/ns, my.ns.my_node"
  })
  void testLoggerNameOfIdentity(String namespace, String expected) {
    NodeIdentity identity = NodeIdentity.create("my_node", namespace);
    String loggerName = LoggerNames.of(identity);
    assertEquals(expected, loggerName);
    assertFalse(loggerName.contains("/"));
    assertEquals(identity.getFullyQualifiedName().substring(1).replace('/', '.'), loggerName);
  }

  @Test
  void testFromFullyQualifiedName() {
    assertEquals("my_node", LoggerNames.fromFullyQualifiedName("/my_node"));
    assertEquals("a.b.c", LoggerNames.fromFullyQualifiedName("/a/b/c"));
    assertThrows(NullPointerException.class, () -> LoggerNames.fromFullyQualifiedName(null));
  }

  @Test
  void testSubIdentityUsesNodeLoggerName() {
    SubIdentity sub = NodeIdentity.create("my_node", "/ns").createSub("sub_ns");
    assertEquals("ns.my_node", LoggerNames.of(sub));
  }

  @Test
  void testLoggerFor() {
    NodeIdentity identity = NodeIdentity.create("my_node", "/my/ns");
    assertEquals("my.ns.my_node", LoggerNames.loggerFor(identity).getName());
    assertSame(LoggerNames.loggerFor(identity), LoggerNames.loggerFor(identity.createSub("x")));
  }
}
