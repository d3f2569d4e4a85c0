package io.treepath.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.model.TypeInfo;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SystemScopeTest {

  @Test
  void innerBindingsShadowOuter() {
    SystemScope outer = SystemScope.EMPTY.push(Map.of(SystemScope.THIS, TypeInfo.STRING));
    SystemScope inner =
        outer.push(Map.of(SystemScope.THIS, TypeInfo.INTEGER, SystemScope.INDEX, TypeInfo.INTEGER));

    assertEquals(TypeInfo.INTEGER, inner.lookup(SystemScope.THIS));
    assertEquals(TypeInfo.STRING, outer.lookup(SystemScope.THIS));
    assertTrue(inner.isBound(SystemScope.INDEX));
    assertFalse(outer.isBound(SystemScope.INDEX));
    assertSame(outer, inner.parent());
    assertEquals(2, inner.depth());
  }

  @Test
  void emptyScopeBindsNothing() {
    assertNull(SystemScope.EMPTY.lookup(SystemScope.TOTAL));
    assertNull(SystemScope.EMPTY.parent());
    assertEquals(0, SystemScope.EMPTY.depth());
  }
}
