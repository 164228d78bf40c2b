package ca.gc.cra.subhunt.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AddressSetTest {

  @Test
  void equalityIgnoresOrder() {
    assertEquals(AddressSet.of("10.0.0.2", "10.0.0.1"), AddressSet.copyOf(List.of("10.0.0.1", "10.0.0.2")));
  }

  @Test
  void joinedListsAddressesSorted() {
    AddressSet set = AddressSet.of("192.0.2.9", "192.0.2.10", "2001:db8::1");
    assertEquals(List.of("192.0.2.10", "192.0.2.9", "2001:db8::1"), set.sorted());
    assertEquals("192.0.2.10, 192.0.2.9, 2001:db8::1", set.joined());
  }

  @Test
  void emptySetReportsEmpty() {
    assertTrue(AddressSet.EMPTY.isEmpty());
    assertEquals(0, AddressSet.EMPTY.size());
  }
}
