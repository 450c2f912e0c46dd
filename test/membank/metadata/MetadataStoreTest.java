package membank.metadata;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetadataStoreTest {
  static final MetadataKey<String> LABEL = new MetadataKey<>("Label", String.class);
  static final MetadataKey<Integer> COUNT = new MetadataKey<>("Count", Integer.class);

  MetadataStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new MetadataStore();
  }

  @Test
  void testNewSym() {
    Sym a = store.newSym("a", SymKind.SRAM);
    Sym b = store.newSym("a", SymKind.Reader);
    Assertions.assertNotEquals(a, b);
    Assertions.assertTrue(a.compareTo(b) < 0);
    Assertions.assertEquals(2, store.size());
    Assertions.assertEquals(Optional.of(b), store.lookupSym(b.getId()));
    Assertions.assertTrue(store.lookupSym(42).isEmpty());
    Assertions.assertTrue(b.isReader());
    Assertions.assertFalse(b.isWriter());
    Assertions.assertEquals("x" + a.getId() + " (a)", a.toString());
  }

  @Test
  void testLastWriteWins() {
    Sym a = store.newSym("a", SymKind.SRAM);
    Assertions.assertTrue(store.get(a, LABEL).isEmpty());
    store.put(a, LABEL, "first");
    store.put(a, COUNT, 3);
    store.put(a, LABEL, "second");
    Assertions.assertEquals(Optional.of("second"), store.get(a, LABEL));
    Assertions.assertEquals(Optional.of(3), store.get(a, COUNT));
  }

  @Test
  void testRemove() {
    Sym a = store.newSym("a", SymKind.SRAM);
    store.put(a, LABEL, "x");
    Assertions.assertTrue(store.remove(a, LABEL));
    Assertions.assertFalse(store.remove(a, LABEL));
    Assertions.assertTrue(store.get(a, LABEL).isEmpty());
  }

  @Test
  void testInvalidPut() {
    Sym a = store.newSym("a", SymKind.SRAM);
    Assertions.assertThrows(IllegalArgumentException.class, () -> store.put(a, LABEL, null));
    MetadataStore other = new MetadataStore();
    other.newSym("b", SymKind.SRAM);
    Sym notInStore = other.newSym("c", SymKind.SRAM);
    Assertions.assertThrows(IllegalArgumentException.class, () -> store.put(notInStore, LABEL, "x"));
  }

  @Test
  void testMirror() {
    Sym a = store.newSym("a", SymKind.SRAM);
    Sym b = store.newSym("b", SymKind.SRAM);
    store.put(a, LABEL, "a");
    store.put(b, LABEL, "b");
    store.put(b, COUNT, 7);
    store.mirror(a, b);
    Assertions.assertEquals(Optional.of("a"), store.get(b, LABEL));
    Assertions.assertEquals(Optional.of(7), store.get(b, COUNT));
    // Mirrored values are independent afterwards
    store.put(a, LABEL, "changed");
    Assertions.assertEquals(Optional.of("a"), store.get(b, LABEL));
  }

  @Test
  void testCopy() {
    Sym a = store.newSym("a", SymKind.SRAM);
    store.put(a, LABEL, "a");
    MetadataStore copy = new MetadataStore(store);
    copy.put(a, LABEL, "copy");
    Assertions.assertEquals(Optional.of("a"), store.get(a, LABEL));
    Assertions.assertEquals(Optional.of("copy"), copy.get(a, LABEL));
    Sym b = copy.newSym("b", SymKind.SRAM);
    Assertions.assertNotEquals(a, b);
    Assertions.assertEquals(1, store.size());
  }

  @Test
  void testKeyType() {
    Sym a = store.newSym("a", SymKind.SRAM);
    MetadataKey<List<Integer>> listKey = new MetadataKey<>("List", List.class);
    store.put(a, listKey, List.of(1, 2));
    Assertions.assertEquals(Optional.of(List.of(1, 2)), store.get(a, listKey));
  }
}
