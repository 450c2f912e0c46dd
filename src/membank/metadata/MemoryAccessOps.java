package membank.metadata;

import java.util.Set;
import java.util.TreeSet;

/**
 * Readers, writers and resetters of a memory.
 */
public class MemoryAccessOps {
  private static final MetadataKey<Set<Sym>> READERS = new MetadataKey<>("Readers", Set.class);
  private static final MetadataKey<Set<Sym>> WRITERS = new MetadataKey<>("Writers", Set.class);
  private static final MetadataKey<Set<Sym>> RESETTERS = new MetadataKey<>("Resetters", Set.class);
  private static final MetadataKey<Boolean> UNUSED = new MetadataKey<>("UnusedMemory", Boolean.class);

  public static Set<Sym> readers(MetadataStore store, Sym mem) { return store.get(mem, READERS).orElse(Set.of()); }
  public static void setReaders(MetadataStore store, Sym mem, Set<Sym> readers) { store.put(mem, READERS, Set.copyOf(readers)); }

  public static Set<Sym> writers(MetadataStore store, Sym mem) { return store.get(mem, WRITERS).orElse(Set.of()); }
  public static void setWriters(MetadataStore store, Sym mem, Set<Sym> writers) { store.put(mem, WRITERS, Set.copyOf(writers)); }

  /** Readers and writers, ordered by symbol id. */
  public static Set<Sym> accesses(MetadataStore store, Sym mem) {
    TreeSet<Sym> result = new TreeSet<>(readers(store, mem));
    result.addAll(writers(store, mem));
    return result;
  }

  public static Set<Sym> resetters(MetadataStore store, Sym mem) { return store.get(mem, RESETTERS).orElse(Set.of()); }
  public static void setResetters(MetadataStore store, Sym mem, Set<Sym> resetters) { store.put(mem, RESETTERS, Set.copyOf(resetters)); }

  public static boolean isUnusedMemory(MetadataStore store, Sym mem) { return store.get(mem, UNUSED).orElse(false); }
  public static void setUnusedMemory(MetadataStore store, Sym mem, boolean flag) { store.put(mem, UNUSED, flag); }
}
