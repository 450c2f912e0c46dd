package membank.unroll;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import membank.instance.Port;
import membank.memory.Memory;
import membank.metadata.AccessOps;
import membank.metadata.AnalysisInvariantException;
import membank.metadata.BankedAccessOps;
import membank.metadata.BankedMemoryOps;
import membank.metadata.MemoryAccessOps;
import membank.metadata.MetadataStore;
import membank.metadata.Sym;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits a banked memory into one memory symbol per duplicate and routes every unrolled access instance
 * to the duplicate(s) it was dispatched to.
 * <p>
 * Each new memory has exactly one instance. Each unrolled access instance becomes its own access symbol,
 * dispatched to index 0 of its new memory, with the port it had on the original dispatch.
 * A writer dispatched to several duplicates is replicated once per duplicate (physical broadcast).
 */
public class DuplicateUnroller {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** One unrolled access instance after routing. */
  public record UnrolledAccess(Sym original, List<Integer> uid, int dispatch, Sym access, Sym memory, Port port) {}

  /** Result of unrolling one memory. */
  public static class Result {
    private final List<Sym> memories;
    private final List<UnrolledAccess> accesses;

    Result(List<Sym> memories, List<UnrolledAccess> accesses) {
      this.memories = Collections.unmodifiableList(memories);
      this.accesses = Collections.unmodifiableList(accesses);
    }

    /** The new memory symbol of each duplicate, by duplicate index. */
    public List<Sym> getMemories() { return memories; }
    public List<UnrolledAccess> getAccesses() { return accesses; }
    /** The routed instances of one original access. */
    public List<UnrolledAccess> getAccesses(Sym original) {
      return accesses.stream().filter(a -> a.original().equals(original)).toList();
    }
  }

  private final MetadataStore store;

  public DuplicateUnroller(MetadataStore store) { this.store = store; }

  /**
   * Unrolls mem, routing all unrolled instances that have ports assigned.
   * @see #unroll(Sym, Map)
   */
  public Result unroll(Sym mem) {
    Map<Sym, Set<List<Integer>>> uids = new HashMap<>();
    for (Sym access : MemoryAccessOps.accesses(store, mem)) {
      Set<List<Integer>> accessUIDs = new HashSet<>();
      BankedAccessOps.getPorts(store, access).ifPresent(ports -> ports.values().forEach(m -> accessUIDs.addAll(m.keySet())));
      uids.put(access, accessUIDs);
    }
    return unroll(mem, uids);
  }

  /**
   * Unrolls mem.
   * @param mem the banked memory with its duplicates, readers and writers set
   * @param uids the unroll ids of every access of mem that must be routed
   * @return the new memories and the routed access instances
   * @throws membank.metadata.MissingMetadataException if mem has no duplicates, or an instance has no dispatch or port
   * @throws AnalysisInvariantException if a reader has more than one dispatch, or a writer none,
   *         or a dispatch refers to a duplicate that does not exist
   */
  public Result unroll(Sym mem, Map<Sym, ? extends Collection<List<Integer>>> uids) {
    List<Memory> duplicates = BankedMemoryOps.duplicates(store, mem);

    List<Sym> memories = new ArrayList<>(duplicates.size());
    for (int d = 0; d < duplicates.size(); ++d) {
      Sym dupMem = store.newSym(duplicates.size() == 1 ? mem.getName() : mem.getName() + "_" + d, mem.getKind());
      store.mirror(mem, dupMem);
      BankedMemoryOps.setInstance(store, dupMem, duplicates.get(d));
      memories.add(dupMem);
    }

    List<UnrolledAccess> routed = new ArrayList<>();
    TreeMap<Integer, Set<Sym>> readersOf = new TreeMap<>();
    TreeMap<Integer, Set<Sym>> writersOf = new TreeMap<>();
    Set<Sym> readers = MemoryAccessOps.readers(store, mem);

    for (Sym access : new TreeSet<>(uids.keySet())) {
      boolean isReader = readers.contains(access) || access.isReader();
      List<List<Integer>> sortedUIDs = uids.get(access).stream().map(List::copyOf).distinct().sorted(this::compareUID).toList();
      for (List<Integer> uid : sortedUIDs) {
        Set<Integer> dispatches = isReader ? Set.of(BankedAccessOps.readerDispatch(store, access, uid))
                                           : BankedAccessOps.dispatch(store, access, uid);
        if (dispatches.isEmpty())
          throw new AnalysisInvariantException(access, uid, "Writer " + access + " is not dispatched to any duplicate");
        for (int d : new TreeSet<>(dispatches)) {
          if (d < 0 || d >= memories.size())
            throw new AnalysisInvariantException(access, uid,
                                                 String.format("Dispatch #%d of %s is out of range for %d duplicates", d, access, memories.size()));
          Port port = BankedAccessOps.port(store, access, d, uid);
          Sym unrolled = store.newSym(access.getName() + "_" + uid.stream().map(String::valueOf).collect(Collectors.joining("_")) +
                                          (dispatches.size() > 1 ? "_d" + d : ""),
                                      access.getKind());
          store.mirror(access, unrolled);
          AccessOps.setMemory(store, unrolled, memories.get(d));
          BankedAccessOps.setDispatches(store, unrolled, Map.of(uid, Set.of(0)));
          BankedAccessOps.clearPorts(store, unrolled);
          BankedAccessOps.addPort(store, unrolled, 0, uid, port);
          (isReader ? readersOf : writersOf).computeIfAbsent(d, k -> new HashSet<>()).add(unrolled);
          routed.add(new UnrolledAccess(access, uid, d, unrolled, memories.get(d), port));
          logger.trace("Routed {} {{}} to duplicate #{} as {}", access, uid, d, unrolled);
        }
      }
    }

    for (int d = 0; d < memories.size(); ++d) {
      Sym dupMem = memories.get(d);
      MemoryAccessOps.setReaders(store, dupMem, readersOf.getOrDefault(d, Set.of()));
      MemoryAccessOps.setWriters(store, dupMem, writersOf.getOrDefault(d, Set.of()));
      if (!readersOf.containsKey(d) && !writersOf.containsKey(d)) {
        logger.warn("Duplicate #{} of {} has no accesses", d, mem);
        MemoryAccessOps.setUnusedMemory(store, dupMem, true);
      }
    }
    logger.debug("Unrolled {} into {} duplicate(s) with {} access instances", mem, memories.size(), routed.size());
    return new Result(memories, routed);
  }

  private int compareUID(List<Integer> a, List<Integer> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); ++i) {
      int cmp = Integer.compare(a.get(i), b.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(a.size(), b.size());
  }
}
