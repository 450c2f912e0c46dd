package membank.instance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import membank.access.AccessMatrix;
import membank.access.Ctrl;
import membank.metadata.AccessOps;
import membank.metadata.AnalysisInvariantException;
import membank.metadata.MetadataStore;
import membank.metadata.Sym;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns buffer ports and time multiplexed (mux) ports to the accesses of one memory duplicate.
 * <p>
 * Reads and writes are scheduled separately. The buffer port of an access is its stage within the metapipe,
 * relative to the first stage that accesses the memory.
 * Accesses on the same buffer port that run in the same controller at the same time step share a mux port.
 * Within a mux port, each group of mutually exclusive accesses gets its own range of lanes,
 * and the exclusive accesses of one group overlap within that range.
 * Unrolled copies of an access with an address identical to an earlier copy reuse its lanes (broadcast).
 */
public class PortScheduler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Lexicographic order of unroll ids. */
  static final Comparator<List<Integer>> uidOrder = (a, b) -> {
    for (int i = 0; i < Math.min(a.size(), b.size()); ++i) {
      int cmp = Integer.compare(a.get(i), b.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(a.size(), b.size());
  };

  private final MetadataStore store;

  /**
   * @param store the store holding parent controller, time step and width of the accesses (see {@link AccessOps})
   */
  public PortScheduler(MetadataStore store) { this.store = store; }

  private record MuxKey(Optional<Integer> bufferPort, Ctrl ctrl, int timeStep) {}

  /** One access instance with its lane allocation, before muxSize is known. */
  private static class Slot {
    final AccessMatrix matrix;
    final MuxKey key;
    final int group;
    int muxPort;
    int muxOfs;
    int broadcast;
    Slot(AccessMatrix matrix, MuxKey key, int group) {
      this.matrix = matrix;
      this.key = key;
      this.group = group;
    }
  }

  /**
   * Computes the ports of all accesses of a duplicate.
   * @param reads read groups (each group is a set of mutually exclusive accesses)
   * @param writes write groups
   * @param metapipe the pipelined controller the memory is N-buffered across, if any
   * @param depth the buffer depth
   * @return the port of every access matrix in reads and writes
   * @throws AnalysisInvariantException if an access lies in a stage beyond the buffer depth,
   *         or the memory is buffered without a metapipe
   */
  public Map<AccessMatrix, Port> schedule(Set<Set<AccessMatrix>> reads, Set<Set<AccessMatrix>> writes, Optional<Ctrl> metapipe, int depth) {
    if (depth < 1)
      throw new IllegalArgumentException("depth must be at least 1, got " + depth);
    Optional<Integer> firstStage = metapipe.flatMap(mp -> firstStage(reads, writes, mp));

    HashMap<AccessMatrix, Port> result = new HashMap<>();
    result.putAll(scheduleDirection(reads, metapipe, firstStage, depth));
    result.putAll(scheduleDirection(writes, metapipe, firstStage, depth));
    return result;
  }

  private Optional<Integer> firstStage(Set<Set<AccessMatrix>> reads, Set<Set<AccessMatrix>> writes, Ctrl metapipe) {
    return Stream.concat(reads.stream(), writes.stream())
        .flatMap(Set::stream)
        .map(a -> AccessOps.parent(store, a.getAccess()).stageWithin(metapipe))
        .flatMap(Optional::stream)
        .min(Integer::compare);
  }

  /**
   * Returns the buffer port of an access: Some(0) for unbuffered memories, the stage within the metapipe
   * (relative to firstStage) for accesses inside it, None for accesses outside of it.
   */
  Optional<Integer> bufferPort(AccessMatrix a, Optional<Ctrl> metapipe, Optional<Integer> firstStage, int depth) {
    if (depth == 1)
      return Optional.of(0);
    if (metapipe.isEmpty())
      throw new AnalysisInvariantException(a.getAccess(), a.getUnroll(), "Buffer of depth " + depth + " has no metapipe");
    Optional<Integer> stage = AccessOps.parent(store, a.getAccess()).stageWithin(metapipe.get());
    if (stage.isEmpty())
      return Optional.empty();
    int port = stage.get() - firstStage.orElse(0);
    if (port >= depth)
      throw new AnalysisInvariantException(a.getAccess(), a.getUnroll(),
                                           String.format("Access in stage %d of %s exceeds buffer depth %d", port, metapipe.get(), depth));
    return Optional.of(port);
  }

  private Map<AccessMatrix, Port> scheduleDirection(Set<Set<AccessMatrix>> groups, Optional<Ctrl> metapipe, Optional<Integer> firstStage,
                                                    int depth) {
    Comparator<AccessMatrix> order = Comparator.comparing((AccessMatrix a) -> AccessOps.parent(store, a.getAccess()).getName())
                                         .thenComparing(a -> AccessOps.timeStep(store, a.getAccess()))
                                         .thenComparing(AccessMatrix::getAccess)
                                         .thenComparing(AccessMatrix::getUnroll, uidOrder);
    // Group order: by the first access of each group.
    List<List<AccessMatrix>> sortedGroups = groups.stream()
                                                .filter(g -> !g.isEmpty())
                                                .map(g -> g.stream().sorted(order).toList())
                                                .sorted(Comparator.comparing((List<AccessMatrix> g) -> g.get(0), order))
                                                .toList();

    // An access listed in several groups is scheduled with the first one.
    List<Slot> slots = new ArrayList<>();
    HashSet<AccessMatrix> seen = new HashSet<>();
    for (int iGroup = 0; iGroup < sortedGroups.size(); ++iGroup) {
      for (AccessMatrix a : sortedGroups.get(iGroup)) {
        if (!seen.add(a))
          continue;
        Sym access = a.getAccess();
        MuxKey key = new MuxKey(bufferPort(a, metapipe, firstStage, depth), AccessOps.parent(store, access), AccessOps.timeStep(store, access));
        slots.add(new Slot(a, key, iGroup));
      }
    }

    // Mux port numbers in order of first appearance, per buffer port.
    LinkedHashMap<MuxKey, Integer> muxPorts = new LinkedHashMap<>();
    HashMap<Optional<Integer>, Integer> nextMuxPort = new HashMap<>();
    slots.stream().sorted(Comparator.comparing((Slot s) -> s.matrix, order)).forEach(s -> {
      muxPorts.computeIfAbsent(s.key, k -> nextMuxPort.merge(k.bufferPort(), 1, Integer::sum) - 1);
    });

    // Lane allocation: groups are stacked, exclusive accesses of a group overlap, copies of one access are stacked.
    HashMap<MuxKey, Integer> laneCount = new HashMap<>();
    for (int iGroup = 0; iGroup < sortedGroups.size(); ++iGroup) {
      int iGroup_ = iGroup;
      Map<MuxKey, List<Slot>> groupSlotsByMux = slots.stream()
                                                    .filter(s -> s.group == iGroup_)
                                                    .collect(Collectors.groupingBy(s -> s.key, LinkedHashMap::new, Collectors.toList()));
      groupSlotsByMux.forEach((key, groupSlots) -> {
        int base = laneCount.getOrDefault(key, 0);
        int groupWidth = 0;
        Map<Sym, List<Slot>> byAccess =
            groupSlots.stream().collect(Collectors.groupingBy(s -> s.matrix.getAccess(), LinkedHashMap::new, Collectors.toList()));
        for (List<Slot> copies : byAccess.values()) {
          int width = AccessOps.width(store, copies.get(0).matrix.getAccess());
          int used = 0;
          LinkedHashMap<Slot, Integer> sources = new LinkedHashMap<>();
          for (Slot s : copies) {
            s.muxPort = muxPorts.get(key);
            Optional<Slot> source = sources.keySet().stream().filter(src -> src.matrix.sameAddress(s.matrix)).findFirst();
            if (source.isPresent()) {
              s.muxOfs = source.get().muxOfs;
              s.broadcast = sources.merge(source.get(), 1, Integer::sum);
            } else {
              s.muxOfs = base + used;
              s.broadcast = 0;
              used += width;
              sources.put(s, 0);
            }
          }
          groupWidth = Math.max(groupWidth, used);
        }
        laneCount.put(key, base + groupWidth);
      });
    }

    // muxSize is the widest mux port on the same buffer port.
    HashMap<Optional<Integer>, Integer> muxSize = new HashMap<>();
    laneCount.forEach((key, lanes) -> muxSize.merge(key.bufferPort(), lanes, Math::max));

    HashMap<AccessMatrix, Port> result = new HashMap<>();
    for (Slot s : slots) {
      Port port = new Port(s.key.bufferPort(), s.muxPort, muxSize.get(s.key.bufferPort()), s.muxOfs, s.broadcast);
      result.put(s.matrix, port);
      logger.trace("Port of {}: {}", s.matrix, port);
    }
    return result;
  }
}
