package membank.instance;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import membank.access.AccessMatrix;
import membank.access.Ctrl;
import membank.banking.Banking;
import membank.memory.AccumType;
import membank.memory.Memory;
import membank.metadata.AccessOps;
import membank.metadata.AnalysisInvariantException;
import membank.metadata.BankedAccessOps;
import membank.metadata.BankedMemoryOps;
import membank.metadata.MetadataStore;
import membank.metadata.Sym;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds candidate {@link Instance}s for a memory and writes the selected ones back into the metadata store.
 */
public class InstanceBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final MetadataStore store;
  private final PortScheduler scheduler;

  public InstanceBuilder(MetadataStore store) {
    this.store = store;
    this.scheduler = new PortScheduler(store);
  }

  /**
   * Builds a candidate instance: collects the controllers of all accesses and schedules their ports.
   * @param reads read groups (mutually exclusive accesses per group)
   * @param writes write groups
   * @param metapipe the metapipe the memory is buffered across, if any
   * @param banking the banking strategies of the candidate
   * @param depth the buffer depth
   * @param cost the cost of the candidate as estimated by the banking search
   * @param accType accumulator type
   */
  public Instance build(Set<Set<AccessMatrix>> reads, Set<Set<AccessMatrix>> writes, Optional<Ctrl> metapipe, List<Banking> banking, int depth,
                        int cost, AccumType accType) {
    Set<Ctrl> ctrls = Stream.concat(reads.stream(), writes.stream())
                          .flatMap(Set::stream)
                          .map(a -> AccessOps.parent(store, a.getAccess()))
                          .collect(Collectors.toCollection(HashSet::new));
    Map<AccessMatrix, Port> ports = scheduler.schedule(reads, writes, metapipe, depth);
    Instance inst = new Instance(reads, writes, ctrls, metapipe, banking, depth, cost, ports, accType);
    logger.debug("Built candidate instance with {} accesses, cost {}", ports.size(), cost);
    return inst;
  }

  /** Returns the cheapest of the given candidates, keeping the earliest on ties. */
  public static Optional<Instance> cheapest(List<Instance> candidates) {
    return candidates.stream().min(Comparator.comparingInt(Instance::getCost));
  }

  /**
   * Stores the duplicates of a memory and the dispatch and port of every access instance.
   * Duplicate i of mem is instances.get(i); every access matrix of instance i is dispatched to i.
   * Previous dispatches and ports of the accesses are replaced, so committing again yields the same state.
   * @param mem the memory
   * @param instances the selected instance of each duplicate
   * @throws AnalysisInvariantException if a reader instance appears in several duplicates
   */
  public void commit(Sym mem, List<Instance> instances) {
    checkReaderDispatch(instances);
    BankedMemoryOps.setDuplicates(store, mem, instances.stream().map(Instance::toMemory).toList());
    Set<Sym> accesses = instances.stream().flatMap(inst -> inst.accesses().stream()).collect(Collectors.toSet());
    for (Sym access : accesses) {
      BankedAccessOps.clearDispatches(store, access);
      BankedAccessOps.clearPorts(store, access);
    }
    for (int i = 0; i < instances.size(); ++i) {
      Instance inst = instances.get(i);
      for (Map.Entry<AccessMatrix, Port> entry : inst.getPorts().entrySet()) {
        AccessMatrix matrix = entry.getKey();
        BankedAccessOps.addDispatch(store, matrix.getAccess(), matrix.getUnroll(), i);
        BankedAccessOps.addPort(store, matrix.getAccess(), i, matrix.getUnroll(), entry.getValue());
      }
      logger.debug("Duplicate #{} of {}:\n{}", i, mem, inst);
    }
  }

  // a reader instance may be served by one duplicate only; checked before the store is touched
  private static void checkReaderDispatch(List<Instance> instances) {
    HashMap<Sym, HashMap<List<Integer>, Integer>> readerDispatch = new HashMap<>();
    for (int i = 0; i < instances.size(); ++i) {
      for (AccessMatrix matrix : instances.get(i).getPorts().keySet()) {
        Sym access = matrix.getAccess();
        if (!access.isReader())
          continue;
        Integer prev = readerDispatch.computeIfAbsent(access, k -> new HashMap<>()).putIfAbsent(matrix.getUnroll(), i);
        if (prev != null && prev != i)
          throw new AnalysisInvariantException(access, matrix.getUnroll(),
                                               String.format("Reader %s cannot be dispatched to duplicates %d and %d", access, prev, i));
      }
    }
  }
}
