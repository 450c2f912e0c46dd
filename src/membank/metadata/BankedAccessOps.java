package membank.metadata;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import membank.instance.Port;

/**
 * Dispatch and port metadata of accesses.
 * <p>
 * Unrolled instances of an access are identified by their unroll id (uid): the unroll indices of all surrounding iterators.
 * Memory duplicates are identified by their index into the duplicates list of the accessed memory.
 * Writers may be dispatched to several duplicates (physical broadcast), readers to at most one.
 */
public class BankedAccessOps {
  private static final MetadataKey<Map<List<Integer>, Set<Integer>>> DISPATCH = new MetadataKey<>("Dispatch", Map.class);
  private static final MetadataKey<Map<Integer, Map<List<Integer>, Port>>> PORTS = new MetadataKey<>("Ports", Map.class);

  public static Optional<Map<List<Integer>, Set<Integer>>> getDispatches(MetadataStore store, Sym access) { return store.get(access, DISPATCH); }
  /** Returns the dispatch map of an access, empty if none is defined. */
  public static Map<List<Integer>, Set<Integer>> dispatches(MetadataStore store, Sym access) {
    return getDispatches(store, access).orElse(Map.of());
  }
  public static void setDispatches(MetadataStore store, Sym access, Map<List<Integer>, Set<Integer>> dispatches) {
    HashMap<List<Integer>, Set<Integer>> copy = new HashMap<>();
    dispatches.forEach((uid, ds) -> copy.put(List.copyOf(uid), Set.copyOf(ds)));
    store.put(access, DISPATCH, Map.copyOf(copy));
  }

  public static void clearDispatches(MetadataStore store, Sym access) { store.remove(access, DISPATCH); }

  public static Optional<Set<Integer>> getDispatch(MetadataStore store, Sym access, List<Integer> uid) {
    return getDispatches(store, access).map(m -> m.get(uid));
  }
  public static Set<Integer> dispatch(MetadataStore store, Sym access, List<Integer> uid) {
    return getDispatch(store, access, uid).orElseThrow(() -> new MissingMetadataException(access, uid, "No dispatch defined for " + access));
  }

  /**
   * Resolves the single duplicate a reader instance reads from.
   * @throws MissingMetadataException if the instance has no dispatch
   * @throws AnalysisInvariantException if the instance was dispatched to several duplicates
   */
  public static int readerDispatch(MetadataStore store, Sym access, List<Integer> uid) {
    Set<Integer> ds = dispatch(store, access, uid);
    if (ds.size() != 1)
      throw new AnalysisInvariantException(access, uid, "Reader " + access + " has " + ds.size() + " dispatches " + ds + ", expected one");
    return ds.iterator().next();
  }

  /** Adds a duplicate index to the dispatch set of an unrolled access instance. */
  public static void addDispatch(MetadataStore store, Sym access, List<Integer> uid, int dispatch) {
    HashMap<List<Integer>, Set<Integer>> map = new HashMap<>(dispatches(store, access));
    HashSet<Integer> set = new HashSet<>(map.getOrDefault(uid, Set.of()));
    set.add(dispatch);
    if (access.isReader() && set.size() > 1)
      throw new AnalysisInvariantException(access, uid, "Reader " + access + " cannot be dispatched to duplicates " + set);
    map.put(List.copyOf(uid), Set.copyOf(set));
    store.put(access, DISPATCH, Map.copyOf(map));
  }

  public static Optional<Map<Integer, Map<List<Integer>, Port>>> getPorts(MetadataStore store, Sym access) { return store.get(access, PORTS); }
  public static Optional<Map<List<Integer>, Port>> getPorts(MetadataStore store, Sym access, int dispatch) {
    return getPorts(store, access).map(m -> m.get(dispatch));
  }
  public static Map<List<Integer>, Port> ports(MetadataStore store, Sym access, int dispatch) {
    return getPorts(store, access, dispatch)
        .orElseThrow(() -> new MissingMetadataException(access, "No ports defined for " + access + " on dispatch #" + dispatch));
  }
  public static void clearPorts(MetadataStore store, Sym access) { store.remove(access, PORTS); }
  public static void addPort(MetadataStore store, Sym access, int dispatch, List<Integer> uid, Port port) {
    HashMap<Integer, Map<List<Integer>, Port>> map = new HashMap<>(getPorts(store, access).orElse(Map.of()));
    HashMap<List<Integer>, Port> ports = new HashMap<>(map.getOrDefault(dispatch, Map.of()));
    ports.put(List.copyOf(uid), port);
    map.put(dispatch, Map.copyOf(ports));
    store.put(access, PORTS, Map.copyOf(map));
  }

  public static Optional<Port> getPort(MetadataStore store, Sym access, int dispatch, List<Integer> uid) {
    return getPorts(store, access, dispatch).map(m -> m.get(uid));
  }
  public static Port port(MetadataStore store, Sym access, int dispatch, List<Integer> uid) {
    return getPort(store, access, dispatch, uid)
        .orElseThrow(() -> new MissingMetadataException(access, uid, "No ports defined for " + access + " on dispatch #" + dispatch));
  }
}
