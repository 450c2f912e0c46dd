package membank.instance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import membank.access.AccessMatrix;
import membank.access.Ctrl;
import membank.banking.Banking;
import membank.banking.ModBanking;
import membank.memory.AccumType;
import membank.memory.Memory;
import membank.metadata.AnalysisInvariantException;
import membank.metadata.Sym;

/**
 * Candidate physical duplicate of a memory, used during the banking analysis to track intermediate results.
 * Instances are compared by cost by the banking search; the winner is written back through {@link Memory} and {@link Port}s.
 */
public final class Instance {
  private final Set<Set<AccessMatrix>> reads;
  private final Set<Set<AccessMatrix>> writes;
  private final Set<Ctrl> ctrls;
  private final Optional<Ctrl> metapipe;
  private final List<Banking> banking;
  private final int depth;
  private final int cost;
  private final Map<AccessMatrix, Port> ports;
  private final AccumType accType;

  /**
   * @param reads all reads of this duplicate, in groups of mutually exclusive accesses
   * @param writes all writes of this duplicate, in groups of mutually exclusive accesses
   * @param ctrls the controllers the accesses are in
   * @param metapipe the controller requiring N-buffering, if any access needs it
   * @param banking the banking strategies
   * @param depth the N-buffer depth
   * @param cost estimated cost of this configuration, lower is better
   * @param ports the port of every access in reads and writes
   * @param accType accumulator type of this duplicate
   * @throws AnalysisInvariantException if an access has no port
   */
  public Instance(Set<Set<AccessMatrix>> reads, Set<Set<AccessMatrix>> writes, Set<Ctrl> ctrls, Optional<Ctrl> metapipe,
                  List<Banking> banking, int depth, int cost, Map<AccessMatrix, Port> ports, AccumType accType) {
    this.reads = copyGroups(reads);
    this.writes = copyGroups(writes);
    this.ctrls = Collections.unmodifiableSet(new HashSet<>(ctrls));
    this.metapipe = metapipe;
    this.banking = List.copyOf(banking);
    this.depth = depth;
    this.cost = cost;
    this.ports = Map.copyOf(ports);
    this.accType = accType;
    for (AccessMatrix matrix : accessMatrices()) {
      if (!this.ports.containsKey(matrix))
        throw new AnalysisInvariantException(matrix.getAccess(), matrix.getUnroll(), "No port assigned to " + matrix.getAccess());
    }
  }

  private static Set<Set<AccessMatrix>> copyGroups(Set<Set<AccessMatrix>> groups) {
    return groups.stream().map(Set::copyOf).collect(Collectors.toUnmodifiableSet());
  }

  /** Unbanked, unbuffered instance without accesses. */
  public static Instance unit(int rank) {
    return new Instance(Set.of(), Set.of(), Set.of(), Optional.empty(), List.of(ModBanking.unit(rank)), 1, 0, Map.of(), AccumType.None);
  }

  public Set<Set<AccessMatrix>> getReads() { return reads; }
  public Set<Set<AccessMatrix>> getWrites() { return writes; }
  public Set<Ctrl> getCtrls() { return ctrls; }
  public Optional<Ctrl> getMetapipe() { return metapipe; }
  public List<Banking> getBanking() { return banking; }
  public int getDepth() { return depth; }
  public int getCost() { return cost; }
  public Map<AccessMatrix, Port> getPorts() { return ports; }
  public AccumType getAccType() { return accType; }

  public Memory toMemory() { return new Memory(banking, depth, accType); }

  public Set<AccessMatrix> accessMatrices() {
    return Stream.concat(reads.stream(), writes.stream()).flatMap(Set::stream).collect(Collectors.toSet());
  }
  public Set<Sym> accesses() { return accessMatrices().stream().map(AccessMatrix::getAccess).collect(Collectors.toSet()); }

  private static final Comparator<AccessMatrix> matrixOrder =
      Comparator.comparing(AccessMatrix::getAccess).thenComparing(AccessMatrix::getUnroll, PortScheduler.uidOrder);

  private String portString(Optional<Integer> port, Set<Set<AccessMatrix>> groups, String tp) {
    List<AccessMatrix> onPort =
        groups.stream().flatMap(Set::stream).filter(a -> ports.get(a).getBufferPort().equals(port)).sorted(matrixOrder).toList();
    int muxSize = onPort.stream().mapToInt(a -> ports.get(a).getMuxSize()).max().orElse(0);

    List<String> lines = new ArrayList<>();
    lines.add(String.format("%s [Type:%s, Width:%d]:", port.map(String::valueOf).orElse("M"), tp, muxSize));
    TreeMap<Integer, List<AccessMatrix>> byMuxPort = new TreeMap<>();
    onPort.forEach(a -> byMuxPort.computeIfAbsent(ports.get(a).getMuxPort(), k -> new ArrayList<>()).add(a));
    byMuxPort.forEach((muxPort, matrices) -> {
      lines.add(" - Mux Port #" + muxPort + ": ");
      for (AccessMatrix a : matrices) {
        Port p = ports.get(a);
        lines.add(String.format("  [Ofs: %d%s] %s {%s}", p.getMuxOfs(), p.getBroadcast() > 0 ? ", Bcast: " + p.getBroadcast() : "", a.getAccess(),
                                a.getUnroll().stream().map(String::valueOf).collect(Collectors.joining(","))));
      }
    });
    return String.join("\n", lines);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reads, writes, metapipe, banking, depth, cost, ports, accType);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Instance other = (Instance)obj;
    return reads.equals(other.reads) && writes.equals(other.writes) && ctrls.equals(other.ctrls) && metapipe.equals(other.metapipe) &&
        banking.equals(other.banking) && depth == other.depth && cost == other.cost && ports.equals(other.ports) &&
        accType.equals(other.accType);
  }

  @Override
  public String toString() {
    List<Optional<Integer>> bufferPorts = new ArrayList<>();
    for (int i = 0; i < depth; ++i)
      bufferPorts.add(Optional.of(i));
    if (depth > 1)
      bufferPorts.add(Optional.empty());

    String format = banking.size() == 1 ? "Flat" : "Hierarchical";
    StringBuilder sb = new StringBuilder();
    sb.append("<Banked>\n");
    sb.append("Depth:    ").append(depth).append('\n');
    sb.append("Accum:    ").append(accType).append('\n');
    sb.append("Banking:  ").append(banking).append(" <").append(format).append(">\n");
    sb.append("Cost:     ").append(cost).append('\n');
    sb.append("Pipeline: ").append(metapipe.map(Ctrl::toString).orElse("---")).append('\n');
    sb.append("Ports:");
    for (Optional<Integer> port : bufferPorts)
      sb.append('\n').append(portString(port, writes, "WR")).append('\n').append(portString(port, reads, "RD"));
    return sb.toString();
  }
}
