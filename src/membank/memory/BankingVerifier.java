package membank.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Enumerates the full address space of a memory and checks that (bank selects, bank offset) identifies each address uniquely.
 */
public class BankingVerifier {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A physical location: the bank index of every banking group plus the offset within the bank. */
  public record Location(List<Integer> banks, int offset) {}

  /** Two addresses mapped to the same location. */
  public record Conflict(List<Integer> first, List<Integer> second, Location location) {
    @Override
    public String toString() {
      return String.format("%s and %s both map to banks %s, offset %d", first, second, location.banks(), location.offset());
    }
  }

  public static class Result {
    private final int numAddresses;
    private final int maxOffset;
    private final List<Conflict> conflicts;

    Result(int numAddresses, int maxOffset, List<Conflict> conflicts) {
      this.numAddresses = numAddresses;
      this.maxOffset = maxOffset;
      this.conflicts = Collections.unmodifiableList(conflicts);
    }

    public int getNumAddresses() { return numAddresses; }
    /** Largest offset within a bank over all addresses. */
    public int getMaxOffset() { return maxOffset; }
    public List<Conflict> getConflicts() { return conflicts; }
    public boolean isInjective() { return conflicts.isEmpty(); }
  }

  /**
   * Maps every address of a memory with the given dimensions.
   * @param memory the banking configuration
   * @param dims the memory dimensions
   * @param maxConflicts stop collecting conflicts after this many
   * @throws membank.metadata.UnsupportedBankingException for unsupported banking shapes
   */
  public static Result verify(Memory memory, List<Integer> dims, int maxConflicts) {
    HashMap<Location, List<Integer>> seen = new HashMap<>();
    List<Conflict> conflicts = new ArrayList<>();
    int maxOffset = 0;
    int numAddresses = 0;
    for (List<Integer> addr : addresses(dims)) {
      Location loc = locate(memory, dims, addr);
      maxOffset = Math.max(maxOffset, loc.offset());
      ++numAddresses;
      List<Integer> prev = seen.putIfAbsent(loc, addr);
      if (prev != null && conflicts.size() < maxConflicts)
        conflicts.add(new Conflict(prev, addr, loc));
    }
    if (!conflicts.isEmpty())
      logger.debug("Banking {} has conflicts, e.g. {}", memory, conflicts.get(0));
    return new Result(numAddresses, maxOffset, conflicts);
  }

  public static Location locate(Memory memory, List<Integer> dims, List<Integer> addr) {
    return new Location(memory.bankSelects(addr), memory.bankOffset(dims, addr));
  }

  /** All addresses within dims in row-major order. */
  public static List<List<Integer>> addresses(List<Integer> dims) {
    List<List<Integer>> result = new ArrayList<>();
    int total = dims.stream().mapToInt(Integer::intValue).reduce(1, (a, b) -> a * b);
    for (int flat = 0; flat < total; ++flat) {
      Integer[] addr = new Integer[dims.size()];
      int rem = flat;
      for (int d = dims.size() - 1; d >= 0; --d) {
        addr[d] = rem % dims.get(d);
        rem /= dims.get(d);
      }
      result.add(List.of(addr));
    }
    return result;
  }
}
