package membank.ui;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import membank.banking.Banking;
import membank.banking.ModBanking;
import membank.memory.AccumType;
import membank.memory.Memory;
import membank.memory.MemoryResource;
import membank.metadata.SymKind;

/**
 * Serializable description of a memory and its chosen banking, as read from YAML:
 * <pre>
 * - !MemoryDescription
 *   name: sram0
 *   kind: SRAM
 *   dims: [4, 9]
 *   depth: 2
 *   accum: Reduce(add)
 *   resource: BRAM
 *   banking:
 *     - {banks: 6, stride: 1, alpha: [3, 4]}
 * </pre>
 * A banking entry without dims covers all dimensions (flat) if it is the only entry,
 * otherwise entry i covers dimension i.
 */
public class MemoryDescription {
  public static class BankingDescription {
    public int banks = 1;
    public int stride = 1;
    public List<Integer> alpha = new ArrayList<>();
    public List<Integer> dims = null;
  }

  public String name = "";
  public String kind = "SRAM";
  public List<Integer> dims = new ArrayList<>();
  public int depth = 1;
  public String accum = "None";
  public String resource = null;
  public List<BankingDescription> banking = new ArrayList<>();

  public SymKind getKind() {
    try {
      return SymKind.valueOf(kind);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown memory kind '" + kind + "' of memory " + name, e);
    }
  }

  /**
   * Builds the banked memory configuration. An empty banking list yields a single unbanked group.
   * @throws IllegalArgumentException if an entry is malformed
   */
  public Memory toMemory() {
    if (dims.isEmpty())
      throw new IllegalArgumentException("Memory " + name + " has no dims");
    List<Banking> strategies = new ArrayList<>();
    for (int i = 0; i < banking.size(); ++i) {
      BankingDescription desc = banking.get(i);
      List<Integer> bankDims = desc.dims;
      if (bankDims == null) {
        bankDims = (banking.size() == 1) ? IntStream.range(0, dims.size()).boxed().toList() : List.of(i);
      }
      if (bankDims.stream().anyMatch(d -> d < 0 || d >= dims.size()))
        throw new IllegalArgumentException("Banking dims " + bankDims + " out of range for rank " + dims.size() + " of memory " + name);
      List<Integer> alpha = desc.alpha.isEmpty() ? bankDims.stream().map(d -> 1).toList() : desc.alpha;
      strategies.add(new ModBanking(desc.banks, desc.stride, alpha, bankDims));
    }
    if (strategies.isEmpty())
      strategies.add(ModBanking.unit(dims.size()));
    Optional<AccumType> accType = AccumType.fromString(accum);
    if (accType.isEmpty())
      throw new IllegalArgumentException("Unknown accumulator type '" + accum + "' of memory " + name);
    return new Memory(strategies, depth, accType.get(), resource != null ? new MemoryResource(resource) : null);
  }
}
