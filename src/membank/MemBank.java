package membank;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import membank.banking.IntLike;
import membank.memory.BankingVerifier;
import membank.memory.Memory;
import membank.memory.MemoryResource;
import membank.metadata.BankedMemoryOps;
import membank.metadata.BankingAnalysisException;
import membank.metadata.MemoryOps;
import membank.metadata.MetadataStore;
import membank.metadata.Sym;
import membank.ui.MemBankConfig;
import membank.ui.MemoryDescription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Front end over the banking metadata: registers described memories in a {@link MetadataStore},
 * checks their address decomposition and renders reports.
 */
public class MemBank {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final MetadataStore store = new MetadataStore();
  private final MemBankConfig cfg;
  private final LinkedHashMap<String, Sym> memories = new LinkedHashMap<>();

  public MemBank(MemBankConfig cfg) { this.cfg = cfg; }

  public MetadataStore getStore() { return store; }
  public List<Sym> getMemories() { return new ArrayList<>(memories.values()); }

  /**
   * Registers a memory with its dimensions and banking instance.
   * @throws IllegalArgumentException if the description is malformed or the name is taken
   */
  public Sym addMemory(MemoryDescription desc) {
    if (memories.containsKey(desc.name))
      throw new IllegalArgumentException("Duplicate memory name " + desc.name);
    Memory memory = desc.toMemory();
    if (desc.dims.stream().anyMatch(dim -> dim < 1))
      throw new IllegalArgumentException("dimensions of " + desc.name + " must be positive: " + desc.dims);
    Sym mem = store.newSym(desc.name, desc.getKind());
    MemoryOps.setDims(store, mem, desc.dims);
    BankedMemoryOps.setInstance(store, mem, memory);
    memories.put(desc.name, mem);
    logger.debug("Added memory {}: {}", mem, memory);
    return mem;
  }

  /**
   * Verifies that every registered memory maps each address to a unique (bank, offset) pair.
   * @return true iff all memories passed
   */
  public boolean check() {
    boolean success = true;
    for (Sym mem : memories.values()) {
      try {
        Memory inst = BankedMemoryOps.instance(store, mem);
        BankingVerifier.Result result = BankingVerifier.verify(inst, MemoryOps.constDims(store, mem), cfg.max_reported_conflicts);
        if (!result.isInjective()) {
          success = false;
          logger.error("Memory {}: banking {} is not conflict-free", mem.getName(), inst.getBanking());
          result.getConflicts().forEach(conflict -> logger.error("  {}", conflict));
        } else {
          logger.info("Memory {}: {} addresses over {} bank(s), max offset {}", mem.getName(), result.getNumAddresses(), inst.totalBanks(),
                      result.getMaxOffset());
        }
      } catch (BankingAnalysisException e) {
        logger.error("Memory {}: {}", mem.getName(), e.getMessage());
        success = false;
      }
    }
    return success;
  }

  /** Renders a summary of a memory's instance. */
  public String report(Sym mem) {
    Memory inst = BankedMemoryOps.instance(store, mem);
    List<Integer> dims = MemoryOps.constDims(store, mem);
    StringBuilder sb = new StringBuilder();
    sb.append(mem.getName()).append(" (").append(mem.getKind()).append(") ").append(dims).append('\n');
    sb.append("  Resource: ").append(inst.resource(new MemoryResource(cfg.default_resource))).append('\n');
    sb.append("  Depth:    ").append(inst.getDepth()).append('\n');
    sb.append("  Accum:    ").append(inst.getAccType()).append('\n');
    sb.append("  Banks:    ").append(inst.totalBanks()).append(" <").append(inst.isFlat() ? "Flat" : "Hierarchical").append(">\n");
    inst.getBanking().forEach(bank -> sb.append("    ").append(bank).append('\n'));
    sb.append("  Bank depth: ").append(inst.bankDepth(dims));
    return sb.toString();
  }

  /** Renders the bank and offset of each address (up to the configured limit) in row-major order. */
  public String bankTable(Sym mem) {
    Memory inst = BankedMemoryOps.instance(store, mem);
    List<Integer> dims = MemoryOps.constDims(store, mem);
    List<List<Integer>> addrs = BankingVerifier.addresses(dims);
    List<String> lines = new ArrayList<>();
    for (List<Integer> addr : addrs.subList(0, Math.min(addrs.size(), cfg.max_table_addresses))) {
      BankingVerifier.Location loc = BankingVerifier.locate(inst, dims, addr);
      lines.add(String.format("  %s -> bank %s, ofs %d", addr, loc.banks(), loc.offset()));
    }
    if (addrs.size() > cfg.max_table_addresses)
      lines.add(String.format("  ... (%d more)", addrs.size() - cfg.max_table_addresses));
    return String.join("\n", lines);
  }

  /** Renders the bank select and offset logic of a memory as expressions over its address inputs. */
  public String expressions(Sym mem) {
    Memory inst = BankedMemoryOps.instance(store, mem);
    int rank = MemoryOps.rank(store, mem);
    List<String> addr = IntStream.range(0, rank).mapToObj(i -> cfg.addr_prefix + "_" + i).toList();
    List<String> banks = inst.bankSelects(IntLike.EXPR, addr);
    String ofs = inst.bankOffset(IntLike.EXPR, store, mem, addr);
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < banks.size(); ++i)
      lines.add(String.format("  bank_%d = %s", i, banks.get(i)));
    lines.add("  ofs = " + ofs);
    return lines.stream().collect(Collectors.joining("\n"));
  }

  /**
   * Registers all memories, checks their banking and prints the requested reports.
   * @return true iff all memories were valid and (if enabled) conflict-free
   */
  public boolean run(List<MemoryDescription> descriptions, boolean printTable, boolean printExpressions, PrintStream out) {
    boolean success = true;
    for (MemoryDescription desc : descriptions) {
      try {
        addMemory(desc);
      } catch (IllegalArgumentException e) {
        logger.error("Skipping memory '{}': {}", desc.name, e.getMessage());
        success = false;
      }
    }
    if (cfg.check_bijection && !check())
      success = false;

    for (Sym mem : memories.values()) {
      try {
        out.println(report(mem));
        if (printTable)
          out.println(bankTable(mem));
        if (printExpressions)
          out.println(expressions(mem));
      } catch (BankingAnalysisException e) {
        logger.error("Memory {}: {}", mem.getName(), e.getMessage());
        success = false;
      }
    }
    return success;
  }
}
