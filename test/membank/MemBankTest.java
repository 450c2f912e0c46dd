package membank;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import membank.metadata.BankedMemoryOps;
import membank.metadata.MemoryOps;
import membank.metadata.Sym;
import membank.ui.MemBankCmd;
import membank.ui.MemBankConfig;
import membank.ui.MemoryDescription;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemBankTest {
  MemBankConfig cfg;
  ByteArrayOutputStream output;
  PrintStream out;

  @BeforeEach
  void setUp() throws Exception {
    cfg = new MemBankConfig();
    output = new ByteArrayOutputStream();
    out = new PrintStream(output, true, StandardCharsets.UTF_8);
  }

  private static MemoryDescription flat(String name, List<Integer> dims, int banks, List<Integer> alpha) {
    var banking = new MemoryDescription.BankingDescription();
    banking.banks = banks;
    banking.alpha = alpha;
    var desc = new MemoryDescription();
    desc.name = name;
    desc.dims = dims;
    desc.banking = List.of(banking);
    return desc;
  }

  @Test
  void testAddMemory() {
    var memBank = new MemBank(cfg);
    Sym mem = memBank.addMemory(flat("m", List.of(4, 4), 4, List.of(1, 2)));
    Assertions.assertEquals(List.of(4, 4), MemoryOps.constDims(memBank.getStore(), mem));
    Assertions.assertEquals(4, BankedMemoryOps.instance(memBank.getStore(), mem).totalBanks());
    Assertions.assertThrows(IllegalArgumentException.class, () -> memBank.addMemory(flat("m", List.of(4), 1, List.of())));
    Assertions.assertThrows(IllegalArgumentException.class, () -> memBank.addMemory(flat("z", List.of(4, 0), 1, List.of())));
    Assertions.assertEquals(List.of(mem), memBank.getMemories());
  }

  @Test
  void testCheck() {
    var memBank = new MemBank(cfg);
    memBank.addMemory(flat("good", List.of(4, 9), 6, List.of(3, 4)));
    Assertions.assertTrue(memBank.check());
    memBank.addMemory(flat("bad", List.of(4, 4), 4, List.of(2, 2)));
    Assertions.assertFalse(memBank.check());
  }

  @Test
  void testReports() {
    cfg.max_table_addresses = 2;
    var memBank = new MemBank(cfg);
    Sym mem = memBank.addMemory(flat("m", List.of(4, 4), 4, List.of(1, 2)));
    String report = memBank.report(mem);
    Assertions.assertTrue(report.startsWith("m (SRAM) [4, 4]\n"), report);
    Assertions.assertTrue(report.contains("Resource: BRAM"), report);
    Assertions.assertTrue(report.contains("Dims {0,1}: Cyclic: N=4, B=1, alpha=<1,2>"), report);
    Assertions.assertTrue(report.endsWith("Bank depth: 4"), report);

    Assertions.assertEquals("  [0, 0] -> bank [0], ofs 0\n  [0, 1] -> bank [2], ofs 1\n  ... (14 more)", memBank.bankTable(mem));
    Assertions.assertEquals("  bank_0 = (addr_0 + (addr_1 * 2)) % 4\n  ofs = ((addr_0 / 4) * 4) + addr_1", memBank.expressions(mem));
  }

  @Test
  void testRun() throws Exception {
    List<MemoryDescription> descriptions;
    try (InputStream in = getClass().getResourceAsStream("/memories.yaml")) {
      descriptions = MemBankCmd.loadDescriptions(in);
    }
    Assertions.assertTrue(new MemBank(cfg).run(descriptions, true, true, out));
    String printed = output.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(printed.contains("weights (SRAM) [4, 9]"), printed);
    Assertions.assertTrue(printed.contains("Resource: URAM"), printed);
    Assertions.assertTrue(printed.contains("tile (SRAM) [4, 6]"), printed);
    Assertions.assertTrue(printed.contains("<Hierarchical>"), printed);
    Assertions.assertTrue(printed.contains("scalars (RegFile) [8]"), printed);
  }

  @Test
  void testRunFailures() {
    var bad = flat("bad", List.of(4, 4), 4, List.of(2, 2));
    var malformed = flat("malformed", List.of(4, 4), 0, List.of(1, 1));
    Assertions.assertFalse(new MemBank(cfg).run(List.of(bad), false, false, out));
    Assertions.assertFalse(new MemBank(cfg).run(List.of(malformed), false, false, out));

    cfg.check_bijection = false;
    Assertions.assertTrue(new MemBank(cfg).run(List.of(bad), false, false, out));
  }

  @Test
  void testUnsupportedBanking() {
    var desc = flat("odd", List.of(2, 2, 2), 2, List.of(1));
    var second = new MemoryDescription.BankingDescription();
    second.banks = 2;
    second.alpha = List.of(1, 1);
    second.dims = List.of(1, 2);
    desc.banking.get(0).dims = List.of(0);
    desc.banking = List.of(desc.banking.get(0), second);
    Assertions.assertFalse(new MemBank(cfg).run(List.of(desc), false, false, out));
  }
}
