package membank.metadata;

import java.util.List;
import java.util.Optional;
import membank.banking.ModBanking;
import membank.memory.AccumType;
import membank.memory.Memory;
import membank.memory.ReduceFunction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BankedMemoryOpsTest {
  MetadataStore store;
  Sym mem;

  @BeforeEach
  void setUp() throws Exception {
    store = new MetadataStore();
    mem = store.newSym("sram", SymKind.SRAM);
  }

  @Test
  void testDuplicates() {
    Assertions.assertThrows(MissingMetadataException.class, () -> BankedMemoryOps.duplicates(store, mem));
    Assertions.assertThrows(IllegalArgumentException.class, () -> BankedMemoryOps.setDuplicates(store, mem, List.of()));
    Memory dup0 = Memory.unit(2);
    Memory dup1 = new Memory(List.of(new ModBanking(4, 1, List.of(1, 2), List.of(0, 1))), 2, AccumType.None);
    BankedMemoryOps.setDuplicates(store, mem, List.of(dup0, dup1));
    Assertions.assertEquals(List.of(dup0, dup1), BankedMemoryOps.duplicates(store, mem));
    Assertions.assertEquals(Optional.of(dup0), BankedMemoryOps.getInstance(store, mem));
    Assertions.assertThrows(AnalysisInvariantException.class, () -> BankedMemoryOps.instance(store, mem));

    BankedMemoryOps.setInstance(store, mem, dup1);
    Assertions.assertEquals(dup1, BankedMemoryOps.instance(store, mem));
    Assertions.assertEquals(List.of(dup1), BankedMemoryOps.duplicates(store, mem));
  }

  @Test
  void testMissingInstance() {
    var ex = Assertions.assertThrows(MissingMetadataException.class, () -> BankedMemoryOps.instance(store, mem));
    Assertions.assertEquals(Optional.of(mem), ex.getSym());
    Assertions.assertTrue(ex.getUID().isEmpty());
  }

  @Test
  void testPadding() {
    MemoryOps.setDims(store, mem, List.of(6, 10));
    Assertions.assertEquals(List.of(6, 10), BankedMemoryOps.paddedDims(store, mem));
    Assertions.assertThrows(MissingMetadataException.class, () -> BankedMemoryOps.padding(store, mem));
    BankedMemoryOps.setPadding(store, mem, List.of(2, 0));
    Assertions.assertEquals(List.of(8, 10), BankedMemoryOps.paddedDims(store, mem));
    BankedMemoryOps.setPadding(store, mem, List.of(2));
    Assertions.assertThrows(AnalysisInvariantException.class, () -> BankedMemoryOps.paddedDims(store, mem));
  }

  @Test
  void testBufferFlags() {
    Assertions.assertFalse(BankedMemoryOps.isWriteBuffer(store, mem));
    Assertions.assertFalse(BankedMemoryOps.isNonBuffer(store, mem));
    BankedMemoryOps.setWriteBuffer(store, mem, true);
    BankedMemoryOps.setNonBuffer(store, mem, true);
    Assertions.assertTrue(BankedMemoryOps.isWriteBuffer(store, mem));
    Assertions.assertTrue(BankedMemoryOps.isNonBuffer(store, mem));
  }

  @Test
  void testAccumulatorOps() {
    Assertions.assertEquals(AccumType.Unknown, AccumulatorOps.accumType(store, mem));
    AccumulatorOps.setAccumType(store, mem, AccumType.FMA);
    Assertions.assertEquals(AccumType.FMA, AccumulatorOps.accumType(store, mem));
    Assertions.assertTrue(AccumulatorOps.reduceType(store, mem).isEmpty());
    AccumulatorOps.setReduceType(store, mem, ReduceFunction.Add);
    Assertions.assertEquals(Optional.of(ReduceFunction.Add), AccumulatorOps.reduceType(store, mem));
    // An empty Optional leaves the reduce type untouched
    AccumulatorOps.setReduceType(store, mem, Optional.empty());
    Assertions.assertEquals(Optional.of(ReduceFunction.Add), AccumulatorOps.reduceType(store, mem));
  }

  @Test
  void testFmaReduceInfo() {
    Sym wr = store.newSym("wr", SymKind.Writer);
    Sym rd = store.newSym("rd", SymKind.Reader);
    Sym mul = store.newSym("mul", SymKind.Other);
    Assertions.assertTrue(AccumulatorOps.fmaReduceInfo(store, mem).isEmpty());
    AccumulatorOps.setFmaReduceInfo(store, mem, Optional.empty());
    Assertions.assertTrue(AccumulatorOps.fmaReduceInfo(store, mem).isEmpty());

    var info = new AccumulatorOps.FMAReduceInfo(mem, wr, rd, mul, 6.0);
    AccumulatorOps.setFmaReduceInfo(store, mem, info);
    Assertions.assertEquals(Optional.of(info), AccumulatorOps.fmaReduceInfo(store, mem));
    Assertions.assertTrue(AccumulatorOps.fmaReduceInfo(store, wr).isEmpty());

    AccumulatorOps.setFmaReduceInfo(store, mem, Optional.empty());
    Assertions.assertEquals(Optional.of(info), AccumulatorOps.fmaReduceInfo(store, mem));
  }
}
