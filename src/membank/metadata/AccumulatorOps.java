package membank.metadata;

import java.util.Optional;
import membank.memory.AccumType;
import membank.memory.ReduceFunction;

/**
 * Accumulator classification of memories and accesses.
 */
public class AccumulatorOps {
  private static final MetadataKey<AccumType> ACCUM_TYPE = new MetadataKey<>("AccumulatorType", AccumType.class);
  private static final MetadataKey<ReduceFunction> REDUCE_TYPE = new MetadataKey<>("ReduceType", ReduceFunction.class);
  private static final MetadataKey<FMAReduceInfo> FMA_REDUCE = new MetadataKey<>("FMAReduce", FMAReduceInfo.class);

  /**
   * A multiply-accumulate cycle that can be fused into one FMA unit.
   * @param accumulator the accumulating memory
   * @param writer the write closing the cycle
   * @param reader the read of the previous partial sum
   * @param product the multiply feeding the sum
   * @param latency latency of the fused unit in cycles
   */
  public record FMAReduceInfo(Sym accumulator, Sym writer, Sym reader, Sym product, double latency) {}

  /** Returns the accumulator type, {@link AccumType#Unknown} if the classification never ran. */
  public static AccumType accumType(MetadataStore store, Sym sym) { return store.get(sym, ACCUM_TYPE).orElse(AccumType.Unknown); }
  public static void setAccumType(MetadataStore store, Sym sym, AccumType tp) { store.put(sym, ACCUM_TYPE, tp); }

  public static Optional<ReduceFunction> reduceType(MetadataStore store, Sym sym) { return store.get(sym, REDUCE_TYPE); }
  public static void setReduceType(MetadataStore store, Sym sym, ReduceFunction func) { store.put(sym, REDUCE_TYPE, func); }
  public static void setReduceType(MetadataStore store, Sym sym, Optional<ReduceFunction> func) {
    func.ifPresent(f -> setReduceType(store, sym, f));
  }

  public static Optional<FMAReduceInfo> fmaReduceInfo(MetadataStore store, Sym sym) { return store.get(sym, FMA_REDUCE); }
  public static void setFmaReduceInfo(MetadataStore store, Sym sym, FMAReduceInfo info) { store.put(sym, FMA_REDUCE, info); }
  public static void setFmaReduceInfo(MetadataStore store, Sym sym, Optional<FMAReduceInfo> info) {
    info.ifPresent(i -> setFmaReduceInfo(store, sym, i));
  }
}
