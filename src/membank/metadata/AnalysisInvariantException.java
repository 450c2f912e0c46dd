package membank.metadata;

import java.util.List;
import java.util.Optional;

/**
 * Thrown when metadata is present but violates an invariant of the analysis,
 * e.g. a reader dispatched to several duplicates.
 */
public class AnalysisInvariantException extends BankingAnalysisException {
  private static final long serialVersionUID = 1L;

  private final List<Integer> uid;

  public AnalysisInvariantException(Sym sym, String message) {
    super(sym, message);
    this.uid = null;
  }
  public AnalysisInvariantException(Sym sym, List<Integer> uid, String message) {
    super(sym, message + " {" + MissingMetadataException.formatUID(uid) + "}");
    this.uid = List.copyOf(uid);
  }

  public Optional<List<Integer>> getUID() { return Optional.ofNullable(uid); }
}
