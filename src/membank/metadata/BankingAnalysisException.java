package membank.metadata;

import java.util.Optional;

/**
 * Base class of all internal errors raised by the banking analysis.
 * These indicate a bug in an earlier analysis pass, never a user error, and are not retried.
 */
public class BankingAnalysisException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Sym sym;

  public BankingAnalysisException(Sym sym, String message) {
    super(message);
    this.sym = sym;
  }
  public BankingAnalysisException(String message) { this(null, message); }

  /** Returns the symbol the error was raised for, if known. */
  public Optional<Sym> getSym() { return Optional.ofNullable(sym); }
}
