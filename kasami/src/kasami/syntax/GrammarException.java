package kasami.syntax;

/**
 * Raised when a grammar violates the structural invariants checked by
 * {@link Grammar#validate()}. Not recoverable; the grammar has to be fixed.
 */
public class GrammarException extends Exception {

  private static final long serialVersionUID = 6015530244418906118L;

  public enum Kind {
    /** a rule or the start refers to a symbol not declared with its kind */
    UNDECLARED_SYMBOL,
    /** no start symbol, or the start symbol has no rules */
    UNREACHABLE_START
  }

  public GrammarException(Kind kind, String symbol, String message) {
    super(message);
    _kind = kind;
    _symbol = symbol;
  }

  public Kind kind() {
    return _kind;
  }

  /** name of the offending symbol, may be null */
  public String symbol() {
    return _symbol;
  }

  private final Kind _kind;
  private final String _symbol;
}
