package kasami.syntax;

/**
 * Errors raised while setting up a parse or reading a grammar file.
 * A sentence outside the language is not an error; see
 * {@link ParseResult#accepted()}.
 */
public class ParserException extends Exception {

  private static final long serialVersionUID = -1187001239405527742L;

  public enum Kind {
    /** grammar without start symbol or rules */
    EMPTY_GRAMMAR,
    /** grammar handed to the parser is not in Chomsky Normal Form */
    NOT_CNF,
    /** input longer than the parser bound, or chart too large to allocate */
    INPUT_TOO_LONG,
    /** malformed line in a grammar file */
    INVALID_LINE
  }

  public ParserException(Kind kind, String message) {
    super(message);
    _kind = kind;
  }

  public ParserException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    _kind = kind;
  }

  public Kind kind() {
    return _kind;
  }

  private final Kind _kind;
}
