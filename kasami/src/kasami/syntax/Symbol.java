package kasami.syntax;

import java.io.Serializable;

/**
 * Grammar symbol: either a terminal or a non-terminal.
 * Two symbols are equal when they have the same kind and name. Non-terminals
 * introduced by {@link CnfConverter} are flagged as synthetic; the flag is not
 * part of equality.
 *
 * @date Oct 12, 2026
 */
public final class Symbol implements Serializable {

  private static final long serialVersionUID = -2904712315437791822L;

  /** prefix for the internal symbols created during normalization */
  public final static char MODPREFIX = '@';

  private Symbol(String name, boolean terminal, boolean synthetic) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Symbol name must not be empty");
    _name = name;
    _terminal = terminal;
    _synthetic = synthetic;
  }

  public static Symbol T(String name) {
    return new Symbol(name, true, false);
  }
  public static Symbol NT(String name) {
    return new Symbol(name, false, false);
  }
  static Symbol syntheticNT(String name) {
    return new Symbol(name, false, true);
  }

  public String name() {
    return _name;
  }
  public boolean isTerminal() {
    return _terminal;
  }
  public boolean isNonTerminal() {
    return !_terminal;
  }
  public boolean isSynthetic() {
    return _synthetic;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (! (o instanceof Symbol))
      return false;
    Symbol that = (Symbol)o;
    return this._terminal == that._terminal &&
        this._name.equals(that._name);
  }

  @Override
  public int hashCode() {
    return 31 * _name.hashCode() + (_terminal ? 1 : 0);
  }

  public String toString() {
    return _name;
  }

  private final String _name;
  private final boolean _terminal;
  private final boolean _synthetic;
}
