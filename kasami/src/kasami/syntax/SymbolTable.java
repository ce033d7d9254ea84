package kasami.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * Symbol Table: dense int ids for grammar symbols, in registration order.
 * The chart keeps one page per registered non-terminal.
 *
 * @date Oct 12, 2026
 */
public class SymbolTable implements Serializable {

  private static final long serialVersionUID = 1L;

  public SymbolTable() {

  }

  public SymbolTable(Iterable<Symbol> symbols) {
    for (Symbol s : symbols)
      register(s);
  }

  public int size() {
    return _ids.size();
  }

  public int register(Symbol s) {
    Integer id = _ids.get(s);
    if (id != null)
      return id;
    _ids.put(s, _symbols.size());
    _symbols.add(s);
    return _symbols.size() - 1;
  }

  /** @return the id of s, or -1 if s was never registered */
  public int lookup(Symbol s) {
    Integer id = _ids.get(s);
    return id == null ? -1 : id;
  }

  public Symbol lookup(int id) {
    if (id >= 0 && id < _symbols.size())
      return _symbols.get(id);
    else
      return null;
  }

  public List<Symbol> symbols() {
    return Collections.unmodifiableList(_symbols);
  }

  private final HashMap<Symbol,Integer> _ids = new HashMap<Symbol,Integer>();
  private final ArrayList<Symbol> _symbols = new ArrayList<Symbol>();
}
