package kasami.syntax;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;

/**
 * CYK table for one input. Entries are addressed by (start, end, nt) and laid
 * out in pages, one per non-terminal, each page holding the triangle of spans
 * at offset <code>end*(end-1)/2+start</code>. Membership is a bit vector;
 * the witness of each entry lives in a sparse map keyed by the same index.
 * <p>
 * Only the first witness offered for an entry is retained. Entries are never
 * removed.
 *
 * @date Oct 14, 2026
 */
public class CykChart implements RecChart {

  public CykChart(SymbolTable nts, int maxpos) {
    _nts = nts;
    _maxpos = maxpos;
    _maxs = nts.size() - 1;
    _pagesize = maxpos * (maxpos + 1) / 2;
    _size = _pagesize * (_maxs + 1);
    _bc = new BitSet(_size);
  }

  /** number of arena entries a chart for maxpos tokens would need */
  public static long size(int nts, int maxpos) {
    return (long)maxpos * (maxpos + 1) / 2 * nts;
  }

  private int index(int start, int end, int nt) {
    assert start >= 0 && end <= _maxpos && start < end && nt <= _maxs;
    return nt * _pagesize + end * (end - 1) / 2 + start;
  }

  @Override
  public boolean get(int start, int end, int nt) {
    if (start == end)
      return _empty.containsKey(nt);
    return _bc.get(index(start, end, nt));
  }

  @Override
  public void set(int start, int end, int nt) {
    _bc.set(index(start, end, nt));
  }

  /**
   * Records nt over [start, end) with witness w, unless the entry is already
   * present.
   * @return true if the entry was new
   */
  public boolean add(int start, int end, int nt, Witness w) {
    if (get(start, end, nt))
      return false;
    if (start == end) {
      _empty.put(nt, w);
    } else {
      set(start, end, nt);
      _witness.put(index(start, end, nt), w);
    }
    return true;
  }

  public boolean contains(int start, int end, Symbol A) {
    int nt = _nts.lookup(A);
    return nt >= 0 && get(start, end, nt);
  }

  /** retained witness for A over [start, end), or null */
  public Witness witness(int start, int end, Symbol A) {
    int nt = _nts.lookup(A);
    if (nt < 0 || !get(start, end, nt))
      return null;
    if (start == end)
      return _empty.get(nt);
    return _witness.get(index(start, end, nt));
  }

  /** non-terminals deriving the span of the given length starting at start */
  public List<Symbol> cell(int start, int length) {
    List<Symbol> cell = new ArrayList<Symbol>();
    for (int nt = 0; nt <= _maxs; nt ++) {
      if (get(start, start + length, nt))
        cell.add(_nts.lookup(nt));
    }
    return cell;
  }

  public boolean recognized(Symbol start) {
    return contains(0, _maxpos, start);
  }

  public double fillrate() {
    if (_size == 0)
      return 0.0;
    return ((double)_bc.cardinality()) / _size;
  }

  public SymbolTable nts() {
    return _nts;
  }

  @Override
  public int maxS() {
    return _maxs;
  }

  @Override
  public int maxpos() {
    return _maxpos;
  }

  public int pagesize() {
    return _pagesize;
  }

  public int size() {
    return _size;
  }

  private final SymbolTable _nts;
  private final int _maxpos;
  private final int _maxs;
  private final int _pagesize;
  private final int _size;
  private final BitSet _bc;
  private final HashMap<Integer,Witness> _witness = new HashMap<Integer,Witness>();
  /** entries over the empty span, only used for the empty input */
  private final HashMap<Integer,Witness> _empty = new HashMap<Integer,Witness>();
}
