package kasami.syntax;

/**
 * Outcome of one parse: whether the input is in the language and, if so,
 * one derivation.
 */
public class ParseResult {

  public ParseResult(boolean accepted, Tree<Symbol> cnfTree, CykChart chart) {
    _accepted = accepted;
    _cnfTree = cnfTree;
    _tree = cnfTree == null ? null : new Trees.SyntheticNodeStripper().transformTree(cnfTree);
    _chart = chart;
  }

  public boolean accepted() {
    return _accepted;
  }

  /** derivation in terms of the original grammar, null if not accepted */
  public Tree<Symbol> tree() {
    return _tree;
  }

  /** derivation over the CNF grammar, synthetic categories included */
  public Tree<Symbol> cnfTree() {
    return _cnfTree;
  }

  public CykChart chart() {
    return _chart;
  }

  public String toString() {
    return _accepted ? "accepted " + _tree : "rejected";
  }

  private final boolean _accepted;
  private final Tree<Symbol> _cnfTree;
  private final Tree<Symbol> _tree;
  private final CykChart _chart;
}
