package kasami.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree transformations and rendering.
 */
public class Trees {

  public static interface TreeTransformer<E> {
    public Tree<E> transformTree(Tree<E> tree);
  }

  /**
   * Removes the categories introduced by {@link CnfConverter}: a synthetic
   * node is replaced by its children in its parent, and a synthetic root with
   * a single child is replaced by that child. Together with the unit chains
   * unwound by {@link ParseTreeBuilder} this gives the tree in terms of the
   * original grammar.
   */
  public static class SyntheticNodeStripper implements TreeTransformer<Symbol> {

    public Tree<Symbol> transformTree(Tree<Symbol> tree) {
      Tree<Symbol> result = strip(tree);
      while (result.getLabel().isSynthetic() && result.getChildren().size() == 1)
        result = result.getChildren().get(0);
      return result;
    }

    private Tree<Symbol> strip(Tree<Symbol> tree) {
      if (tree.isLeaf())
        return new Tree<Symbol>(tree.getLabel());
      List<Tree<Symbol>> children = new ArrayList<Tree<Symbol>>();
      for (Tree<Symbol> child : tree.getChildren()) {
        Tree<Symbol> stripped = strip(child);
        if (stripped.getLabel().isSynthetic())
          children.addAll(stripped.getChildren());
        else
          children.add(stripped);
      }
      return new Tree<Symbol>(tree.getLabel(), children);
    }
  }

  /** indented rendering, one node per line */
  public static class PennTreeRenderer {

    public static <L> String render(Tree<L> tree) {
      StringBuilder sb = new StringBuilder();
      renderTree(tree, 0, false, false, false, true, sb);
      sb.append('\n');
      return sb.toString();
    }

    private static <L> void renderTree(Tree<L> tree, int indent, boolean parentLabelNull,
        boolean firstSibling, boolean leftSiblingPreTerminal, boolean topLevel, StringBuilder sb) {
      // the condition for staying on the same line in Penn Treebank
      boolean suppressIndent = (parentLabelNull || (firstSibling && tree.isPreTerminal())
          || (leftSiblingPreTerminal && tree.isPreTerminal()));
      if (suppressIndent) {
        sb.append(' ');
      } else {
        if (!topLevel) {
          sb.append('\n');
        }
        for (int i = 0; i < indent; i++) {
          sb.append("  ");
        }
      }
      if (tree.isLeaf() || tree.isPreTerminal()) {
        renderFlat(tree, sb);
        return;
      }
      sb.append('(');
      sb.append(tree.getLabel());
      renderChildren(tree.getChildren(), indent + 1, tree.getLabel() == null, sb);
      sb.append(')');
    }

    private static <L> void renderFlat(Tree<L> tree, StringBuilder sb) {
      if (tree.isLeaf()) {
        sb.append(tree.getLabel());
        return;
      }
      sb.append('(');
      sb.append(tree.getLabel());
      sb.append(' ');
      sb.append(tree.getChildren().get(0).getLabel());
      sb.append(')');
    }

    private static <L> void renderChildren(List<Tree<L>> children, int indent,
        boolean parentLabelNull, StringBuilder sb) {
      boolean firstSibling = true;
      boolean leftSibIsPreTerm = true;
      for (Tree<L> child : children) {
        renderTree(child, indent, parentLabelNull, firstSibling, leftSibIsPreTerm, false, sb);
        leftSibIsPreTerm = child.isPreTerminal();
        firstSibling = false;
      }
    }
  }
}
