package kasami.syntax;

/**
 * Recognition chart over the spans [start, end) of an input of length
 * {@link #maxpos()}, with one page per non-terminal id.
 *
 * @date Oct 14, 2026
 */
public interface RecChart {
  public int maxpos();
  public boolean get(int start, int end, int symbol);
  public void set(int start, int end, int symbol);
  public int maxS();
}
