package kasami.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;

import kasami.util.CollectionUtils;

/**
 * CYK parser over a grammar in Chomsky Normal Form.
 * <p>
 * Every call to {@link #parse(List)} fills a chart of its own, bottom-up by
 * span length: for each span, split points left to right, and for each split
 * the binary rules in grammar order. The first derivation found for an entry
 * is the one kept, so repeated parses return the same tree.
 * <p>
 * The grammar is immutable and may be shared; a parser instance is not
 * thread-safe because of its {@link Statistics}.
 *
 * @date Oct 15, 2026
 */
public class Parser {

  public final static int DEFAULT_MAXLENGTH = 256;
  /** hard cap on chart entries, checked before allocation */
  public final static long MAX_CHART_SIZE = 1L << 28;

  public Parser(Grammar g) throws ParserException {
    this(g, DEFAULT_MAXLENGTH);
  }

  public Parser(Grammar g, int maxlength) throws ParserException {
    if (g == null || g.start() == null)
      throw new ParserException(ParserException.Kind.EMPTY_GRAMMAR, "Grammar has no start symbol");
    if (!g.isCnf())
      throw new ParserException(ParserException.Kind.NOT_CNF, "Grammar is not in Chomsky Normal Form");
    _g = g;
    _maxlength = maxlength;
    _nts = new SymbolTable(g.nonTerminals());
    indexRules();
  }

  private void indexRules() {
    for (Rule r : _g.trules())
      CollectionUtils.addToValueList(_lexidx, r.rhs(0).name(), r);
    List<Rule> birules = _g.birules();
    _birules = birules.toArray(new Rule[birules.size()]);
    _bilhs = new int[_birules.length];
    _bileft = new int[_birules.length];
    _biright = new int[_birules.length];
    for (int i = 0; i < _birules.length; i ++) {
      _bilhs[i] = _nts.lookup(_birules[i].lhs());
      _bileft[i] = _nts.lookup(_birules[i].rhs(0));
      _biright[i] = _nts.lookup(_birules[i].rhs(1));
    }
  }

  /** convenience for a one-off parse */
  public static ParseResult parse(Grammar g, List<String> tokens) throws ParserException {
    return new Parser(g).parse(tokens);
  }

  public ParseResult parse(List<String> tokens) throws ParserException {
    int maxpos = tokens.size();
    if (maxpos > _maxlength)
      throw new ParserException(ParserException.Kind.INPUT_TOO_LONG,
          "Input of " + maxpos + " tokens exceeds the limit of " + _maxlength);
    if (CykChart.size(_nts.size(), maxpos) > MAX_CHART_SIZE)
      throw new ParserException(ParserException.Kind.INPUT_TOO_LONG,
          "Chart for " + maxpos + " tokens and " + _nts.size() + " non-terminals is too large");
    _stats.totalSentences ++;
    _stats.lastTokens = maxpos;
    _stats.totalTokens += maxpos;
    long startTime = System.nanoTime();
    CykChart chart = new CykChart(_nts, maxpos);
    lexparse(chart, tokens);
    recognize(chart);
    Tree<Symbol> tree = null;
    boolean accepted = chart.recognized(_g.start());
    if (accepted) {
      _stats.successSentences ++;
      _stats.successTokens += maxpos;
      tree = ParseTreeBuilder.build(chart, _g.start(), maxpos);
    }
    _stats.lastParseTime = System.nanoTime() - startTime;
    _stats.totalParseTime += _stats.lastParseTime;
    _stats.lastCFR = chart.fillrate();
    _stats.totalCFR += _stats.lastCFR;
    return new ParseResult(accepted, tree, chart);
  }

  /**
   * Fills the spans of length one from the lexical rules. Tokens matching no
   * terminal leave their cell empty. The empty input gets the epsilon rule of
   * the start symbol, if there is one.
   */
  void lexparse(CykChart chart, List<String> tokens) {
    if (tokens.isEmpty()) {
      for (Rule r : _g.rules(_g.start())) {
        if (r.isEpsilon()) {
          chart.add(0, 0, _nts.lookup(r.lhs()), Witness.empty(r));
          break;
        }
      }
      return;
    }
    for (int i = 0; i < tokens.size(); i ++) {
      for (Rule r : CollectionUtils.getValueList(_lexidx, tokens.get(i)))
        chart.add(i, i + 1, _nts.lookup(r.lhs()), Witness.lexical(r));
    }
  }

  /** fills the spans of length 2..n, shorter spans first */
  void recognize(CykChart chart) {
    int maxpos = chart.maxpos();
    for (int length = 2; length <= maxpos; length ++) {
      for (int start = 0; start + length <= maxpos; start ++) {
        int end = start + length;
        for (int mid = start + 1; mid < end; mid ++) {
          for (int i = 0; i < _birules.length; i ++) {
            if (chart.get(start, mid, _bileft[i]) &&
                chart.get(mid, end, _biright[i]))
              chart.add(start, end, _bilhs[i], Witness.binary(_birules[i], mid));
          }
        }
      }
    }
  }

  /** lowercases the sentence and splits it on whitespace */
  public static List<String> tokenize(String sentence) {
    String trimmed = sentence.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty())
      return Collections.emptyList();
    List<String> tokenized = new ArrayList<String>();
    Collections.addAll(tokenized, trimmed.split("\\s+"));
    return tokenized;
  }

  public Grammar grammar() {
    return _g;
  }

  public int maxlength() {
    return _maxlength;
  }

  public Statistics stats() {
    return _stats;
  }

  private final Grammar _g;
  private final int _maxlength;
  private final SymbolTable _nts;
  /** lexical rules indexed by their terminal */
  private final HashMap<String,List<Rule>> _lexidx = new HashMap<String,List<Rule>>();
  private Rule [] _birules = null;
  private int [] _bilhs = null;
  private int [] _bileft = null;
  private int [] _biright = null;
  private final Statistics _stats = new Statistics();

  public static class Statistics {
    public int totalSentences = 0; // total number of sentences parsed
    public int totalTokens = 0; // total number of tokens parsed
    public int successSentences = 0; // accepted sentences
    public int successTokens = 0; // sum of tokens from accepted sentences
    public long totalParseTime = 0l; // total time (in nanoseconds) spent on parsing
    public double totalCFR = 0.0; // total sum of chart filling rates
    public double lastCFR = 0.0; // chart filling rate of the last parse
    public long lastParseTime = 0l; // parsing time of the last parse, nanoseconds
    public int lastTokens = 0; // length of the last parse input

    public double coverage() { // %
      return ((double)successSentences) / totalSentences;
    }
    public double averageSentenceLength() { // token / sentence
      return ((double)totalTokens) / totalSentences;
    }
    public double averageCFR() { // CFR
      return totalCFR / totalSentences;
    }
    public double averageParseTimePerSentence() { // milliseconds / sentence
      return totalParseTime / 1e6 / totalSentences;
    }
  }
}
