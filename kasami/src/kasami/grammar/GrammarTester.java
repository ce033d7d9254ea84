package kasami.grammar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.javatuples.Pair;

import kasami.syntax.CnfConverter;
import kasami.syntax.Grammar;
import kasami.syntax.GrammarException;
import kasami.syntax.ParseResult;
import kasami.syntax.Parser;
import kasami.syntax.ParserException;
import kasami.syntax.Rule;
import kasami.syntax.Symbol;
import kasami.syntax.Tree;
import kasami.syntax.Trees;
import kasami.util.StringUtils;

/**
 * Command line driver: normalizes a grammar and parses sentences with it.
 * <p>
 * Sentences are taken from the remaining arguments, or read from stdin one
 * per line until an empty line. Progress and timing go to stderr, results to
 * stdout.
 */
public class GrammarTester {

  public final static String DEFAULT_GRAMMAR = "grammars/english.cfg";
  public final static String USAGE = "GrammarTester [-g grammar] [-s start] [-cnf] [-vocab] [-examples] [-raw] [-m n] [-v] [sentence]";

  /** sample sentences for the bundled grammar with their expected verdict */
  public final static List<Pair<String,Boolean>> EXAMPLES = Arrays.asList(
      Pair.with("she eats a cake", true),
      Pair.with("he drinks the beer", true),
      Pair.with("the cat cooks the soup with a dog", true),
      Pair.with("she eats the fork", true),
      Pair.with("she eats", false),
      Pair.with("eats a cake", false),
      Pair.with("the cat quickly drinks beer", false));

  @SuppressWarnings("static-access")
  static Options options() {
    Options options = new Options();
    options.addOption(OptionBuilder.withArgName("file").hasArg()
        .withDescription("grammar file (default: bundled English fragment)").create("g"));
    options.addOption(OptionBuilder.withArgName("symbol").hasArg()
        .withDescription("start symbol (default: first head)").create("s"));
    options.addOption(OptionBuilder.withArgName("n").hasArg()
        .withDescription("maximum number of tokens per sentence (default " + Parser.DEFAULT_MAXLENGTH + ")").create("m"));
    options.addOption("cnf", false, "print the grammar in Chomsky Normal Form");
    options.addOption("vocab", false, "list the vocabulary by category");
    options.addOption("examples", false, "parse the built-in example sentences");
    options.addOption("raw", false, "print trees over the CNF grammar");
    options.addOption("v", false, "verbose mode");
    return options;
  }

  public static void main(String[] args) {
    PrintWriter out = new PrintWriter(System.out, true);
    PrintWriter err = new PrintWriter(System.err, true);
    int status = run(args, new InputStreamReader(System.in, StandardCharsets.UTF_8), out, err);
    System.exit(status);
  }

  /** @return the process exit status */
  public static int run(String[] args, Reader in, PrintWriter out, PrintWriter err) {
    Options options = options();
    CommandLine cmd = null;
    try {
      CommandLineParser parser = new PosixParser();
      cmd = parser.parse(options, args);
    } catch (ParseException ex) {
      err.println(ex.getMessage());
      new HelpFormatter().printHelp(err, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
          HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
      return 1;
    }
    try {
      boolean verbose = cmd.hasOption("v");
      err.print("Loading grammar ... ");
      Grammar grammar = cmd.hasOption("g") ?
          GrammarReader.load(cmd.getOptionValue("g"), cmd.getOptionValue("s")) :
          GrammarReader.loadResource(DEFAULT_GRAMMAR, cmd.getOptionValue("s"));
      err.println("done.");
      long startTime = System.nanoTime();
      Grammar cnf = CnfConverter.toCNF(grammar);
      if (verbose)
        err.println("toCNF(): " + millis(System.nanoTime() - startTime) + " ms, "
            + grammar.rules().size() + " -> " + cnf.rules().size() + " rules");
      int maxlength = cmd.hasOption("m") ? Integer.parseInt(cmd.getOptionValue("m")) : Parser.DEFAULT_MAXLENGTH;
      Parser parser = new Parser(cnf, maxlength);
      GrammarTester tester = new GrammarTester(grammar, parser, cmd.hasOption("raw"), verbose, out, err);

      boolean action = false;
      if (cmd.hasOption("cnf")) {
        out.print(cnf);
        action = true;
      }
      if (cmd.hasOption("vocab")) {
        tester.printVocabulary();
        action = true;
      }
      if (cmd.hasOption("examples")) {
        tester.runExamples();
        action = true;
      }
      if (cmd.getArgs().length > 0) {
        tester.test(StringUtils.join(Arrays.asList(cmd.getArgs()), " "));
      } else if (!action) {
        BufferedReader br = new BufferedReader(in);
        String sentence = null;
        while ((sentence = br.readLine()) != null) {
          if (sentence.trim().isEmpty())
            break;
          tester.test(sentence);
        }
      }
      if (verbose)
        tester.printStatistics();
      out.flush();
      return 0;
    } catch (NumberFormatException ex) {
      err.println("Invalid number: " + ex.getMessage());
    } catch (IOException ex) {
      err.println(ex.getMessage());
    } catch (GrammarException ex) {
      err.println("Invalid grammar: " + ex.getMessage());
    } catch (ParserException ex) {
      err.println(ex.getMessage());
    }
    return 1;
  }

  public GrammarTester(Grammar grammar, Parser parser, boolean raw, boolean verbose,
      PrintWriter out, PrintWriter err) {
    _grammar = grammar;
    _parser = parser;
    _raw = raw;
    _verbose = verbose;
    _out = out;
    _err = err;
  }

  /** parses one raw sentence and prints the verdict and the tree */
  public ParseResult test(String sentence) throws ParserException {
    List<String> tokens = Parser.tokenize(sentence);
    ParseResult result = _parser.parse(tokens);
    _out.println(StringUtils.join(tokens, " ") + " : " + (result.accepted() ? "Yes" : "No"));
    if (_verbose)
      _err.println("parse(): " + millis(_parser.stats().lastParseTime) + " ms");
    if (result.accepted()) {
      Tree<Symbol> tree = _raw ? result.cnfTree() : result.tree();
      _out.print(Trees.PennTreeRenderer.render(tree));
    } else {
      List<String> unknown = unknownWords(tokens);
      if (!unknown.isEmpty())
        _out.println("Unknown words: " + StringUtils.join(unknown, ", "));
    }
    return result;
  }

  /** tokens that are not terminals of the grammar */
  public List<String> unknownWords(List<String> tokens) {
    List<String> unknown = new ArrayList<String>();
    for (String tok : tokens) {
      if (!_grammar.terminals().contains(Symbol.T(tok)))
        unknown.add(tok);
    }
    return unknown;
  }

  /** terminals grouped by the non-terminals that produce them directly */
  public void printVocabulary() {
    for (Symbol lhs : _grammar.heads()) {
      List<String> words = new ArrayList<String>();
      for (Rule r : _grammar.rules(lhs)) {
        if (r.isLexical())
          words.add(r.rhs(0).name());
      }
      if (!words.isEmpty())
        _out.println(lhs + ": " + StringUtils.join(words, ", "));
    }
  }

  /** @return number of examples whose verdict differs from the expected one */
  public int runExamples() throws ParserException {
    int mismatches = 0;
    for (Pair<String,Boolean> example : EXAMPLES) {
      ParseResult result = test(example.getValue0());
      if (result.accepted() != example.getValue1()) {
        mismatches ++;
        _out.println("Expected " + (example.getValue1() ? "Yes" : "No"));
      }
      _out.println(StringUtils.repeat('-', 40));
    }
    return mismatches;
  }

  public void printStatistics() {
    Parser.Statistics stats = _parser.stats();
    if (stats.totalSentences == 0)
      return;
    _err.format("Sentences: %d, accepted: %d (%.2f%%)%n", stats.totalSentences,
        stats.successSentences, stats.coverage() * 100);
    _err.format("Average length: %.2f tokens, average parse time: %.3f ms%n",
        stats.averageSentenceLength(), stats.averageParseTimePerSentence());
    _err.flush();
  }

  private static String millis(long nanos) {
    return String.format("%.3f", nanos / 1e6);
  }

  private final Grammar _grammar;
  private final Parser _parser;
  private final boolean _raw;
  private final boolean _verbose;
  private final PrintWriter _out;
  private final PrintWriter _err;
}
