package RPT;

import RPT.Model.ExactThreshold;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class RPTCommandLine {
  static final double DEFAULT_EPS = 0.3;
  static final double DEFAULT_ERROR_PROBA = 0.3;

  public static void main(String[] args) {
    double eps = DEFAULT_EPS;
    double errorProba = DEFAULT_ERROR_PROBA;
    double thresholdConstant = ExactThreshold.DEFAULT_CONSTANT;
    long seed = System.nanoTime();
    int repeat = 1;
    List<String> positional = new ArrayList<>(2);

    try {
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if ("--eps".equalsIgnoreCase(arg)) {
          eps = Double.parseDouble(requireValue(args, ++i, arg));
        } else if ("--errorProba".equalsIgnoreCase(arg)) {
          errorProba = Double.parseDouble(requireValue(args, ++i, arg));
        } else if ("--seed".equalsIgnoreCase(arg)) {
          seed = Long.parseLong(requireValue(args, ++i, arg));
        } else if ("--threshold".equalsIgnoreCase(arg)) {
          thresholdConstant = Double.parseDouble(requireValue(args, ++i, arg));
        } else if ("--repeat".equalsIgnoreCase(arg)) {
          repeat = Integer.parseInt(requireValue(args, ++i, arg));
        } else if (arg.startsWith("--")) {
          // Unknown flag
          printUsageAndExit();
        } else {
          positional.add(arg);
        }
      }
    } catch (NumberFormatException ex) {
      System.err.println("Invalid number: " + ex.getMessage());
      printUsageAndExit();
    }

    boolean validInvocation = (positional.size() == 2 && repeat > 0);
    if (!validInvocation) {
      printUsageAndExit();
    }

    final AutomatonGraph<String> automaton = BAFormat.getBAFile(positional.get(0));
    Word<String> word = null;
    try {
      word = parseWord(positional.get(1), repeat);
    } catch (IllegalArgumentException ex) {
      System.err.println(ex.getMessage());
      printUsageAndExit();
    }
    System.out.println("States: " + automaton.numStates());
    System.out.println("Strongly connected components: " + automaton.numScc());
    System.out.println("Word length: " + word.length());

    evaluate(automaton, word, eps, errorProba, ExactThreshold.scaled(thresholdConstant), new Random(seed));
  }

  private static String requireValue(String[] args, int i, String flag) {
    // Require a value that isn't another flag
    if (i >= args.length || args[i].startsWith("--")) {
      System.err.println("Missing value for " + flag);
      printUsageAndExit(); // exits
    }
    return args[i];
  }

  private static void printUsageAndExit() {
    System.out.println(
        "RPT [--eps <x>] [--errorProba <p>] [--seed <s>] [--threshold <c>] [--repeat <r>] <BA file> <word>");
    System.out.println("[--eps <x>] : distance fraction in (0,1], default " + DEFAULT_EPS);
    System.out.println("[--errorProba <p>] : error probability in (0,1], default " + DEFAULT_ERROR_PROBA);
    System.out.println("[--seed <s>] : seed of the fragment sampling");
    System.out.println("[--threshold <c>] : exact simulation threshold constant, default " + ExactThreshold.DEFAULT_CONSTANT);
    System.out.println("[--repeat <r>] : repeat the word r times");
    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format).");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.out.println("<word> : transition labels separated by commas or whitespace.");
    System.exit(0);
  }

  /**
   * Split a list of labels and repeat it.
   * @param labels - labels separated by commas or whitespace
   * @param repeat - number of copies
   * @return - the word
   * @throws IllegalArgumentException if the repeated word has more than Integer.MAX_VALUE letters
   */
  static Word<String> parseWord(String labels, int repeat) {
    final List<String> letters = new ArrayList<>();
    for (String label : labels.trim().split("[,\\s]+")) {
      if (!label.isEmpty()) {
        letters.add(label);
      }
    }
    final int size;
    try {
      size = Math.multiplyExact(letters.size(), repeat);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("word too long: " + letters.size() + " letters repeated " + repeat + " times", ex);
    }
    final List<String> repeated = new ArrayList<>(size);
    for (List<String> copy : Collections.nCopies(repeat, letters)) {
      repeated.addAll(copy);
    }
    return Word.fromList(repeated);
  }

  /**
   * Run exact simulation and the property tester on the same word and print both verdicts.
   */
  static Verdicts evaluate(AutomatonGraph<String> automaton, Word<String> word,
                           double eps, double errorProba, ExactThreshold threshold, Random random) {
    long before = System.currentTimeMillis();
    final boolean exact = automaton.accepts(word);
    long after = System.currentTimeMillis();
    System.out.println("exact: " + exact + " (" + ((after - before) / 1000f) + "s)");

    final PropertyTester tester = new PropertyTester(threshold, random);
    System.out.println("exact threshold: " + tester.getThreshold().getName() + " " + tester.getThreshold().getParam());
    before = System.currentTimeMillis();
    final boolean approx = tester.test(automaton, word, eps, errorProba);
    after = System.currentTimeMillis();
    System.out.println("property test (eps=" + eps + ", errorProba=" + errorProba + "): "
        + approx + " (" + ((after - before) / 1000f) + "s)");
    return new Verdicts(exact, approx);
  }

  record Verdicts(boolean exact, boolean approximate) { }
}
