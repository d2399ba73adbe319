package FSM;

import FSM.Model.Automaton;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class FSMCommandLine {
  public static void main(String[] args) {
    String filename = null;
    boolean withDeadState = false;
    boolean print = false;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        PowersetDeterminizer.DEBUG = true;
      } else if ("--dead".equalsIgnoreCase(arg)) {
        withDeadState = true;
      } else if ("--print".equalsIgnoreCase(arg)) {
        print = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 2) {
      printUsageAndExit();
    }

    String algorithm = positional.get(0);
    String filePath  = positional.get(1);

    final Automaton origNFA = BAFormat.getBAFile(filePath);
    System.out.println("Original NFA size: " + origNFA.size());
    System.out.println("Alphabet size:" + origNFA.alphabetSize());

    long before = System.currentTimeMillis();
    Automaton result = allAlgorithms(algorithm, origNFA, withDeadState);
    long after = System.currentTimeMillis();
    System.out.println(algorithm + " result size: " + result.size());
    System.out.println(algorithm + " duration: " + ((after - before) / 1000f) + "s");

    if (print) {
      printAutomaton(result, System.out);
    }
    if (filename != null) {
      if (result.isDeterministic()) {
        System.out.println("Writing to file: " + filename);
        BAFormat.writeBAFile(filename, result);
      } else {
        System.err.println("Not writing " + filename + ": result is not deterministic");
      }
    }
  }

  /**
   * Prints the debug rendering as UTF-8, whatever the platform encoding, so that ε survives.
   */
  static void printAutomaton(Automaton automaton, PrintStream target) {
    PrintStream out = new PrintStream(target, true, StandardCharsets.UTF_8);
    out.print(automaton);
    out.flush();
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSM [--debug] [--dead] [--print] [--writeBA <BA output file>] <algorithm> <BA input file>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--dead] : Complete DFAs with a dead state");
    System.out.println("[--print] : Print the resulting automaton");
    System.out.println("[--writeBA <BA output file> : Write DFA to specified output file");
    System.out.println();
    System.out.println("<algorithm> : one of the choices below:");
    System.out.println("  POWERSET: Subset construction.");
    System.out.println("  REVERSE: Automaton for the reverse language.");
    System.out.println("  MIN: Brzozowski's double-reversal minimization.");
    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format).");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  /**
   * Choose algorithm to run.
   * @param algorithm - algorithm passed in from command-line
   * @param origNFA - original automaton
   * @param withDeadState - whether DFAs are completed with a dead state
   * @return - transformed automaton
   */
  static Automaton allAlgorithms(String algorithm, Automaton origNFA, boolean withDeadState) {
    System.out.println();
    System.out.println("Invoking algorithm:" + algorithm);
    return switch (algorithm.toLowerCase()) {
      case "powerset" -> origNFA.powerset(withDeadState);
      case "reverse" -> origNFA.reverse();
      case "min" -> origNFA.minimalDFA(withDeadState);
      default -> throw new IllegalStateException("Unexpected algorithm choice: " + algorithm);
    };
  }
}
