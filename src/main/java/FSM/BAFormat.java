package FSM;

import FSM.Model.Automaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

import java.io.*;
import java.util.*;

public class BAFormat {
    /*
    Parsing is AutomataLib's; symbols of the CompactNFA<String> become their alphabet indices.
     */
    public static Automaton readBA(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        final Alphabet<String> alphabet = automaton.getInputAlphabet();
        int states = automaton.size();
        int aAlphSize = alphabet.size();
        CompactNFA<Integer> tv = new CompactNFA<>(CompactConversion.alphabet(aAlphSize), states);
        Set<Integer> initialStates = automaton.getInitialStates();
        for(int i=0;i<states;i++) {
            tv.addState(automaton.isAccepting(i));
            if (initialStates.contains(i)) {
                tv.setInitial(i, true);
            }
        }
        for(int i=0;i<states;i++) {
            for(int a=0;a<aAlphSize;a++) {
                tv.addTransitions(i,a,automaton.getTransitions(i,alphabet.getSymbol(a)));
            }
        }
        return CompactConversion.fromCompactNFA(tv);
    }

    public static Automaton getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return readBA(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * @throws IllegalArgumentException if the automaton is not deterministic
     */
    public static void writeBA(OutputStream os, Automaton dfa) throws IOException {
        final CompactDFA<Integer> compact = CompactConversion.toCompactDFA(dfa);
        BAWriter<Integer> baWriter = new BAWriter<>();
        baWriter.writeModel(os, compact, compact.getInputAlphabet());
    }

    public static void writeBAFile(String filename, Automaton dfa) {
        try (OutputStream os = new FileOutputStream(filename)) {
            writeBA(os, dfa);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
