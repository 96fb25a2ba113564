package RPT;

import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public class BAFormat {
    /*
    We just use the parser from Automatalib and copy the CompactNFA<String> it returns
     */
    public static AutomatonGraph<String> read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return AutomatonGraph.fromNFA(automaton, automaton.getInputAlphabet());
    }

    static AutomatonGraph<String> getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } catch (FormatException ex) {
            throw new IllegalArgumentException("Malformed BA file: " + filePath, ex);
        }
    }
}
