package FSA;

import FSA.Interop.CompactConversions;
import FSA.Model.Automaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("IntegTest")
public class TableFillingMinimizerIntegTest {
  @Test
  void testAgainstHopcroft() {
    Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    for (int size = 1; size < 12; size++) {
      for (int randomSeed = 0; randomSeed < 200; randomSeed++) {
        CompactDFA<Integer> dfa = RandomDFA.getRandomAutomaton(randomSeed, size, alphabet);
        String debug = randomSeed + "; " + size;

        Automaton automaton = CompactConversions.fromDFA(dfa, alphabet);
        Automaton minimal = TableFillingMinimizer.minimize(automaton);
        CompactDFA<Integer> hopcroft = HopcroftMinimizer.minimizeDFA(dfa, alphabet);

        Assertions.assertEquals(hopcroft.size(), minimal.size(), debug);
        Assertions.assertTrue(CompactConversions.equivalent(automaton, minimal), debug);
        Assertions.assertSame(minimal, TableFillingMinimizer.minimize(minimal), debug);
      }
    }
  }
}
