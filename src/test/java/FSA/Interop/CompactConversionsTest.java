package FSA.Interop;

import FSA.DivisibilityChecker;
import FSA.Exceptions.InvalidTransitionException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonDefinition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CompactConversionsTest {
  @Test
  void testToCompactDFA() {
    Automaton a = DivisibilityChecker.create(2, 3);
    CompactDFA<String> dfa = CompactConversions.toCompactDFA(a);
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals(0, dfa.getInitialState());
    Assertions.assertTrue(dfa.accepts(List.of("1", "1")));
    Assertions.assertFalse(dfa.accepts(List.of("1", "0", "1")));

    Automaton back = CompactConversions.fromDFA(dfa, dfa.getInputAlphabet());
    Assertions.assertEquals(a, back);
  }

  @Test
  void testDFARejectsMultipleTargets() {
    Automaton a = nfaExample();
    Assertions.assertThrows(InvalidTransitionException.class, () -> CompactConversions.toCompactDFA(a));
  }

  @Test
  void testNFARoundTrip() {
    Automaton a = nfaExample();
    CompactNFA<String> nfa = CompactConversions.toCompactNFA(a);
    Assertions.assertEquals(2, nfa.size());
    Assertions.assertTrue(nfa.getInitialStates().contains(0));
    Assertions.assertEquals(2, nfa.getTransitions(0, "a").size());
    Assertions.assertTrue(nfa.accepts(List.of("a", "b")));

    Alphabet<String> alphabet = nfa.getInputAlphabet();
    Assertions.assertEquals(a, CompactConversions.fromNFA(nfa, alphabet));
  }

  @Test
  void testEquivalent() {
    Assertions.assertTrue(CompactConversions.equivalent(
        DivisibilityChecker.create(2, 3), DivisibilityChecker.create(2, 3)));
    Assertions.assertFalse(CompactConversions.equivalent(
        DivisibilityChecker.create(2, 3), DivisibilityChecker.create(2, 4)));

    // a missing transition behaves like one into a rejecting sink
    Automaton partial = Automaton.of(AutomatonDefinition.create()
        .state("S0", true, true).transition("S0", "a", "S0"));
    Automaton total = Automaton.of(AutomatonDefinition.create()
        .state("S0", true, true).transition("S0", "a", "S0").transition("S0", "b", "S1")
        .state("S1", false, false).transition("S1", "a", "S1").transition("S1", "b", "S1"));
    Assertions.assertTrue(CompactConversions.equivalent(partial, total));
    Assertions.assertTrue(CompactConversions.equivalent(total, partial));
    Assertions.assertFalse(CompactConversions.equivalent(partial, DivisibilityChecker.create(2, 1)));
  }

  private static Automaton nfaExample() {
    return Automaton.of(AutomatonDefinition.create()
        .state("S0", true, false).transition("S0", "a", List.of("S0", "S1"))
        .state("S1", false, true).transition("S1", "b", "S1"));
  }
}
