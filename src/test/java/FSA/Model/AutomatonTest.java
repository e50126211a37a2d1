package FSA.Model;

import FSA.Exceptions.InvalidFSADefinitionException;
import FSA.Exceptions.InvalidStateException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AutomatonTest {
  static AutomatonDefinition wikiExample() {
    return AutomatonDefinition.create()
        .state("S0", true, false).transition("S0", 0, "S1").transition("S0", 1, "S2")
        .state("S1", false, false).transition("S1", 0, "S0").transition("S1", 1, "S3")
        .state("S2", false, true).transition("S2", 0, "S4").transition("S2", 1, "S5")
        .state("S3", false, true).transition("S3", 0, "S4").transition("S3", 1, "S5")
        .state("S4", false, true).transition("S4", 0, "S4").transition("S4", 1, "S5")
        .state("S5", false, false).transition("S5", 0, "S5").transition("S5", 1, "S5");
  }

  @Test
  void testLoad() {
    Automaton a = Automaton.of(wikiExample());
    Assertions.assertEquals(6, a.size());
    Assertions.assertEquals(0, a.getStartState());
    Assertions.assertTrue(a.isNormalized());
    Assertions.assertTrue(a.isDeterministic());
    Assertions.assertFalse(a.isMinimal());
    Assertions.assertTrue(a.containsState(5));
    Assertions.assertFalse(a.containsState(6));
    Assertions.assertTrue(a.isAccepting(2));
    Assertions.assertFalse(a.isAccepting(5));
    Assertions.assertEquals(Transition.single(3), a.getTransition(1, "1"));
    Assertions.assertNull(a.getTransition(1, "2"));
    Assertions.assertEquals(List.of("0", "1"), List.copyOf(a.getSymbols()));
  }

  @Test
  void testLabelsOrderedBySuffix() {
    AutomatonDefinition def = AutomatonDefinition.create()
        .state("q10", false, true).transition("q10", "a", "q2")
        .state("q2", true, false).transition("q2", "a", "q10");
    Automaton a = Automaton.of(def);
    // q2 becomes S0, q10 becomes S1
    Assertions.assertEquals(0, a.getStartState());
    Assertions.assertTrue(a.isAccepting(1));
    Assertions.assertEquals(Transition.single(1), a.getTransition(0, "a"));
  }

  @Test
  void testToString() {
    AutomatonDefinition def = AutomatonDefinition.create()
        .state("S0", true, true).transition("S0", 0, "S0").transition("S0", 1, "S1")
        .state("S1", false, false).transition("S1", 0, "S1").transition("S1", 1, "S0");
    Assertions.assertEquals(
        "S0: | 0: S0, 1: S1, start: True , accept: True  |\n"
            + "S1: | 0: S1, 1: S0, start: False, accept: False |",
        Automaton.of(def).toString());
  }

  @Test
  void testEmptyDefinition() {
    Assertions.assertThrows(InvalidFSADefinitionException.class, () -> Automaton.of(AutomatonDefinition.create()));
  }

  @Test
  void testMissingFlags() {
    AutomatonDefinition def = AutomatonDefinition.create().transition("S0", "a", "S0");
    InvalidFSADefinitionException e =
        Assertions.assertThrows(InvalidFSADefinitionException.class, () -> Automaton.of(def));
    Assertions.assertTrue(e.getMessage().contains("'start' and 'accept'"));
  }

  @Test
  void testNoStartState() {
    AutomatonDefinition def = AutomatonDefinition.create().state("S0", false, true).transition("S0", "a", "S0");
    Assertions.assertThrows(InvalidFSADefinitionException.class, () -> Automaton.of(def));
  }

  @Test
  void testDanglingTarget() {
    AutomatonDefinition def = AutomatonDefinition.create().state("S0", true, true).transition("S0", "a", "S7");
    InvalidStateException e = Assertions.assertThrows(InvalidStateException.class, () -> Automaton.of(def));
    Assertions.assertEquals("S7", e.state);
  }

  @Test
  void testSeveralStartFlags() {
    AutomatonDefinition def = AutomatonDefinition.create()
        .state("S1", true, false).transition("S1", "a", "S0")
        .state("S0", true, true).transition("S0", "a", "S1");
    Automaton a = Automaton.of(def);
    Assertions.assertEquals(0, a.getStartState());
    Assertions.assertTrue(a.getState(0).start());
    Assertions.assertFalse(a.getState(1).start());
  }

  @Test
  void testMultipleTargets() {
    AutomatonDefinition def = AutomatonDefinition.create()
        .state("S0", true, false).transition("S0", "a", List.of("S1", "S0", "S1"))
        .state("S1", false, true);
    Automaton a = Automaton.of(def);
    Assertions.assertFalse(a.isDeterministic());
    Transition t = a.getTransition(0, "a");
    Assertions.assertTrue(t instanceof Transition.Multiple);
    Assertions.assertEquals(List.of(1, 0), List.copyOf(t.targets()));
    Assertions.assertEquals("[S1, S0]", t.toString());
  }

  @Test
  void testMapRoundTrip() {
    Map<String, Map<String, Object>> raw = new LinkedHashMap<>();
    Map<String, Object> s0 = new LinkedHashMap<>();
    s0.put("0", "S0");
    s0.put("1", List.of("S0", "S1"));
    s0.put("start", true);
    s0.put("accept", false);
    Map<String, Object> s1 = new LinkedHashMap<>();
    s1.put("0", "S1");
    s1.put("start", false);
    s1.put("accept", true);
    raw.put("S0", s0);
    raw.put("S1", s1);

    AutomatonDefinition def = AutomatonDefinition.fromMap(raw);
    Assertions.assertEquals(raw, def.toMap());

    Automaton a = Automaton.of(def);
    Assertions.assertEquals(raw, a.toDefinition().toMap());
    Assertions.assertEquals(a, Automaton.of(a.toDefinition()));
  }

  @Test
  void testMapRejectsBadValues() {
    Map<String, Map<String, Object>> raw = new LinkedHashMap<>();
    Map<String, Object> s0 = new LinkedHashMap<>();
    s0.put("start", "yes");
    s0.put("accept", true);
    raw.put("S0", s0);
    Assertions.assertThrows(InvalidFSADefinitionException.class, () -> AutomatonDefinition.fromMap(raw));

    s0.put("start", true);
    s0.put("a", 42);
    Assertions.assertThrows(InvalidFSADefinitionException.class, () -> AutomatonDefinition.fromMap(raw));
  }

  @Test
  void testReservedSymbol() {
    Assertions.assertThrows(InvalidFSADefinitionException.class,
        () -> AutomatonDefinition.create().transition("S0", "start", "S0"));
  }

  @Test
  void testLabels() {
    Assertions.assertEquals("S12", Automaton.label(12));
    Assertions.assertEquals(12, Automaton.parseLabel("S12"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("S"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("Q1"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("Sx"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("S+1"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("S01"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.parseLabel("S99999999999"));
    Assertions.assertEquals(0, Automaton.parseLabel("S0"));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.of(wikiExample()).getState(9));
  }

  @Test
  void testFromStates() {
    State s0 = new State(0, true, false, Map.of("a", Transition.single(1)));
    State s1 = new State(1, true, true, Map.of());
    Assertions.assertThrows(InvalidFSADefinitionException.class, () -> Automaton.fromStates(List.of(s0, s1), false));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> Automaton.fromStates(List.of(s0, s0), false));
    Assertions.assertThrows(InvalidStateException.class, () -> Automaton.fromStates(List.of(s0), false));

    Automaton a = Automaton.fromStates(List.of(s0, s1.withStart(false)), true);
    Assertions.assertTrue(a.isMinimal());
    Assertions.assertEquals(0, a.getStartState());
  }
}
