package FSA.Display;

import FSA.DivisibilityChecker;
import FSA.Model.Transition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class LabelCompressorTest {
  @Test
  void testDecimalParity() {
    List<CompressedState> states = LabelCompressor.compress(DivisibilityChecker.create(10, 2));
    Assertions.assertEquals(2, states.size());

    CompressedState s0 = states.get(0);
    Assertions.assertEquals("S0", s0.label());
    Assertions.assertTrue(s0.start());
    Assertions.assertTrue(s0.accept());
    Assertions.assertEquals(List.of("0,2,4,6,8", "1,3,5,7,9"), List.copyOf(s0.edges().keySet()));
    Assertions.assertEquals(Transition.single(0), s0.edges().get("0,2,4,6,8"));
    Assertions.assertEquals(Transition.single(1), s0.edges().get("1,3,5,7,9"));
  }

  @Test
  void testSpaces() {
    List<CompressedState> states = LabelCompressor.compress(DivisibilityChecker.create(10, 2), true);
    Assertions.assertTrue(states.get(1).edges().containsKey("0, 2, 4, 6, 8"));
  }

  @Test
  void testNumericOrder() {
    // 10 and 2 share a target: numeric order puts 2 first
    List<CompressedState> states = LabelCompressor.compress(DivisibilityChecker.create(12, 2));
    Assertions.assertEquals(List.of("0,2,4,6,8,10", "1,3,5,7,9,11"), List.copyOf(states.get(0).edges().keySet()));
  }
}
