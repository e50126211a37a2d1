package FSA;

import FSA.Model.Automaton;
import FSA.Model.AutomatonDefinition;

/**
 * DFA reading base-{@code b} digits most significant first and accepting iff the number read is divisible by
 * {@code m}. State {@code r} holds the remainder read so far.
 */
public class DivisibilityChecker {
    private DivisibilityChecker() {}

    /**
     * @param base - digit base, at least 2; symbols are {@code 0..base-1}
     * @param divisor - at least 1; the automaton has this many states
     * @return normalized automaton where {@code S<r>} on digit {@code s} moves to {@code S<(base*r + s) mod divisor>}
     */
    public static Automaton create(int base, int divisor) {
        if (base < 2) {
            throw new IllegalArgumentException("Base must be at least 2, got " + base);
        }
        if (divisor < 1) {
            throw new IllegalArgumentException("Divisor must be at least 1, got " + divisor);
        }
        AutomatonDefinition definition = AutomatonDefinition.create();
        for (int r = 0; r < divisor; r++) {
            definition.state(Automaton.label(r), r == 0, r == 0);
            for (int s = 0; s < base; s++) {
                definition.transition(Automaton.label(r), s, Automaton.label((int) (((long) base * r + s) % divisor)));
            }
        }
        return Automaton.of(definition);
    }
}
