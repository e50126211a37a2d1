package FSA;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.Random;

public class RandomDFA {
    /**
     * Generate a random total DFA: every state has one successor per letter, drawn uniformly.
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param acceptNum
     *      number of accepting states, in [0,size]
     * @param alphabet
     *      alphabet
     * @return
     *      a random DFA with initial state 0, not necessarily connected
     */
    public static CompactDFA<Integer> generateDFA(Random r, int size, int acceptNum, Alphabet<Integer> alphabet) {
        assert acceptNum >= 0 && acceptNum <= size;
        CompactDFA<Integer> result = new CompactDFA<>(alphabet, size);
        for (int i = 0; i < size; i++) {
            result.addState(false);
        }
        result.setInitialState(0);
        for (int f : RandomUtil.distinctIntegers(r, acceptNum, 0, size)) {
            result.setAccepting(f, true);
        }
        for (int q = 0; q < size; q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                result.setTransition(q, a, r.nextInt(size));
            }
        }
        return result;
    }

    public static CompactDFA<Integer> getRandomAutomaton(int seed, int size, Alphabet<Integer> alphabet) {
        Random r = new Random(seed);
        return generateDFA(r, size, Math.round(0.5f * size), alphabet);
    }
}
