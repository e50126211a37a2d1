package FSA.Model;

import java.util.function.IntUnaryOperator;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Value stored under a transition symbol: either a single target (DFA-style) or an ordered set of targets (NFA-style).
 */
public interface Transition {

    /**
     * @return targets in their stored order; a singleton for {@link Single}
     */
    IntList targets();

    /**
     * Rewrite every target through the given mapping, keeping the shape.
     */
    Transition map(IntUnaryOperator mapping);

    static Transition single(int target) {
        return new Single(target);
    }

    static Transition multiple(IntList targets) {
        return new Multiple(targets);
    }

    record Single(int target) implements Transition {
        @Override
        public IntList targets() {
            return IntLists.singleton(target);
        }

        @Override
        public Transition map(IntUnaryOperator mapping) {
            return new Single(mapping.applyAsInt(target));
        }

        @Override
        public String toString() {
            return Automaton.label(target);
        }
    }

    /**
     * Targets are kept distinct, in first-occurrence order.
     */
    record Multiple(IntList targets) implements Transition {
        public Multiple {
            targets = IntLists.unmodifiable(new IntArrayList(new IntLinkedOpenHashSet(targets)));
        }

        @Override
        public Transition map(IntUnaryOperator mapping) {
            IntList mapped = new IntArrayList(targets.size());
            for (int t : targets) {
                mapped.add(mapping.applyAsInt(t));
            }
            return new Multiple(mapped);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(Automaton.label(targets.getInt(i)));
            }
            return sb.append(']').toString();
        }
    }
}
