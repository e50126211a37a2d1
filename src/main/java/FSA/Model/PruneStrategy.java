package FSA.Model;

import java.util.ArrayDeque;
import java.util.Deque;

import FSA.Exceptions.InvalidFSADefinitionException;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Strategies deciding which states a reachability pruning pass removes.
 * Pruning repeats passes until one returns no state.
 */
public interface PruneStrategy {

    /**
     * States to delete in one pass.
     * @param automaton current automaton
     * @return ids to remove; empty once the fixed point is reached
     */
    IntSet unreachable(Automaton automaton);

    String getName();

    /**
     * targetMembership(): a state survives a pass iff some transition (its own included) targets it.
     * This is not a walk from the start state: a start state without incoming edges is removed, and a cycle of
     * otherwise unreachable states is kept.
     */
    static PruneStrategy targetMembership() {
        return new PruneStrategy() {
            @Override
            public IntSet unreachable(Automaton automaton) {
                final IntSet targets = new IntOpenHashSet();
                for (State s : automaton.getStates()) {
                    for (Transition t : s.transitions().values()) {
                        targets.addAll(t.targets());
                    }
                }
                final IntSet result = new IntOpenHashSet();
                for (int id : automaton.getStateIds()) {
                    if (!targets.contains(id)) {
                        result.add(id);
                    }
                }
                return result;
            }

            @Override
            public String getName() {
                return "targetMembership";
            }
        };
    }

    /**
     * fromStart(): breadth-first reachability from the start state; everything not visited is removed.
     * Reaches its fixed point in a single pass.
     */
    static PruneStrategy fromStart() {
        return new PruneStrategy() {
            @Override
            public IntSet unreachable(Automaton automaton) {
                if (!automaton.hasStartState()) {
                    throw new InvalidFSADefinitionException("no start state to compute reachability from");
                }
                final IntSet visited = new IntOpenHashSet();
                final Deque<Integer> queue = new ArrayDeque<>();
                visited.add(automaton.getStartState());
                queue.add(automaton.getStartState());
                while (!queue.isEmpty()) {
                    final State s = automaton.getState(queue.poll());
                    for (Transition t : s.transitions().values()) {
                        for (int target : t.targets()) {
                            if (visited.add(target)) {
                                queue.add(target);
                            }
                        }
                    }
                }
                final IntSet result = new IntOpenHashSet();
                for (int id : automaton.getStateIds()) {
                    if (!visited.contains(id)) {
                        result.add(id);
                    }
                }
                return result;
            }

            @Override
            public String getName() {
                return "fromStart";
            }
        };
    }
}
