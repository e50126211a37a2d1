package FSA;

import java.util.ArrayList;
import java.util.List;

import FSA.Model.Automaton;
import FSA.Model.PruneStrategy;
import FSA.Model.State;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Removes unreachable states, pass after pass, until a pass removes nothing.
 * Ids are not renumbered; run {@link Normalizer#normalize(Automaton)} afterwards for a dense numbering.
 */
public class ReachabilityPruner {
    private ReachabilityPruner() {}

    /**
     * Prune with {@link PruneStrategy#targetMembership()}: states that are never a transition target are dropped,
     * a start state without incoming edges included.
     */
    public static Automaton prune(Automaton automaton) {
        return prune(automaton, PruneStrategy.targetMembership());
    }

    /**
     * @return the receiver if nothing was removed, otherwise a new automaton without the removed states
     */
    public static Automaton prune(Automaton automaton, PruneStrategy strategy) {
        Automaton current = automaton;
        int passes = 0;
        while (true) {
            final IntSet unreachable = strategy.unreachable(current);
            if (unreachable.isEmpty()) {
                break;
            }
            passes++;
            List<State> kept = new ArrayList<>(current.size() - unreachable.size());
            for (State s : current.getStates()) {
                if (!unreachable.contains(s.id())) {
                    kept.add(s);
                }
            }
            current = Automaton.fromStates(kept, false);
        }
        if (TableFillingMinimizer.DEBUG && passes > 0) {
            System.out.println("DEBUG: " + strategy.getName() + " pruning: " + automaton.size() + " -> "
                + current.size() + " states in " + passes + " passes");
        }
        return current;
    }
}
