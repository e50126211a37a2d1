package FSA;

import java.util.List;

import FSA.Exceptions.InvalidFSADefinitionException;
import FSA.Exceptions.InvalidTransitionException;
import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.Transition;

/**
 * Cursor executing input symbols against an automaton.
 * Every feeding method returns this run, so symbols can be supplied in one call or incrementally:
 * {@code a.run().feed(1, 1).isAccepting()} and {@code a.run().step("1").step("1").isAccepting()} agree.
 * <p>
 * Nondeterminism is not resolved: a transition with several targets is rejected.
 * A run is not thread-safe; the automaton it reads is immutable and may be shared.
 */
public class Run {
    private final Automaton automaton;
    private int current;
    private boolean accept;

    public Run(Automaton automaton) {
        if (!automaton.hasStartState()) {
            throw new InvalidFSADefinitionException("FSA has no start state to run from");
        }
        this.automaton = automaton;
        reset();
    }

    /**
     * Move back to the start state.
     */
    public Run reset() {
        this.current = automaton.getStartState();
        this.accept = automaton.isAccepting(current);
        return this;
    }

    /**
     * Consume one symbol.
     * @throws InvalidTransitionException if the current state has no transition on {@code symbol}, or more than one
     * target for it. The cursor is left where it was.
     */
    public Run step(String symbol) {
        final State state = automaton.getState(current);
        final Transition transition = state.getTransition(symbol);
        if (transition == null) {
            throw new InvalidTransitionException(state.label(), symbol,
                "No transition defined for input '" + symbol + "' in state '" + state.label() + "'");
        }
        final int next;
        if (transition instanceof Transition.Single) {
            next = ((Transition.Single) transition).target();
        } else if (transition.targets().size() == 1) {
            next = transition.targets().getInt(0);
        } else {
            throw new InvalidTransitionException(state.label(), symbol,
                "NFA with multiple possible states not supported: state '" + state.label() + "' has "
                    + transition.targets().size() + " possible transitions for input '" + symbol + "'");
        }
        this.current = next;
        this.accept = automaton.isAccepting(next);
        return this;
    }

    public Run step(int symbol) {
        return step(String.valueOf(symbol));
    }

    public Run feed(String... symbols) {
        for (String symbol : symbols) {
            step(symbol);
        }
        return this;
    }

    public Run feed(int... symbols) {
        for (int symbol : symbols) {
            step(String.valueOf(symbol));
        }
        return this;
    }

    /**
     * Consume a pre-built sequence; each element is a symbol in its {@link String#valueOf(Object)} form.
     */
    public Run feed(List<?> symbols) {
        for (Object symbol : symbols) {
            step(String.valueOf(symbol));
        }
        return this;
    }

    public boolean isAccepting() {
        return accept;
    }

    public int getCurrentState() {
        return current;
    }

    public String getCurrentLabel() {
        return Automaton.label(current);
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    @Override
    public String toString() {
        return getCurrentLabel() + (accept ? " (accepting)" : "");
    }
}
