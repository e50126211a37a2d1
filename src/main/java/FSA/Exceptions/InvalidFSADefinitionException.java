package FSA.Exceptions;

import java.io.Serial;

/**
 * Malformed automaton definition: missing start/accept flags, labels that cannot be ordered, no start state.
 */
public class InvalidFSADefinitionException extends FSAException {
    @Serial
    private static final long serialVersionUID = -2618236330716468157L;

    public InvalidFSADefinitionException(String message) {
        super("Invalid FSA definition: " + message);
    }
}
