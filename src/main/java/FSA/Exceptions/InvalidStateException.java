package FSA.Exceptions;

import java.io.Serial;

/**
 * A state label that is not part of the automaton.
 */
public class InvalidStateException extends FSAException {
    @Serial
    private static final long serialVersionUID = 7793502216360617783L;

    public final String state;

    public InvalidStateException(String state) {
        this(state, "Invalid state '" + state + "' referenced in FSA");
    }

    public InvalidStateException(String state, String message) {
        super(message);
        this.state = state;
    }
}
