package FSA.Exceptions;

import java.io.Serial;

public class InvalidTransitionException extends FSAException {
    @Serial
    private static final long serialVersionUID = -5466391851408926115L;

    public final String fromState;
    public final String inputSymbol;

    public InvalidTransitionException(String fromState, String inputSymbol, String message) {
        super(message);
        this.fromState = fromState;
        this.inputSymbol = inputSymbol;
    }
}
