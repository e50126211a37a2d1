package FSA.Exceptions;

import java.io.Serial;

/**
 * Base class of every error raised by the automaton core.
 */
public class FSAException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4125874011596312470L;

    public FSAException(String message) {
        super(message);
    }

    public FSAException(String message, Throwable cause) {
        super(message, cause);
    }
}
