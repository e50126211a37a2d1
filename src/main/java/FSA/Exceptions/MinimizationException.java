package FSA.Exceptions;

import java.io.Serial;

/**
 * Table-filling minimization hit a broken internal invariant (table shape, index range, nondeterminism).
 */
public class MinimizationException extends FSAException {
    @Serial
    private static final long serialVersionUID = 1306649259744133202L;

    public MinimizationException(String message) {
        super("FSA minimization failed: " + message);
    }

    public MinimizationException(String message, Throwable cause) {
        super("FSA minimization failed: " + message, cause);
    }
}
