package nqueens.ga;

/**
 * Raised when a solver run cannot continue, e.g. a worker failed or the
 * controller thread was interrupted while waiting for a generation.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
