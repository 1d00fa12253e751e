package nqueens.ga;

/**
 * Receives a snapshot after every generation. Called on the controller thread.
 */
@FunctionalInterface
public interface GenerationListener {
    GenerationListener NONE = snapshot -> { };

    void onGeneration(GenerationSnapshot snapshot);
}
