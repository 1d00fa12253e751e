package nqueens.ga;

import java.util.Objects;
import nqueens.core.Board;

/**
 * The two boards chosen to produce a pair of children.
 */
public final class Parents {
    private final Board first;
    private final Board second;

    public Parents(Board first, Board second) {
        this.first = Objects.requireNonNull(first, "first parent");
        this.second = Objects.requireNonNull(second, "second parent");
        if (first.size() != second.size()) {
            throw new IllegalArgumentException("Parents differ in size: " + first.size() + " vs " + second.size());
        }
    }

    public Board getFirst() {
        return first;
    }

    public Board getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return "Parents{" + first + ", " + second + "}";
    }
}
