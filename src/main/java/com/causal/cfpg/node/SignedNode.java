package com.causal.cfpg.node;

import java.util.Objects;

/**
 * A node name paired with the cumulative sign of the walk that reached it.
 *
 * <p>
 * Polarity 0 means the walk has an activating (positive) net effect, polarity 1
 * an inhibiting (negative) one. In unsigned mode every node carries polarity 0.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
public final class SignedNode<N> {
    private final N name;
    private final int polarity;

    public SignedNode(N name, int polarity) {
        if (polarity != 0 && polarity != 1)
            throw new IllegalArgumentException("Polarity must be 0 or 1, got " + polarity);
        this.name = Objects.requireNonNull(name, "name");
        this.polarity = polarity;
    }

    public N name() {
        return name;
    }

    public int polarity() {
        return polarity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignedNode<?> other))
            return false;
        return polarity == other.polarity && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + polarity;
    }

    @Override
    public String toString() {
        return "(" + name + ", " + polarity + ")";
    }
}
