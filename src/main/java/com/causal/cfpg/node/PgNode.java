package com.causal.cfpg.node;

import java.util.Objects;

/**
 * A node of a layered paths graph.
 *
 * <p>
 * One type covers every stage of construction: raw paths-graph and pre-CFPG
 * nodes carry no history ({@link #isSplit()} is false); the split copies of a
 * cycle-free paths graph carry the {@link History} that distinguishes them from
 * the other copies of the same {@code (layer, name, polarity)}. A node merged
 * by name carries the topological indices of the nodes it replaces instead.
 *
 * @param <N> Type of the node identifiers of the input graph.
 */
public final class PgNode<N> {
    private final int layer;
    private final N name;
    private final int polarity;
    private final History history;

    public PgNode(int layer, N name, int polarity, History history) {
        if (layer < 0)
            throw new IllegalArgumentException("Negative layer: " + layer);
        if (polarity != 0 && polarity != 1)
            throw new IllegalArgumentException("Polarity must be 0 or 1, got " + polarity);
        this.layer = layer;
        this.name = Objects.requireNonNull(name, "name");
        this.polarity = polarity;
        this.history = history;
    }

    public PgNode(int layer, N name, int polarity) {
        this(layer, name, polarity, null);
    }

    public int layer() {
        return layer;
    }

    public N name() {
        return name;
    }

    public int polarity() {
        return polarity;
    }

    /** History of a split copy, or {@code null} before splitting. */
    public History history() {
        return history;
    }

    public boolean isSplit() {
        return history != null;
    }

    public SignedNode<N> signedNode() {
        return new SignedNode<>(name, polarity);
    }

    /** Same node with its history dropped. */
    public PgNode<N> unsplit() {
        return history == null ? this : new PgNode<>(layer, name, polarity, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PgNode<?> other))
            return false;
        return layer == other.layer && polarity == other.polarity && name.equals(other.name)
                && Objects.equals(history, other.history);
    }

    @Override
    public int hashCode() {
        int h = layer;
        h = h * 31 + name.hashCode();
        h = h * 31 + polarity;
        return h * 31 + Objects.hashCode(history);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        sb.append('(').append(layer).append(", ").append(name).append(", ").append(polarity);
        if (history != null)
            sb.append(", ").append(history);
        return sb.append(')').toString();
    }
}
