package com.stagegraph.definition.model;

import java.util.Objects;

/** Parent → child dependency, the direction artifacts flow. Derived from {@code previous}. */
public final class StageEdge {

    private final String from;
    private final String to;

    public StageEdge(String from, String to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    /** Parent stage id (data source). */
    public String getFrom() {
        return from;
    }

    /** Child stage id (data consumer). */
    public String getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageEdge that = (StageEdge) o;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
