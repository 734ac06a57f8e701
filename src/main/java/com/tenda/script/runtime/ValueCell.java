package com.tenda.script.runtime;

/**
 * Storage slot of one variable.
 *
 * <p>An owned cell is private to the Environment that holds it: assigning the
 * name replaces the cell, so nothing else ever observes the change. A shared
 * cell is the one aliasing channel of the runtime; closures that captured the
 * name hold the same cell and see every write.
 */
public final class ValueCell {
    private final boolean shared;
    private Value value;

    private ValueCell(boolean shared, Value value) {
        this.shared = shared;
        this.value = (value == null) ? Value.nil() : value;
    }

    public static ValueCell owned(Value value) {
        return new ValueCell(false, value);
    }

    public static ValueCell shared(Value value) {
        return new ValueCell(true, value);
    }

    public static ValueCell of(Value value, boolean shared) {
        return new ValueCell(shared, value);
    }

    public boolean isShared() {
        return shared;
    }

    public Value read() {
        return value;
    }

    /** In-place write, visible to every holder. Owned cells are replaced, never written. */
    public void set(Value v) {
        if (!shared) throw new IllegalStateException("Owned cells are replaced, not written");
        this.value = (v == null) ? Value.nil() : v;
    }

    /** Promotion: a shared cell holding the current value ({@code this} when already shared). */
    public ValueCell share() {
        return shared ? this : shared(value);
    }

    @Override
    public String toString() {
        return (shared ? "Shared(" : "Owned(") + value.repr() + ")";
    }
}
