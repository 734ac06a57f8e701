package com.tenda.script.runtime;

/** Map key: a text or a finite integer. */
public final class AssociativeKey {
    private final String text;   // null for numeric keys
    private final long number;

    private AssociativeKey(String text, long number) {
        this.text = text;
        this.number = number;
    }

    public static AssociativeKey of(String text) {
        if (text == null) throw new IllegalArgumentException("text");
        return new AssociativeKey(text, 0);
    }

    public static AssociativeKey of(long number) {
        return new AssociativeKey(null, number);
    }

    /** @throws RuntimeError INVALID_MAP_KEY for anything but text or a finite integral number */
    public static AssociativeKey from(Value v) {
        if (v.type == Value.Type.STRING) return of(v.asString());
        if (v.type == Value.Type.NUMBER) {
            double d = v.asNumber();
            if (Double.isFinite(d) && d == Math.rint(d)) return of((long) d);
        }
        throw new RuntimeError(Diagnostic.invalidMapKey(v));
    }

    public boolean isText() {
        return text != null;
    }

    /** Unquoted: the text itself, or the number in decimal. */
    public String name() {
        return isText() ? text : Long.toString(number);
    }

    public Value toValue() {
        return isText() ? Value.string(text) : Value.number(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssociativeKey)) return false;
        AssociativeKey k = (AssociativeKey) o;
        if (isText() != k.isText()) return false;
        return isText() ? text.equals(k.text) : number == k.number;
    }

    @Override
    public int hashCode() {
        return isText() ? text.hashCode() : Long.hashCode(number);
    }

    /** Display form used inside map displays: quoted text, bare number. */
    @Override
    public String toString() {
        return isText() ? '"' + text + '"' : Long.toString(number);
    }
}
