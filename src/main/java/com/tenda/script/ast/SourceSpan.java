package com.tenda.script.ast;

import java.util.Objects;

/**
 * Character range of a node in its source unit. Opaque to the runtime, which only
 * attaches it to diagnostics.
 */
public final class SourceSpan {
    public final int start;
    public final int end;
    public final String sourceId; // may be null for synthetic nodes

    public SourceSpan(int start, int end, String sourceId) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
        this.sourceId = sourceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan other = (SourceSpan) o;
        return start == other.start && end == other.end && Objects.equals(sourceId, other.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, sourceId);
    }

    @Override
    public String toString() {
        return (sourceId == null ? "" : sourceId + ":") + start + ".." + end;
    }
}
