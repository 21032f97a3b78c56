package org.loctrace.ir.location;

import java.util.List;
import java.util.Objects;

/**
 * Structural comparison of locations that may belong to different contexts.
 * <p>
 * Within one context identity already is structural equality. This class answers the same
 * question across contexts by comparing content recursively. Opaque locations compare their
 * underlying object by reference, as interning does.
 */
public final class LocationEquivalence {

    private LocationEquivalence() {}

    /**
     * Checks whether two locations have equal content.
     *
     * @param a The first location.
     * @param b The second location.
     * @return {@code true} if both describe the same provenance.
     */
    public static boolean equivalent(Location a, Location b) {
        if (a == b) return true;
        if (a == null || b == null || a.kind() != b.kind()) return false;
        // Canonical within a context: distinct handles of one context always differ.
        if (a.context() == b.context()) return false;

        return switch (a.kind()) {
            case UNKNOWN -> true;
            case FILE_LINE_COL_RANGE -> {
                FileLineColRange x = (FileLineColRange) a;
                FileLineColRange y = (FileLineColRange) b;
                yield x.filename().equals(y.filename())
                        && x.startLine() == y.startLine() && x.startColumn() == y.startColumn()
                        && x.endLine() == y.endLine() && x.endColumn() == y.endColumn();
            }
            case NAME -> ((NameLoc) a).name().equals(((NameLoc) b).name())
                    && equivalent(((NameLoc) a).child(), ((NameLoc) b).child());
            case CALL_SITE -> equivalent(((CallSiteLoc) a).callee(), ((CallSiteLoc) b).callee())
                    && equivalent(((CallSiteLoc) a).caller(), ((CallSiteLoc) b).caller());
            case FUSED -> {
                FusedLoc x = (FusedLoc) a;
                FusedLoc y = (FusedLoc) b;
                yield x.metadata().equals(y.metadata()) && allEquivalent(x.locations(), y.locations());
            }
            case OPAQUE -> {
                OpaqueLoc x = (OpaqueLoc) a;
                OpaqueLoc y = (OpaqueLoc) b;
                yield x.typeTag() == y.typeTag()
                        && x.underlyingReference() == y.underlyingReference()
                        && equivalent(x.fallback(), y.fallback());
            }
        };
    }

    /**
     * Computes a hash that is consistent with {@link #equivalent(Location, Location)}.
     *
     * @param location The location.
     * @return The structural hash.
     */
    public static int structuralHash(Location location) {
        return switch (location.kind()) {
            case UNKNOWN -> 0;
            case FILE_LINE_COL_RANGE -> {
                FileLineColRange f = (FileLineColRange) location;
                yield Objects.hash(f.filename(), f.startLine(), f.startColumn(), f.endLine(), f.endColumn());
            }
            case NAME -> 31 * ((NameLoc) location).name().hashCode() + structuralHash(((NameLoc) location).child());
            case CALL_SITE -> 31 * structuralHash(((CallSiteLoc) location).callee())
                    + structuralHash(((CallSiteLoc) location).caller()) + 7;
            case FUSED -> {
                FusedLoc f = (FusedLoc) location;
                int hash = f.metadata().hashCode();
                for (Location inner : f.locations()) {
                    hash = 31 * hash + structuralHash(inner);
                }
                yield hash;
            }
            case OPAQUE -> {
                OpaqueLoc o = (OpaqueLoc) location;
                yield 31 * (31 * o.typeTag().id() + System.identityHashCode(o.underlyingReference())) + structuralHash(o.fallback());
            }
        };
    }

    private static boolean allEquivalent(List<Location> a, List<Location> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!equivalent(a.get(i), b.get(i))) return false;
        }
        return true;
    }
}
