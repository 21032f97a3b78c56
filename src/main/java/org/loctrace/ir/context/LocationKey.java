package org.loctrace.ir.context;

/**
 * Structural content of a location, used as the lookup key of {@link LocationStorage}.
 * <p>
 * Implementations are records: their {@code equals} and {@code hashCode} cover exactly the
 * fields that participate in the identity of the variant. Child locations are compared by
 * reference, which is sound because children are themselves canonical.
 */
public interface LocationKey {
}
