package org.loctrace.typeid;

/**
 * A process-stable runtime token identifying one Java type.
 * <p>
 * Tokens are only created by {@link TypeTagRegistry}, which guarantees that every class maps
 * to exactly one token. Two tokens are therefore equal if and only if they are the same object.
 * Ids are sequential within one process run and carry no meaning across runs.
 */
public final class TypeTag {

    private final int id;
    private final Class<?> type;

    TypeTag(int id, Class<?> type) {
        this.id = id;
        this.type = type;
    }

    /**
     * Returns the token for the given type, registering it on first use.
     *
     * @param type The type to look up.
     * @return The unique token of {@code type}.
     */
    public static TypeTag of(Class<?> type) {
        return TypeTagRegistry.getInstance().tagFor(type);
    }

    /**
     * @return The sequential registration id of this token.
     */
    public int id() {
        return id;
    }

    /**
     * @return The fully qualified name of the tagged type.
     */
    public String typeName() {
        return type.getName();
    }

    /**
     * Checks whether this token was issued for exactly the given type.
     *
     * @param candidate The type to compare with.
     * @return {@code true} if this is the token of {@code candidate}.
     */
    public boolean isTagOf(Class<?> candidate) {
        return type == candidate;
    }

    @Override
    public String toString() {
        return "TypeTag{" + id + ":" + type.getName() + '}';
    }
}
