// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a value offered as a group member is not an {@link Exception}.
 *
 * @since 0.1.0
 */
public final class InvalidMemberException extends FaultsetException {

    private final @Nullable Object member;
    private final int index;

    public InvalidMemberException(final @Nullable Object member, final int index) {
        super("Expected an exception object at index %d, not %s".formatted(index, describe(member)));
        this.member = member;
        this.index = index;
    }

    private static String describe(final @Nullable Object member) {
        if (member == null) {
            return "null";
        }
        return member.getClass().getSimpleName() + " '" + member + "'";
    }

    /**
     * Returns the rejected value.
     *
     * @return the offending member, may be {@code null}
     */
    public @Nullable Object member() {
        return member;
    }

    /**
     * Returns the position of the rejected value in the exceptions sequence.
     *
     * @return zero-based index
     */
    public int index() {
        return index;
    }
}
