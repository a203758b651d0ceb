// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a shape cannot be specialized with the given arguments.
 *
 * @since 0.1.0
 */
public final class InvalidSpecializationException extends FaultsetException {

    private final @Nullable Object argument;

    public InvalidSpecializationException(final String message, final @Nullable Object argument) {
        super(message);
        this.argument = argument;
    }

    /**
     * Returns the argument that was rejected, if a single argument was at fault.
     *
     * @return the offending argument, or {@code null}
     */
    public @Nullable Object argument() {
        return argument;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Argument is not a {@link Throwable} subclass (or the open marker).
     */
    public static InvalidSpecializationException notAnErrorKind(final @Nullable Object argument) {
        return new InvalidSpecializationException(
            "Expected a Throwable subclass, not " + argument, argument);
    }

    /**
     * Shape is already specialized; specializations do not nest.
     */
    public static InvalidSpecializationException alreadySpecialized(final String shapeName) {
        return new InvalidSpecializationException(
            "Cannot specialize already specialized '%s'".formatted(shapeName), null);
    }

    /**
     * Specialization was requested with an empty argument list.
     */
    public static InvalidSpecializationException noKinds(final String shapeName) {
        return new InvalidSpecializationException(
            "Specialization of '%s' requires at least one kind".formatted(shapeName), null);
    }

    /**
     * Shape belongs to another family than the value being constructed through it.
     */
    public static InvalidSpecializationException familyMismatch(
            final String shapeName, final Class<?> family) {
        return new InvalidSpecializationException(
            "Shape '%s' does not belong to family %s".formatted(shapeName, family.getSimpleName()),
            family);
    }

    /**
     * Members of a value do not satisfy the shape it is constructed through.
     */
    public static InvalidSpecializationException membersDoNotMatch(
            final String shapeName, final String derivedName) {
        return new InvalidSpecializationException(
            "Members %s do not match specialization '%s'".formatted(derivedName, shapeName), null);
    }
}
