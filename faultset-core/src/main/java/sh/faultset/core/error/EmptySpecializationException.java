// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core.error;

/**
 * Thrown when a grouped error with no members is requested.
 *
 * <p>A specialized shape names at least one kind, so it can never describe an
 * empty group. The unspecialized root refuses empty groups as well: a group
 * without members has no kind to match against.
 *
 * @since 0.1.0
 */
public final class EmptySpecializationException extends FaultsetException {

    private final String shapeName;

    public EmptySpecializationException(final String shapeName) {
        super("Specialization '%s' does not match empty exceptions".formatted(shapeName));
        this.shapeName = shapeName;
    }

    public String shapeName() {
        return shapeName;
    }
}
