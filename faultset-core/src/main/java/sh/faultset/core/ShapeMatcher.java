// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import java.util.Set;

/**
 * Structural subtype test between two {@link GroupShape}s.
 *
 * <p>
 * A single value member may satisfy several filter requirements and a single
 * requirement may be satisfied by several members, so the two directions are
 * checked independently instead of comparing set sizes:
 * <ol>
 * <li>every filter requirement is covered by some value member of that kind or a subtype</li>
 * <li>for exact filters, every value member is a subtype of some filter requirement</li>
 * </ol>
 */
public final class ShapeMatcher {

    private ShapeMatcher() {
    }

    /**
     * Tests whether {@code filter} accepts {@code value}.
     *
     * <p>Never throws for shapes produced by a {@link ShapeRegistry}.
     *
     * @param filter the shape named by a handler
     * @param value  the kind of a raised grouped error
     * @return true if the handler catches the value
     */
    public static boolean matches(final GroupShape filter, final GroupShape value) {
        if (filter == value) {
            return true;
        }
        if (filter.base() != value.base()) {
            return false;
        }
        if (!filter.isSpecialized()) {
            return true;
        }
        for (final Class<? extends Throwable> required : filter.members()) {
            if (!anySubtypeOf(value.members(), required)) {
                return false;
            }
        }
        if (filter.isInclusive()) {
            return true;
        }
        // exact: no value member may be left unaccounted for
        for (final Class<? extends Throwable> member : value.members()) {
            if (!subtypeOfAny(member, filter.members())) {
                return false;
            }
        }
        return true;
    }

    private static boolean anySubtypeOf(
            final Set<Class<? extends Throwable>> candidates, final Class<? extends Throwable> required) {
        for (final Class<? extends Throwable> candidate : candidates) {
            if (required.isAssignableFrom(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean subtypeOfAny(
            final Class<? extends Throwable> member, final Set<Class<? extends Throwable>> requirements) {
        for (final Class<? extends Throwable> required : requirements) {
            if (required.isAssignableFrom(member)) {
                return true;
            }
        }
        return false;
    }
}
