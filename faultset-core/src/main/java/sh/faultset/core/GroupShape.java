// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

import sh.faultset.core.error.EmptySpecializationException;
import sh.faultset.core.error.InvalidMemberException;
import sh.faultset.core.error.InvalidSpecializationException;
import sh.faultset.core.error.SourceCountMismatchException;

/**
 * A catchable refinement of a {@link GroupedError} family.
 *
 * <p>
 * A shape is the triple (base, members, inclusive). The unspecialized root of a
 * family has no members and accepts every grouped error of that family. A
 * specialized shape lists the kinds a grouped error must contain:
 * <ul>
 * <li><strong>exact</strong> ({@code GroupedError[KeyError, IOException]}) -
 * every listed kind must be present and every member must be accounted for</li>
 * <li><strong>inclusive</strong> ({@code GroupedError[KeyError, ...]}) - every
 * listed kind must be present, other members are tolerated</li>
 * </ul>
 * Matching is covariant: a member of a more specific kind satisfies a more
 * general requirement.
 *
 * <p>
 * Shapes are interned. Two requests for the same (base, members, inclusive)
 * return the identical object while either is still referenced, so shapes can be
 * compared with {@code ==}. The registry does not keep specialized shapes alive.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * static final GroupShape LOOKUP_FAILURES = GroupShape.root(GroupedError.class)
 *         .specialize(NoSuchElementException.class, GroupShape.OPEN);
 *
 * try {
 *     runAll(tasks);
 * } catch (GroupedError e) {
 *     if (!LOOKUP_FAILURES.isInstance(e)) {
 *         throw e;
 *     }
 *     // handle groups containing at least one lookup failure
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class GroupShape {

    /**
     * Marker that makes a specialization inclusive when passed to
     * {@link #specialize(Class...)}.
     */
    public static final Class<Open> OPEN = Open.class;

    /**
     * Type of the {@link #OPEN} marker. Never instantiated.
     */
    public static final class Open {
        private Open() {
        }
    }

    private final ShapeRegistry registry;
    private final Class<? extends GroupedError> base;
    private final Set<Class<? extends Throwable>> members;
    private final boolean inclusive;
    private final String name;

    GroupShape(
            final ShapeRegistry registry,
            final Class<? extends GroupedError> base,
            final Set<Class<? extends Throwable>> members,
            final boolean inclusive) {
        this.registry = registry;
        this.base = base;
        this.members = members;
        this.inclusive = inclusive;
        this.name = nameOf(base, members, inclusive);
    }

    private static String nameOf(
            final Class<? extends GroupedError> base,
            final Set<Class<? extends Throwable>> members,
            final boolean inclusive) {
        if (members.isEmpty()) {
            return base.getSimpleName();
        }
        final String listed = members.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", "));
        return base.getSimpleName() + "[" + listed + (inclusive ? ", ...]" : "]");
    }

    /**
     * Returns the unspecialized root shape of a family.
     *
     * @param family the grouped error class rooting the family
     * @return the root shape, one per family
     */
    public static GroupShape root(final Class<? extends GroupedError> family) {
        return ShapeRegistry.shared().root(family);
    }

    /**
     * Specializes this root shape with the given kinds.
     *
     * <p>Passing {@link #OPEN} among the kinds makes the result inclusive. Passing
     * only {@link #OPEN} returns this root unchanged.
     *
     * @param kinds {@link Throwable} subclasses, optionally including {@link #OPEN}
     * @return the interned specialized shape
     * @throws InvalidSpecializationException if this shape is already specialized,
     *         no kinds are given, or an argument is not a {@link Throwable} subclass
     */
    public GroupShape specialize(final Class<?>... kinds) {
        Objects.requireNonNull(kinds, "kinds");
        if (isSpecialized()) {
            throw InvalidSpecializationException.alreadySpecialized(name);
        }
        if (kinds.length == 0) {
            throw InvalidSpecializationException.noKinds(name);
        }
        return registry.getOrCreate(base, Arrays.asList(kinds), false);
    }

    /**
     * Tests whether this shape, used as a filter, accepts a value of the given shape.
     *
     * @param value the shape of a raised grouped error
     * @return true if a handler for this shape catches the value
     * @see ShapeMatcher#matches(GroupShape, GroupShape)
     */
    public boolean accepts(final GroupShape value) {
        return ShapeMatcher.matches(this, Objects.requireNonNull(value, "value"));
    }

    /**
     * Tests whether a throwable is a grouped error whose kind this shape accepts.
     *
     * @param throwable the candidate, may be {@code null}
     * @return true if the throwable would be caught by a handler for this shape
     */
    public boolean isInstance(final @Nullable Throwable throwable) {
        return throwable instanceof GroupedError group && accepts(group.kind());
    }

    /**
     * Constructs a grouped error through this shape.
     *
     * <p>Unlike {@link GroupedError#GroupedError(String, List, List)}, this checks
     * the members against the shape: a specialized shape rejects a value its own
     * filter would not accept.
     *
     * @param message     description of the overall failure
     * @param exceptions  the member exceptions, in order
     * @param sources     one origin description per exception
     * @return a new grouped error of this shape's family
     * @throws EmptySpecializationException  if {@code exceptions} is empty
     * @throws InvalidMemberException        if a member is not an {@link Exception}
     * @throws SourceCountMismatchException  if the two sequences differ in length
     * @throws InvalidSpecializationException if this shape belongs to another family
     *         than {@link GroupedError}, or does not accept the members
     */
    public GroupedError create(
            final String message,
            final List<? extends Exception> exceptions,
            final List<String> sources) {
        return new GroupedError(this, message, exceptions, sources);
    }

    public Class<? extends GroupedError> base() {
        return base;
    }

    /**
     * Returns the required kinds, sorted by class name. Empty for a root shape.
     *
     * @return unmodifiable set of member kinds
     */
    public Set<Class<? extends Throwable>> members() {
        return members;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    public boolean isSpecialized() {
        return !members.isEmpty();
    }

    /**
     * Returns the display name, e.g. {@code GroupedError[KeyError, IOException, ...]}.
     *
     * @return the shape name
     */
    public String name() {
        return name;
    }

    ShapeRegistry registry() {
        return registry;
    }

    @Override
    public String toString() {
        return "<shape '" + name + "'>";
    }
}
