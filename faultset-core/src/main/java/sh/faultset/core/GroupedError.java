// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

import sh.faultset.core.error.EmptySpecializationException;
import sh.faultset.core.error.InvalidMemberException;
import sh.faultset.core.error.InvalidSpecializationException;
import sh.faultset.core.error.SourceCountMismatchException;

/**
 * An exception that contains other exceptions.
 *
 * <p>
 * Its main use is to represent several child tasks failing "in parallel". Each
 * member is paired with a source string describing where it came from.
 *
 * <p>
 * On construction the group derives its {@link #kind()}: the exact
 * {@link GroupShape} of its member classes. Handlers select groups by testing
 * that kind against a filter shape:
 *
 * <pre>{@code
 * try {
 *     throw new GroupedError("lookups failed",
 *             List.of(new NoSuchElementException("a"), new IllegalStateException("b")),
 *             List.of("worker-1", "worker-2"));
 * } catch (GroupedError e) {
 *     GroupShape lookups = GroupShape.root(GroupedError.class)
 *             .specialize(NoSuchElementException.class, GroupShape.OPEN);
 *     if (lookups.isInstance(e)) {
 *         // at least one NoSuchElementException, possibly others
 *     }
 * }
 * }</pre>
 *
 * <p>
 * Every subclass roots its own family: its values never match shapes of another
 * family. Subclasses must override {@link #rebuild(List, List)} so that
 * {@link #copy()} and {@link #split(Class)} stay inside the family.
 *
 * <p>
 * The message, members and sources are immutable. Chaining metadata (cause,
 * context, suppressed throwables, stack trace) may be attached later.
 *
 * @since 0.1.0
 */
public class GroupedError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String message;
    private final List<Exception> exceptions;
    private final List<String> sources;
    private transient GroupShape kind;

    private @Nullable Throwable context;
    private boolean contextSuppressed;
    private boolean causeInitialized;

    /**
     * Halves of a grouped error produced by {@link #split(Class, Predicate)}.
     *
     * @param matched group of matching members, or {@code null} if none matched
     * @param rest    group of remaining members, or {@code null} if all matched
     */
    public record Split(@Nullable GroupedError matched, @Nullable GroupedError rest) {
    }

    /**
     * Creates a grouped error through the root shape of {@link GroupedError}.
     *
     * @param message    description of the overall failure
     * @param exceptions the member exceptions, in order
     * @param sources    one origin description per exception
     * @throws EmptySpecializationException if {@code exceptions} is empty
     * @throws InvalidMemberException       if a member is not an {@link Exception}
     * @throws SourceCountMismatchException if the two sequences differ in length
     */
    public GroupedError(
            final String message,
            final List<? extends Exception> exceptions,
            final List<String> sources) {
        this(GroupShape.root(GroupedError.class), message, exceptions, sources);
    }

    /**
     * Creates a grouped error through the given shape.
     *
     * <p>Subclasses pass the root of their own family, or a specialization of it.
     *
     * @param through    shape the caller constructs through
     * @param message    description of the overall failure
     * @param exceptions the member exceptions, in order
     * @param sources    one origin description per exception
     * @throws InvalidSpecializationException if {@code through} belongs to another
     *         family, or is specialized and does not accept the members
     */
    protected GroupedError(
            final GroupShape through,
            final String message,
            final List<? extends Exception> exceptions,
            final List<String> sources) {
        super(message);
        Objects.requireNonNull(through, "through");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(exceptions, "exceptions");
        Objects.requireNonNull(sources, "sources");

        if (through.base() != getClass()) {
            throw InvalidSpecializationException.familyMismatch(through.name(), getClass());
        }
        if (exceptions.isEmpty()) {
            throw new EmptySpecializationException(through.name());
        }
        int index = 0;
        for (final Object member : exceptions) {
            // guards against heap pollution from raw or unchecked callers
            if (!(member instanceof Exception)) {
                throw new InvalidMemberException(member, index);
            }
            index++;
        }
        if (sources.size() != exceptions.size()) {
            throw new SourceCountMismatchException(sources.size(), exceptions.size());
        }

        this.message = message;
        this.exceptions = List.copyOf(exceptions);
        this.sources = List.copyOf(sources);
        this.kind = through.registry().derive(getClass(), this.exceptions);

        if (through.isSpecialized() && !through.accepts(kind)) {
            throw InvalidSpecializationException.membersDoNotMatch(through.name(), kind.name());
        }
        DebugLogger.logConstruction("[GROUP] %s from %d member(s)", kind.name(), this.exceptions.size());
    }

    public String message() {
        return message;
    }

    /**
     * Returns the member exceptions in construction order.
     *
     * @return unmodifiable list of members
     */
    public List<Exception> exceptions() {
        return exceptions;
    }

    /**
     * Returns the origin descriptions, aligned by position with {@link #exceptions()}.
     *
     * @return unmodifiable list of sources
     */
    public List<String> sources() {
        return sources;
    }

    /**
     * Returns the exact shape derived from the member classes.
     *
     * @return the kind used for matching
     */
    public GroupShape kind() {
        return kind;
    }

    /**
     * Returns the exception that was being handled when this group was raised.
     *
     * @return the context, or {@code null}
     */
    public @Nullable Throwable context() {
        return context;
    }

    public void setContext(final @Nullable Throwable context) {
        this.context = context;
    }

    /**
     * Returns whether the context should be hidden when reporting this group.
     *
     * <p>Becomes {@code true} when a cause is attached with {@link #initCause(Throwable)}.
     *
     * @return the suppression flag
     */
    public boolean isContextSuppressed() {
        return contextSuppressed;
    }

    public void setContextSuppressed(final boolean contextSuppressed) {
        this.contextSuppressed = contextSuppressed;
    }

    /**
     * Attaches an explicit cause and suppresses the context.
     */
    @Override
    public synchronized Throwable initCause(final @Nullable Throwable cause) {
        super.initCause(cause);
        causeInitialized = true;
        contextSuppressed = true;
        return this;
    }

    /**
     * Returns a new group with the same message, members and sources, and the
     * same chaining metadata.
     *
     * @return the copy
     */
    public GroupedError copy() {
        final GroupedError copy = rebuild(exceptions, sources);
        copyChainingTo(copy);
        return copy;
    }

    /**
     * Splits the members into those that are instances of {@code kind} and the rest.
     *
     * @param kind the kind to extract
     * @return the two halves
     * @see #split(Class, Predicate)
     */
    public Split split(final Class<? extends Throwable> kind) {
        return split(kind, member -> true);
    }

    /**
     * Splits the members into those that are instances of {@code kind} accepted
     * by {@code match}, and the rest.
     *
     * <p>
     * Members that are themselves grouped errors are split recursively; each of
     * their non-empty halves lands on the corresponding side. Both halves keep
     * this group's message, its chaining metadata, and the sources of their
     * members. {@code match} is only consulted for members of {@code kind}.
     *
     * @param kind  the kind to extract
     * @param match additional condition on extracted members
     * @return the two halves, either of which is {@code null} when empty
     */
    public Split split(final Class<? extends Throwable> kind, final Predicate<? super Throwable> match) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(match, "match");

        final List<Exception> matched = new ArrayList<>();
        final List<String> matchedSources = new ArrayList<>();
        final List<Exception> rest = new ArrayList<>();
        final List<String> restSources = new ArrayList<>();

        for (int i = 0; i < exceptions.size(); i++) {
            final Exception member = exceptions.get(i);
            final String source = sources.get(i);
            if (member instanceof GroupedError nested) {
                final Split inner = nested.split(kind, match);
                if (inner.matched() != null) {
                    matched.add(inner.matched());
                    matchedSources.add(source);
                }
                if (inner.rest() != null) {
                    rest.add(inner.rest());
                    restSources.add(source);
                }
            } else if (kind.isInstance(member) && match.test(member)) {
                matched.add(member);
                matchedSources.add(source);
            } else {
                rest.add(member);
                restSources.add(source);
            }
        }
        return new Split(part(matched, matchedSources), part(rest, restSources));
    }

    private @Nullable GroupedError part(final List<Exception> members, final List<String> memberSources) {
        if (members.isEmpty()) {
            return null;
        }
        final GroupedError part = rebuild(members, memberSources);
        copyChainingTo(part);
        return part;
    }

    /**
     * Builds a new, unchained group of this family with this message.
     *
     * <p>Subclasses must override this to construct an instance of their own class.
     *
     * @param members       members of the new group
     * @param memberSources sources of the new group
     * @return the new group
     */
    protected GroupedError rebuild(final List<Exception> members, final List<String> memberSources) {
        if (getClass() != GroupedError.class) {
            throw new UnsupportedOperationException(
                    getClass().getName() + " must override rebuild(List, List)");
        }
        return new GroupedError(message, members, memberSources);
    }

    private void copyChainingTo(final GroupedError target) {
        target.setStackTrace(getStackTrace());
        target.setContext(context);
        if (causeInitialized) {
            target.initCause(getCause());
        }
        for (final Throwable suppressed : getSuppressed()) {
            target.addSuppressed(suppressed);
        }
        // initCause flips the flag, so it is applied last
        target.setContextSuppressed(contextSuppressed);
    }

    private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        // shapes are not serialized; the kind is derived again from the members
        kind = ShapeRegistry.shared().derive(getClass(), exceptions);
    }

    /**
     * Renders the members, comma-separated, in order.
     *
     * @return the member renderings
     */
    public String render() {
        return exceptions.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "GroupedError: " + render();
    }
}
