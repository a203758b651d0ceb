// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.faultset.core.error.InvalidSpecializationException;

/**
 * Interns {@link GroupShape} instances.
 *
 * <p>
 * Root shapes are held strongly, one per family. Specialized shapes are held by
 * weak values: once nothing else references a shape, it and its entry are
 * reclaimed. {@link Cache#get(Object, java.util.function.Function)} performs the
 * lookup and the insert as one atomic step per key, and a reclaimed value reads as
 * absent, so concurrent callers always observe a single live shape per key.
 *
 * @since 0.1.0
 */
public final class ShapeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ShapeRegistry.class);

    private static final ShapeRegistry SHARED = new ShapeRegistry();

    private static final Comparator<Class<?>> BY_NAME = Comparator.comparing(Class::getName);

    private final ConcurrentMap<Class<? extends GroupedError>, GroupShape> roots = new ConcurrentHashMap<>();

    private final Cache<ShapeKey, GroupShape> specializations = Caffeine.newBuilder()
            .weakValues()
            .build();

    /** Cache key; member sets compare by content, not order. */
    private record ShapeKey(
            Class<? extends GroupedError> base,
            Set<Class<? extends Throwable>> members,
            boolean inclusive) {
    }

    ShapeRegistry() {
    }

    /**
     * Returns the process-wide registry.
     *
     * @return the shared registry
     */
    public static ShapeRegistry shared() {
        return SHARED;
    }

    /**
     * Returns the root shape of a family, creating it on first use.
     *
     * @param family the grouped error class rooting the family
     * @return the unspecialized root shape
     */
    public GroupShape root(final Class<? extends GroupedError> family) {
        Objects.requireNonNull(family, "family");
        return roots.computeIfAbsent(family, f -> new GroupShape(this, f, Set.of(), true));
    }

    /**
     * Returns the interned shape for a (base, members, inclusive) combination.
     *
     * <p>Duplicates in {@code members} collapse. {@link GroupShape#OPEN} may appear
     * among the members and forces the shape to be inclusive. If no kinds remain
     * after removing the marker, the root of {@code base} is returned.
     *
     * @param base      the family
     * @param members   requested kinds
     * @param inclusive whether unmatched value members are tolerated
     * @return the shape; identical for equal requests
     * @throws InvalidSpecializationException if a member is not a {@link Throwable} subclass
     */
    public GroupShape getOrCreate(
            final Class<? extends GroupedError> base,
            final Collection<? extends Class<?>> members,
            final boolean inclusive) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(members, "members");

        boolean open = inclusive;
        final List<Class<? extends Throwable>> kinds = new ArrayList<>(members.size());
        for (final Class<?> member : members) {
            if (member == GroupShape.OPEN) {
                open = true;
            } else if (member == null || !Throwable.class.isAssignableFrom(member)) {
                throw InvalidSpecializationException.notAnErrorKind(member);
            } else {
                kinds.add(member.asSubclass(Throwable.class));
            }
        }
        if (kinds.isEmpty()) {
            return root(base);
        }

        final ShapeKey key = new ShapeKey(base, normalize(kinds), open);
        return specializations.get(key, this::realize);
    }

    private static Set<Class<? extends Throwable>> normalize(final List<Class<? extends Throwable>> kinds) {
        final List<Class<? extends Throwable>> sorted = new ArrayList<>(new LinkedHashSet<>(kinds));
        sorted.sort(BY_NAME);
        return Collections.unmodifiableSet(new LinkedHashSet<>(sorted));
    }

    private GroupShape realize(final ShapeKey key) {
        final GroupShape shape = new GroupShape(this, key.base(), key.members(), key.inclusive());
        LOG.debug("Realized shape {}", shape.name());
        DebugLogger.logRegistry("[SHAPE] realized %s", shape.name());
        return shape;
    }

    /**
     * Derives the exact shape of a sequence of members.
     */
    GroupShape derive(final Class<? extends GroupedError> base, final List<? extends Throwable> exceptions) {
        final List<Class<?>> kinds = new ArrayList<>(exceptions.size());
        for (final Throwable exception : exceptions) {
            kinds.add(exception.getClass());
        }
        return getOrCreate(base, kinds, false);
    }
}
