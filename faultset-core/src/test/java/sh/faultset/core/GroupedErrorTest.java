// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.faultset.core.error.EmptySpecializationException;
import sh.faultset.core.error.InvalidMemberException;
import sh.faultset.core.error.SourceCountMismatchException;

class GroupedErrorTest {

    private static final GroupShape ROOT = GroupShape.root(GroupedError.class);

    /** Raises a group caused by, and raised during, an arithmetic failure. */
    @SuppressWarnings("divzero")
    private static GroupedError raiseGroup() {
        try {
            try {
                final int zero = 0;
                System.out.println(1 / zero);
                throw new AssertionError("unreachable");
            } catch (ArithmeticException e) {
                final GroupedError group = new GroupedError("ManyError", List.of(e), List.of(e.getMessage()));
                group.setContext(e);
                group.initCause(e);
                throw group;
            }
        } catch (GroupedError e) {
            return e;
        }
    }

    /** A family that supports copy and split. */
    static final class TaskFailures extends GroupedError {
        TaskFailures(final String message, final List<? extends Exception> exceptions, final List<String> sources) {
            super(GroupShape.root(TaskFailures.class), message, exceptions, sources);
        }

        @Override
        protected GroupedError rebuild(final List<Exception> members, final List<String> memberSources) {
            return new TaskFailures(message(), members, memberSources);
        }
    }

    @Nested
    class Construction {

        @Test
        void exposesMessageExceptionsAndSources() {
            final IllegalArgumentException memberA = new IllegalArgumentException("A");
            final IllegalStateException memberB = new IllegalStateException("B");

            final GroupedError group = new GroupedError(
                    "many error.", List.of(memberA, memberB), List.of(memberA.getMessage(), memberB.getMessage()));

            assertEquals(List.of(memberA, memberB), group.exceptions());
            assertSame(memberA, group.exceptions().get(0));
            assertEquals("many error.", group.message());
            assertEquals("many error.", group.getMessage());
            assertEquals(List.of("A", "B"), group.sources());
        }

        @Test
        void sequencesAreImmutableSnapshots() {
            final List<Exception> members = new ArrayList<>(List.of(new IllegalStateException()));
            final List<String> sources = new ArrayList<>(List.of("a"));

            final GroupedError group = new GroupedError("m", members, sources);
            members.add(new ArithmeticException());
            sources.add("b");

            assertEquals(1, group.exceptions().size());
            assertEquals(1, group.sources().size());
            assertThrows(UnsupportedOperationException.class, () -> group.exceptions().add(new RuntimeException()));
            assertThrows(UnsupportedOperationException.class, () -> group.sources().add("c"));
        }

        @Test
        @SuppressWarnings({"unchecked", "rawtypes"})
        void rejectsMembersThatAreNotExceptions() {
            final List polluted = List.of(new IllegalStateException("RuntimeError"), "error2");

            final InvalidMemberException ex = assertThrows(
                    InvalidMemberException.class,
                    () -> new GroupedError("error", polluted, List.of("RuntimeError", "error2")));

            assertEquals("error2", ex.member());
            assertEquals(1, ex.index());
        }

        @Test
        @SuppressWarnings({"unchecked", "rawtypes"})
        void rejectsFatalErrorsAsMembers() {
            final List polluted = List.of(new OutOfMemoryError());

            final InvalidMemberException ex = assertThrows(
                    InvalidMemberException.class, () -> new GroupedError("error", polluted, List.of("heap")));
            assertEquals(0, ex.index());
        }

        @Test
        void rejectsMisalignedSources() {
            final SourceCountMismatchException ex = assertThrows(
                    SourceCountMismatchException.class,
                    () -> new GroupedError(
                            "many error.",
                            List.of(new IllegalArgumentException("A"), new IllegalStateException("B")),
                            List.of("A")));

            assertEquals(1, ex.sourceCount());
            assertEquals(2, ex.exceptionCount());
            assertTrue(ex.getMessage().contains("(1)"));
            assertTrue(ex.getMessage().contains("(2)"));
        }

        @Test
        @DisplayName("empty groups are rejected at the root as well")
        void rejectsEmptyGroup() {
            assertThrows(EmptySpecializationException.class, () -> new GroupedError("m", List.of(), List.of()));
        }

        @Test
        void rejectsNullArguments() {
            assertThrows(NullPointerException.class, () -> new GroupedError("m", null, List.of()));
            assertThrows(
                    NullPointerException.class,
                    () -> new GroupedError("m", List.of(new IllegalStateException()), null));
        }
    }

    @Nested
    class Handling {

        @Test
        void catchesWithTheMatchingFilter() {
            final GroupedError group = raiseGroup();

            assertTrue(ROOT.specialize(ArithmeticException.class).isInstance(group));
            assertFalse(ROOT.specialize(ArrayIndexOutOfBoundsException.class).isInstance(group));
        }

        @Test
        void firstAcceptingHandlerWins() {
            final GroupShape onlyLookup = ROOT.specialize(ArrayIndexOutOfBoundsException.class);
            final GroupShape onlyState = ROOT.specialize(IllegalStateException.class);
            final GroupShape both = ROOT.specialize(ArrayIndexOutOfBoundsException.class, IllegalStateException.class);

            try {
                throw new GroupedError(
                        "message",
                        List.of(new ArrayIndexOutOfBoundsException(), new IllegalStateException()),
                        List.of("first", "second"));
            } catch (GroupedError e) {
                if (onlyLookup.isInstance(e) || onlyState.isInstance(e)) {
                    fail("group triggered too specific handler");
                } else if (!both.isInstance(e)) {
                    fail("group did not trigger handler");
                }
            }
        }

        @Test
        void inclusiveHandlerStillRequiresListedKinds() {
            final GroupedError group = raiseGroup();

            assertTrue(ROOT.specialize(ArithmeticException.class, GroupShape.OPEN).isInstance(group));
            assertFalse(ROOT.specialize(ArrayIndexOutOfBoundsException.class, GroupShape.OPEN).isInstance(group));
        }

        @Test
        void familiesAreSeparate() {
            final TaskFailures failures = new TaskFailures(
                    "tasks", List.of(new IllegalStateException()), List.of("worker"));

            assertSame(TaskFailures.class, failures.kind().base());
            assertFalse(ROOT.isInstance(failures));
            assertTrue(GroupShape.root(TaskFailures.class).isInstance(failures));
            assertTrue(GroupShape.root(TaskFailures.class).specialize(RuntimeException.class).isInstance(failures));
        }
    }

    @Nested
    class Rendering {

        @Test
        void rendersEveryMemberInOrder() {
            final GroupedError group = new GroupedError(
                    "many error.",
                    List.of(new IllegalArgumentException("memberA"), new IllegalArgumentException("memberB")),
                    List.of("memberA", "memberB"));

            assertEquals(
                    "java.lang.IllegalArgumentException: memberA, java.lang.IllegalArgumentException: memberB",
                    group.render());
            assertEquals("GroupedError: " + group.render(), group.toString());
        }
    }

    @Nested
    class Copy {

        @Test
        void copiesValueAndChainingMetadata() {
            final GroupedError group = raiseGroup();

            final GroupedError copy = group.copy();

            assertNotSame(group, copy);
            assertEquals(group.message(), copy.message());
            assertEquals(group.exceptions(), copy.exceptions());
            assertEquals(group.sources(), copy.sources());
            assertSame(group.kind(), copy.kind());
            assertEquals(List.of(group.getStackTrace()), List.of(copy.getStackTrace()));
            assertSame(group.getCause(), copy.getCause());
            assertSame(group.context(), copy.context());
            assertNotNull(copy.getCause());
            assertNotNull(copy.context());
            assertTrue(copy.isContextSuppressed());
        }

        @Test
        void restoresAnUnsuppressedContextAfterLinkingTheCause() {
            final GroupedError group = raiseGroup();
            group.setContextSuppressed(false);

            final GroupedError copy = group.copy();

            assertSame(group.getCause(), copy.getCause());
            assertSame(group.context(), copy.context());
            assertFalse(copy.isContextSuppressed());
        }

        @Test
        void copiesSuppressedThrowables() {
            final GroupedError group = new GroupedError("m", List.of(new IllegalStateException()), List.of("a"));
            final IllegalArgumentException cleanup = new IllegalArgumentException("cleanup");
            group.addSuppressed(cleanup);

            final GroupedError copy = group.copy();

            assertEquals(List.of(cleanup), List.of(copy.getSuppressed()));
            assertNull(copy.getCause());
            assertFalse(copy.isContextSuppressed());
        }

        @Test
        void initCauseSuppressesTheContext() {
            final GroupedError group = new GroupedError("m", List.of(new IllegalStateException()), List.of("a"));
            assertFalse(group.isContextSuppressed());

            group.initCause(new IllegalArgumentException());

            assertTrue(group.isContextSuppressed());
        }

        @Test
        void copyKeepsAnExplicitlyEmptyCause() {
            final GroupedError group = new GroupedError("m", List.of(new IllegalStateException()), List.of("a"));
            group.initCause(null);

            final GroupedError copy = group.copy();

            assertNull(copy.getCause());
            assertTrue(copy.isContextSuppressed());
            assertThrows(IllegalStateException.class, () -> copy.initCause(new IllegalArgumentException()));
        }

        @Test
        void copyStaysInTheFamily() {
            final TaskFailures failures = new TaskFailures(
                    "tasks", List.of(new IllegalStateException()), List.of("worker"));

            final GroupedError copy = failures.copy();

            assertSame(TaskFailures.class, copy.getClass());
            assertSame(failures.kind(), copy.kind());
        }

        @Test
        void subclassWithoutRebuildCannotBeCopied() {
            final ShapeMatcherTest.OtherFamily other = new ShapeMatcherTest.OtherFamily(
                    List.of(new IllegalStateException()), List.of("x"));

            assertThrows(UnsupportedOperationException.class, other::copy);
        }
    }

    @Nested
    class Serialization {

        private GroupedError roundTrip(final GroupedError group) throws IOException, ClassNotFoundException {
            final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
                out.writeObject(group);
            }
            try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
                return (GroupedError) in.readObject();
            }
        }

        @Test
        void kindIsDerivedAgainAfterDeserialization() throws Exception {
            final GroupedError group = new GroupedError(
                    "m", List.of(new IllegalStateException("x"), new ArithmeticException()), List.of("a", "b"));

            final GroupedError restored = roundTrip(group);

            assertSame(group.kind(), restored.kind());
            assertTrue(ROOT.isInstance(restored));
            assertTrue(ROOT.specialize(IllegalStateException.class, GroupShape.OPEN).isInstance(restored));
            assertEquals(List.of("a", "b"), restored.sources());
            assertEquals("m", restored.message());
        }

        @Test
        void chainingMetadataSurvivesDeserialization() throws Exception {
            final GroupedError group = raiseGroup();
            group.setContextSuppressed(false);

            final GroupedError restored = roundTrip(group);

            assertNotNull(restored.getCause());
            assertNotNull(restored.context());
            assertFalse(restored.isContextSuppressed());
            assertFalse(restored.copy().isContextSuppressed());
        }
    }
}
