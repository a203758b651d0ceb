// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core.error;

/**
 * Base runtime exception for all failures raised by faultset itself.
 *
 * <p>
 * These are construction and specialization failures. They are never thrown by
 * matching, which is total for well-formed shapes.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * FaultsetException
 * ├── {@link InvalidSpecializationException} - bad specialization arguments, nested specialization
 * ├── {@link EmptySpecializationException} - specialized shape constructed with no members
 * ├── {@link InvalidMemberException} - a member is not an exception
 * └── {@link SourceCountMismatchException} - sources and exceptions differ in length
 * </pre>
 *
 * <p>
 * Note that {@link sh.faultset.core.GroupedError} is deliberately outside this
 * hierarchy: it carries application failures, not faultset failures.
 *
 * @since 0.1.0
 */
public sealed class FaultsetException extends RuntimeException
        permits InvalidSpecializationException,
        EmptySpecializationException,
        InvalidMemberException,
        SourceCountMismatchException {

    public FaultsetException(final String message) {
        super(message);
    }
}
