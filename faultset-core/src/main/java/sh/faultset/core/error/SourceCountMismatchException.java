// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.core.error;

/**
 * Thrown when the sources of a grouped error are not aligned with its exceptions.
 *
 * @since 0.1.0
 */
public final class SourceCountMismatchException extends FaultsetException {

    private final int sourceCount;
    private final int exceptionCount;

    public SourceCountMismatchException(final int sourceCount, final int exceptionCount) {
        super("Different number of sources (%d) and exceptions (%d)".formatted(sourceCount, exceptionCount));
        this.sourceCount = sourceCount;
        this.exceptionCount = exceptionCount;
    }

    public int sourceCount() {
        return sourceCount;
    }

    public int exceptionCount() {
        return exceptionCount;
    }
}
