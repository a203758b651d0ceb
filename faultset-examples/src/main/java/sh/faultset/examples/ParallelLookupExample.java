// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.examples;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import sh.faultset.core.GroupShape;
import sh.faultset.core.GroupedError;

/**
 * Example demonstrating shape-based handling of parallel failures.
 *
 * <p>This example covers:
 * <ul>
 *   <li>Fanning lookups out to a thread pool with {@link FanOut}</li>
 *   <li>Collecting every failure into one {@link GroupedError}</li>
 *   <li>Selecting a handler with exact and inclusive {@link GroupShape}s</li>
 *   <li>Splitting a group into the part a handler owns and the rest</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * mvn -pl faultset-examples exec:java \
 *     -Dexec.mainClass=sh.faultset.examples.ParallelLookupExample \
 *     -Dfaultset.examples.tasks=12 -Dfaultset.examples.threads=4 -Dfaultset.debug=true
 * </pre>
 */
public final class ParallelLookupExample {

    private static final GroupShape ROOT = GroupShape.root(GroupedError.class);

    /** Only missing keys. */
    static final GroupShape MISSING_ONLY = ROOT.specialize(NoSuchElementException.class);

    /** Missing keys together with I/O failures, nothing else. */
    static final GroupShape MISSING_AND_IO = ROOT.specialize(NoSuchElementException.class, IOException.class);

    /** At least one I/O failure, anything else tolerated. */
    static final GroupShape ANY_IO = ROOT.specialize(IOException.class, GroupShape.OPEN);

    private ParallelLookupExample() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws InterruptedException {
        System.out.println("=== Parallel Lookup Example ===\n");

        final int taskCount = Integer.getInteger("faultset.examples.tasks", 10);
        final int threads = Integer.getInteger("faultset.examples.threads", 3);

        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            final FanOut fanOut = new FanOut(executor);
            final Map<String, Callable<String>> lookups = new LinkedHashMap<>();
            for (int i = 0; i < taskCount; i++) {
                final int key = i;
                lookups.put("lookup-" + key, () -> lookup(key));
            }

            try {
                final Map<String, String> values = fanOut.runAll("lookups failed", lookups);
                System.out.println("[1] All lookups succeeded: " + values);
            } catch (GroupedError e) {
                System.out.println("[1] " + e.getMessage() + " with kind " + e.kind().name());
                System.out.println("    " + handle(e));
            }
        } finally {
            executor.shutdown();
        }

        System.out.println("\n=== Example Complete ===");
    }

    /**
     * Dispatches to the first handler whose shape accepts the group, the way a
     * chain of catch clauses would.
     */
    static String handle(final GroupedError e) {
        if (MISSING_ONLY.isInstance(e)) {
            return "missing keys only: fall back to defaults for " + e.sources();
        }
        if (MISSING_AND_IO.isInstance(e)) {
            final GroupedError.Split split = e.split(IOException.class);
            return "retry " + split.matched().sources() + ", default " + split.rest().sources();
        }
        if (ANY_IO.isInstance(e)) {
            return "storage trouble among " + e.render();
        }
        throw e;
    }

    private static String lookup(final int key) throws IOException {
        if (key % 3 == 1) {
            throw new NoSuchElementException("no value for key " + key);
        }
        if (key % 5 == 4) {
            throw new IOException("store unavailable for key " + key);
        }
        return "value-" + key;
    }
}
