// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.faultset.examples;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.faultset.core.GroupedError;

/**
 * Runs named tasks in parallel and reports every failure at once.
 *
 * <p>
 * All tasks run to completion. If any fail, their exceptions are raised together
 * as one {@link GroupedError}, in submission order, with the task names as sources.
 */
public final class FanOut {

    private static final Logger LOG = LoggerFactory.getLogger(FanOut.class);

    private final ExecutorService executor;

    public FanOut(final ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs every task and returns their results keyed by name.
     *
     * @param message description used if tasks fail
     * @param tasks   tasks keyed by name, in submission order
     * @param <T>     result type
     * @return results in submission order
     * @throws GroupedError         if at least one task failed
     * @throws InterruptedException if interrupted while waiting; unfinished tasks are cancelled
     */
    public <T> Map<String, T> runAll(final String message, final Map<String, Callable<T>> tasks)
            throws InterruptedException {
        final Map<String, Future<T>> futures = new LinkedHashMap<>();
        for (final Map.Entry<String, Callable<T>> task : tasks.entrySet()) {
            futures.put(task.getKey(), executor.submit(task.getValue()));
        }

        final Map<String, T> results = new LinkedHashMap<>();
        final List<Exception> failures = new ArrayList<>();
        final List<String> sources = new ArrayList<>();
        for (final Map.Entry<String, Future<T>> future : futures.entrySet()) {
            try {
                results.put(future.getKey(), future.getValue().get());
            } catch (ExecutionException e) {
                failures.add(unwrap(e));
                sources.add(future.getKey());
            } catch (InterruptedException e) {
                cancelAll(futures.values());
                throw e;
            }
        }

        if (!failures.isEmpty()) {
            LOG.debug("{} of {} task(s) failed", failures.size(), tasks.size());
            throw new GroupedError(message, failures, sources);
        }
        return results;
    }

    private static void cancelAll(final Collection<? extends Future<?>> futures) {
        for (final Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static Exception unwrap(final ExecutionException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof Error error) {
            throw error;
        }
        return cause instanceof Exception exception ? exception : e;
    }
}
