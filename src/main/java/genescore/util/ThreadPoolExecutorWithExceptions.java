/*
 * The MIT License
 *
 * Copyright (c) 2025 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package genescore.util;

import genescore.GeneScoreException;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed size pool of daemon threads named after the job they run. Failed jobs are logged as they finish.
 * {@link #invokeInOrder} hands the first failure, in task order, back to the caller.
 */
public class ThreadPoolExecutorWithExceptions extends ThreadPoolExecutor {
    private static final Log log = Log.getInstance(ThreadPoolExecutorWithExceptions.class);

    /**
     * @param threads The number of threads in the executor pool.
     * @param jobName prefix of the worker thread names
     */
    public ThreadPoolExecutorWithExceptions(final int threads, final String jobName) {
        super(threads, threads, 0, TimeUnit.SECONDS, new LinkedBlockingDeque<>(), namedThreads(jobName));
    }

    private static ThreadFactory namedThreads(final String jobName) {
        final AtomicInteger count = new AtomicInteger();
        return r -> {
            final Thread thread = new Thread(r, jobName + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Runs every task and returns the results in task order. With one thread the tasks run on the calling thread.
     *
     * @throws GeneScoreException wrapping the first checked exception thrown by a task; unchecked ones are rethrown as is
     */
    public static <T> List<T> invokeInOrder(final List<? extends Callable<T>> tasks, final int threads, final String jobName) {
        final List<T> results = new ArrayList<>(tasks.size());
        if (threads <= 1) {
            for (final Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (final RuntimeException e) {
                    throw e;
                } catch (final Exception e) {
                    throw new GeneScoreException(jobName + " failed", e);
                }
            }
            return results;
        }

        final ThreadPoolExecutorWithExceptions executor = new ThreadPoolExecutorWithExceptions(threads, jobName);
        try {
            final List<Future<T>> futures = new ArrayList<>(tasks.size());
            for (final Callable<T> task : tasks) {
                futures.add(executor.submit(task));
            }
            for (final Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneScoreException("Interrupted while waiting for " + jobName, e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw new GeneScoreException(jobName + " failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /** Logs a failed job as soon as it finishes; {@link #invokeInOrder} reports it to the caller. */
    @Override
    protected void afterExecute(final Runnable r, final Throwable t) {
        Throwable failure = t;
        if (failure == null && r instanceof Future<?> && ((Future<?>) r).isDone()) {
            try {
                ((Future<?>) r).get();
            } catch (final CancellationException e) {
                failure = e;
            } catch (final ExecutionException e) {
                failure = e.getCause();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failure != null) {
            log.error(failure, "Job on ", Thread.currentThread().getName(), " failed");
        }
    }
}
