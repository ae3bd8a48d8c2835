package com.astrazeneca.tmber.modes;

import com.astrazeneca.tmber.Configuration;
import com.astrazeneca.tmber.collection.DirectThreadExecutor;
import com.astrazeneca.tmber.exception.TaskFailedException;
import htsjdk.samtools.util.Log;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Abstract Mode of tmber. Runs independent tasks either in the calling thread (one thread) or in a fixed pool,
 * waits for all of them and fails the whole run on the first failed task.
 */
public abstract class AbstractMode {
    private static final Log log = Log.getInstance(AbstractMode.class);

    protected final Configuration conf;

    public AbstractMode(Configuration conf) {
        this.conf = conf;
    }

    /**
     * Runs the mode and writes its outputs.
     * @throws IOException if inputs can't be read or outputs can't be written
     */
    public abstract void run() throws IOException;

    ExecutorService createExecutor() {
        return conf.threads <= 1 ? new DirectThreadExecutor() : Executors.newFixedThreadPool(conf.threads);
    }

    /**
     * Submits all tasks and collects their results in completion order. If a task fails, the others are cancelled
     * and its exception is rethrown: unchecked exceptions as they are, checked ones wrapped in
     * {@link TaskFailedException}.
     * @param tasks named tasks
     * @param <T> result type
     * @return results of all tasks
     */
    <T> List<T> dispatch(List<NamedTask<T>> tasks) {
        ExecutorService executor = createExecutor();
        CompletionService<T> completionService = new ExecutorCompletionService<>(executor);
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        Map<Future<T>, String> names = new HashMap<>();
        try {
            for (NamedTask<T> task : tasks) {
                Future<T> future = completionService.submit(task.callable);
                futures.add(future);
                names.put(future, task.name);
            }
            List<T> results = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                Future<T> done = completionService.take();
                try {
                    results.add(done.get());
                } catch (ExecutionException e) {
                    String name = names.get(done);
                    log.error("Task ", name, " failed, the computation will be stopped.");
                    for (Future<T> future : futures) {
                        future.cancel(true);
                    }
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new TaskFailedException(name, cause);
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } finally {
            executor.shutdownNow();
        }
    }

    static final class NamedTask<T> {
        final String name;
        final Callable<T> callable;

        NamedTask(String name, Callable<T> callable) {
            this.name = name;
            this.callable = callable;
        }
    }
}
