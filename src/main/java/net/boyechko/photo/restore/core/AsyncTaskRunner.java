/*
 * Photo-Restore - Desktop front-end for old photo restoration
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.photo.restore.core;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job at a time off the interface thread and hands its result back.
 *
 * <p>The background thread never touches the interface. It puts the single {@link JobResult} on a
 * queue and asks the interface executor to drain it; the drain runs on the interface thread,
 * returns the runner to {@link State#IDLE} and only then calls the completion callback, so the
 * callback may submit the next job.
 */
public class AsyncTaskRunner {
    private static final Logger logger = LoggerFactory.getLogger(AsyncTaskRunner.class);

    public enum State {
        IDLE,
        RUNNING
    }

    private final Function<JobRequest, JobResult> job;
    private final Executor interfaceExecutor;
    private final ExecutorService background;
    private final BlockingQueue<Delivery> results = new LinkedBlockingQueue<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private record Delivery(JobResult result, Consumer<JobResult> callback) {}

    /**
     * @param job the blocking work, typically {@link RestorationService#execute}
     * @param interfaceExecutor runs tasks on the interface thread (e.g. {@code
     *     SwingUtilities::invokeLater})
     */
    public AsyncTaskRunner(Function<JobRequest, JobResult> job, Executor interfaceExecutor) {
        this.job = job;
        this.interfaceExecutor = interfaceExecutor;
        this.background =
                Executors.newSingleThreadExecutor(
                        r -> {
                            Thread t = new Thread(r, "restoration-worker");
                            t.setDaemon(true);
                            return t;
                        });
    }

    /**
     * Starts {@code request} in the background and returns immediately. {@code onComplete} is
     * called exactly once, on the interface thread.
     *
     * @throws IllegalStateException if a previous job has not been delivered yet
     */
    public void submit(JobRequest request, Consumer<JobResult> onComplete) {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("A restoration job is already running");
        }
        logger.debug("Submitting job for {}", request.inputPath());
        try {
            background.execute(() -> complete(runJob(request), onComplete));
        } catch (RuntimeException e) {
            state.set(State.IDLE);
            throw e;
        }
    }

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /** Stops accepting work. A job already running is left to finish on its daemon thread. */
    public void shutdown() {
        background.shutdown();
    }

    private JobResult runJob(JobRequest request) {
        try {
            return job.apply(request);
        } catch (RuntimeException | Error e) {
            logger.error("Restoration job failed unexpectedly", e);
            return JobResult.failure(FailureKind.UNEXPECTED, String.valueOf(e.getMessage()), e);
        }
    }

    private void complete(JobResult result, Consumer<JobResult> onComplete) {
        results.add(new Delivery(result, onComplete));
        interfaceExecutor.execute(this::drain);
    }

    // Interface thread only.
    private void drain() {
        Delivery delivery = results.poll();
        if (delivery == null) {
            return;
        }
        state.set(State.IDLE);
        delivery.callback().accept(delivery.result());
    }
}
