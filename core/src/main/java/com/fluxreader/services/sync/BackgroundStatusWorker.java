package com.fluxreader.services.sync;

import com.fluxreader.api.ApiResult;
import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.GatewayFactory;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.queue.MutationQueue;
import com.fluxreader.core.queue.QueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * Sends single status changes off the caller's thread.
 * <p>
 * Each task opens its own gateway from the passed credentials and its own queue store over the
 * queue directory; nothing in memory is shared with the caller. The change is already queued before
 * the task is submitted, the task only removes it once the server accepted it.
 */
public class BackgroundStatusWorker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundStatusWorker.class);

    private final GatewayFactory gatewayFactory;
    private final File queueDir;
    private final ExecutorService executor;
    private final Map<Long, StatusTask> pending = new ConcurrentHashMap<>();

    public BackgroundStatusWorker(GatewayFactory gatewayFactory, File queueDir) {
        this.gatewayFactory = gatewayFactory;
        this.queueDir = queueDir;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "status-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public Future<Boolean> submit(long entryId, EntryStatus status, String serverAddress, String apiToken) {
        cancel(entryId);
        StatusTask task = new StatusTask(entryId, () -> send(entryId, status, serverAddress, apiToken));
        pending.put(entryId, task);
        executor.execute(task);
        logger.debug("Background update queued for entry {} -> {}", entryId, status);
        return task;
    }

    /**
     * Cancels the outstanding update for an entry, if any. A request already on the wire
     * finishes, but its result no longer touches a newer queued change.
     */
    public boolean cancel(long entryId) {
        StatusTask task = pending.remove(entryId);
        if (task == null) return false;
        boolean cancelled = task.cancel(true);
        logger.info("Cancelled background update for entry {}", entryId);
        return cancelled;
    }

    public boolean hasPending(long entryId) {
        return pending.containsKey(entryId);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Status worker did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class StatusTask extends FutureTask<Boolean> {
        private final long entryId;

        StatusTask(long entryId, Callable<Boolean> work) {
            super(work);
            this.entryId = entryId;
        }

        @Override
        protected void done() {
            pending.remove(entryId, this);
        }
    }

    private boolean send(long entryId, EntryStatus status, String serverAddress, String apiToken) {
        EntryGateway gateway = gatewayFactory.create(serverAddress, apiToken);
        ApiResult<Void> result = gateway.updateStatus(List.of(entryId), status);
        if (!result.isOk()) {
            logger.warn("Background update failed for entry {}: {} (stays queued)", entryId, result.getError());
            return false;
        }
        MutationQueue queue = new QueueManager(queueDir);
        queue.removeStatuses(List.of(entryId), status);
        logger.debug("Background update done for entry {} -> {}", entryId, status);
        return true;
    }
}
