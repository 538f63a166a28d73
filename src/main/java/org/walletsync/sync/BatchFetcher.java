package org.walletsync.sync;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.node.NodeClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Batched node queries with per-item fallback.
 * <p>
 * Keys are queried in batches. When a batch call fails, that batch's keys are queried one by one;
 * an item that fails on its own is left out of the results and out of {@link Outcome#getSucceeded()}.
 * A failure never aborts the other batches.
 * <p>
 * Batches run concurrently when an executor is supplied. Results are merged in key order either way.
 */
public class BatchFetcher {

    private static final Logger LOGGER = LogManager.getLogger(BatchFetcher.class);

    @FunctionalInterface
    public interface BatchCall<V> {
        Map<String, V> fetch(List<String> keys) throws NodeClientException;
    }

    @FunctionalInterface
    public interface SingleCall<V> {
        V fetch(String key) throws NodeClientException;
    }

    public static class Outcome<V> {
        private final Map<String, V> results = new LinkedHashMap<>();
        private final Set<String> succeeded = new LinkedHashSet<>();
        private final Set<String> failed = new LinkedHashSet<>();
        private int batchesIssued;
        private int batchesFailed;

        /** Returns values of successfully queried keys. */
        public Map<String, V> getResults() {
            return this.results;
        }

        /** Returns keys whose query succeeded, whatever the value. */
        public Set<String> getSucceeded() {
            return this.succeeded;
        }

        public Set<String> getFailed() {
            return this.failed;
        }

        public int getBatchesIssued() {
            return this.batchesIssued;
        }

        public int getBatchesFailed() {
            return this.batchesFailed;
        }

        private void merge(Outcome<V> other) {
            this.results.putAll(other.results);
            this.succeeded.addAll(other.succeeded);
            this.failed.addAll(other.failed);
            this.batchesIssued += other.batchesIssued;
            this.batchesFailed += other.batchesFailed;
        }
    }

    private final String description;
    private final int batchSize;
    private final ExecutorService executor;

    /**
     * @param description what is fetched, for logging, e.g. "history"
     * @param batchSize number of keys per batch call
     * @param executor runs batches concurrently, or null to run them in sequence
     */
    public BatchFetcher(String description, int batchSize, ExecutorService executor) {
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive");

        this.description = description;
        this.batchSize = batchSize;
        this.executor = executor;
    }

    public <V> Outcome<V> fetch(List<String> keys, BatchCall<V> batchCall, SingleCall<V> singleCall) throws NodeClientException {
        List<List<String>> batches = Lists.partition(keys, this.batchSize);
        Outcome<V> outcome = new Outcome<>();

        if (this.executor == null || batches.size() < 2) {
            for (List<String> batch : batches)
                outcome.merge(this.fetchBatch(batch, batchCall, singleCall));

            return outcome;
        }

        List<Future<Outcome<V>>> futures = new ArrayList<>(batches.size());
        for (List<String> batch : batches)
            futures.add(this.executor.submit(() -> this.fetchBatch(batch, batchCall, singleCall)));

        try {
            for (Future<Outcome<V>> future : futures)
                outcome.merge(future.get());
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new NodeClientException(String.format("Interrupted while fetching %s", this.description), e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));

            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;

            throw new NodeClientException(String.format("Unable to fetch %s", this.description), cause);
        }

        return outcome;
    }

    private <V> Outcome<V> fetchBatch(List<String> batch, BatchCall<V> batchCall, SingleCall<V> singleCall) {
        Outcome<V> outcome = new Outcome<>();
        outcome.batchesIssued = 1;

        List<String> unanswered = new ArrayList<>();

        try {
            Map<String, V> batchResults = batchCall.fetch(batch);

            for (String key : batch) {
                V value = batchResults.get(key);

                if (value == null) {
                    unanswered.add(key);
                    continue;
                }

                outcome.results.put(key, value);
                outcome.succeeded.add(key);
            }
        } catch (NodeClientException e) {
            LOGGER.warn("Batch {} fetch of {} items failed, falling back to individual requests: {}",
                    this.description, batch.size(), e.getMessage());

            outcome.batchesFailed = 1;
            unanswered.clear();
            unanswered.addAll(batch);
        }

        for (String key : unanswered) {
            try {
                V value = singleCall.fetch(key);
                if (value == null) {
                    outcome.failed.add(key);
                    continue;
                }

                outcome.results.put(key, value);
                outcome.succeeded.add(key);
            } catch (NodeClientException e) {
                LOGGER.warn("Unable to fetch {} for {}: {}", this.description, key, e.getMessage());
                outcome.failed.add(key);
            }
        }

        return outcome;
    }
}
