package org.walletsync.test.sync;

import org.junit.Assert;
import org.junit.Test;
import org.walletsync.node.NodeClientException;
import org.walletsync.sync.BatchFetcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class BatchFetcherTests {

	private static List<String> keys(int count) {
		List<String> keys = new ArrayList<>();
		for (int i = 0; i < count; ++i)
			keys.add("key" + i);

		return keys;
	}

	private static Map<String, Integer> answerAll(List<String> keys) {
		Map<String, Integer> results = new LinkedHashMap<>();
		for (String key : keys)
			results.put(key, key.length());

		return results;
	}

	@Test
	public void testBatches() throws NodeClientException {
		AtomicInteger batchCalls = new AtomicInteger();
		AtomicInteger singleCalls = new AtomicInteger();

		BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 50, null).fetch(keys(120),
				batch -> { batchCalls.incrementAndGet(); return answerAll(batch); },
				key -> { singleCalls.incrementAndGet(); return 0; });

		Assert.assertEquals(3, batchCalls.get());
		Assert.assertEquals(0, singleCalls.get());
		Assert.assertEquals(3, outcome.getBatchesIssued());
		Assert.assertEquals(0, outcome.getBatchesFailed());
		Assert.assertEquals(120, outcome.getResults().size());
		Assert.assertEquals(120, outcome.getSucceeded().size());
		Assert.assertTrue(outcome.getFailed().isEmpty());
	}

	@Test
	public void testEmptyKeys() throws NodeClientException {
		BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 50, null).fetch(new ArrayList<>(),
				batch -> { throw new NodeClientException("Shouldn't be called"); },
				key -> { throw new NodeClientException("Shouldn't be called"); });

		Assert.assertEquals(0, outcome.getBatchesIssued());
		Assert.assertTrue(outcome.getResults().isEmpty());
	}

	@Test
	public void testFailedBatchFallsBack() throws NodeClientException {
		AtomicInteger singleCalls = new AtomicInteger();

		BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 10, null).fetch(keys(25),
				batch -> {
					if (batch.contains("key13"))
						throw new NodeClientException.NetworkException("Batch too big");
					return answerAll(batch);
				},
				key -> {
					singleCalls.incrementAndGet();
					if (key.equals("key17"))
						throw new NodeClientException.NetworkException("Unreachable");
					return -1;
				});

		Assert.assertEquals(3, outcome.getBatchesIssued());
		Assert.assertEquals(1, outcome.getBatchesFailed());
		Assert.assertEquals(10, singleCalls.get());

		Assert.assertEquals(Arrays.asList("key17"), new ArrayList<>(outcome.getFailed()));
		Assert.assertEquals(24, outcome.getSucceeded().size());
		Assert.assertFalse(outcome.getResults().containsKey("key17"));
		Assert.assertEquals(Integer.valueOf(-1), outcome.getResults().get("key13"));
		Assert.assertEquals(Integer.valueOf(4), outcome.getResults().get("key3"));
	}

	@Test
	public void testMissingBatchAnswersFetchedSingly() throws NodeClientException {
		BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 50, null).fetch(keys(5),
				batch -> {
					Map<String, Integer> results = answerAll(batch);
					results.remove("key2");
					return results;
				},
				key -> key.equals("key2") ? 99 : null);

		Assert.assertEquals(0, outcome.getBatchesFailed());
		Assert.assertEquals(Integer.valueOf(99), outcome.getResults().get("key2"));
		Assert.assertTrue(outcome.getFailed().isEmpty());
	}

	@Test
	public void testNullSingleAnswerIsFailure() throws NodeClientException {
		BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 50, null).fetch(keys(2),
				batch -> { throw new NodeClientException("No batches"); },
				key -> key.equals("key0") ? 1 : null);

		Assert.assertEquals(Arrays.asList("key0"), new ArrayList<>(outcome.getSucceeded()));
		Assert.assertEquals(Arrays.asList("key1"), new ArrayList<>(outcome.getFailed()));
	}

	@Test
	public void testConcurrentBatchesKeepKeyOrder() throws NodeClientException {
		ExecutorService executor = Executors.newFixedThreadPool(4);

		try {
			List<String> keys = keys(95);

			BatchFetcher.Outcome<Integer> outcome = new BatchFetcher("test", 10, executor).fetch(keys,
					batch -> {
						// Later batches finish first
						try {
							Thread.sleep(100 - Integer.parseInt(batch.get(0).substring(3)));
						} catch (InterruptedException e) {
							throw new NodeClientException("Interrupted", e);
						}
						return answerAll(batch);
					},
					key -> 0);

			Assert.assertEquals(10, outcome.getBatchesIssued());
			Assert.assertEquals(keys, new ArrayList<>(outcome.getResults().keySet()));
		} finally {
			executor.shutdownNow();
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidBatchSize() {
		new BatchFetcher("test", 0, null);
	}

}
