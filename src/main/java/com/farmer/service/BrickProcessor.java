package com.farmer.service;

import com.farmer.service.BlobPipeline.BlobOutcome;
import com.farmer.service.BlobPipeline.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reparte los blobs de un brick en un pool fijo de hilos, un pipeline por blob.
 * El único estado compartido es el catálogo padre.
 */
public class BrickProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BrickProcessor.class);

    private final BlobPipeline pipeline;
    private final Supplier<ExecutorService> executorFactory;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile ExecutorService exec;

    public BrickProcessor(BlobPipeline pipeline, int threads) {
        this(pipeline, () -> Executors.newFixedThreadPool(threads));
    }

    BrickProcessor(BlobPipeline pipeline, Supplier<ExecutorService> executorFactory) {
        this.pipeline = pipeline;
        this.executorFactory = executorFactory;
    }

    public static class Summary {
        public final int fitted, failed, rejected;
        public final List<BlobOutcome> outcomes;

        Summary(List<BlobOutcome> outcomes) {
            int f = 0, x = 0, r = 0;
            for (BlobOutcome o : outcomes) {
                if (o.status() == Status.FITTED) f++;
                else if (o.status() == Status.FAILED) x++;
                else r++;
            }
            this.fitted = f;
            this.failed = x;
            this.rejected = r;
            this.outcomes = Collections.unmodifiableList(outcomes);
        }

        public int total() { return outcomes.size(); }
    }

    public Summary process(Brick brick) throws InterruptedException {
        return process(brick, brick.blobIds(), o -> { });
    }

    /**
     * Procesa los blobs indicados. El callback se llama desde los hilos del pool tras cada blob.
     */
    public Summary process(Brick brick, List<Integer> blobIds, Consumer<BlobOutcome> onBlobDone) throws InterruptedException {
        stopRequested.set(false);
        List<BlobOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger processed = new AtomicInteger(0);
        long start = System.currentTimeMillis();

        exec = executorFactory.get();
        for (int blobId : blobIds) {
            if (stopRequested.get() || exec.isShutdown()) break;
            try {
                exec.submit(() -> {
                    if (stopRequested.get()) return;
                    BlobOutcome outcome;
                    try {
                        outcome = pipeline.process(brick, blobId);
                    } catch (RuntimeException ex) {
                        logger.error("Blob {} failed with {}", blobId, ex.toString(), ex);
                        outcome = BlobOutcome.failed(blobId, "exception", ex.getMessage());
                    }
                    if (outcome.status() == Status.FAILED) {
                        logger.warn("Blob {} FAILED at {}: {}", blobId, outcome.stage(), outcome.reason());
                    }
                    outcomes.add(outcome);
                    processed.incrementAndGet();
                    onBlobDone.accept(outcome);
                });
            } catch (RejectedExecutionException e) {
                // Pool cerrado por stop() entre la comprobación y el envío, o saturado
                logger.info("Submission stopped at blob {}: processor is shutting down", blobId);
                break;
            }
        }
        exec.shutdown();
        exec.awaitTermination(24, TimeUnit.HOURS);

        Summary summary = new Summary(new ArrayList<>(outcomes));
        logger.info("Processed {} of {} blobs in {} ms: {} fitted, {} failed, {} rejected", processed.get(), blobIds.size(),
                System.currentTimeMillis() - start, summary.fitted, summary.failed, summary.rejected);
        return summary;
    }

    public void stop() {
        stopRequested.set(true);
        ExecutorService e = exec;
        if (e != null) e.shutdownNow();
    }
}
