package fr.lapetina.ollama.cluster.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.ollama.cluster.disruptor.handlers.ChunkAggregationHandler;
import fr.lapetina.ollama.cluster.domain.event.ChunkCompletionEvent;
import fr.lapetina.ollama.cluster.domain.event.ChunkCompletionEventFactory;
import fr.lapetina.ollama.cluster.domain.model.BatchResult;
import fr.lapetina.ollama.cluster.domain.model.ChunkResult;
import fr.lapetina.ollama.cluster.domain.model.FailureKind;
import fr.lapetina.ollama.cluster.extraction.BatchCancellation;
import fr.lapetina.ollama.cluster.extraction.ChunkProcessor;
import fr.lapetina.ollama.cluster.extraction.ProgressListener;
import fr.lapetina.ollama.cluster.infrastructure.health.ClusterRegistry;
import fr.lapetina.ollama.cluster.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Applies a {@link ChunkProcessor} to an ordered batch of chunks in parallel.
 *
 * Each batch gets its own worker pool, sized to the number of configured
 * servers (capped by the number of chunks), so that every server can be busy
 * with one chunk at a time. Workers never touch shared batch state: each
 * completed chunk is published on a Disruptor ring buffer whose single
 * consumer stores results by index, counts completions and reports progress.
 *
 * PRODUCER TYPE CHOICE: MULTI, since all workers of all running batches publish.
 *
 * WAIT STRATEGY CHOICE: BlockingWaitStrategy. Completions arrive at the pace
 * of model inference, so a spinning consumer would only burn CPU.
 *
 * A batch always completes with exactly one result per chunk and one progress
 * event per chunk, whatever fails along the way. This holds across
 * {@link #close()}: running workers get a bounded time to finish, and chunks
 * still without a result afterwards are reported as cancelled.
 */
public final class FanOutScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FanOutScheduler.class);

    static final String MDC_CHUNK_INDEX = "chunkIndex";
    static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final ClusterRegistry registry;
    private final Duration drainTimeout;
    private final Disruptor<ChunkCompletionEvent> disruptor;
    private final RingBuffer<ChunkCompletionEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger poolCounter = new AtomicInteger(0);
    private final Map<String, LiveBatch> liveBatches = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    // Publishers hold the read lock; close() takes the write lock to shut the channel
    private final ReadWriteLock publishLock = new ReentrantReadWriteLock();
    private boolean channelOpen;

    public FanOutScheduler(ClusterRegistry registry, MetricsRegistry metrics, int bufferSize) {
        this(registry, metrics, bufferSize, DEFAULT_DRAIN_TIMEOUT);
    }

    /**
     * @param drainTimeout how long {@link #close()} waits for running workers
     *                     before interrupting them
     */
    FanOutScheduler(ClusterRegistry registry, MetricsRegistry metrics, int bufferSize, Duration drainTimeout) {
        if (Integer.bitCount(bufferSize) != 1) {
            throw new IllegalArgumentException("Completion buffer size must be power of 2: " + bufferSize);
        }
        this.registry = registry;
        this.drainTimeout = drainTimeout;

        this.disruptor = new Disruptor<>(
                new ChunkCompletionEventFactory(),
                bufferSize,
                new NamedThreadFactory("completion-aggregator"),
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(new ChunkAggregationHandler(metrics));
        disruptor.setDefaultExceptionHandler(new AggregationExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("FanOutScheduler created: bufferSize={}", bufferSize);
    }

    /**
     * Starts the completion channel.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running.compareAndSet(false, true)) {
                channelOpen = true;
                disruptor.start();
                log.info("FanOutScheduler started");
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of workers used for a batch of the given size.
     */
    public int poolSize(int chunkCount) {
        return Math.max(1, Math.min(registry.size(), chunkCount));
    }

    /**
     * Submits a batch.
     *
     * @return future completing with the result of every chunk, in chunk order,
     *         after the listener has received the last progress event
     */
    public CompletableFuture<BatchResult> submit(
            List<String> chunks,
            ChunkProcessor processor,
            ProgressListener listener,
            BatchCancellation cancellation
    ) {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                CompletableFuture<BatchResult> future = new CompletableFuture<>();
                future.completeExceptionally(new IllegalStateException("Scheduler not running"));
                return future;
            }
            if (chunks.isEmpty()) {
                log.info("Empty batch, nothing to process");
                return CompletableFuture.completedFuture(BatchResult.empty());
            }

            String batchId = UUID.randomUUID().toString();
            BatchAggregation batch = new BatchAggregation(batchId, chunks.size(), listener);
            int workers = poolSize(chunks.size());

            log.info("Starting parallel processing: batchId={}, workers={}, chunks={}", batchId, workers, chunks.size());

            ExecutorService executor = Executors.newFixedThreadPool(workers,
                    new NamedThreadFactory("fanout-" + poolCounter.incrementAndGet() + "-worker"));
            liveBatches.put(batchId, new LiveBatch(batch, executor));
            batch.getFuture().whenComplete((result, error) -> liveBatches.remove(batchId));
            try {
                for (int i = 0; i < chunks.size(); i++) {
                    int index = i;
                    String chunk = chunks.get(i);
                    executor.execute(() -> runChunk(batch, processor, cancellation, index, chunk));
                }
            } finally {
                // Already queued chunks still run
                executor.shutdown();
            }

            return batch.getFuture();
        }
    }

    /**
     * Runs a batch and waits for its completion.
     */
    public BatchResult run(
            List<String> chunks,
            ChunkProcessor processor,
            ProgressListener listener,
            BatchCancellation cancellation
    ) {
        return submit(chunks, processor, listener, cancellation).join();
    }

    public BatchResult run(List<String> chunks, ChunkProcessor processor, ProgressListener listener) {
        return run(chunks, processor, listener, new BatchCancellation());
    }

    private void runChunk(
            BatchAggregation batch,
            ChunkProcessor processor,
            BatchCancellation cancellation,
            int index,
            String chunk
    ) {
        ChunkResult result;
        if (cancellation.isCancelled()) {
            log.debug("Chunk skipped after cancellation: batchId={}, chunkIndex={}", batch.getBatchId(), index);
            result = ChunkResult.cancelled(index);
        } else {
            MDC.put(MDC_CHUNK_INDEX, String.valueOf(index));
            try {
                log.info("Processing chunk {}/{}", index + 1, batch.getTotal());
                result = checked(processor.process(index, chunk), index);
            } catch (RuntimeException e) {
                log.error("Error processing chunk: chunkIndex={}, error={}", index, e.getMessage(), e);
                result = ChunkResult.failed(index, FailureKind.INTERNAL_ERROR, e.getMessage());
            } finally {
                MDC.remove(MDC_CHUNK_INDEX);
            }
        }
        publish(batch, result);
    }

    private static ChunkResult checked(ChunkResult result, int index) {
        if (result == null) {
            return ChunkResult.failed(index, FailureKind.INTERNAL_ERROR, "Processor returned no result");
        }
        if (result.chunkIndex() != index) {
            return new ChunkResult(index, result.status(), result.observations(), result.serverName(),
                    result.failureKind(), result.errorMessage());
        }
        return result;
    }

    private void publish(BatchAggregation batch, ChunkResult result) {
        publishLock.readLock().lock();
        try {
            if (!channelOpen) {
                log.warn("Completion channel closed, result dropped: batchId={}, chunkIndex={}",
                        batch.getBatchId(), result.chunkIndex());
                return;
            }
            ringBuffer.publishEvent((event, sequence, b, r) -> event.set(b, r), batch, result);
        } finally {
            publishLock.readLock().unlock();
        }
    }

    /**
     * Number of batches submitted and not yet completed.
     */
    public int getRunningBatchCount() {
        return liveBatches.size();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Stops accepting batches, waits for running workers, aggregates their
     * pending completions, then stops the channel.
     * <p>
     * Workers still busy after the drain timeout are interrupted. Every batch
     * future is resolved on return: chunks without a result are reported as
     * {@link ChunkResult#cancelled(int) cancelled}.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
        }
        log.info("Shutting down FanOutScheduler: runningBatches={}", liveBatches.size());
        drainWorkers();

        publishLock.writeLock().lock();
        try {
            channelOpen = false;
        } finally {
            publishLock.writeLock().unlock();
        }

        boolean graceful;
        try {
            disruptor.shutdown(30, TimeUnit.SECONDS);
            graceful = true;
            log.info("FanOutScheduler shut down gracefully");
        } catch (TimeoutException e) {
            log.warn("FanOutScheduler shutdown timed out, halting...");
            disruptor.halt();
            graceful = false;
        }
        resolveUnfinished(graceful);
    }

    private void drainWorkers() {
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        for (LiveBatch live : liveBatches.values()) {
            ExecutorService executor = live.executor();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                if (!executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Batch workers still busy after {} ms, interrupting: batchId={}",
                            drainTimeout.toMillis(), live.batch().getBatchId());
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
    }

    private void resolveUnfinished(boolean graceful) {
        for (LiveBatch live : liveBatches.values()) {
            BatchAggregation batch = live.batch();
            if (batch.getFuture().isDone()) {
                continue;
            }
            if (graceful) {
                // The aggregator has stopped, this thread is the only one left touching the batch
                int cancelled = batch.cancelRemaining();
                log.warn("Batch cut short by shutdown: batchId={}, cancelledChunks={}", batch.getBatchId(), cancelled);
            } else {
                batch.fail(new IllegalStateException("Scheduler closed before batch completed: " + batch.getBatchId()));
            }
        }
        liveBatches.clear();
    }

    private record LiveBatch(BatchAggregation batch, ExecutorService executor) {
    }

    /**
     * Thread factory for named daemon threads.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the owning batch instead of leaving its future pending.
     */
    private static class AggregationExceptionHandler implements ExceptionHandler<ChunkCompletionEvent> {

        private static final Logger log = LoggerFactory.getLogger(AggregationExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, ChunkCompletionEvent event) {
            log.error("Exception in aggregation handler: sequence={}, event={}", sequence, event, ex);
            if (event.getBatch() != null) {
                event.getBatch().fail(ex);
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during completion channel start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during completion channel shutdown", ex);
        }
    }
}
