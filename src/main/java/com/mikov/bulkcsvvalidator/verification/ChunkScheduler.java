package com.mikov.bulkcsvvalidator.verification;

import com.mikov.bulkcsvvalidator.exception.ChunkWorkerException;
import com.mikov.bulkcsvvalidator.model.EmailRecord;
import com.mikov.bulkcsvvalidator.model.VerifiedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fans addresses out to a fixed number of chunk workers and gathers the outcomes back in input order.
 * Chunk {@code i} gets every address whose position is congruent to {@code i} modulo the worker count,
 * so a slow run of neighbouring addresses is spread over all workers.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
public class ChunkScheduler {

    private final VerificationClient verificationClient;
    private final Executor executor;

    public ChunkScheduler(final VerificationClient verificationClient,
                          @Qualifier("chunkWorkerExecutor") final Executor executor) {
        this.verificationClient = verificationClient;
        this.executor = executor;
    }

    /**
     * Verifies every record and returns the results in the same order as {@code records}.
     *
     * @throws ChunkWorkerException when any worker fails; the remaining workers are told to stop
     */
    public List<VerifiedRecord> schedule(final List<EmailRecord> records, final int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be positive, got " + workerCount);
        }
        final var chunks = partition(records.size(), workerCount);
        final var results = new AtomicReferenceArray<VerifiedRecord>(records.size());
        final var aborted = new AtomicBoolean(false);
        final var failure = new CompletableFuture<Void>();
        final var workers = new ArrayList<CompletableFuture<Void>>();

        log.info("Scheduling {} addresses over {} chunks", records.size(), workerCount);
        for (var chunkIndex = 0; chunkIndex < chunks.size(); chunkIndex++) {
            final var positions = chunks.get(chunkIndex);
            if (positions.isEmpty()) {
                continue;
            }
            final var index = chunkIndex;
            final CompletableFuture<Void> worker;
            try {
                worker = CompletableFuture.runAsync(
                    () -> runChunk(index, positions, records, results, aborted), executor);
            } catch (final RejectedExecutionException e) {
                aborted.set(true);
                throw new ChunkWorkerException(index, e);
            }
            worker.whenComplete((ignored, error) -> {
                if (error != null) {
                    failure.completeExceptionally(error);
                }
            });
            workers.add(worker);
        }

        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])), failure).join();
        } catch (final CompletionException e) {
            aborted.set(true);
            workers.forEach(worker -> worker.cancel(true));
            throw asWorkerFailure(e);
        }

        final var ordered = new ArrayList<VerifiedRecord>(records.size());
        for (var i = 0; i < records.size(); i++) {
            final var result = results.get(i);
            if (result == null) {
                throw new IllegalStateException("No verification result for position " + i);
            }
            ordered.add(result);
        }
        return ordered;
    }

    /**
     * Positions assigned to each chunk by round robin. Chunks are empty when there are fewer
     * positions than workers.
     */
    public static List<List<Integer>> partition(final int size, final int workerCount) {
        final var chunks = new ArrayList<List<Integer>>(workerCount);
        for (var i = 0; i < workerCount; i++) {
            chunks.add(new ArrayList<>());
        }
        for (var position = 0; position < size; position++) {
            chunks.get(position % workerCount).add(position);
        }
        return chunks;
    }

    private void runChunk(final int chunkIndex,
                          final List<Integer> positions,
                          final List<EmailRecord> records,
                          final AtomicReferenceArray<VerifiedRecord> results,
                          final AtomicBoolean aborted) {
        final var started = System.currentTimeMillis();
        log.info("Chunk {} started with {} addresses", chunkIndex, positions.size());
        try {
            for (final var position : positions) {
                if (aborted.get()) {
                    log.info("Chunk {} stopped early because another chunk failed", chunkIndex);
                    return;
                }
                final var record = records.get(position);
                results.set(position, new VerifiedRecord(record, verificationClient.verify(record.address())));
            }
        } catch (final RuntimeException e) {
            throw new ChunkWorkerException(chunkIndex, e);
        }
        log.info("Chunk {} completed {} addresses in {} ms", chunkIndex, positions.size(),
            System.currentTimeMillis() - started);
    }

    private static ChunkWorkerException asWorkerFailure(final CompletionException e) {
        final var cause = e.getCause();
        if (cause instanceof ChunkWorkerException workerException) {
            return workerException;
        }
        return new ChunkWorkerException(-1, cause == null ? e : cause);
    }
}
