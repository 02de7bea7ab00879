package com.chainfeed.merge;

import com.chainfeed.domain.FeedTransaction;
import com.chainfeed.stream.StreamStep;
import com.chainfeed.stream.TransactionStream;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * K-way, newest-first merge over a fixed, ordered set of transaction streams.
 * <p>
 * Each round peeks every stream concurrently, waits for all peeks, picks the candidate with the
 * highest {@link MergeKey} (lowest stream index on ties) and consumes from that stream only. Losing
 * streams keep their lookahead for the next round. A call ends when the limit is reached or no
 * stream has an item left; a short result is normal.
 * <p>
 * One {@link #takeN(int)} call at a time per merger; streams must not be shared with another merger.
 */
@Slf4j
public class StreamMerger {

    public static final int MAX_LIMIT = 10_000;
    public static final int DEFAULT_MAX_EMPTY_ROUNDS = 3;

    private static final Comparator<Candidate> WINNER_ORDER = Comparator
            .comparing(Candidate::key)
            .thenComparing(Candidate::streamIndex, Comparator.reverseOrder());

    private final List<TransactionStream> streams;
    private final Executor peekExecutor;
    private final int maxEmptyRounds;

    /**
     * Peeks block on stream I/O, so the executor must have a thread per stream to spare; the
     * common fork-join pool does not qualify.
     */
    public StreamMerger(List<? extends TransactionStream> streams, Executor peekExecutor) {
        this(streams, peekExecutor, DEFAULT_MAX_EMPTY_ROUNDS);
    }

    public StreamMerger(List<? extends TransactionStream> streams, Executor peekExecutor, int maxEmptyRounds) {
        if (streams == null || streams.isEmpty()) {
            throw new StreamMergeException(MergeErrorCode.INVALID_CONFIGURATION, "At least one transaction stream required");
        }
        if (streams.stream().anyMatch(Objects::isNull)) {
            throw new StreamMergeException(MergeErrorCode.INVALID_CONFIGURATION, "Transaction streams must not contain null");
        }
        if (peekExecutor == null) {
            throw new StreamMergeException(MergeErrorCode.INVALID_CONFIGURATION, "Peek executor required");
        }
        if (maxEmptyRounds < 1) {
            throw new StreamMergeException(MergeErrorCode.INVALID_CONFIGURATION,
                    "maxEmptyRounds must be positive: " + maxEmptyRounds);
        }
        this.streams = List.copyOf(streams);
        this.peekExecutor = peekExecutor;
        this.maxEmptyRounds = maxEmptyRounds;
    }

    /**
     * Limit as received from an untyped request parameter. NaN, infinities and fractions are rejected.
     */
    public List<FeedTransaction> takeN(double limit) {
        if (!Double.isFinite(limit) || limit != Math.rint(limit)) {
            throw invalidLimit(String.valueOf(limit));
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw invalidLimit(String.valueOf(limit));
        }
        return takeN((int) limit);
    }

    /**
     * Merge up to {@code limit} transactions, newest first.
     *
     * @throws StreamMergeException on an invalid limit (before any stream is touched), malformed timestamps,
     *                              a stall, or a stream failure; no partial result is returned
     */
    public List<FeedTransaction> takeN(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw invalidLimit(String.valueOf(limit));
        }
        List<FeedTransaction> results = new ArrayList<>(Math.min(limit, 256));
        int emptyRounds = 0;
        int rounds = 0;
        while (results.size() < limit) {
            rounds++;
            List<Candidate> available = peekAll();
            if (available.isEmpty()) {
                break;
            }
            Candidate winner = available.stream().max(WINNER_ORDER).orElseThrow();
            StreamStep step = streams.get(winner.streamIndex()).next();
            Optional<FeedTransaction> value = step != null ? step.value() : Optional.empty();
            if (value.isPresent()) {
                results.add(value.get());
                emptyRounds = 0;
                continue;
            }
            emptyRounds++;
            log.debug("Round {}: stream {} won with {} (key {}) but produced nothing ({} empty in a row)",
                    rounds, winner.streamIndex(), winner.transaction().sourceId(), winner.key(), emptyRounds);
            if (emptyRounds >= maxEmptyRounds) {
                log.warn("Merge stalled after {} rounds: {} consecutive empty rounds, {} of {} collected",
                        rounds, emptyRounds, results.size(), limit);
                throw new MergeStalledException(emptyRounds, results.size(), limit);
            }
        }
        log.debug("Merged {} of {} requested transaction(s) from {} stream(s) in {} round(s)",
                results.size(), limit, streams.size(), rounds);
        return results;
    }

    public int getStreamCount() {
        return streams.size();
    }

    /**
     * Peeks all streams on the executor and waits for every one of them, failed or not.
     * Candidates come back in stream index order; exhausted streams are left out.
     */
    private List<Candidate> peekAll() {
        List<CompletableFuture<Candidate>> futures = new ArrayList<>(streams.size());
        try {
            for (int i = 0; i < streams.size(); i++) {
                int index = i;
                TransactionStream stream = streams.get(i);
                futures.add(CompletableFuture.supplyAsync(() -> peekOne(index, stream), peekExecutor));
            }
        } catch (RejectedExecutionException e) {
            awaitQuietly(futures);
            throw new StreamMergeException(MergeErrorCode.STREAM_FAILURE,
                    "Peek executor rejected stream " + futures.size(), e);
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        List<Candidate> available = new ArrayList<>(futures.size());
        for (CompletableFuture<Candidate> future : futures) {
            Candidate candidate = future.join();
            if (candidate != null) {
                available.add(candidate);
            }
        }
        return available;
    }

    private static Candidate peekOne(int index, TransactionStream stream) {
        Optional<FeedTransaction> head = stream.peek();
        if (head == null || head.isEmpty()) {
            return null;
        }
        FeedTransaction tx = head.get();
        return new Candidate(index, tx, TransactionTimestampNormalizer.mergeKey(tx));
    }

    /**
     * Waits for already submitted peeks so nothing keeps running after the call fails.
     * Their own outcome is irrelevant: the rejection is the error being reported.
     */
    private static void awaitQuietly(List<CompletableFuture<Candidate>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, failure) -> null)
                .join();
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new StreamMergeException(MergeErrorCode.STREAM_FAILURE, "Stream peek failed: " + cause.getMessage(), cause);
    }

    private static StreamMergeException invalidLimit(String limit) {
        return new StreamMergeException(MergeErrorCode.INVALID_LIMIT,
                "limit must be a whole number between 1 and " + MAX_LIMIT + ", got " + limit);
    }

    private record Candidate(int streamIndex, FeedTransaction transaction, MergeKey key) {
    }
}
