package com.chainfeed.merge;

import com.chainfeed.domain.BitcoinTransaction;
import com.chainfeed.domain.FeedTransaction;
import com.chainfeed.domain.SparkTransaction;
import com.chainfeed.domain.StacksTransaction;
import com.chainfeed.domain.StarknetTransaction;
import com.chainfeed.stream.ListTransactionStream;
import com.chainfeed.stream.StreamStep;
import com.chainfeed.stream.TransactionStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamMergerTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StreamMerger merger(TransactionStream... streams) {
        return new StreamMerger(List.of(streams), executor, StreamMerger.DEFAULT_MAX_EMPTY_ROUNDS);
    }

    private static BitcoinTransaction btc(String id, long blockTime) {
        return BitcoinTransaction.of(id, blockTime);
    }

    @Test
    @DisplayName("interleaves two streams newest first")
    void takeN_interleavesByTimestamp() {
        BitcoinTransaction a100 = btc("a100", 100);
        BitcoinTransaction a50 = btc("a50", 50);
        BitcoinTransaction b90 = btc("b90", 90);

        List<FeedTransaction> result = merger(ListTransactionStream.of(a100, a50), ListTransactionStream.of(b90)).takeN(3);

        assertThat(result).containsExactly(a100, b90, a50);
    }

    @Test
    @DisplayName("equal timestamps: lower stream index wins")
    void takeN_tieGoesToLowestIndex() {
        BitcoinTransaction first = btc("first", 100);
        StarknetTransaction second = StarknetTransaction.of("second", "1970-01-01T00:01:40Z");

        List<FeedTransaction> result = merger(ListTransactionStream.of(first), ListTransactionStream.of(second)).takeN(1);

        assertThat(result).containsExactly(first);
    }

    @Test
    void takeN_tieBreakIsStableAcrossWholeOutput() {
        BitcoinTransaction a1 = btc("a1", 100);
        BitcoinTransaction a2 = btc("a2", 100);
        BitcoinTransaction b1 = btc("b1", 100);
        BitcoinTransaction c1 = btc("c1", 100);

        List<FeedTransaction> result = merger(
                ListTransactionStream.of(c1),
                ListTransactionStream.of(a1, a2),
                ListTransactionStream.of(b1)).takeN(10);

        assertThat(result).containsExactly(c1, a1, a2, b1);
    }

    @Test
    @DisplayName("pending stacks items come ahead of every confirmed item")
    void takeN_pendingStacksFirst() {
        StacksTransaction pending = StacksTransaction.of("0xpending", null, null);
        StacksTransaction confirmed = StacksTransaction.of("0xconfirmed", 1_700_000_000L, 1_699_999_000L);
        SparkTransaction spark = SparkTransaction.of("s1", "2030-01-01T00:00:00Z");

        List<FeedTransaction> result = merger(
                ListTransactionStream.of(spark),
                ListTransactionStream.of(pending, confirmed)).takeN(3);

        assertThat(result).containsExactly(pending, spark, confirmed);
    }

    @Test
    @DisplayName("short read when all streams exhaust before the limit")
    void takeN_shortReadOnExhaustion() {
        BitcoinTransaction a = btc("a", 3);
        BitcoinTransaction b = btc("b", 2);

        List<FeedTransaction> result = merger(ListTransactionStream.of(a), ListTransactionStream.of(b)).takeN(50);

        assertThat(result).containsExactly(a, b);
    }

    @Test
    @DisplayName("all streams empty on first round returns empty result")
    void takeN_allEmpty_returnsEmpty() {
        RecordingStream a = new RecordingStream();
        RecordingStream b = new RecordingStream();

        assertThat(merger(a, b).takeN(5)).isEmpty();
        assertThat(a.nexts.get()).isZero();
        assertThat(b.nexts.get()).isZero();
    }

    @Test
    void takeN_stopsAtLimitAndLeavesLosersUnconsumed() {
        RecordingStream a = new RecordingStream(btc("a1", 10), btc("a2", 5));
        RecordingStream b = new RecordingStream(btc("b1", 8));

        List<FeedTransaction> result = merger(a, b).takeN(2);

        assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("a1", "b1");
        assertThat(a.nexts.get()).isEqualTo(1);
        assertThat(b.nexts.get()).isEqualTo(1);
        assertThat(a.peek()).map(FeedTransaction::sourceId).contains("a2");
    }

    @Test
    void takeN_eachRoundConsumesOnlyTheWinner() {
        RecordingStream a = new RecordingStream(btc("a1", 10), btc("a2", 9), btc("a3", 8));
        RecordingStream b = new RecordingStream(btc("b1", 1));

        merger(a, b).takeN(3);

        assertThat(a.nexts.get()).isEqualTo(3);
        assertThat(b.nexts.get()).isZero();
        assertThat(b.peeks.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("transient empty next is retried and does not end the merge")
    void takeN_transientEmptyIsTolerated() {
        RecordingStream a = new RecordingStream(btc("a1", 10), btc("a2", 5)).withTransientEmpties(2);

        List<FeedTransaction> result = merger(a).takeN(5);

        assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("a1", "a2");
    }

    @Test
    @DisplayName("three consecutive empty rounds fail the call as stalled")
    void takeN_threeEmptyRounds_stalls() {
        RecordingStream stuck = new RecordingStream(btc("stuck", 200)).withTransientEmpties(3);
        RecordingStream healthy = new RecordingStream(btc("h1", 100), btc("h2", 90));

        assertThatThrownBy(() -> merger(stuck, healthy).takeN(5))
                .isInstanceOf(MergeStalledException.class)
                .hasMessageContaining("Possible infinite loop")
                .satisfies(e -> {
                    MergeStalledException stall = (MergeStalledException) e;
                    assertThat(stall.getErrorCode()).isEqualTo(MergeErrorCode.MERGE_STALLED);
                    assertThat(stall.getEmptyRounds()).isEqualTo(3);
                    assertThat(stall.getCollected()).isZero();
                });
        assertThat(healthy.nexts.get()).isZero();
    }

    @Test
    void takeN_emptyRoundCounterResetsOnProgress() {
        RecordingStream a = new RecordingStream(btc("a1", 10), btc("a2", 9), btc("a3", 8)) {
            private int calls;

            @Override
            public StreamStep next() {
                // two empties before every real item
                calls++;
                if (calls % 3 != 0) {
                    nexts.incrementAndGet();
                    return StreamStep.empty();
                }
                return super.next();
            }
        };

        List<FeedTransaction> result = merger(a).takeN(3);

        assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("a1", "a2", "a3");
    }

    @Test
    void takeN_doneStepFromWinnerCountsAsEmptyRound() {
        TransactionStream lying = new TransactionStream() {
            @Override
            public Optional<FeedTransaction> peek() {
                return Optional.of(btc("ghost", 1));
            }

            @Override
            public StreamStep next() {
                return StreamStep.finished();
            }
        };

        assertThatThrownBy(() -> merger(lying).takeN(1)).isInstanceOf(MergeStalledException.class);
    }

    @Test
    void takeN_customStallThreshold() {
        RecordingStream stuck = new RecordingStream(btc("stuck", 1)).withTransientEmpties(4);

        List<FeedTransaction> result = new StreamMerger(List.of(stuck), executor, 5).takeN(1);

        assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("stuck");
    }

    @Test
    void constructor_rejectsEmptyOrAbsentStreams() {
        assertThatThrownBy(() -> new StreamMerger(List.of(), executor))
                .isInstanceOf(StreamMergeException.class)
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.INVALID_CONFIGURATION));
        assertThatThrownBy(() -> new StreamMerger(null, executor))
                .isInstanceOf(StreamMergeException.class)
                .hasMessageContaining("At least one");
        assertThatThrownBy(() -> new StreamMerger(Collections.singletonList(null), executor))
                .isInstanceOf(StreamMergeException.class)
                .hasMessageContaining("null");
    }

    @Test
    void constructor_requiresPeekExecutor() {
        assertThatThrownBy(() -> new StreamMerger(List.of(new RecordingStream(btc("a", 1))), null))
                .isInstanceOf(StreamMergeException.class)
                .hasMessageContaining("Peek executor required")
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.INVALID_CONFIGURATION));
    }

    @Test
    @DisplayName("peeks run on the supplied executor, never on the caller or the common pool")
    void takeN_peeksRunOnSuppliedExecutor() {
        ExecutorService named = Executors.newFixedThreadPool(2, r -> new Thread(r, "merge-peek-test"));
        Set<String> peekThreads = ConcurrentHashMap.newKeySet();
        try {
            List<TransactionStream> streams = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                streams.add(new ListTransactionStream(List.of(btc("s" + i, 10 - i))) {
                    @Override
                    public Optional<FeedTransaction> peek() {
                        peekThreads.add(Thread.currentThread().getName());
                        return super.peek();
                    }
                });
            }

            List<FeedTransaction> result = new StreamMerger(streams, named).takeN(2);

            assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("s0", "s1");
            assertThat(peekThreads).containsExactly("merge-peek-test");
        } finally {
            named.shutdownNow();
        }
    }

    @Test
    void constructor_rejectsNonPositiveStallThreshold() {
        assertThatThrownBy(() -> new StreamMerger(List.of(new RecordingStream()), executor, 0))
                .isInstanceOf(StreamMergeException.class)
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.INVALID_CONFIGURATION));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 10_001, Integer.MIN_VALUE})
    void takeN_invalidIntLimit_failsWithoutTouchingStreams(int limit) {
        RecordingStream stream = new RecordingStream(btc("a", 1));

        assertThatThrownBy(() -> merger(stream).takeN(limit))
                .isInstanceOf(StreamMergeException.class)
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.INVALID_LIMIT));
        assertThat(stream.calls()).isZero();
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 0.0, -1.0, 2.5, 10_001.0})
    void takeN_invalidDoubleLimit_failsWithoutTouchingStreams(double limit) {
        RecordingStream stream = new RecordingStream(btc("a", 1));

        assertThatThrownBy(() -> merger(stream).takeN(limit))
                .isInstanceOf(StreamMergeException.class)
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.INVALID_LIMIT));
        assertThat(stream.calls()).isZero();
    }

    @Test
    void takeN_wholeDoubleLimitAccepted() {
        List<FeedTransaction> result = merger(ListTransactionStream.of(btc("a", 2), btc("b", 1))).takeN(1.0);

        assertThat(result).hasSize(1);
    }

    @Test
    void takeN_maxLimitAccepted() {
        List<FeedTransaction> many = new ArrayList<>();
        for (int i = StreamMerger.MAX_LIMIT + 5; i > 0; i--) {
            many.add(btc("t" + i, i));
        }

        List<FeedTransaction> result = merger(new ListTransactionStream(many)).takeN(StreamMerger.MAX_LIMIT);

        assertThat(result).hasSize(StreamMerger.MAX_LIMIT);
    }

    @Test
    @DisplayName("malformed starknet timestamp fails the whole call")
    void takeN_malformedTimestamp_failsCall() {
        RecordingStream good = new RecordingStream(btc("a", 1));
        RecordingStream bad = new RecordingStream(StarknetTransaction.of("0xbad", "not-a-date"));

        assertThatThrownBy(() -> merger(good, bad).takeN(2))
                .isInstanceOf(MalformedTimestampException.class)
                .hasMessageContaining("not-a-date");
        assertThat(good.nexts.get()).isZero();
    }

    @Test
    void takeN_peekFailure_propagatesUnwrapped() {
        IllegalStateException boom = new IllegalStateException("explorer down");
        RecordingStream good = new RecordingStream(btc("a", 1));
        RecordingStream failing = new RecordingStream().failingPeek(boom);

        assertThatThrownBy(() -> merger(good, failing).takeN(1)).isSameAs(boom);
    }

    @Test
    void takeN_nextFailure_propagates() {
        TransactionStream failing = new TransactionStream() {
            @Override
            public Optional<FeedTransaction> peek() {
                return Optional.of(btc("x", 1));
            }

            @Override
            public StreamStep next() {
                throw new IllegalStateException("cursor expired");
            }
        };

        assertThatThrownBy(() -> merger(failing).takeN(1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("cursor expired");
    }

    @Test
    void takeN_rejectingExecutor_failsAsStreamFailure() {
        StreamMerger merger = new StreamMerger(List.of(new RecordingStream(btc("a", 1))),
                command -> {
                    throw new java.util.concurrent.RejectedExecutionException("full");
                },
                StreamMerger.DEFAULT_MAX_EMPTY_ROUNDS);

        assertThatThrownBy(() -> merger.takeN(1))
                .isInstanceOf(StreamMergeException.class)
                .satisfies(e -> assertThat(((StreamMergeException) e).getErrorCode()).isEqualTo(MergeErrorCode.STREAM_FAILURE));
    }

    @Test
    @DisplayName("peeks of one round run concurrently")
    void takeN_peeksRunConcurrently() throws InterruptedException {
        int streams = 3;
        CountDownLatch allPeeking = new CountDownLatch(streams);
        List<TransactionStream> gated = new ArrayList<>();
        for (int i = 0; i < streams; i++) {
            BitcoinTransaction tx = btc("s" + i, 10 - i);
            gated.add(new ListTransactionStream(List.of(tx)) {
                private boolean first = true;

                @Override
                public Optional<FeedTransaction> peek() {
                    if (first) {
                        first = false;
                        allPeeking.countDown();
                        try {
                            // only returns if every stream's first peek is in flight at the same time
                            if (!allPeeking.await(5, TimeUnit.SECONDS)) {
                                throw new IllegalStateException("peeks ran sequentially");
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException(e);
                        }
                    }
                    return super.peek();
                }
            });
        }

        List<FeedTransaction> result = new StreamMerger(gated, executor, 3).takeN(3);

        assertThat(result).extracting(FeedTransaction::sourceId).containsExactly("s0", "s1", "s2");
    }

    @Test
    @DisplayName("output is sorted by key descending, ties by stream index")
    void takeN_mixedSources_outputOrdered() {
        List<TransactionStream> streams = List.of(
                ListTransactionStream.of(btc("b1", 300), btc("b2", 100), btc("b3", 0)),
                ListTransactionStream.of(StacksTransaction.of("s1", 0L, 300L), StacksTransaction.of("s2", 200L, 150L)),
                ListTransactionStream.of(StarknetTransaction.of("k1", "1970-01-01T00:04:10Z")),
                ListTransactionStream.of(SparkTransaction.of("p1", null)));

        List<FeedTransaction> result = new StreamMerger(streams, executor, 3).takeN(20);

        assertThat(result).extracting(FeedTransaction::sourceId)
                .containsExactly("b1", "s1", "k1", "s2", "b2", "b3", "p1");
        for (int i = 1; i < result.size(); i++) {
            assertThat(TransactionTimestampNormalizer.mergeKey(result.get(i - 1)))
                    .isGreaterThanOrEqualTo(TransactionTimestampNormalizer.mergeKey(result.get(i)));
        }
    }
}
