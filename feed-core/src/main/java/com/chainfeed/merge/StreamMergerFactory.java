package com.chainfeed.merge;

import com.chainfeed.domain.FeedTransaction;
import com.chainfeed.merge.config.MergeProperties;
import com.chainfeed.stream.TransactionStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds mergers bound to merge-peek-executor and the configured stall threshold.
 * A merger is single-use per request: streams carry cursor state and are not shared.
 */
@Component
@Slf4j
public class StreamMergerFactory {

    private final MergeProperties mergeProperties;
    private final Executor peekExecutor;

    public StreamMergerFactory(MergeProperties mergeProperties,
                               @Qualifier("merge-peek-executor") Executor peekExecutor) {
        this.mergeProperties = mergeProperties;
        this.peekExecutor = peekExecutor;
    }

    public StreamMerger create(List<? extends TransactionStream> streams) {
        StreamMerger merger = new StreamMerger(streams, peekExecutor, mergeProperties.getMaxEmptyRounds());
        log.debug("Created merger over {} stream(s)", merger.getStreamCount());
        return merger;
    }

    /**
     * One-shot merge: build a merger over {@code streams} and take up to {@code limit} items.
     */
    public List<FeedTransaction> merge(List<? extends TransactionStream> streams, int limit) {
        return create(streams).takeN(limit);
    }
}
