package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One transaction as emitted by a source feed: {@code {"type": "<kind>", "data": {...}}}.
 * Closed over the supported source kinds; values are immutable and passed through the merge unchanged.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BitcoinTransaction.class, name = "bitcoin"),
        @JsonSubTypes.Type(value = StacksTransaction.class, name = "stacks"),
        @JsonSubTypes.Type(value = StarknetTransaction.class, name = "starknet"),
        @JsonSubTypes.Type(value = SparkTransaction.class, name = "spark")
})
public sealed interface FeedTransaction
        permits BitcoinTransaction, StacksTransaction, StarknetTransaction, SparkTransaction {

    SourceKind kind();

    /**
     * Source-native identifier (txid, tx_id, transaction hash or spark id).
     */
    String sourceId();

    <R> R accept(Visitor<R> visitor);

    /**
     * One method per source kind. A new variant needs a new method here, which every visitor must implement.
     */
    interface Visitor<R> {

        R visitBitcoin(BitcoinTransaction tx);

        R visitStacks(StacksTransaction tx);

        R visitStarknet(StarknetTransaction tx);

        R visitSpark(SparkTransaction tx);
    }
}
