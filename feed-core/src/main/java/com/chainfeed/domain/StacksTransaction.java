package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Stacks feed item. The API nests the transaction under {@code data.tx} with snake_case fields.
 * Pending transactions carry neither block time.
 */
@JsonTypeName("stacks")
public record StacksTransaction(Data data) implements FeedTransaction {

    public static StacksTransaction of(String txId, Long blockTime, Long burnBlockTime) {
        return new StacksTransaction(new Data(new Tx(txId, blockTime, burnBlockTime)));
    }

    @Override
    public SourceKind kind() {
        return SourceKind.STACKS;
    }

    @Override
    public String sourceId() {
        return data != null && data.tx() != null ? data.tx().txId() : null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStacks(this);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(Tx tx) {
    }

    /**
     * @param blockTime     Stacks block time, epoch seconds; 0 or absent until the block is confirmed
     * @param burnBlockTime time of the anchoring Bitcoin block, epoch seconds
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tx(
            @JsonProperty("tx_id") String txId,
            @JsonProperty("block_time") Long blockTime,
            @JsonProperty("burn_block_time") Long burnBlockTime
    ) {
    }
}
