package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Starknet feed item. {@code blockTimestamp} is ISO-8601 text as returned by the indexer.
 */
@JsonTypeName("starknet")
public record StarknetTransaction(Data data) implements FeedTransaction {

    public static StarknetTransaction of(String transactionHash, String blockTimestamp) {
        return new StarknetTransaction(new Data(transactionHash, blockTimestamp));
    }

    @Override
    public SourceKind kind() {
        return SourceKind.STARKNET;
    }

    @Override
    public String sourceId() {
        return data != null ? data.transactionHash() : null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStarknet(this);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String transactionHash, String blockTimestamp) {
    }
}
