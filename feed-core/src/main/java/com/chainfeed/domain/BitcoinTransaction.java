package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Bitcoin feed item. {@code blockTime} is epoch seconds of the confirming block; null while in the mempool.
 */
@JsonTypeName("bitcoin")
public record BitcoinTransaction(Data data) implements FeedTransaction {

    public static BitcoinTransaction of(String txid, Long blockTime) {
        return new BitcoinTransaction(new Data(txid, blockTime));
    }

    @Override
    public SourceKind kind() {
        return SourceKind.BITCOIN;
    }

    @Override
    public String sourceId() {
        return data != null ? data.txid() : null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBitcoin(this);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String txid, Long blockTime) {
    }
}
