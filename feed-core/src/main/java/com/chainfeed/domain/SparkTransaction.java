package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("spark")
public record SparkTransaction(Data data) implements FeedTransaction {

    public static SparkTransaction of(String id, String createdAt) {
        return new SparkTransaction(new Data(id, createdAt));
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SPARK;
    }

    @Override
    public String sourceId() {
        return data != null ? data.id() : null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSpark(this);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String id, String createdAt) {
    }
}
