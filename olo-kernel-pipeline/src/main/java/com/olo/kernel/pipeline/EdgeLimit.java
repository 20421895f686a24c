package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Cap on how many times the transition {@code from -> to} may be taken in one session. */
public final class EdgeLimit {

    private final String from;
    private final String to;
    private final int maxCount;

    @JsonCreator
    public EdgeLimit(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("max_count") int maxCount) {
        this.from = from;
        this.to = to;
        this.maxCount = maxCount;
    }

    @JsonProperty("from")
    public String getFrom() {
        return from;
    }

    @JsonProperty("to")
    public String getTo() {
        return to;
    }

    @JsonProperty("max_count")
    public int getMaxCount() {
        return maxCount;
    }
}
