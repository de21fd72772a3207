package com.cachebench.loadgen.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The part of the POST /ask response the load generator cares about.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AskReply(
    @JsonProperty("from_cache") boolean fromCache
) {}
