package com.cachebench.qa.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /ask.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AskRequest(
    @JsonProperty("query") String query
) {}
