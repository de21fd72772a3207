package com.cachebench.qa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("redis")  String redis
) {}
