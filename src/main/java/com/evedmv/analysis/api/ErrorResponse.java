package com.evedmv.analysis.api;

/** Error body returned by the pool endpoints. */
public record ErrorResponse(String error, String message) {}
