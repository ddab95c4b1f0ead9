package com.evedmv.analysis.api;

/** Number of queued jobs discarded by a queue reset. */
public record ClearQueueResponse(int dropped) {}
