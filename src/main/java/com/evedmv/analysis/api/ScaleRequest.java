package com.evedmv.analysis.api;

import jakarta.validation.constraints.Positive;

/** Request body for resizing the worker pool. */
public record ScaleRequest(@Positive int size) {}
