package com.hypecycle.dispatch.api;

/**
 * Inbound JSON body for POST /api/analyze.
 *
 * @param keyword technology keyword, 1-100 characters after trimming
 */
public record AnalyzeRequest(String keyword) {}
