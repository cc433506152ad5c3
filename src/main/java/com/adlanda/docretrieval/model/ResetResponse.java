package com.adlanda.docretrieval.model;

/**
 * Response from the reset endpoint.
 */
public record ResetResponse(String message, int totalVectors) {}
