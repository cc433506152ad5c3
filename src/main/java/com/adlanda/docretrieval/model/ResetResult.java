package com.adlanda.docretrieval.model;

/**
 * Outcome of a store reset; {@code totalVectors} is always zero.
 */
public record ResetResult(int totalVectors) {}
