package com.reelindex.service.inference;

/**
 * Identity of the model that produced a vector, stored alongside it.
 */
public record ModelInfo(String name, String version, int dimension) {
}
