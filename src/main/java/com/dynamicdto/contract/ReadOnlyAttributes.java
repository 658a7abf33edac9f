package com.dynamicdto.contract;

/**
 * Marks a Dto type that can be filled during construction and is immutable afterwards.
 */
public interface ReadOnlyAttributes {
}
