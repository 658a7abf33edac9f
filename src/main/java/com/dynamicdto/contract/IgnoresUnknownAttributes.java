package com.dynamicdto.contract;

/**
 * Marks a Dto type that answers {@code null} for attributes it does not hold
 * instead of failing.
 */
public interface IgnoresUnknownAttributes {
}
