package com.dynamicdto.contract;

/**
 * Marks a Dto type whose attributes can be assigned only once.
 */
public interface ForbidsOverrides {
}
