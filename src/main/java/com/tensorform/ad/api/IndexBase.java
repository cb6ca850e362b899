package com.tensorform.ad.api;

/**
 * One slot of a multi-index: either a symbolic {@link Index} or a
 * {@link FixedIndex} naming a single component.
 */
public interface IndexBase {
}
