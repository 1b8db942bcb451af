package com.nightlifemap.directory.service;

import com.nightlifemap.directory.model.Venue;

/**
 * Both venues as they stand after a completed swap.
 */
public record SwapResult(Venue source, Venue target) {
}
