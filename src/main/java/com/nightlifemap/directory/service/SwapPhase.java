package com.nightlifemap.directory.service;

/**
 * States of the sequential swap protocol.
 */
public enum SwapPhase {
    IDLE,
    SOURCE_DETACHED,
    TARGET_RELOCATED,
    DONE,
    ROLLED_BACK,
    FATAL
}
