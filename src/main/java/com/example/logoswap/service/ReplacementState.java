package com.example.logoswap.service;

/**
 * Stages of a single image's replacement run.
 */
public enum ReplacementState {
    START,
    SEARCHING,
    FOUND,
    NOT_FOUND,
    ERASING,
    PLACING,
    COMPOSITING,
    DONE
}
