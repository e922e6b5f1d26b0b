package com.mikov.bulkcsvvalidator.services;

/**
 * Coarse progress callback supplied by whoever triggered a run.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = percent -> { };

    void report(int percent);
}
