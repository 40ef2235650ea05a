package io.tessera.core.consensus;

/// A validator's verdict on the submitted work.
public enum Vote {
    PASS,
    FAIL
}
