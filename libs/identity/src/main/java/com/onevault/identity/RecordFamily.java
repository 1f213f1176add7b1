package com.onevault.identity;

/** The append-only record families a mutation can touch. */
public enum RecordFamily {
    HUB,
    SATELLITE,
    LINK
}
