package com.onevault.security;

/** What an actor wants to do with a resource in its knowledge domain. */
public enum AccessAction {
    READ,
    WRITE,
    /** Use the data to train or update a model. */
    LEARN,
    /** Run a model over the data. */
    INFERENCE
}
