package org.pragmatica.config.tree;

/// Whether a single leaf may stand for a one-element sequence.
///
/// Flat sources (environment variables, a single command line flag) cannot tell a scalar
/// from a list of one element, so they are normally created with [#VALID].
public enum LeafForSequence {
    VALID,
    INVALID
}
