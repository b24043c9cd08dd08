package br.edu.ifba.graphsync.core;

/**
 * Kind of record a failure or mismatch refers to.
 */
public enum RecordKind {
    NODE,
    RELATIONSHIP
}
