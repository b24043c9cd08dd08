package br.edu.ifba.graphsync.export;

/**
 * Phases of an export run, in execution order.
 */
public enum ExportPhase {
    CLEAR,
    INDEX,
    NODES,
    RELATIONSHIPS
}
