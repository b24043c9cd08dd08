package br.edu.ifba.graphsync.verify;

/**
 * What differs between a relational record and its graph element.
 */
public enum MismatchProblem {
    /** No graph element with the record's id under the expected label or type. */
    MISSING,
    /** The node carries labels other than the canonical one. */
    LABEL,
    /** The relationship type differs from the canonical one. */
    TYPE,
    /** The relationship connects different nodes, or the record's endpoint does not exist. */
    ENDPOINT,
    /** A property is missing, extra or has a different value. */
    PROPERTY,
    /** The relational record holds a value that cannot be encoded, so nothing can match it. */
    UNENCODABLE
}
