package br.edu.ifba.graphsync.verify;

/**
 * Relational versus graph element counts of a scope.
 *
 * @param expectedNodes entity records in the scope
 * @param actualNodes graph nodes tagged with the scope
 * @param expectedRelationships relationship records in the scope
 * @param actualRelationships graph relationships tagged with the scope
 */
public record CountCheck(
    long expectedNodes,
    long actualNodes,
    long expectedRelationships,
    long actualRelationships
) {

    public boolean inSync() {
        return expectedNodes == actualNodes && expectedRelationships == actualRelationships;
    }
}
