package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Capability implemented by model-like values that can be stored in a semi-structured column.
 *
 * <p>The codec calls {@link #flatten()} and encodes the returned map recursively, so the map
 * may itself contain other {@code Flattenable} values, maps, collections and scalars.</p>
 */
@FunctionalInterface
public interface Flattenable {

    /**
     * Returns the structured content of this value as a map keyed by property name.
     *
     * @return the property map, never null
     */
    @NotNull
    Map<String, ?> flatten();
}
