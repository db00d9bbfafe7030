package fr.lapetina.mesh.gateway;

import java.util.List;
import java.util.Map;

/**
 * Reshaping of a JSON response body, applied as extract, rename, remove, then wrap.
 *
 * @param extract dot path of the sub-document to keep, e.g. {@code data.items}
 * @param rename  field renames applied on the top-level object
 * @param remove  top-level fields to drop
 * @param wrap    name of a field to wrap the result in
 */
public record TransformationConfig(String extract, Map<String, String> rename, List<String> remove, String wrap) {

    public TransformationConfig {
        rename = rename != null ? Map.copyOf(rename) : Map.of();
        remove = remove != null ? List.copyOf(remove) : List.of();
    }

    public boolean isEmpty() {
        return (extract == null || extract.isBlank()) && rename.isEmpty() && remove.isEmpty()
                && (wrap == null || wrap.isBlank());
    }
}
