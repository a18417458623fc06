package org.janelia.atlasreg.model.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Raised when following parent links returns to an already visited atlas.
 */
public class CyclicChainException extends AtlasRegistrationException {

    private final List<String> visited;
    private final String repeated;

    public CyclicChainException(List<String> visited, String repeated) {
        super("Cyclic atlas hierarchy: " + String.join(" -> ", visited) + " -> " + repeated);
        this.visited = ImmutableList.copyOf(visited);
        this.repeated = repeated;
    }

    public List<String> getVisited() {
        return visited;
    }

    public String getRepeated() {
        return repeated;
    }
}
