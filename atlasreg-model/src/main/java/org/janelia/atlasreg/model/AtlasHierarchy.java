package org.janelia.atlasreg.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.janelia.atlasreg.model.exceptions.CyclicChainException;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;

/**
 * Registry of the atlases known to a run, keyed by id. Parent links are resolved through this registry so
 * that specs never hold references to each other.
 */
public class AtlasHierarchy {

    private final Map<String, AtlasSpec> atlases = new LinkedHashMap<>();

    public AtlasHierarchy() {
    }

    public AtlasHierarchy(Collection<AtlasSpec> specs) {
        specs.forEach(this::add);
    }

    public AtlasHierarchy add(AtlasSpec spec) {
        Preconditions.checkArgument(spec.getId() != null, "Atlas spec without id cannot be registered");
        AtlasSpec existing = atlases.get(spec.getId());
        Preconditions.checkArgument(existing == null || existing.equals(spec),
                "Another atlas spec is already registered as %s", spec.getId());
        atlases.put(spec.getId(), spec);
        return this;
    }

    public Optional<AtlasSpec> get(String id) {
        return Optional.ofNullable(atlases.get(id));
    }

    public boolean contains(String id) {
        return atlases.containsKey(id);
    }

    public Collection<AtlasSpec> getAll() {
        return Collections.unmodifiableCollection(atlases.values());
    }

    /**
     * Return the parent of the given spec.
     *
     * @throws CyclicChainException if the spec names itself as parent
     * @throws InvalidSpecException if the parent is not registered
     */
    public Optional<AtlasSpec> resolveParent(AtlasSpec spec) {
        if (!spec.hasParent()) {
            return Optional.empty();
        }
        if (spec.getParentId().equals(spec.getId())) {
            throw new CyclicChainException(ImmutableList.of(spec.getId()), spec.getParentId());
        }
        AtlasSpec parent = atlases.get(spec.getParentId());
        if (parent == null) {
            throw new InvalidSpecException(spec.getId(), "parent atlas " + spec.getParentId() + " is not defined");
        }
        return Optional.of(parent);
    }

    /**
     * Walk the parent links starting with the given spec.
     *
     * @return the spec followed by all its ancestors, the root atlas last
     * @throws CyclicChainException if an atlas is reached twice
     */
    public List<AtlasSpec> ancestry(AtlasSpec spec) {
        Set<String> visited = new LinkedHashSet<>();
        List<AtlasSpec> lineage = new ArrayList<>();
        AtlasSpec current = spec;
        while (current != null) {
            if (!visited.add(current.getId())) {
                throw new CyclicChainException(new ArrayList<>(visited), current.getId());
            }
            lineage.add(current);
            current = resolveParent(current).orElse(null);
        }
        return lineage;
    }

    public int size() {
        return atlases.size();
    }
}
