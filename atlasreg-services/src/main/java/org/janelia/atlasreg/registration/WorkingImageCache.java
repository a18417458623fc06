package org.janelia.atlasreg.registration;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.Supplier;

import org.janelia.atlasreg.image.VolumeImage;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;

/**
 * Images of one registration run keyed by atlas id and reduction factors. Each entry is produced once; concurrent
 * requests for the same key wait for the producer and only ever see a complete image. A failed production is not
 * cached.
 */
public class WorkingImageCache {

    private static class Key {
        private final String specId;
        private final double[] factors;

        Key(String specId, double[] factors) {
            this.specId = specId;
            this.factors = factors.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Key key = (Key) o;
            return specId.equals(key.specId) && Arrays.equals(factors, key.factors);
        }

        @Override
        public int hashCode() {
            return Objects.hash(specId) * 31 + Arrays.hashCode(factors);
        }
    }

    private final ConcurrentMap<Key, FutureTask<VolumeImage<?>>> images = new ConcurrentHashMap<>();

    public VolumeImage<?> get(String specId, double[] factors, Supplier<VolumeImage<?>> producer) {
        Key key = new Key(specId, factors);
        FutureTask<VolumeImage<?>> task = new FutureTask<>(producer::get);
        FutureTask<VolumeImage<?>> existing = images.putIfAbsent(key, task);
        if (existing == null) {
            existing = task;
            task.run();
        }
        try {
            return existing.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AtlasRegistrationException("Interrupted while waiting for the working image of " + specId, e);
        } catch (ExecutionException e) {
            images.remove(key, existing);
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new AtlasRegistrationException("Error producing the working image of " + specId, e.getCause());
        }
    }

    public boolean contains(String specId, double[] factors) {
        FutureTask<VolumeImage<?>> task = images.get(new Key(specId, factors));
        return task != null && task.isDone();
    }

    public int size() {
        return images.size();
    }

    public void clear() {
        images.clear();
    }
}
