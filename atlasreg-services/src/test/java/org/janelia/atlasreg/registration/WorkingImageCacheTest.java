package org.janelia.atlasreg.registration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import net.imglib2.type.numeric.real.FloatType;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.VolumeImage;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class WorkingImageCacheTest {

    private static final double[] FACTORS = {2, 2, 2};
    private static final ImageGrid GRID = new ImageGrid(new long[] {4, 4, 4}, new double[] {1, 1, 1});

    @Test
    public void concurrentRequestsShareOneProduction() throws Exception {
        WorkingImageCache cache = new WorkingImageCache();
        AtomicInteger productions = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(8);
        try {
            List<Future<VolumeImage<?>>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Callable<VolumeImage<?>> request = () -> {
                    start.await();
                    return cache.get("sample", FACTORS, () -> {
                        productions.incrementAndGet();
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return VolumeImage.create(new FloatType(), GRID);
                    });
                };
                futures.add(executorService.submit(request));
            }
            start.countDown();
            VolumeImage<?> first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<VolumeImage<?>> f : futures) {
                assertSame(first, f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executorService.shutdownNow();
        }
        assertEquals(1, productions.get());
        assertEquals(1, cache.size());
    }

    @Test
    public void failedProductionIsNotCached() {
        WorkingImageCache cache = new WorkingImageCache();
        try {
            cache.get("sample", FACTORS, () -> {
                throw new IllegalStateException("cannot read template");
            });
            fail("Production error should have been rethrown");
        } catch (IllegalStateException e) {
            assertEquals("cannot read template", e.getMessage());
        }
        assertFalse(cache.contains("sample", FACTORS));

        VolumeImage<?> image = cache.get("sample", FACTORS, () -> VolumeImage.create(new FloatType(), GRID));
        assertSame(image, cache.get("sample", FACTORS, () -> {
            throw new IllegalStateException("should not be called");
        }));
    }

    @Test
    public void keysIncludeTheFactors() {
        WorkingImageCache cache = new WorkingImageCache();
        VolumeImage<?> full = cache.get("sample", new double[] {1, 1, 1}, () -> VolumeImage.create(new FloatType(), GRID));
        VolumeImage<?> reduced = cache.get("sample", FACTORS, () -> VolumeImage.create(new FloatType(), GRID));

        assertEquals(2, cache.size());
        assertFalse(full == reduced);
        cache.clear();
        assertEquals(0, cache.size());
    }
}
