package com.farmer.service;

import com.farmer.model.CatalogRow;
import com.farmer.model.FitConfig;
import com.farmer.model.SourceCatalog;
import com.farmer.model.SourceSeed;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class BrickTest {

    private static final String[] BANDS = {"g", "r"};
    private static final int W = 40, H = 40;

    private final FitConfig config = FitConfig.builder().blobBuffer(2).build();

    // Imagen en rampa: el valor codifica la posición
    private static double[][][] ramp() {
        double[][][] images = new double[BANDS.length][H][W];
        for (int b = 0; b < BANDS.length; b++)
            for (int y = 0; y < H; y++)
                for (int x = 0; x < W; x++) images[b][y][x] = 1000 * b + 100 * y + x + 1;
        return images;
    }

    /** Segmentos 3 y 5 forman el blob 2; el segmento 7 es el blob 4. */
    private static Brick brick() {
        int[][] segmap = new int[H][W];
        TestBricks.disk(segmap, 10, 12, 3, 3);
        TestBricks.disk(segmap, 15, 12, 3, 5);
        TestBricks.disk(segmap, 30, 30, 4, 7);
        int[][] blobmap = new int[H][W];
        for (int y = 0; y < H; y++) {
            for (int x = 0; x < W; x++) {
                if (segmap[y][x] == 3 || segmap[y][x] == 5) blobmap[y][x] = 2;
                else if (segmap[y][x] == 7) blobmap[y][x] = 4;
            }
        }
        return TestBricks.brick(BANDS, ramp(), segmap, blobmap, null);
    }

    @Test
    public void blobIdsAreSorted() {
        assertEquals(Arrays.asList(2, 4), brick().blobIds());
    }

    @Test
    public void extractionTranslatesTheCatalog() throws DegenerateBlobException {
        Brick brick = brick();
        Blob blob = brick.extractBlob(2, config);

        // Caja x 7..18, y 9..15 con margen 2
        assertEquals(5, blob.getOffsetX());
        assertEquals(7, blob.getOffsetY());
        assertEquals(16, blob.width());
        assertEquals(11, blob.height());

        List<SourceSeed> seeds = blob.getSeeds();
        assertEquals(2, seeds.size());
        assertEquals(3, seeds.get(0).id());
        assertEquals(5, seeds.get(1).id());
        CatalogRow row = brick.getCatalog().find(5).get();
        assertEquals(row.x - 5, seeds.get(1).x(), 1e-12);
        assertEquals(row.y - 7, seeds.get(1).y(), 1e-12);
        assertEquals(row.flux, seeds.get(1).flux(), 0.0);
        assertSame(brick.getCatalog(), blob.getParentCatalog());
    }

    @Test
    public void cutoutCopiesPixelsAndMasksEverythingOutsideTheBlob() throws DegenerateBlobException {
        Brick brick = brick();
        Blob blob = brick.extractBlob(2, config);

        for (int b = 0; b < BANDS.length; b++) {
            for (int y = 0; y < blob.height(); y++) {
                for (int x = 0; x < blob.width(); x++) {
                    int gx = x + blob.getOffsetX(), gy = y + blob.getOffsetY();
                    assertEquals(brick.getImage(b)[gy][gx], blob.getImage(b)[y][x], 0.0);
                    assertEquals(brick.getBlobmap()[gy][gx] != 2, blob.getMask(b)[y][x]);
                    double w = blob.getBandImages().get(b).invvar[y][x];
                    assertEquals(blob.getMask(b)[y][x] ? 0.0 : 1.0, w, 0.0);
                }
            }
        }
    }

    @Test
    public void cutoutIsClippedAtTheBrickEdge() throws DegenerateBlobException {
        Blob blob = brick().extractBlob(4, FitConfig.builder().blobBuffer(8).build());
        assertEquals(18, blob.getOffsetX());
        assertEquals(W - 18, blob.width());
        assertEquals(1, blob.sourceCount());
    }

    @Test
    public void sparseBlobIsRejected() {
        int[][] segmap = new int[H][W];
        int[][] blobmap = new int[H][W];
        for (int i = 0; i < 30; i++) {
            segmap[i][i] = 1;
            blobmap[i][i] = 1;
        }
        Brick brick = TestBricks.brick(BANDS, ramp(), segmap, blobmap, null);
        FitConfig strict = FitConfig.builder().sparseThreshold(0.5).sparseSize(100).build();
        try {
            brick.extractBlob(1, strict);
            fail("expected a sparse blob");
        } catch (DegenerateBlobException e) {
            assertEquals(1, e.getBlobId());
            assertTrue(e.getMessage().contains("sparse"));
        }
    }

    @Test
    public void smallBlobsAreNotRejectedForSparseness() throws DegenerateBlobException {
        int[][] segmap = new int[H][W];
        int[][] blobmap = new int[H][W];
        for (int i = 0; i < 5; i++) {
            segmap[i][i] = 1;
            blobmap[i][i] = 1;
        }
        Brick brick = TestBricks.brick(BANDS, ramp(), segmap, blobmap, null);
        FitConfig strict = FitConfig.builder().sparseThreshold(0.5).sparseSize(100).build();
        assertEquals(1, brick.extractBlob(1, strict).sourceCount());
    }

    @Test(expected = DegenerateBlobException.class)
    public void unknownBlobIsDegenerate() throws DegenerateBlobException {
        brick().extractBlob(99, config);
    }

    @Test(expected = IllegalStateException.class)
    public void segmentWithoutCatalogRowIsAnError() throws DegenerateBlobException {
        Brick full = brick();
        SourceCatalog partial = new SourceCatalog();
        partial.add(full.getCatalog().find(3).get());
        Brick brick = new Brick(BANDS, ramp(), null, null, null, full.getSegmap(), full.getBlobmap(), partial, null);
        brick.extractBlob(2, config);
    }

    @Test(expected = IllegalArgumentException.class)
    public void mismatchedShapesAreRejected() {
        new Brick(BANDS, new double[2][H][W + 1], null, null, null, new int[H][W], new int[H][W], new SourceCatalog(), null);
    }
}
