package com.farmer.service;

import com.farmer.model.FitConfig;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import static org.junit.Assert.*;

public class BrickLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final FitsImageService fits = new FitsImageService();
    private final BrickLoader loader = new BrickLoader(fits, new CatalogBuilder());
    private File dir;

    @Before
    public void setUp() throws Exception {
        dir = tmp.newFolder("brick");
        double[][] image = new double[12][12];
        double[][] seg = new double[12][12];
        double[][] blobs = new double[12][12];
        for (int y = 3; y <= 5; y++) {
            for (int x = 3; x <= 5; x++) {
                image[y][x] = 5.0;
                seg[y][x] = 1;
                blobs[y][x] = 1;
            }
        }
        for (int y = 8; y <= 9; y++) {
            for (int x = 8; x <= 10; x++) {
                image[y][x] = 1.0;
                seg[y][x] = 2;
                blobs[y][x] = 3;
            }
        }
        fits.writeImage(new File(dir, "r.fits"), image);
        fits.writeImage(new File(dir, "g.fits"), image);
        fits.writeImage(new File(dir, "g.weight.fits"), new double[12][12]);
        fits.writeImage(new File(dir, BrickLoader.SEGMAP), seg);
        fits.writeImage(new File(dir, BrickLoader.BLOBMAP), blobs);
    }

    @Test
    public void bandsAreDiscoveredInOrder() {
        assertArrayEquals(new String[]{"g", "r"}, BrickLoader.discoverBands(dir));
    }

    @Test
    public void loadsMapsAndBuildsTheCatalog() throws Exception {
        Brick brick = loader.load(dir);

        assertArrayEquals(new String[]{"g", "r"}, brick.getBands());
        assertEquals(12, brick.width());
        assertEquals(Arrays.asList(1, 3), brick.blobIds());
        assertEquals(2, brick.getCatalog().size());
        assertEquals(4.0, brick.getCatalog().find(1).get().x, 1e-9);
        assertEquals(45.0, brick.getCatalog().find(1).get().flux, 1e-6);
        assertNull(brick.getWcs());
    }

    @Test
    public void zeroWeightPixelsAreMasked() throws Exception {
        // g.weight.fits es todo cero: en g no queda ningún píxel útil
        Blob blob = loader.load(dir).extractBlob(1, FitConfig.defaults());
        for (boolean[] row : blob.getMask(0)) for (boolean m : row) assertTrue(m);
        assertFalse(blob.getMask(1)[4][4]);
    }

    @Test(expected = IOException.class)
    public void emptyDirectoryHasNoBands() throws Exception {
        loader.load(tmp.newFolder("empty"));
    }
}
