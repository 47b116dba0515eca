package com.farmer.service;

import com.farmer.model.CatalogRow;
import com.farmer.model.SourceCatalog;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class CatalogBuilderTest {

    private final CatalogBuilder builder = new CatalogBuilder();

    @Test
    public void centroidFluxAndShapeOfAnElongatedSource() {
        double[][] image = new double[20][20];
        int[][] segmap = new int[20][20];
        // Barra horizontal de 7 x 3 píxeles
        for (int y = 9; y <= 11; y++) {
            for (int x = 5; x <= 11; x++) {
                image[y][x] = 2.0;
                segmap[y][x] = 4;
            }
        }
        SourceCatalog catalog = builder.build(image, segmap);

        assertEquals(1, catalog.size());
        CatalogRow row = catalog.find(4).get();
        assertEquals(8.0, row.x, 1e-12);
        assertEquals(10.0, row.y, 1e-12);
        assertEquals(42.0, row.flux, 1e-12);
        assertTrue(row.a > row.b);
        assertEquals(0.0, row.theta, 1e-9);
        assertEquals(Math.sqrt(2.0 / 3.0) / 2.0, row.axisRatio(), 1e-9);
    }

    @Test
    public void centroidIsWeightedByFlux() {
        double[][] image = new double[5][5];
        int[][] segmap = new int[5][5];
        segmap[2][1] = 1;
        segmap[2][3] = 1;
        image[2][1] = 1.0;
        image[2][3] = 3.0;

        CatalogRow row = builder.build(image, segmap).find(1).get();
        assertEquals(2.5, row.x, 1e-12);
        assertEquals(2.0, row.y, 1e-12);
    }

    @Test
    public void sourcesWithoutPositiveFluxUseGeometricCentre() {
        double[][] image = new double[5][5];
        int[][] segmap = new int[5][5];
        segmap[1][1] = 2;
        segmap[1][3] = 2;
        image[1][1] = -1.0;
        image[1][3] = Double.NaN;

        CatalogRow row = builder.build(image, segmap).find(2).get();
        assertEquals(2.0, row.x, 1e-12);
        assertEquals(1.0, row.y, 1e-12);
        assertEquals(-1.0, row.flux, 1e-12);
    }

    @Test
    public void backgroundPixelsAreIgnored() {
        double[][] image = new double[4][4];
        for (double[] row : image) Arrays.fill(row, 100.0);
        SourceCatalog catalog = builder.build(image, new int[4][4]);
        assertEquals(0, catalog.size());
    }
}
