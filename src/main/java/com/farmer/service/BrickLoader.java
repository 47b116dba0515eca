package com.farmer.service;

import com.farmer.model.SourceCatalog;
import com.farmer.model.TanWcs;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Carga un brick desde un directorio: &lt;banda&gt;.fits, opcionales &lt;banda&gt;.weight.fits y
 * &lt;banda&gt;.psf.fits, segmap.fits y blobmap.fits. La primera banda es la de modelado.
 */
public class BrickLoader {
    private static final Logger logger = LoggerFactory.getLogger(BrickLoader.class);

    public static final String SEGMAP = "segmap.fits";
    public static final String BLOBMAP = "blobmap.fits";
    private static final String WEIGHT_SUFFIX = ".weight.fits";
    private static final String PSF_SUFFIX = ".psf.fits";
    private static final String FITS_SUFFIX = ".fits";

    private final FitsImageService fitsService;
    private final CatalogBuilder catalogBuilder;

    public BrickLoader(FitsImageService fitsService, CatalogBuilder catalogBuilder) {
        this.fitsService = fitsService;
        this.catalogBuilder = catalogBuilder;
    }

    /** Bandas presentes en el directorio, en orden alfabético. */
    public static String[] discoverBands(File dir) {
        File[] files = dir.listFiles((d, name) -> name.toLowerCase().endsWith(FITS_SUFFIX));
        List<String> bands = new ArrayList<>();
        if (files != null) {
            for (File f : files) {
                String name = f.getName();
                if (name.equals(SEGMAP) || name.equals(BLOBMAP) || name.endsWith(WEIGHT_SUFFIX) || name.endsWith(PSF_SUFFIX)) continue;
                bands.add(name.substring(0, name.length() - FITS_SUFFIX.length()));
            }
        }
        bands.sort(String::compareTo);
        return bands.toArray(new String[0]);
    }

    public Brick load(File dir) throws IOException, FitsException {
        return load(dir, discoverBands(dir));
    }

    public Brick load(File dir, String[] bands) throws IOException, FitsException {
        if (bands.length == 0) throw new IOException("No band images found in " + dir);
        int nb = bands.length;
        double[][][] images = new double[nb][][];
        double[][][] weights = new double[nb][][];
        double[][][] psfs = new double[nb][][];
        boolean anyWeight = false;

        for (int b = 0; b < nb; b++) {
            images[b] = fitsService.readImage(new File(dir, bands[b] + FITS_SUFFIX));
            File wf = new File(dir, bands[b] + WEIGHT_SUFFIX);
            if (wf.isFile()) {
                weights[b] = fitsService.readImage(wf);
                anyWeight = true;
            }
            File pf = new File(dir, bands[b] + PSF_SUFFIX);
            if (pf.isFile()) psfs[b] = fitsService.readImage(pf);
            else logger.info("No PSF for band {}: using the default circular PSF", bands[b]);
        }

        // Bandas sin mapa de pesos: peso 1
        if (anyWeight) {
            for (int b = 0; b < nb; b++) {
                if (weights[b] != null) continue;
                weights[b] = new double[images[b].length][images[b][0].length];
                for (double[] row : weights[b]) Arrays.fill(row, 1.0);
            }
        }

        // Píxeles sin dato o con peso nulo quedan enmascarados
        boolean[][][] masks = new boolean[nb][][];
        for (int b = 0; b < nb; b++) {
            masks[b] = new boolean[images[b].length][images[b][0].length];
            for (int y = 0; y < masks[b].length; y++) {
                for (int x = 0; x < masks[b][y].length; x++) {
                    masks[b][y][x] = !Double.isFinite(images[b][y][x]) || (weights[b] != null && !(weights[b][y][x] > 0));
                }
            }
        }

        int[][] segmap = fitsService.readLabels(new File(dir, SEGMAP));
        int[][] blobmap = fitsService.readLabels(new File(dir, BLOBMAP));
        TanWcs wcs = fitsService.readWcs(new File(dir, bands[0] + FITS_SUFFIX));
        SourceCatalog catalog = catalogBuilder.build(images[0], segmap);

        logger.info("Loaded brick {}: bands {}, {}x{} px, {} sources", dir.getName(), Arrays.toString(bands),
                segmap[0].length, segmap.length, catalog.size());
        return new Brick(bands, images, anyWeight ? weights : null, masks, psfs, segmap, blobmap, catalog, wcs);
    }
}
