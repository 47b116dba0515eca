package com.farmer.service;

import com.farmer.engine.JointFit;
import com.farmer.model.CatalogRow;
import com.farmer.model.ExpGalaxy;
import com.farmer.model.GalaxyShape;
import com.farmer.model.ModelFamily;
import com.farmer.model.PointSource;
import com.farmer.model.SourceCatalog;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceSeed;
import com.farmer.model.SourceState;
import com.farmer.model.TanWcs;
import com.farmer.model.TrialResult;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ResultProjectionTest {

    private static final String[] BANDS = {"g", "wise w1"};

    private final ResultProjection projection = new ResultProjection();

    private static SourceCatalog parent(int... ids) {
        SourceCatalog c = new SourceCatalog();
        for (int id : ids) c.add(new CatalogRow(id, 0, 0, 1, 1, 1, 0));
        return c;
    }

    /** Blob resuelto a mano: estrella (id 4) y galaxia exponencial (id 9), recorte desplazado a (100, 50). */
    private static Blob solved(SourceCatalog parent, TanWcs wcs) {
        Blob blob = TestBricks.blob(BANDS, new double[2][20][20], 1.0, new int[20][20], 100, 50,
                Arrays.asList(new SourceSeed(4, 5, 5, 100, 1, 0), new SourceSeed(9, 14, 12, 300, 0.5, 20)), parent, wcs);

        SourceModel star = new PointSource(5.5, 4.5, BANDS, new double[]{100, 80});
        SourceModel galaxy = new ExpGalaxy(14, 12, BANDS, new double[]{300, 350}, new GalaxyShape(2.0, 0.5, 20));
        List<SourceModel> models = Arrays.asList(star, galaxy);
        for (SourceState s : blob.getStates()) {
            SourceModel m = models.get(s.index());
            s.record(0, 0, new TrialResult(m.family(), m, 10.0 + s.index()));
            s.capturePositionVariance(0.04, 0.09);
            s.solve(0, 0, false);
            s.setFinalChisq(12.5);
            Map<String, Double> var = new HashMap<>();
            var.put("brightness.g", 16.0);
            var.put("brightness.wise w1", 25.0);
            var.put("shape.re", 0.01);
            var.put("shape.ab", 0.0004);
            var.put("shape.phi", 4.0);
            s.setParameterVariance(var);
        }
        blob.setSolution(new JointFit(blob.getBandImages(), models), false);
        return blob;
    }

    @Test
    public void writesPhotometryPositionAndModel() {
        SourceCatalog catalog = parent(4, 9);
        projection.project(solved(catalog, null));

        CatalogRow star = catalog.find(4).get();
        assertEquals(100, star.getDouble("g"), 0.0);
        assertEquals(4.0, star.getDouble("g_err"), 1e-12);
        assertEquals(12.5, star.getDouble("g_chisq"), 0.0);
        assertEquals(80, star.getDouble("wise_w1"), 0.0);
        assertEquals(5.0, star.getDouble("wise_w1_err"), 1e-12);
        assertTrue(Double.isNaN(star.getDouble("wise_w1_chisq")));

        assertEquals(105.5, star.getDouble("x_model"), 0.0);
        assertEquals(54.5, star.getDouble("y_model"), 0.0);
        assertEquals(0.2, star.getDouble("x_model_err"), 1e-12);
        assertEquals(0.3, star.getDouble("y_model_err"), 1e-12);
        assertEquals("PointSource", star.getString("solmodel"));
        assertEquals(ModelFamily.POINT_SOURCE.id(), star.getDouble("solmodel_id"), 0.0);
        assertFalse(star.has("reff"));
        assertFalse(star.has("RA"));
    }

    @Test
    public void extendedSourcesGetShapeColumns() {
        SourceCatalog catalog = parent(4, 9);
        projection.project(solved(catalog, null));

        CatalogRow galaxy = catalog.find(9).get();
        assertEquals("ExpGalaxy", galaxy.getString("solmodel"));
        assertEquals(2.0, galaxy.getDouble("reff"), 1e-12);
        assertEquals(0.1, galaxy.getDouble("reff_err"), 1e-12);
        assertEquals(0.5, galaxy.getDouble("ab"), 1e-12);
        assertEquals(0.02, galaxy.getDouble("ab_err"), 1e-12);
        assertEquals(20.0, galaxy.getDouble("phi"), 1e-12);
        assertEquals(2.0, galaxy.getDouble("phi_err"), 1e-12);
    }

    @Test
    public void forcedPhotometryErrorsTakePrecedence() {
        SourceCatalog catalog = parent(4, 9);
        Blob blob = solved(catalog, null);
        blob.getStates().get(0).setForcedVariance(new double[]{1.0, 9.0});
        blob.getStates().get(0).setForcedChisq(new double[]{3.0, 4.0});

        Map<String, Object> row = projection.columns(blob).get(4);
        assertEquals(1.0, (Double) row.get("g_err"), 1e-12);
        assertEquals(3.0, (Double) row.get("wise_w1_err"), 1e-12);
        assertEquals(4.0, (Double) row.get("wise_w1_chisq"), 0.0);
    }

    @Test
    public void skyCoordinatesWhenWcsIsKnown() {
        SourceCatalog catalog = parent(4, 9);
        TanWcs wcs = new TanWcs(150.0, 2.0, 106.5, 55.5, -1.0 / 3600, 0, 0, 1.0 / 3600);
        projection.project(solved(catalog, wcs));

        CatalogRow star = catalog.find(4).get();
        assertEquals(150.0, star.getDouble("RA"), 1e-9);
        assertEquals(2.0, star.getDouble("Dec"), 1e-9);
    }

    @Test
    public void unknownSourceIdWritesNothing() {
        SourceCatalog catalog = parent(4);
        try {
            projection.project(solved(catalog, null));
            fail("expected missing id");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("9"));
        }
        assertFalse(catalog.find(4).get().has("x_model"));
    }

    @Test(expected = IllegalStateException.class)
    public void unsolvedBlobHasNothingToProject() {
        Blob blob = TestBricks.blankBlob(BANDS, 10, 10, Arrays.asList(new SourceSeed(1, 5, 5, 10, 1, 0)));
        projection.columns(blob);
    }
}
