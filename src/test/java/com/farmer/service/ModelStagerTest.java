package com.farmer.service;

import com.farmer.model.ExpGalaxy;
import com.farmer.model.ModelFamily;
import com.farmer.model.PointSource;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceSeed;
import com.farmer.model.SourceState;
import com.farmer.model.TrialResult;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class ModelStagerTest {

    private static final String[] BANDS = {"g", "r"};
    private final ModelStager stager = new ModelStager(0.3);

    private Blob blob() {
        return TestBricks.blankBlob(BANDS, 30, 30, Arrays.asList(
                new SourceSeed(1, 8.0, 9.0, 120.0, 0.5, 30.0),
                new SourceSeed(2, 20.0, 18.0, 60.0, 1.0, 0.0)));
    }

    private static void recordFirstTrial(SourceState s, double x, double y) {
        s.record(0, 0, new TrialResult(ModelFamily.POINT_SOURCE, new PointSource(x, y, BANDS, new double[]{1, 1}), 1.0));
    }

    @Test
    public void firstStageBuildsPointSourcesFromTheSeeds() {
        Blob blob = blob();
        List<SourceModel> models = stager.stage(blob);

        assertEquals(2, models.size());
        assertSame(models.get(0), blob.getModelCatalog().get(0));
        SourceModel m = models.get(0);
        assertTrue(m instanceof PointSource);
        assertEquals(8.0, m.getX(), 0.0);
        assertEquals(9.0, m.getY(), 0.0);
        assertArrayEquals(new double[]{120, 120}, m.getFluxes(), 0.0);
        assertFalse(m.isFrozen(SourceModel.POS));
    }

    @Test
    public void galaxyShapeComesFromAxisRatioAndAngle() {
        Blob blob = blob();
        for (SourceState s : blob.getStates()) {
            recordFirstTrial(s, s.seed().x(), s.seed().y());
            s.setFamily(ModelFamily.EXP_GALAXY);
        }
        SourceModel m = stager.stage(blob).get(0);
        assertTrue(m instanceof ExpGalaxy);
        assertEquals(1.0, m.getShape().re(), 0.0);
        assertEquals(0.5, m.getShape().ab(), 0.0);
        assertEquals(30.0, m.getShape().phi(), 0.0);
    }

    @Test
    public void positionsFrozenToFirstTrialOnceNoPointSourceRemains() {
        Blob blob = blob();
        List<SourceState> states = blob.getStates();
        recordFirstTrial(states.get(0), 8.4137, 9.2718);
        recordFirstTrial(states.get(1), 19.5, 18.25);
        states.get(0).setFamily(ModelFamily.SIMPLE_GALAXY);
        states.get(1).setFamily(ModelFamily.SIMPLE_GALAXY);

        assertTrue(ModelStager.positionsFrozen(states));
        List<SourceModel> models = stager.stage(blob);
        assertEquals(states.get(0).trial(0, 0).model().getX(), models.get(0).getX(), 0.0);
        assertEquals(states.get(0).trial(0, 0).model().getY(), models.get(0).getY(), 0.0);
        assertEquals(19.5, models.get(1).getX(), 0.0);
        assertTrue(models.get(0).isFrozen(SourceModel.POS));
        assertTrue(models.get(1).isFrozen(SourceModel.POS));
    }

    @Test
    public void solvedPointSourceKeepsPositionsFree() {
        Blob blob = blob();
        List<SourceState> states = blob.getStates();
        recordFirstTrial(states.get(0), 8.4, 9.3);
        recordFirstTrial(states.get(1), 19.5, 18.25);
        states.get(0).solve(0, 0, false);
        states.get(1).setFamily(ModelFamily.SIMPLE_GALAXY);

        assertFalse(ModelStager.positionsFrozen(states));
        List<SourceModel> models = stager.stage(blob);
        assertEquals(20.0, models.get(1).getX(), 0.0);
        assertFalse(models.get(1).isFrozen(SourceModel.POS));
    }

    @Test(expected = IllegalStateException.class)
    public void freezingWithoutFirstTrialFails() {
        Blob blob = blob();
        for (SourceState s : blob.getStates()) s.setFamily(ModelFamily.DEV_GALAXY);
        stager.stage(blob);
    }

    @Test
    public void stagedModelsAreIndependentOfTheTrialModels() {
        Blob blob = blob();
        for (SourceState s : blob.getStates()) {
            recordFirstTrial(s, 10, 10);
            s.setFamily(ModelFamily.COMPOSITE_GALAXY);
        }
        SourceModel m = stager.stage(blob).get(0);
        m.thawAllParams();
        m.setPosition(0, 0);
        assertEquals(10, blob.getStates().get(0).trial(0, 0).model().getX(), 0.0);
        assertEquals(ModelFamily.COMPOSITE_GALAXY, m.family());
    }
}
