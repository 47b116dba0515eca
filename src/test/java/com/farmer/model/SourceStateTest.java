package com.farmer.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class SourceStateTest {

    private static final String[] BANDS = {"r"};

    private SourceState state() {
        return new SourceState(0, new SourceSeed(7, 5, 5, 100, 1.0, 0));
    }

    @Test
    public void startsAsUnsolvedPointSource() {
        SourceState s = state();
        assertEquals(ModelFamily.POINT_SOURCE, s.family());
        assertEquals(0, s.level());
        assertFalse(s.isSolved());
        assertNull(s.trial(0, 0));
    }

    @Test
    public void solveCopiesTheTrialModel() {
        SourceState s = state();
        PointSource ps = new PointSource(5, 5, BANDS, new double[]{100});
        s.record(0, 0, new TrialResult(ModelFamily.POINT_SOURCE, ps, 10.0));
        s.solve(0, 0, false);
        ps.setPosition(0, 0);

        assertTrue(s.isSolved());
        assertEquals(10.0, s.solvedChisq(), 0.0);
        assertEquals(5.0, s.solution().getX(), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void solvedFamilyCannotChange() {
        SourceState s = state();
        s.record(0, 0, new TrialResult(ModelFamily.POINT_SOURCE, new PointSource(5, 5, BANDS, new double[]{1}), 1.0));
        s.solve(0, 0, false);
        s.setFamily(ModelFamily.EXP_GALAXY);
    }

    @Test(expected = IllegalStateException.class)
    public void levelNeverDecreases() {
        SourceState s = state();
        s.advanceTo(1);
        s.advanceTo(0);
    }

    @Test(expected = IllegalStateException.class)
    public void emptyTrialCannotBeSolved() {
        state().solve(1, 0, false);
    }

    @Test
    public void positionVarianceIsCapturedOnce() {
        SourceState s = state();
        s.capturePositionVariance(0.01, 0.02);
        s.capturePositionVariance(5, 5);
        assertArrayEquals(new double[]{0.01, 0.02}, s.positionVariance(), 0.0);
    }
}
