package com.farmer.service;

import com.farmer.model.ModelFamily;
import org.junit.Test;

import static org.junit.Assert.*;

public class WinnerDecisionTest {

    private static final double CLOSE = 0.5;

    // --- NIVEL 0 ---

    @Test
    public void pointSourceWinsWhenStrictlyBetter() {
        WinnerDecision d = WinnerDecision.level0(10.0, 12.0);
        assertTrue(d.isSolved());
        assertEquals(ModelFamily.POINT_SOURCE, d.family());
        assertEquals(0, d.level());
        assertEquals(0, d.sublevel());
        assertFalse(d.isFallback());
    }

    @Test
    public void tieAtLevelZeroPromotesToExponential() {
        WinnerDecision d = WinnerDecision.level0(12.0, 12.0);
        assertFalse(d.isSolved());
        assertEquals(WinnerDecision.Outcome.PROMOTE, d.outcome());
        assertEquals(ModelFamily.EXP_GALAXY, d.family());
        assertEquals(1, d.level());
    }

    // --- NIVEL 1 ---

    @Test
    public void nearTieThatDoesNotBeatBaselineResolvesToSimpleGalaxy() {
        WinnerDecision d = WinnerDecision.level1(19.9, 20.0, 20.05, CLOSE);
        assertTrue(d.isSolved());
        assertEquals(ModelFamily.SIMPLE_GALAXY, d.family());
        assertEquals(0, d.level());
        assertEquals(1, d.sublevel());
        assertFalse(d.isFallback());
    }

    @Test
    public void clearExponentialWinner() {
        WinnerDecision d = WinnerDecision.level1(19.9, 15.0, 25.0, CLOSE);
        assertTrue(d.isSolved());
        assertEquals(ModelFamily.EXP_GALAXY, d.family());
        assertEquals(1, d.level());
        assertEquals(0, d.sublevel());
    }

    @Test
    public void clearDevaucouleursWinner() {
        WinnerDecision d = WinnerDecision.level1(19.9, 18.0, 12.0, CLOSE);
        assertEquals(ModelFamily.DEV_GALAXY, d.family());
        assertEquals(1, d.sublevel());
        assertFalse(d.isFallback());
    }

    @Test
    public void nearTieBelowBaselinePromotesToComposite() {
        WinnerDecision d = WinnerDecision.level1(19.9, 15.0, 15.2, CLOSE);
        assertFalse(d.isSolved());
        assertEquals(ModelFamily.COMPOSITE_GALAXY, d.family());
        assertEquals(2, d.level());
    }

    @Test
    public void uncoveredCaseFallsBackToLowestChiSquare() {
        // Casi empate pero solo Exp mejora la referencia
        WinnerDecision d = WinnerDecision.level1(19.9, 19.7, 20.0, CLOSE);
        assertTrue(d.isSolved());
        assertTrue(d.isFallback());
        assertEquals(ModelFamily.EXP_GALAXY, d.family());
    }

    @Test
    public void fallbackTiesGoToTheSimplerFamily() {
        WinnerDecision d = WinnerDecision.level1(19.9, 19.8, 19.8, 0.0);
        // Sin casi-empate (umbral 0) y sin dominancia estricta
        assertTrue(d.isFallback());
        assertEquals(ModelFamily.EXP_GALAXY, d.family());
    }

    // --- NIVEL 2 ---

    @Test
    public void compositeWinsWhenBetterThanBoth() {
        WinnerDecision d = WinnerDecision.level2(15.0, 15.2, 14.0);
        assertEquals(ModelFamily.COMPOSITE_GALAXY, d.family());
        assertEquals(2, d.level());
    }

    @Test
    public void otherwiseTheBetterOfExpAndDevWins() {
        assertEquals(ModelFamily.DEV_GALAXY, WinnerDecision.level2(15.2, 15.0, 15.1).family());
        assertEquals(ModelFamily.EXP_GALAXY, WinnerDecision.level2(15.0, 15.2, 15.1).family());
    }

    @Test
    public void exactExpDevTieAtLevelTwoGoesToExp() {
        WinnerDecision d = WinnerDecision.level2(15.0, 15.0, 16.0);
        assertEquals(ModelFamily.EXP_GALAXY, d.family());
        assertTrue(d.isFallback());
    }
}
