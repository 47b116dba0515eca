package com.farmer.service;

import com.farmer.model.CompositeGalaxy;
import com.farmer.model.DevGalaxy;
import com.farmer.model.ExpGalaxy;
import com.farmer.model.GalaxyShape;
import com.farmer.model.ModelFamily;
import com.farmer.model.PointSource;
import com.farmer.model.SimpleGalaxy;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceSeed;
import com.farmer.model.SourceState;
import com.farmer.model.TrialResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Construye un modelo nuevo por fuente a partir de su familia actual y de la fila del catálogo.
 */
public class ModelStager {

    private static final double INITIAL_RE = 1.0;
    private static final double INITIAL_FRAC_DEV = 0.5;

    private final double simpleGalaxyRadius;

    public ModelStager(double simpleGalaxyRadius) {
        this.simpleGalaxyRadius = simpleGalaxyRadius;
    }

    /**
     * Prepara el catálogo de trabajo del blob. Si ninguna fuente sigue en la etapa de fuente puntual,
     * la posición se toma del ajuste (0,0) y queda congelada.
     */
    public List<SourceModel> stage(Blob blob) {
        List<SourceState> states = blob.getStates();
        String[] bands = blob.getBands();
        boolean freezePosition = positionsFrozen(states);

        List<SourceModel> models = new ArrayList<>(states.size());
        for (SourceState state : states) {
            SourceSeed seed = state.seed();
            double x = seed.x(), y = seed.y();
            if (freezePosition) {
                TrialResult first = state.trial(0, 0);
                if (first == null) {
                    throw new IllegalStateException("Blob " + blob.getBlobId() + ": source " + seed.id() + " has no (0,0) trial to take its position from");
                }
                x = first.model().getX();
                y = first.model().getY();
            }
            double[] fluxes = new double[bands.length];
            Arrays.fill(fluxes, seed.flux());
            GalaxyShape shape = new GalaxyShape(INITIAL_RE, seed.axisRatio(), seed.theta());

            SourceModel model = create(state.family(), x, y, bands, fluxes, shape);
            if (freezePosition) model.freezeParams(SourceModel.POS);
            models.add(model);
        }
        blob.setModelCatalog(models);
        return models;
    }

    public static boolean positionsFrozen(List<SourceState> states) {
        for (SourceState s : states) if (s.family().id() < ModelFamily.SIMPLE_GALAXY.id()) return false;
        return true;
    }

    SourceModel create(ModelFamily family, double x, double y, String[] bands, double[] fluxes, GalaxyShape shape) {
        switch (family) {
            case POINT_SOURCE:
                return new PointSource(x, y, bands, fluxes);
            case SIMPLE_GALAXY:
                return new SimpleGalaxy(x, y, bands, fluxes, simpleGalaxyRadius);
            case EXP_GALAXY:
                return new ExpGalaxy(x, y, bands, fluxes, shape);
            case DEV_GALAXY:
                return new DevGalaxy(x, y, bands, fluxes, shape);
            case COMPOSITE_GALAXY:
                return new CompositeGalaxy(x, y, bands, fluxes, INITIAL_FRAC_DEV, shape, shape);
            default:
                throw new IllegalArgumentException("Unsupported model family " + family);
        }
    }
}
