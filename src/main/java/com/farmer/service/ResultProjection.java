package com.farmer.service;

import com.farmer.model.CelestialPoint;
import com.farmer.model.GalaxyShape;
import com.farmer.model.SourceModel;
import com.farmer.model.SourceState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vuelca la solución de un blob en el catálogo padre: flujos, posiciones, forma, chi² y errores.
 */
public class ResultProjection {

    public Map<Integer, Map<String, Object>> columns(Blob blob) {
        List<SourceModel> solution = blob.getSolutionCatalog();
        if (solution.isEmpty()) throw new IllegalStateException("Blob " + blob.getBlobId() + " has nothing to project");
        String[] bands = blob.getBands();

        Map<Integer, Map<String, Object>> updates = new LinkedHashMap<>();
        for (SourceState s : blob.getStates()) {
            SourceModel m = solution.get(s.index());
            Map<String, Object> row = new LinkedHashMap<>();

            // --- FOTOMETRÍA ---
            double[] forcedVar = s.forcedVariance();
            double[] forcedChisq = s.forcedChisq();
            for (int b = 0; b < bands.length; b++) {
                double var = forcedVar != null ? forcedVar[b]
                        : s.parameterVariance().getOrDefault(SourceModel.BRIGHTNESS + "." + bands[b], Double.NaN);
                String col = bands[b].replace(' ', '_');
                row.put(col, m.getFlux(b));
                row.put(col + "_err", Math.sqrt(var));
                row.put(col + "_chisq", forcedChisq != null ? forcedChisq[b] : (b == 0 ? s.finalChisq() : Double.NaN));
            }

            // --- POSICIÓN ---
            double x = m.getX() + blob.getOffsetX();
            double y = m.getY() + blob.getOffsetY();
            double[] posVar = s.positionVariance();
            row.put("x_model", x);
            row.put("y_model", y);
            row.put("x_model_err", posVar == null ? Double.NaN : Math.sqrt(posVar[0]));
            row.put("y_model_err", posVar == null ? Double.NaN : Math.sqrt(posVar[1]));
            if (blob.getWcs() != null) {
                CelestialPoint sky = blob.getWcs().pixelToWorld(x, y);
                row.put("RA", sky.ra());
                row.put("Dec", sky.dec());
            }

            // --- MODELO ---
            row.put("solmodel", s.family().modelName());
            row.put("solmodel_id", s.family().id());
            row.put("chisq_model", s.finalChisq());

            if (s.family().isExtended()) {
                GalaxyShape shape = m.getShape();
                String group = m.shapeGroup();
                Map<String, Double> var = s.parameterVariance();
                row.put("reff", shape.re());
                row.put("reff_err", Math.sqrt(var.getOrDefault(group + ".re", Double.NaN)));
                row.put("ab", shape.ab());
                row.put("ab_err", Math.sqrt(var.getOrDefault(group + ".ab", Double.NaN)));
                row.put("phi", shape.phi());
                row.put("phi_err", Math.sqrt(var.getOrDefault(group + ".phi", Double.NaN)));
            }
            updates.put(s.sourceId(), row);
        }
        return updates;
    }

    /**
     * Escribe las columnas en el catálogo padre. Un id ausente es un error del llamador y no se escribe nada.
     */
    public void project(Blob blob) {
        blob.getParentCatalog().merge(blob.getBlobId(), columns(blob));
    }
}
