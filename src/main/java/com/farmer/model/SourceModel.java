package com.farmer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Modelo paramétrico de una fuente. Los parámetros tienen nombre "grupo.campo"
 * (pos.x, brightness.r, shape.re...) y se congelan por grupo.
 */
public abstract class SourceModel {

    public static final String POS = "pos";
    public static final String BRIGHTNESS = "brightness";

    protected final String[] bands;
    protected final String[] names;
    protected final double[] params;
    private final boolean[] frozen;

    protected SourceModel(String[] bands, String[] names, double[] params) {
        if (names.length != params.length) throw new IllegalArgumentException("names/params length mismatch");
        this.bands = bands.clone();
        this.names = names;
        this.params = params;
        this.frozen = new boolean[params.length];
    }

    protected SourceModel(SourceModel other) {
        this.bands = other.bands.clone();
        this.names = other.names.clone();
        this.params = other.params.clone();
        this.frozen = other.frozen.clone();
    }

    public abstract ModelFamily family();

    public abstract SourceModel copy();

    /** Componentes gaussianas de la fuente en una banda, convolucionadas con la PSF. */
    public abstract void addComponents(int band, Psf psf, List<GaussianComponent> out);

    // Recorta parámetros fuera de rango tras un paso del optimizador
    protected void normalize() {}

    public String name() { return family().modelName(); }

    public double getX() { return params[0]; }
    public double getY() { return params[1]; }

    public void setPosition(double x, double y) {
        params[0] = x;
        params[1] = y;
    }

    public int bandCount() { return bands.length; }
    public String[] getBands() { return bands.clone(); }

    public double getFlux(int band) { return params[2 + band]; }

    public double[] getFluxes() {
        return Arrays.copyOfRange(params, 2, 2 + bands.length);
    }

    public void setFluxes(double[] fluxes) {
        if (fluxes.length != bands.length) throw new IllegalArgumentException("Expected " + bands.length + " fluxes");
        System.arraycopy(fluxes, 0, params, 2, fluxes.length);
    }

    /** Forma reportada en el catálogo, o null para fuentes sin forma libre. */
    public GalaxyShape getShape() { return null; }

    /** Prefijo del grupo cuya forma se reporta (shape, shapeExp, shapeDev). */
    public String shapeGroup() { return null; }

    // --- CONGELADO ---

    public void freezeParams(String group) { setFrozen(group, true); }
    public void thawParams(String group) { setFrozen(group, false); }

    public void freezeAllBut(String group) {
        for (int i = 0; i < names.length; i++) frozen[i] = !groupOf(names[i]).equals(group);
    }

    public void thawAllParams() { Arrays.fill(frozen, false); }

    public boolean isFrozen(String group) {
        boolean any = false;
        for (int i = 0; i < names.length; i++) {
            if (groupOf(names[i]).equals(group)) {
                if (!frozen[i]) return false;
                any = true;
            }
        }
        return any;
    }

    private void setFrozen(String group, boolean value) {
        for (int i = 0; i < names.length; i++) if (groupOf(names[i]).equals(group)) frozen[i] = value;
    }

    private static String groupOf(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    // --- PARÁMETROS LIBRES ---

    public int numberOfParams() {
        int n = 0;
        for (boolean f : frozen) if (!f) n++;
        return n;
    }

    public List<String> thawedParameterNames() {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < names.length; i++) if (!frozen[i]) out.add(names[i]);
        return out;
    }

    public double[] getThawedParams() {
        double[] out = new double[numberOfParams()];
        int k = 0;
        for (int i = 0; i < params.length; i++) if (!frozen[i]) out[k++] = params[i];
        return out;
    }

    /** Lee numberOfParams() valores desde offset y los aplica a los parámetros libres. */
    public void setThawedParams(double[] values, int offset) {
        int k = offset;
        for (int i = 0; i < params.length; i++) if (!frozen[i]) params[i] = values[k++];
        normalize();
    }

    public String[] parameterNames() { return names.clone(); }

    protected static String[] concat(String[] a, String[] b) {
        String[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    protected static String[] baseNames(String[] bands) {
        String[] out = new String[2 + bands.length];
        out[0] = "pos.x";
        out[1] = "pos.y";
        for (int b = 0; b < bands.length; b++) out[2 + b] = "brightness." + bands[b];
        return out;
    }

    protected static double[] baseParams(double x, double y, double[] fluxes, int extra) {
        double[] out = new double[2 + fluxes.length + extra];
        out[0] = x;
        out[1] = y;
        System.arraycopy(fluxes, 0, out, 2, fluxes.length);
        return out;
    }

    @Override
    public String toString() {
        return String.format("%s(x=%.2f, y=%.2f, flux=%s)", name(), getX(), getY(), Arrays.toString(getFluxes()));
    }
}
