package com.farmer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fila del catálogo padre: columnas semilla inmutables más columnas de resultados.
 */
public class CatalogRow {
    public final int id;
    public final double x, y;
    public final double flux;
    public final double a, b;
    public final double theta;

    private final Map<String, Object> columns = new LinkedHashMap<>();

    public CatalogRow(int id, double x, double y, double flux, double a, double b, double theta) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.flux = flux;
        this.a = a;
        this.b = b;
        this.theta = theta;
    }

    public double axisRatio() {
        return a > 0 ? Math.min(1.0, b / a) : 1.0;
    }

    synchronized void putAll(Map<String, Object> values) {
        columns.putAll(values);
    }

    public synchronized Object get(String column) {
        return columns.get(column);
    }

    public synchronized boolean has(String column) {
        return columns.containsKey(column);
    }

    public double getDouble(String column) {
        Object v = get(column);
        if (v == null) throw new IllegalArgumentException("Row " + id + " has no column " + column);
        return ((Number) v).doubleValue();
    }

    public String getString(String column) {
        Object v = get(column);
        return v == null ? null : v.toString();
    }

    public double[] getArray(String column) {
        Object v = get(column);
        if (v == null) throw new IllegalArgumentException("Row " + id + " has no column " + column);
        return ((double[]) v).clone();
    }

    public synchronized Map<String, Object> columns() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
