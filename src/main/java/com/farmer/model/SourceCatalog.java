package com.farmer.model;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catálogo padre compartido entre blobs. Las escrituras de un blob se aplican
 * completas bajo el lock del catálogo, o no se aplican.
 */
public class SourceCatalog {

    private final Map<Integer, CatalogRow> rows = new LinkedHashMap<>();

    public synchronized void add(CatalogRow row) {
        if (rows.containsKey(row.id)) throw new IllegalArgumentException("Duplicate source id " + row.id);
        rows.put(row.id, row);
    }

    public synchronized Optional<CatalogRow> find(int id) {
        return Optional.ofNullable(rows.get(id));
    }

    public synchronized boolean contains(int id) {
        return rows.containsKey(id);
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized List<CatalogRow> rows() {
        return new ArrayList<>(rows.values());
    }

    /**
     * Escribe los resultados de un blob. Si algún id no existe no se escribe nada.
     */
    public synchronized void merge(int blobId, Map<Integer, Map<String, Object>> updates) {
        for (Integer id : updates.keySet()) {
            if (!rows.containsKey(id)) {
                throw new IllegalArgumentException("Blob " + blobId + ": source id " + id + " not found in parent catalog");
            }
        }
        updates.forEach((id, values) -> rows.get(id).putAll(values));
    }

    public synchronized List<String> columnNames() {
        Set<String> names = new LinkedHashSet<>();
        for (CatalogRow r : rows.values()) names.addAll(r.columns().keySet());
        return new ArrayList<>(names);
    }

    public void writeCsv(File file) throws IOException {
        List<String> extra = columnNames();
        Collection<CatalogRow> snapshot = rows();
        try (BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            StringBuilder header = new StringBuilder("sid,x,y,flux,a,b,theta");
            for (String c : extra) header.append(',').append(c);
            w.write(header.toString());
            w.newLine();
            for (CatalogRow r : snapshot) {
                StringBuilder line = new StringBuilder();
                line.append(r.id).append(',').append(fmt(r.x)).append(',').append(fmt(r.y)).append(',')
                        .append(fmt(r.flux)).append(',').append(fmt(r.a)).append(',').append(fmt(r.b)).append(',')
                        .append(fmt(r.theta));
                for (String c : extra) line.append(',').append(cell(r.get(c)));
                w.write(line.toString());
                w.newLine();
            }
        }
    }

    private static String cell(Object v) {
        if (v == null) return "";
        if (v instanceof double[]) {
            double[] arr = (double[]) v;
            StringBuilder sb = new StringBuilder("\"");
            for (int i = 0; i < arr.length; i++) {
                if (i > 0) sb.append(' ');
                sb.append(fmt(arr[i]));
            }
            return sb.append('"').toString();
        }
        if (v instanceof Double || v instanceof Float) return fmt(((Number) v).doubleValue());
        return v.toString();
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.6g", v);
    }
}
