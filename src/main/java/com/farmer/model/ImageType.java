package com.farmer.model;

import java.util.Locale;

public enum ImageType {
    IMAGE, MODEL, RESIDUAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ImageType parse(String value) {
        if (value != null) {
            for (ImageType t : values()) if (t.label().equals(value)) return t;
        }
        throw new IllegalArgumentException("image_type must be 'image', 'model' or 'residual', got: " + value);
    }
}
