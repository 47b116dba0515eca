package com.farmer.model;

import java.util.List;

/**
 * Detecciones sobre el residuo de una banda; count es el número de fuentes tras la separación por umbrales.
 */
public record ResidualDetection(String band, List<ResidualSource> sources, int count) {}
