package com.farmer.model;

// Posición en coordenadas locales del recorte
public record SourceSeed(int id, double x, double y, double flux, double axisRatio, double theta) {}
