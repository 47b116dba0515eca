package com.farmer.model;

// re en píxeles, phi en grados
public record GalaxyShape(double re, double ab, double phi) {}
