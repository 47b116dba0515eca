package com.farmer.model;

public record CelestialPoint(double ra, double dec) {}
