package com.farmer.model;

public record ResidualSource(double x, double y, double area, double signal) {}
