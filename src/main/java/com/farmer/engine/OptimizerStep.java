package com.farmer.engine;

public record OptimizerStep(double dlnp, double[] variance) {}
