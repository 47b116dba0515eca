package com.farmer.model;

public record TrialResult(ModelFamily family, SourceModel model, double chisq) {}
