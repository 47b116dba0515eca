package com.farmer.model;

public record BackgroundEstimate(double level, double rms) {}
