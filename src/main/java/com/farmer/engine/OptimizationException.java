package com.farmer.engine;

/**
 * El optimizador no pudo completar un paso (matriz singular, valores no finitos...).
 */
public class OptimizationException extends Exception {

    public OptimizationException(String message) {
        super(message);
    }

    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
