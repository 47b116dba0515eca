package com.farmer.service;

/**
 * El blob no se puede ajustar (máscara demasiado dispersa o sin píxeles). El llamador debe saltarlo.
 */
public class DegenerateBlobException extends Exception {

    private final int blobId;

    public DegenerateBlobException(int blobId, String message) {
        super("Blob " + blobId + ": " + message);
        this.blobId = blobId;
    }

    public int getBlobId() {
        return blobId;
    }
}
