package com.farmer.service;

import com.farmer.engine.LevenbergMarquardtOptimizer;
import com.farmer.model.FitConfig;
import com.farmer.model.FitResult;
import com.farmer.model.ImageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Procesa un blob de principio a fin: extracción, cascada, fotometría forzada, proyección y
 * fotometría de apertura/residuos. Todas las columnas del blob se escriben de una vez al final;
 * un blob fallido no escribe nada.
 */
public class BlobPipeline {
    private static final Logger logger = LoggerFactory.getLogger(BlobPipeline.class);

    public enum Status { FITTED, FAILED, REJECTED }

    public record BlobOutcome(int blobId, Status status, String stage, String reason) {
        static BlobOutcome fitted(int blobId) { return new BlobOutcome(blobId, Status.FITTED, null, null); }
        static BlobOutcome failed(int blobId, String stage, String reason) { return new BlobOutcome(blobId, Status.FAILED, stage, reason); }
        static BlobOutcome rejected(int blobId, String reason) { return new BlobOutcome(blobId, Status.REJECTED, "extraction", reason); }
    }

    private final FitConfig config;
    private final ModelSelectionCascade cascade;
    private final ForcedPhotometry forcedPhotometry;
    private final ResultProjection projection;
    private final AperturePhotometryService aperturePhotometry;
    private final ResidualDetectionService residualDetection;

    public BlobPipeline(FitConfig config, ModelSelectionCascade cascade, ForcedPhotometry forcedPhotometry,
                        ResultProjection projection, AperturePhotometryService aperturePhotometry,
                        ResidualDetectionService residualDetection) {
        this.config = config;
        this.cascade = cascade;
        this.forcedPhotometry = forcedPhotometry;
        this.projection = projection;
        this.aperturePhotometry = aperturePhotometry;
        this.residualDetection = residualDetection;
    }

    /** Pipeline con el optimizador LM y los servicios configurados desde {@link FitConfig}. */
    public static BlobPipeline create(FitConfig config) {
        OptimizationDriver driver = new OptimizationDriver(new LevenbergMarquardtOptimizer(), config.maxSteps, config.convergenceThreshold);
        ImageProcessingService imageService = new ImageProcessingService();
        return new BlobPipeline(config,
                new ModelSelectionCascade(config, driver),
                new ForcedPhotometry(driver),
                new ResultProjection(),
                new AperturePhotometryService(imageService, config.apertureRadiiPixels()),
                new ResidualDetectionService(imageService, config.residualThreshold, config.residualMinArea,
                        config.deblendNThresh, config.deblendCont));
    }

    public BlobOutcome process(Brick brick, int blobId) {
        Blob blob;
        try {
            blob = brick.extractBlob(blobId, config);
        } catch (DegenerateBlobException e) {
            logger.warn("Blob {} skipped: {}", blobId, e.getMessage());
            return BlobOutcome.rejected(blobId, e.getMessage());
        }

        FitResult result = cascade.run(blob);
        if (!result.isSuccess()) return BlobOutcome.failed(blobId, result.stage(), result.reason());

        result = forcedPhotometry.run(blob);
        if (!result.isSuccess()) return BlobOutcome.failed(blobId, result.stage(), result.reason());

        // --- COLUMNAS ---
        Map<Integer, Map<String, Object>> updates = projection.columns(blob);
        for (String band : blob.getBands()) {
            if (config.aperturePhotometry) {
                for (ImageType type : ImageType.values()) {
                    combine(updates, AperturePhotometryService.columns(aperturePhotometry.measure(blob, band, type.label(), false)));
                }
            }
            if (config.residualDetection) {
                combine(updates, ResidualDetectionService.columns(blob, residualDetection.detect(blob, band, false)));
            }
        }
        brick.getCatalog().merge(blobId, updates);
        return BlobOutcome.fitted(blobId);
    }

    static void combine(Map<Integer, Map<String, Object>> target, Map<Integer, Map<String, Object>> extra) {
        extra.forEach((id, values) -> target.computeIfAbsent(id, k -> new HashMap<>()).putAll(values));
    }
}
