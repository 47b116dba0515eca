package com.farmer.ui;

import com.farmer.model.AppConfig;
import com.farmer.model.FitConfig;
import com.farmer.service.BlobPipeline;
import com.farmer.service.BlobPipeline.BlobOutcome;
import com.farmer.service.Brick;
import com.farmer.service.BrickLoader;
import com.farmer.service.BrickProcessor;
import com.farmer.service.CatalogBuilder;
import com.farmer.service.FitsImageService;
import javafx.application.Platform;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class BlobFittingTab {
    private static final Logger logger = LoggerFactory.getLogger(BlobFittingTab.class);

    private final BrickLoader loader = new BrickLoader(new FitsImageService(), new CatalogBuilder());

    private Task<BrickProcessor.Summary> currentTask;
    private BrickProcessor processor;
    private Brick brick;

    // UI Controls
    private TextField txtInput, txtBands;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnStop, btnExport;
    private Label lblStatTotal, lblStatFitted, lblStatFailed, lblStatRejected;

    public Tab create() {
        Tab tab = new Tab("🌌 Ajuste de Blobs");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        VBox topContainer = new VBox(10);

        HBox folderBox = new HBox(10);
        folderBox.setAlignment(Pos.CENTER_LEFT);
        txtInput = new TextField(AppConfig.getLastBrickDir());
        txtInput.setPromptText("Carpeta del brick...");
        txtInput.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Seleccionar");
        btnBrowse.setOnAction(e -> browseDir(txtInput));
        folderBox.getChildren().addAll(new Label("Carpeta FITS:"), txtInput, btnBrowse);

        HBox bandsBox = new HBox(10);
        bandsBox.setAlignment(Pos.CENTER_LEFT);
        txtBands = new TextField();
        txtBands.setPromptText("Vacío = todas las bandas (orden alfabético)");
        txtBands.setPrefWidth(350);
        bandsBox.getChildren().addAll(new Label("Bandas:"), txtBands);

        topContainer.getChildren().addAll(folderBox, bandsBox, new Separator());

        // --- STATS DASHBOARD ---
        VBox statsPanel = new VBox(10);
        statsPanel.setPadding(new Insets(10));
        statsPanel.setPrefWidth(220);
        statsPanel.setStyle("-fx-background-color: #f4f4f4; -fx-border-color: #ccc; -fx-border-width: 0 0 0 1;");
        Label lblTitleStats = new Label("📊 Estadísticas");
        lblTitleStats.setStyle("-fx-font-weight: bold; -fx-font-size: 14px; -fx-text-fill: #2c3e50;");
        lblStatTotal = new Label("Blobs: -");
        lblStatFitted = new Label("✅ Ajustados: -"); lblStatFitted.setStyle("-fx-text-fill: green;");
        lblStatFailed = new Label("❌ Fallidos: -"); lblStatFailed.setStyle("-fx-text-fill: red;");
        lblStatRejected = new Label("⚠️ Descartados: -"); lblStatRejected.setStyle("-fx-text-fill: #E65100;");
        btnExport = new Button("💾 Exportar catálogo CSV");
        btnExport.setDisable(true);
        btnExport.setOnAction(e -> exportCatalog());
        statsPanel.getChildren().addAll(lblTitleStats, lblStatTotal, lblStatFitted, lblStatFailed, lblStatRejected, new Separator(), btnExport);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        SplitPane splitPane = new SplitPane();
        splitPane.getItems().addAll(logArea, statsPanel);
        splitPane.setDividerPositions(0.75);

        btnStart = new Button("🚀 INICIAR AJUSTE");
        btnStart.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnStart.setMaxWidth(Double.MAX_VALUE);

        btnStop = new Button("🛑 DETENER");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setDisable(true);
        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        root.setTop(topContainer);
        root.setCenter(splitPane);
        root.setBottom(new VBox(5, new HBox(10, btnStart, btnStop), progressBar));

        btnStart.setOnAction(e -> startFitting());
        btnStop.setOnAction(e -> detenerProceso());

        tab.setContent(root);
        return tab;
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void detenerProceso() {
        btnStop.setDisable(true);
        if (processor != null) processor.stop();
        if (currentTask != null) currentTask.cancel();
    }

    private void startFitting() {
        File dir = new File(txtInput.getText().trim());
        if (!dir.isDirectory()) {
            logArea.appendText("❌ Carpeta no válida: " + dir + "\n");
            return;
        }
        AppConfig.setLastBrickDir(dir.getAbsolutePath());
        String bandText = txtBands.getText().trim();
        String[] bands = bandText.isEmpty() ? BrickLoader.discoverBands(dir) : bandText.split("\\s*,\\s*");

        FitConfig config = AppConfig.toFitConfig();
        processor = new BrickProcessor(BlobPipeline.create(config), config.threads);

        btnStart.setDisable(true); btnStop.setDisable(false); btnExport.setDisable(true);
        lblStatFitted.setText("✅ Ajustados: 0");
        lblStatFailed.setText("❌ Fallidos: 0");
        lblStatRejected.setText("⚠️ Descartados: 0");

        currentTask = new Task<>() {
            @Override protected BrickProcessor.Summary call() throws Exception {
                Platform.runLater(() -> logArea.appendText("📥 Cargando brick " + dir.getName() + "...\n"));
                brick = loader.load(dir, bands);
                List<Integer> ids = brick.blobIds();
                Platform.runLater(() -> {
                    lblStatTotal.setText("Blobs: " + ids.size());
                    logArea.appendText("🔬 Ajustando " + ids.size() + " blobs con " + config.threads + " hilos...\n");
                });

                AtomicInteger processed = new AtomicInteger(0);
                AtomicInteger fitted = new AtomicInteger(0);
                AtomicInteger failed = new AtomicInteger(0);
                AtomicInteger rejected = new AtomicInteger(0);
                return processor.process(brick, ids, outcome -> {
                    switch (outcome.status()) {
                        case FITTED: fitted.incrementAndGet(); break;
                        case FAILED: failed.incrementAndGet(); break;
                        default: rejected.incrementAndGet();
                    }
                    String msg = describe(outcome);
                    int f = fitted.get(), x = failed.get(), r = rejected.get();
                    Platform.runLater(() -> {
                        logArea.appendText(msg + "\n");
                        lblStatFitted.setText("✅ Ajustados: " + f);
                        lblStatFailed.setText("❌ Fallidos: " + x);
                        lblStatRejected.setText("⚠️ Descartados: " + r);
                    });
                    updateProgress(processed.incrementAndGet(), ids.size());
                });
            }
        };
        progressBar.progressProperty().bind(currentTask.progressProperty());
        currentTask.setOnSucceeded(e -> {
            BrickProcessor.Summary s = currentTask.getValue();
            finish(String.format("🏁 FIN: %d ajustados, %d fallidos, %d descartados.", s.fitted, s.failed, s.rejected));
            btnExport.setDisable(false);
        });
        currentTask.setOnFailed(e -> {
            Throwable ex = currentTask.getException();
            logger.error("Brick {} failed", dir, ex);
            finish("❌ Error: " + ex.getMessage());
        });
        currentTask.setOnCancelled(e -> finish("🛑 Proceso detenido."));
        new Thread(currentTask).start();
    }

    private void finish(String message) {
        progressBar.progressProperty().unbind();
        btnStart.setDisable(false);
        btnStop.setDisable(true);
        logArea.appendText(message + "\n");
    }

    private static String describe(BlobOutcome o) {
        switch (o.status()) {
            case FITTED: return "Blob " + o.blobId() + " -> ✅ OK";
            case FAILED: return "Blob " + o.blobId() + " -> ❌ FALLO en " + o.stage() + ": " + o.reason();
            default: return "Blob " + o.blobId() + " -> ⚠️ DESCARTADO (" + o.reason() + ")";
        }
    }

    private void exportCatalog() {
        if (brick == null) return;
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv"));
        fc.setInitialFileName("catalog.csv");
        File f = fc.showSaveDialog(logArea.getScene().getWindow());
        if (f == null) return;
        try {
            brick.getCatalog().writeCsv(f);
            logArea.appendText("💾 Catálogo guardado en " + f.getAbsolutePath() + "\n");
        } catch (IOException e) {
            logger.error("Could not write catalog to {}", f, e);
            logArea.appendText("❌ No se pudo guardar el catálogo: " + e.getMessage() + "\n");
        }
    }
}
