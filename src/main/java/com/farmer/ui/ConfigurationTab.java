package com.farmer.ui;

import com.farmer.model.AppConfig;
import com.farmer.model.FitConfig;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

import java.util.Locale;

public class ConfigurationTab {

    // UI Controls
    private TextField txtSparseThresh, txtSparseSize, txtBuffer;
    private TextField txtMaxSteps, txtConThresh, txtExpDev;
    private TextField txtPixelScale, txtApertures;
    private TextField txtResThresh, txtResMinArea, txtDeblendN, txtDeblendCont;
    private TextField txtThreads;
    private CheckBox chkAperPhot, chkResidual;
    private Label lblResults;

    public Tab create() {
        Tab tab = new Tab("⚙️ Configuración");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(700);

        Label title = new Label("🔭 Configuración del Ajuste");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. BLOBS ---
        GridPane gridBlob = section();
        txtSparseThresh = new TextField(fmt(AppConfig.getSparseThreshold()));
        txtSparseSize = new TextField(String.valueOf(AppConfig.getSparseSize()));
        txtBuffer = new TextField(String.valueOf(AppConfig.getBlobBuffer()));
        gridBlob.add(new Label("Fracción enmascarada máx.:"), 0, 0); gridBlob.add(txtSparseThresh, 1, 0);
        gridBlob.add(new Label("Tamaño mín. para rechazo (px):"), 0, 1); gridBlob.add(txtSparseSize, 1, 1);
        gridBlob.add(new Label("Margen del recorte (px):"), 0, 2); gridBlob.add(txtBuffer, 1, 2);

        // --- 2. OPTIMIZADOR Y CASCADA ---
        GridPane gridFit = section();
        txtMaxSteps = new TextField(String.valueOf(AppConfig.getMaxSteps()));
        txtConThresh = new TextField(fmt(AppConfig.getConvergenceThreshold()));
        txtExpDev = new TextField(fmt(AppConfig.getExpDevThreshold()));
        gridFit.add(new Label("Pasos máximos:"), 0, 0); gridFit.add(txtMaxSteps, 1, 0);
        gridFit.add(new Label("Umbral de convergencia (dlnp):"), 0, 1); gridFit.add(txtConThresh, 1, 1);
        gridFit.add(new Label("Umbral Exp/Dev (Δχ²):"), 0, 2); gridFit.add(txtExpDev, 1, 2);

        // --- 3. FOTOMETRÍA ---
        GridPane gridPhot = section();
        txtPixelScale = new TextField(fmt(AppConfig.getPixelScale()));
        txtApertures = new TextField(AppConfig.formatList(AppConfig.getApertureRadii()));
        txtApertures.setPromptText("Radios en arcsec, separados por coma");
        chkAperPhot = new CheckBox("Fotometría de apertura");
        chkAperPhot.setSelected(AppConfig.isAperturePhotometry());
        gridPhot.add(new Label("Escala (\"/px):"), 0, 0); gridPhot.add(txtPixelScale, 1, 0);
        gridPhot.add(new Label("Aperturas (\"):"), 0, 1); gridPhot.add(txtApertures, 1, 1);
        gridPhot.add(chkAperPhot, 0, 2, 2, 1);

        // --- 4. RESIDUOS ---
        GridPane gridRes = section();
        txtResThresh = new TextField(fmt(AppConfig.getResidualThreshold()));
        txtResMinArea = new TextField(String.valueOf(AppConfig.getResidualMinArea()));
        txtDeblendN = new TextField(String.valueOf(AppConfig.getDeblendNThresh()));
        txtDeblendCont = new TextField(String.format(Locale.US, "%.4f", AppConfig.getDeblendCont()));
        chkResidual = new CheckBox("Buscar fuentes en el residuo");
        chkResidual.setSelected(AppConfig.isResidualDetection());
        gridRes.add(new Label("Umbral (σ):"), 0, 0); gridRes.add(txtResThresh, 1, 0);
        gridRes.add(new Label("Área mínima (px):"), 0, 1); gridRes.add(txtResMinArea, 1, 1);
        gridRes.add(new Label("Niveles de separación:"), 0, 2); gridRes.add(txtDeblendN, 1, 2);
        gridRes.add(new Label("Contraste mínimo:"), 0, 3); gridRes.add(txtDeblendCont, 1, 3);
        gridRes.add(chkResidual, 0, 4, 2, 1);

        txtThreads = new TextField(String.valueOf(AppConfig.getThreads()));
        HBox threadsBox = new HBox(10, new Label("Hilos de trabajo:"), txtThreads);
        threadsBox.setAlignment(Pos.CENTER_LEFT);

        // --- FOOTER ---
        lblResults = new Label("");
        lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");

        Button btnDefaults = new Button("↩️ Valores por defecto");
        btnDefaults.setOnAction(e -> fill(FitConfig.defaults()));

        Button btnSave = new Button("💾 Guardar TODO");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setMaxWidth(Double.MAX_VALUE);
        btnSave.setOnAction(e -> saveAllConfig());

        content.getChildren().addAll(title,
                header("🧩 Blobs"), gridBlob,
                header("📉 Optimizador y Cascada"), gridFit,
                header("🔆 Fotometría"), gridPhot,
                header("🔍 Residuos"), gridRes,
                threadsBox, btnDefaults, btnSave, lblResults);

        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        scroll.setStyle("-fx-background-color:transparent;");

        root.setCenter(scroll);
        tab.setContent(root);
        return tab;
    }

    private static GridPane section() {
        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(10);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");
        return grid;
    }

    private static Label header(String text) {
        Label l = new Label(text);
        l.setFont(Font.font("System", FontWeight.BOLD, 13));
        return l;
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    private void fill(FitConfig c) {
        txtSparseThresh.setText(fmt(c.sparseThreshold));
        txtSparseSize.setText(String.valueOf(c.sparseSize));
        txtBuffer.setText(String.valueOf(c.blobBuffer));
        txtMaxSteps.setText(String.valueOf(c.maxSteps));
        txtConThresh.setText(fmt(c.convergenceThreshold));
        txtExpDev.setText(fmt(c.expDevThreshold));
        txtPixelScale.setText(fmt(c.pixelScale));
        txtApertures.setText(AppConfig.formatList(c.apertureRadii));
        txtResThresh.setText(fmt(c.residualThreshold));
        txtResMinArea.setText(String.valueOf(c.residualMinArea));
        txtDeblendN.setText(String.valueOf(c.deblendNThresh));
        txtDeblendCont.setText(String.format(Locale.US, "%.4f", c.deblendCont));
        txtThreads.setText(String.valueOf(c.threads));
        chkAperPhot.setSelected(c.aperturePhotometry);
        chkResidual.setSelected(c.residualDetection);
    }

    private void saveAllConfig() {
        FitConfig c;
        try {
            // Se valida todo antes de guardar nada
            c = FitConfig.builder()
                    .sparseThreshold(Double.parseDouble(txtSparseThresh.getText()))
                    .sparseSize(Integer.parseInt(txtSparseSize.getText().trim()))
                    .blobBuffer(Integer.parseInt(txtBuffer.getText().trim()))
                    .maxSteps(Integer.parseInt(txtMaxSteps.getText().trim()))
                    .convergenceThreshold(Double.parseDouble(txtConThresh.getText()))
                    .expDevThreshold(Double.parseDouble(txtExpDev.getText()))
                    .pixelScale(Double.parseDouble(txtPixelScale.getText()))
                    .apertureRadii(AppConfig.parseList(txtApertures.getText()))
                    .residualThreshold(Double.parseDouble(txtResThresh.getText()))
                    .residualMinArea(Integer.parseInt(txtResMinArea.getText().trim()))
                    .deblendNThresh(Integer.parseInt(txtDeblendN.getText().trim()))
                    .deblendCont(Double.parseDouble(txtDeblendCont.getText()))
                    .threads(Integer.parseInt(txtThreads.getText().trim()))
                    .aperturePhotometry(chkAperPhot.isSelected())
                    .residualDetection(chkResidual.isSelected())
                    .build();
        } catch (IllegalArgumentException e) {
            lblResults.setText("❌ Error en números: " + e.getMessage());
            return;
        }

        AppConfig.setSparseThreshold(c.sparseThreshold);
        AppConfig.setSparseSize(c.sparseSize);
        AppConfig.setBlobBuffer(c.blobBuffer);
        AppConfig.setMaxSteps(c.maxSteps);
        AppConfig.setConvergenceThreshold(c.convergenceThreshold);
        AppConfig.setExpDevThreshold(c.expDevThreshold);
        AppConfig.setPixelScale(c.pixelScale);
        AppConfig.setApertureRadii(c.apertureRadii);
        AppConfig.setResidualThreshold(c.residualThreshold);
        AppConfig.setResidualMinArea(c.residualMinArea);
        AppConfig.setDeblendNThresh(c.deblendNThresh);
        AppConfig.setDeblendCont(c.deblendCont);
        AppConfig.setThreads(c.threads);
        AppConfig.setAperturePhotometry(c.aperturePhotometry);
        AppConfig.setResidualDetection(c.residualDetection);

        lblResults.setText(String.format(Locale.US, "✅ Configuración Guardada (galaxia compacta: %.2f px)", c.simpleGalaxyRadius()));
    }
}
