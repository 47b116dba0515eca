package com.farmer.main;

import com.farmer.ui.BlobFittingTab;
import com.farmer.ui.ConfigurationTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class FarmerApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🌌 Blob Farmer");

        TabPane tabPane = new TabPane();

        // ORDEN DE PESTAÑAS
        tabPane.getTabs().add(new ConfigurationTab().create()); // 1. Configurar
        tabPane.getTabs().add(new BlobFittingTab().create());   // 2. Ajustar brick

        Scene scene = new Scene(tabPane, 1024, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
