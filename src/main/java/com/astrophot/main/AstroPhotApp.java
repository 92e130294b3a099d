package com.astrophot.main;

import com.astrophot.ui.PhotometryTab;
import com.astrophot.ui.SettingsTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class AstroPhotApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 AstroPhot - Fotometría Diferencial");

        TabPane tabPane = new TabPane();

        // ORDEN DE PESTAÑAS
        tabPane.getTabs().add(new SettingsTab().create());   // 1. Configurar
        tabPane.getTabs().add(new PhotometryTab().create()); // 2. Curva de luz

        Scene scene = new Scene(tabPane, 1024, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
