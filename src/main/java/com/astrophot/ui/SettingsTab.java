package com.astrophot.ui;

import com.astrophot.model.AppConfig;
import com.astrophot.model.ClipStatistic;
import com.astrophot.model.PositionMetric;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.FileChooser;

import java.io.File;

public class SettingsTab {

    // UI Controls
    private ComboBox<PositionMetric> cmbMetric;
    private ComboBox<ClipStatistic> cmbClip;
    private TextField txtTolerance, txtMagWeight;
    private TextField txtMinEnsemble, txtSigma, txtCoverage, txtMaxErr, txtExclusion;
    private TextField txtMinFrames, txtMinPerFrame, txtOutlier;
    private Label lblResults;

    public Tab create() {
        Tab tab = new Tab("⚙️ Configuración");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(700);

        Label title = new Label("🔭 Parámetros de Fotometría");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. MATCHING ---
        GridPane gridMatch = section();
        cmbMetric = new ComboBox<>();
        cmbMetric.getItems().addAll(PositionMetric.values());
        cmbMetric.setValue(AppConfig.getPositionMetric());
        txtTolerance = new TextField(String.valueOf(AppConfig.getMatchTolerance()));
        txtMagWeight = new TextField(String.valueOf(AppConfig.getMagnitudeWeight()));
        gridMatch.add(new Label("Espacio de posiciones:"), 0, 0); gridMatch.add(cmbMetric, 1, 0);
        gridMatch.add(new Label("Tolerancia (arcsec / px):"), 0, 1); gridMatch.add(txtTolerance, 1, 1);
        gridMatch.add(new Label("Peso de magnitud:"), 0, 2); gridMatch.add(txtMagWeight, 1, 2);

        // --- 2. COMPARACIONES ---
        VBox compBox = new VBox(10);
        compBox.setStyle("-fx-border-color: #FF9800; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #FFF3E0;");
        Label lblComp = new Label("⭐ Selección de Comparaciones");
        lblComp.setFont(Font.font("System", FontWeight.BOLD, 13));
        GridPane gridComp = new GridPane();
        gridComp.setHgap(10); gridComp.setVgap(10);
        cmbClip = new ComboBox<>();
        cmbClip.getItems().addAll(ClipStatistic.values());
        cmbClip.setValue(AppConfig.getClipStatistic());
        txtMinEnsemble = new TextField(String.valueOf(AppConfig.getMinEnsembleSize()));
        txtSigma = new TextField(String.valueOf(AppConfig.getSigmaClip()));
        txtCoverage = new TextField(String.valueOf(AppConfig.getMinCoverageFraction()));
        txtMaxErr = new TextField(String.valueOf(AppConfig.getMaxMagnitudeError()));
        gridComp.add(new Label("Estadístico de rechazo:"), 0, 0); gridComp.add(cmbClip, 1, 0);
        gridComp.add(new Label("Sigma clip:"), 0, 1); gridComp.add(txtSigma, 1, 1);
        gridComp.add(new Label("Mínimo de estrellas:"), 0, 2); gridComp.add(txtMinEnsemble, 1, 2);
        gridComp.add(new Label("Cobertura mínima (0-1):"), 0, 3); gridComp.add(txtCoverage, 1, 3);
        gridComp.add(new Label("Error máximo (mag):"), 0, 4); gridComp.add(txtMaxErr, 1, 4);
        txtExclusion = new TextField(AppConfig.getExclusionFile());
        txtExclusion.setPromptText("CSV ra,dec de variables conocidas (opcional)");
        Button btnExclusion = new Button("📂");
        btnExclusion.setOnAction(e -> {
            FileChooser fc = new FileChooser();
            fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv", "*.txt"));
            File f = fc.showOpenDialog(txtExclusion.getScene().getWindow());
            if (f != null) txtExclusion.setText(f.getAbsolutePath());
        });
        gridComp.add(new Label("Excluir coordenadas:"), 0, 5); gridComp.add(new HBox(5, txtExclusion, btnExclusion), 1, 5);
        compBox.getChildren().addAll(lblComp, gridComp);

        // --- 3. CURVA DE LUZ ---
        VBox curveBox = new VBox(10);
        curveBox.setStyle("-fx-border-color: #2196F3; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #E3F2FD;");
        Label lblCurve = new Label("📈 Curva de Luz");
        lblCurve.setFont(Font.font("System", FontWeight.BOLD, 13));
        GridPane gridCurve = new GridPane();
        gridCurve.setHgap(10); gridCurve.setVgap(10);
        txtMinFrames = new TextField(String.valueOf(AppConfig.getMinUsableFrames()));
        txtMinPerFrame = new TextField(String.valueOf(AppConfig.getMinEnsemblePerFrame()));
        txtOutlier = new TextField(String.valueOf(AppConfig.getOutlierSigma()));
        gridCurve.add(new Label("Frames mínimos:"), 0, 0); gridCurve.add(txtMinFrames, 1, 0);
        gridCurve.add(new Label("Comparaciones por frame:"), 0, 1); gridCurve.add(txtMinPerFrame, 1, 1);
        gridCurve.add(new Label("Outliers (sigma, 0 = no):"), 0, 2); gridCurve.add(txtOutlier, 1, 2);
        curveBox.getChildren().addAll(lblCurve, gridCurve);

        // --- FOOTER ---
        lblResults = new Label("");
        lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");

        Button btnSave = new Button("💾 Guardar TODO");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setMaxWidth(Double.MAX_VALUE);
        btnSave.setOnAction(e -> saveAllConfig());

        content.getChildren().addAll(title, gridMatch, compBox, curveBox, btnSave, lblResults);

        // Scroll pane por si la pantalla es chica
        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        scroll.setStyle("-fx-background-color:transparent;");

        root.setCenter(scroll);
        tab.setContent(root);
        return tab;
    }

    private static GridPane section() {
        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(15);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");
        return grid;
    }

    private void saveAllConfig() {
        try {
            double tol = Double.parseDouble(txtTolerance.getText());
            double magW = Double.parseDouble(txtMagWeight.getText());
            int minEns = Integer.parseInt(txtMinEnsemble.getText().trim());
            double sigma = Double.parseDouble(txtSigma.getText());
            double cov = Double.parseDouble(txtCoverage.getText());
            double maxErr = Double.parseDouble(txtMaxErr.getText());
            int minFrames = Integer.parseInt(txtMinFrames.getText().trim());
            int minPerFrame = Integer.parseInt(txtMinPerFrame.getText().trim());
            double outlier = Double.parseDouble(txtOutlier.getText());
            if (tol <= 0 || sigma <= 0 || cov < 0 || cov > 1 || minEns < 1 || minFrames < 1 || minPerFrame < 1 || outlier < 0) {
                lblResults.setText("❌ Valores fuera de rango");
                return;
            }

            // Guardar Matching
            AppConfig.setPositionMetric(cmbMetric.getValue());
            AppConfig.setMatchTolerance(tol);
            AppConfig.setMagnitudeWeight(magW);

            // Guardar Comparaciones
            AppConfig.setClipStatistic(cmbClip.getValue());
            AppConfig.setSigmaClip(sigma);
            AppConfig.setMinEnsembleSize(minEns);
            AppConfig.setMinCoverageFraction(cov);
            AppConfig.setMaxMagnitudeError(maxErr);
            AppConfig.setExclusionFile(txtExclusion.getText().trim());

            // Guardar Curva
            AppConfig.setMinUsableFrames(minFrames);
            AppConfig.setMinEnsemblePerFrame(minPerFrame);
            AppConfig.setOutlierSigma(outlier);

            lblResults.setText("✅ Configuración Guardada");
        } catch (NumberFormatException e) { lblResults.setText("❌ Error en números"); }
    }
}
