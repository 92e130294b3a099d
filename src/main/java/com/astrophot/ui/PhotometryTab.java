package com.astrophot.ui;

import com.astrophot.exception.PhotometryException;
import com.astrophot.model.AppConfig;
import com.astrophot.model.CelestialPoint;
import com.astrophot.model.Frame;
import com.astrophot.model.LightCurvePoint;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PhotometryResult;
import com.astrophot.service.ExclusionListReader;
import com.astrophot.service.FrameIngestService;
import com.astrophot.service.PhotometryPipeline;
import com.astrophot.service.PhotometryTableWriter;
import com.astrophot.service.SimbadService;
import javafx.application.Platform;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.DirectoryChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class PhotometryTab {

    private static final Logger log = LoggerFactory.getLogger(PhotometryTab.class);

    private static final String OUTPUT_FOLDER = "astrophot";

    private final SimbadService simbadService = new SimbadService();
    private final FrameIngestService ingestService = new FrameIngestService();
    private final PhotometryPipeline pipeline = new PhotometryPipeline();
    private final PhotometryTableWriter tableWriter = new PhotometryTableWriter();
    private final ExclusionListReader exclusionReader = new ExclusionListReader();

    private Task<PhotometryResult> currentTask;
    private PhotometryResult lastResult;

    // UI Controls
    private TextField txtInput;
    private TextField txtRa, txtDec, txtObjectName;
    private CheckBox chkSurvey;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnStop, btnSearchSim, btnExport;
    private TableView<LightCurvePoint> table;

    // Stats UI Controls
    private Label lblStatFrames, lblStatStars, lblStatComps;
    private Label lblStatPoints, lblStatGaps, lblStatZero, lblStatRms;

    public Tab create() {
        Tab tab = new Tab("📈 Fotometría");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        VBox topContainer = new VBox(10);

        HBox folderBox = new HBox(10);
        folderBox.setAlignment(Pos.CENTER_LEFT);
        txtInput = new TextField(AppConfig.getLastFolder());
        txtInput.setPromptText("Carpeta con CSV o FITS...");
        txtInput.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Seleccionar");
        btnBrowse.setOnAction(e -> browseDir(txtInput));
        folderBox.getChildren().addAll(new Label("Carpeta:"), txtInput, btnBrowse);

        // --- OBJETIVO ---
        VBox targetGroup = new VBox(8);
        targetGroup.setStyle("-fx-border-color: #DDD; -fx-padding: 10; -fx-background-radius: 5; -fx-border-radius: 5;");
        Label lblTarget = new Label("🎯 Objetivo");
        lblTarget.setStyle("-fx-font-weight: bold;");

        HBox targetBox = new HBox(10);
        targetBox.setAlignment(Pos.CENTER_LEFT);
        txtObjectName = new TextField(AppConfig.getLastObject()); txtObjectName.setPrefWidth(120);
        btnSearchSim = new Button("🔍");
        btnSearchSim.setOnAction(e -> buscarEnSimbad());
        txtRa = new TextField("0.000"); txtRa.setPrefWidth(90);
        txtDec = new TextField("0.000"); txtDec.setPrefWidth(90);
        targetBox.getChildren().addAll(new Label("Obj:"), txtObjectName, btnSearchSim, new Label("RA:"), txtRa, new Label("DEC:"), txtDec);

        chkSurvey = new CheckBox("Relevar variabilidad de todo el campo");
        targetGroup.getChildren().addAll(lblTarget, targetBox, chkSurvey);
        topContainer.getChildren().addAll(folderBox, targetGroup, new Separator());

        // --- STATS DASHBOARD ---
        VBox statsPanel = new VBox(10);
        statsPanel.setPadding(new Insets(10));
        statsPanel.setPrefWidth(220);
        statsPanel.setStyle("-fx-background-color: #f4f4f4; -fx-border-color: #ccc; -fx-border-width: 0 0 0 1;");
        Label lblTitleStats = new Label("📊 Resultado");
        lblTitleStats.setStyle("-fx-font-weight: bold; -fx-font-size: 14px; -fx-text-fill: #2c3e50;");
        lblStatFrames = new Label("Frames: -");
        lblStatStars = new Label("Estrellas: -");
        lblStatComps = new Label("Comparaciones: -");
        lblStatPoints = new Label("✅ Puntos: -"); lblStatPoints.setStyle("-fx-text-fill: green;");
        lblStatGaps = new Label("❌ Huecos: -"); lblStatGaps.setStyle("-fx-text-fill: red;");
        lblStatZero = new Label("Punto cero: -");
        lblStatRms = new Label("Dispersión: -");
        statsPanel.getChildren().addAll(lblTitleStats, lblStatFrames, lblStatStars, lblStatComps, new Separator(),
                lblStatPoints, lblStatGaps, lblStatZero, lblStatRms);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        table = createTable();
        SplitPane left = new SplitPane(table, logArea);
        left.setOrientation(javafx.geometry.Orientation.VERTICAL);
        left.setDividerPositions(0.6);

        SplitPane splitPane = new SplitPane();
        splitPane.getItems().addAll(left, statsPanel);
        splitPane.setDividerPositions(0.75);

        btnStart = new Button("🚀 CALCULAR CURVA DE LUZ");
        btnStart.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnStart.setMaxWidth(Double.MAX_VALUE);
        HBox.setHgrow(btnStart, Priority.ALWAYS);

        btnStop = new Button("🛑 DETENER");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setDisable(true);

        btnExport = new Button("💾 Exportar CSV");
        btnExport.setDisable(true);

        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        root.setTop(topContainer);
        root.setCenter(splitPane);
        root.setBottom(new VBox(5, new HBox(10, btnStart, btnStop, btnExport), progressBar));

        btnStart.setOnAction(e -> startProcessing());
        btnStop.setOnAction(e -> detenerProceso());
        btnExport.setOnAction(e -> exportar());

        tab.setContent(root);
        return tab;
    }

    private TableView<LightCurvePoint> createTable() {
        TableView<LightCurvePoint> tv = new TableView<>();
        tv.getColumns().add(column("Frame", p -> p.frameId));
        tv.getColumns().add(column("MJD", p -> String.format(Locale.US, "%.5f", p.timestamp)));
        tv.getColumns().add(column("Δmag", p -> String.format(Locale.US, "%+.4f", p.differentialMagnitude)));
        tv.getColumns().add(column("Error", p -> String.format(Locale.US, "%.4f", p.error)));
        tv.getColumns().add(column("Comps", p -> String.valueOf(p.comparisonsUsed)));
        TableColumn<LightCurvePoint, Object> flag = new TableColumn<>("Calidad");
        flag.setCellValueFactory(c -> new ReadOnlyObjectWrapper<>(c.getValue().flag));
        tv.getColumns().add(flag);
        tv.setColumnResizePolicy(TableView.CONSTRAINED_RESIZE_POLICY);
        return tv;
    }

    private static TableColumn<LightCurvePoint, String> column(String title,
                                                               java.util.function.Function<LightCurvePoint, String> f) {
        TableColumn<LightCurvePoint, String> c = new TableColumn<>(title);
        c.setCellValueFactory(cell -> new ReadOnlyStringWrapper(f.apply(cell.getValue())));
        return c;
    }

    private void detenerProceso() {
        btnStop.setDisable(true);
        if (currentTask != null) currentTask.cancel();
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void buscarEnSimbad() {
        String name = txtObjectName.getText().trim();
        if (name.isEmpty()) { logArea.appendText("⚠️ Ingresa un nombre.\n"); return; }
        logArea.appendText("🔍 Buscando '" + name + "'...\n");
        btnSearchSim.setDisable(true);
        new Thread(() -> {
            Optional<CelestialPoint> cp = simbadService.search(name);
            Platform.runLater(() -> {
                if (cp.isPresent()) {
                    txtRa.setText(String.format(Locale.US, "%.5f", cp.get().ra));
                    txtDec.setText(String.format(Locale.US, "%.5f", cp.get().dec));
                    AppConfig.setLastObject(name);
                    logArea.appendText("✅ SIMBAD: Encontrado (RA " + String.format("%.4f", cp.get().ra) + ")\n");
                } else logArea.appendText("❌ SIMBAD: No encontrado.\n");
                btnSearchSim.setDisable(false);
            });
        }).start();
    }

    private void startProcessing() {
        String path = txtInput.getText();
        if (path == null || path.isEmpty()) { logArea.appendText("⚠️ Selecciona carpeta.\n"); return; }

        PhotometryConfig cfg;
        try {
            CelestialPoint target = new CelestialPoint(Double.parseDouble(txtRa.getText().trim()),
                    Double.parseDouble(txtDec.getText().trim()));
            List<CelestialPoint> excluded = List.of();
            String exclusionFile = AppConfig.getExclusionFile();
            if (!exclusionFile.isBlank()) {
                excluded = exclusionReader.read(Path.of(exclusionFile));
                logArea.appendText("🚫 Excluidas como comparación: " + excluded.size() + " coordenadas\n");
            }
            cfg = AppConfig.toPhotometryConfig(target, excluded);
        } catch (PhotometryException e) {
            logArea.appendText("❌ " + e.getMessage() + "\n");
            return;
        } catch (IllegalArgumentException e) {
            logArea.appendText("❌ Parámetros inválidos: " + e.getMessage() + "\n");
            return;
        }
        AppConfig.setLastFolder(path);
        final Path folder = Path.of(path);
        final boolean survey = chkSurvey.isSelected();

        btnStart.setDisable(true); btnStop.setDisable(false); btnExport.setDisable(true);
        logArea.clear();
        table.getItems().clear();

        currentTask = new Task<>() {
            @Override protected PhotometryResult call() {
                updateProgress(-1, 1);
                Platform.runLater(() -> logArea.appendText("📡 FASE 1: Cargando frames de " + folder.getFileName() + "...\n"));
                List<Frame> frames = ingestService.loadFolder(folder);
                if (isCancelled()) return null;
                Platform.runLater(() -> logArea.appendText("🔬 FASE 2: Fotometría diferencial sobre " + frames.size() + " frames...\n"));
                return pipeline.run(frames, cfg, survey);
            }
        };
        progressBar.progressProperty().bind(currentTask.progressProperty());
        currentTask.setOnSucceeded(e -> {
            finish();
            PhotometryResult r = currentTask.getValue();
            if (r != null) showResult(r);
        });
        currentTask.setOnFailed(e -> {
            finish();
            Throwable ex = currentTask.getException();
            if (ex instanceof PhotometryException) logArea.appendText("❌ " + ex.getMessage() + "\n");
            else {
                log.error("Fallo inesperado en la corrida", ex);
                logArea.appendText("❌ Error inesperado: " + ex + "\n");
            }
        });
        currentTask.setOnCancelled(e -> { finish(); logArea.appendText("🛑 Cancelado.\n"); });
        new Thread(currentTask, "photometry-run").start();
    }

    private void finish() {
        progressBar.progressProperty().unbind();
        progressBar.setProgress(0);
        btnStart.setDisable(false);
        btnStop.setDisable(true);
    }

    private void showResult(PhotometryResult r) {
        lastResult = r;
        table.getItems().setAll(r.lightCurve.points);

        double[] diffs = r.lightCurve.points.stream().mapToDouble((LightCurvePoint p) -> p.differentialMagnitude).toArray();
        double mean = 0; for (double d : diffs) mean += d;
        mean /= Math.max(1, diffs.length);
        double sumSq = 0; for (double d : diffs) sumSq += Math.pow(d - mean, 2);
        double rms = Math.sqrt(sumSq / Math.max(1, diffs.length));

        lblStatFrames.setText("Frames: " + r.catalog.frames().size() + " (" + r.catalog.skippedFrameIds().size() + " vacíos)");
        lblStatStars.setText("Estrellas: " + r.catalog.stars().size() + " | Obj: #" + r.catalog.targetId());
        lblStatComps.setText("Comparaciones: " + r.ensemble.size() + (r.isDegraded() ? " ⚠️ degradado" : ""));
        lblStatPoints.setText("✅ Puntos: " + r.lightCurve.size());
        lblStatGaps.setText("❌ Huecos: " + r.lightCurve.gaps.size());
        lblStatZero.setText(String.format("Punto cero: %.4f", r.lightCurve.zeroPoint));
        lblStatRms.setText(String.format("Dispersión: %.4f mag", rms));

        for (var gap : r.lightCurve.gaps)
            logArea.appendText(gap.frameId + " -> ❌ " + gap.reason + "\n");
        if (r.isDegraded()) logArea.appendText("⚠️ Ensemble degradado: pocas estrellas estables, pesos uniformes.\n");
        if (!r.variability.isEmpty()) logArea.appendText("📊 Variabilidad relevada en " + r.variability.size() + " estrellas.\n");
        logArea.appendText("🏁 FIN PROCESO.\n");
        btnExport.setDisable(false);
    }

    private void exportar() {
        if (lastResult == null) return;
        Path out = Path.of(txtInput.getText(), OUTPUT_FOLDER);
        try {
            List<Path> files = tableWriter.writeAll(lastResult.catalog, lastResult.ensemble, lastResult.lightCurve,
                    lastResult.variability, out);
            logArea.appendText("💾 Exportadas " + files.size() + " tablas en " + out + "\n");
        } catch (PhotometryException e) {
            logArea.appendText("❌ " + e.getMessage() + "\n");
        }
    }
}
