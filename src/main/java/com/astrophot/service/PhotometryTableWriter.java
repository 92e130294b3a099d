package com.astrophot.service;

import com.astrophot.exception.PhotometryException;
import com.astrophot.model.ComparisonEnsemble;
import com.astrophot.model.LightCurve;
import com.astrophot.model.LightCurvePoint;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.StarVariability;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tablas de salida separadas por comas, con cabecera. Los métodos que reciben un {@link Writer}
 * lo dejan abierto.
 */
public class PhotometryTableWriter {

    private static final Logger log = LoggerFactory.getLogger(PhotometryTableWriter.class);

    public static final String CATALOG_FILE = "catalog.csv";
    public static final String ENSEMBLE_FILE = "compsUsed.csv";
    public static final String LIGHT_CURVE_FILE = "lightcurve.csv";
    public static final String VARIABILITY_FILE = "starVariability.csv";

    private final CsvMapper mapper = new CsvMapper();

    public PhotometryTableWriter() {
        // el Writer recibido queda abierto
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    // --- FILAS ---
    @JsonPropertyOrder({"starId", "ra", "dec", "x", "y", "meanMagnitude", "observations", "target"})
    public static class CatalogRow {
        public final int starId;
        public final double ra, dec, x, y;
        public final double meanMagnitude;
        public final int observations;
        public final boolean target;

        public CatalogRow(int starId, double ra, double dec, double x, double y, double meanMagnitude,
                          int observations, boolean target) {
            this.starId = starId;
            this.ra = ra;
            this.dec = dec;
            this.x = x;
            this.y = y;
            this.meanMagnitude = meanMagnitude;
            this.observations = observations;
            this.target = target;
        }
    }

    @JsonPropertyOrder({"rank", "starId", "weight", "scatter", "statistic", "degraded"})
    public static class EnsembleRow {
        public final int rank;
        public final int starId;
        public final double weight, scatter, statistic;
        public final boolean degraded;

        public EnsembleRow(int rank, int starId, double weight, double scatter, double statistic, boolean degraded) {
            this.rank = rank;
            this.starId = starId;
            this.weight = weight;
            this.scatter = scatter;
            this.statistic = statistic;
            this.degraded = degraded;
        }
    }

    @JsonPropertyOrder({"frameId", "timestamp", "differentialMagnitude", "error", "flag", "targetMagnitude",
            "ensembleMagnitude", "comparisonsUsed"})
    public static class LightCurveRow {
        public final String frameId;
        public final double timestamp, differentialMagnitude, error;
        public final String flag;
        public final double targetMagnitude, ensembleMagnitude;
        public final int comparisonsUsed;

        public LightCurveRow(String frameId, double timestamp, double differentialMagnitude, double error,
                             String flag, double targetMagnitude, double ensembleMagnitude, int comparisonsUsed) {
            this.frameId = frameId;
            this.timestamp = timestamp;
            this.differentialMagnitude = differentialMagnitude;
            this.error = error;
            this.flag = flag;
            this.targetMagnitude = targetMagnitude;
            this.ensembleMagnitude = ensembleMagnitude;
            this.comparisonsUsed = comparisonsUsed;
        }
    }

    @JsonPropertyOrder({"starId", "ra", "dec", "medianMagnitude", "standardDeviation", "observations"})
    public static class VariabilityRow {
        public final int starId;
        public final double ra, dec;
        public final double medianMagnitude, standardDeviation;
        public final int observations;

        public VariabilityRow(int starId, double ra, double dec, double medianMagnitude, double standardDeviation,
                              int observations) {
            this.starId = starId;
            this.ra = ra;
            this.dec = dec;
            this.medianMagnitude = medianMagnitude;
            this.standardDeviation = standardDeviation;
            this.observations = observations;
        }
    }

    public void writeCatalog(MasterCatalog catalog, Writer out) throws IOException {
        List<CatalogRow> rows = new ArrayList<>();
        for (MasterStar s : catalog.stars())
            rows.add(new CatalogRow(s.id(), s.ra(), s.dec(), s.x(), s.y(), s.meanMagnitude(), s.coverage(),
                    s.id() == catalog.targetId()));
        write(rows, CatalogRow.class, out);
    }

    public void writeEnsemble(ComparisonEnsemble ensemble, Writer out) throws IOException {
        List<EnsembleRow> rows = new ArrayList<>();
        for (ComparisonEnsemble.Member m : ensemble.members)
            rows.add(new EnsembleRow(m.rank, m.starId, m.weight, m.scatter, m.statistic, ensemble.degraded));
        write(rows, EnsembleRow.class, out);
    }

    public void writeLightCurve(LightCurve curve, Writer out) throws IOException {
        List<LightCurveRow> rows = new ArrayList<>();
        for (LightCurvePoint p : curve.points)
            rows.add(new LightCurveRow(p.frameId, p.timestamp, p.differentialMagnitude, p.error,
                    p.flag.name(), p.targetMagnitude, p.ensembleMagnitude, p.comparisonsUsed));
        write(rows, LightCurveRow.class, out);
    }

    public void writeVariability(List<StarVariability> variability, Writer out) throws IOException {
        List<VariabilityRow> rows = new ArrayList<>();
        for (StarVariability v : variability)
            rows.add(new VariabilityRow(v.starId, v.ra, v.dec, v.medianMagnitude, v.standardDeviation,
                    v.observations));
        write(rows, VariabilityRow.class, out);
    }

    /** Escribe las cuatro tablas en la carpeta indicada; la de variabilidad solo si hay datos. */
    public List<Path> writeAll(MasterCatalog catalog, ComparisonEnsemble ensemble, LightCurve curve,
                               List<StarVariability> variability, Path folder) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(folder);
            Path p = folder.resolve(CATALOG_FILE);
            try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) { writeCatalog(catalog, w); }
            written.add(p);

            p = folder.resolve(ENSEMBLE_FILE);
            try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) { writeEnsemble(ensemble, w); }
            written.add(p);

            p = folder.resolve(LIGHT_CURVE_FILE);
            try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) { writeLightCurve(curve, w); }
            written.add(p);

            if (!variability.isEmpty()) {
                p = folder.resolve(VARIABILITY_FILE);
                try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) { writeVariability(variability, w); }
                written.add(p);
            }
        } catch (IOException e) {
            throw new PhotometryException("No se pudieron escribir las tablas en " + folder, e);
        }
        log.info("Exportadas {} tablas en {}", written.size(), folder);
        return written;
    }

    private <T> void write(List<T> rows, Class<T> type, Writer out) throws IOException {
        CsvSchema schema = mapper.schemaFor(type).withHeader();
        try (SequenceWriter writer = mapper.writer(schema).writeValues(out)) {
            for (T row : rows) writer.write(row);
            writer.flush();
        }
    }
}
