package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tablas de fotometría en CSV sin cabecera: {@code ra, dec, x, y, counts, countsErr}.
 * Los metadatos salen del nombre {@code OBJETO_FILTRO_EXPTIME_FECHA_AIRMASS_MJD_INSTRUMENTO.csv},
 * con 'a' y 'd' como separador decimal en airmass y MJD.
 */
public class PhotometryFileReader {

    private static final Logger log = LoggerFactory.getLogger(PhotometryFileReader.class);

    private static final int COLUMNS = 6;

    private final CsvMapper mapper = new CsvMapper();

    public PhotometryFileReader() {
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    /** Metadatos extraídos del nombre de archivo. */
    public static class FileMetadata {
        public final String object;
        public final String filter;
        public final double exposure;
        public final double airmass;
        public final double mjd;

        public FileMetadata(String object, String filter, double exposure, double airmass, double mjd) {
            this.object = object;
            this.filter = filter;
            this.exposure = exposure;
            this.airmass = airmass;
            this.mjd = mjd;
        }
    }

    public Frame read(Path file) {
        FileMetadata meta = parseFileName(file.getFileName().toString());
        return read(file, frameId(file), meta.mjd, meta.airmass, meta.filter);
    }

    public Frame read(Path file, String frameId, double mjd, double airmass, String filter) {
        List<Detection> detections = new ArrayList<>();
        int rejected = 0, line = 0;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {
            while (it.hasNext()) {
                String[] row = it.next();
                line++;
                if (row.length == 0 || (row.length == 1 && row[0].isBlank())) continue;
                if (row.length < COLUMNS)
                    throw new PhotometryIngestException(file.getFileName() + ":" + line + " tiene " + row.length
                            + " columnas, se esperaban " + COLUMNS);
                double[] v;
                try {
                    v = parse(row);
                } catch (NumberFormatException e) {
                    if (line == 1) continue; // cabecera
                    throw new PhotometryIngestException(file.getFileName() + ":" + line + " valor no numérico", e);
                }
                Detection d = toDetection(frameId, v);
                if (d == null) rejected++;
                else detections.add(d);
            }
        } catch (IOException e) {
            throw new PhotometryIngestException("No se pudo leer " + file, e);
        }
        if (rejected > 0) log.warn("{}: {} filas descartadas (coordenadas fuera de rango o flujo no positivo)",
                file.getFileName(), rejected);
        log.debug("{}: {} detecciones, MJD {}", file.getFileName(), detections.size(), mjd);
        return new Frame(frameId, mjd, detections, airmass, filter);
    }

    private static double[] parse(String[] row) {
        double[] v = new double[COLUMNS];
        for (int i = 0; i < COLUMNS; i++) v[i] = Double.parseDouble(row[i].trim());
        return v;
    }

    // Fila inválida -> null
    static Detection toDetection(String frameId, double[] v) {
        double ra = v[0], dec = v[1], counts = v[4], countsErr = v[5];
        if (!(ra >= 0 && ra <= 360) || !(Math.abs(dec) <= 90)) return null;
        if (!(counts > 0) || Double.isNaN(countsErr)) return null;
        return Detection.fromCounts(frameId, ra == 360 ? 0 : ra, dec, v[2], v[3], counts, countsErr, 0);
    }

    public static FileMetadata parseFileName(String name) {
        String base = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
        String[] parts = base.split("_");
        if (parts.length < 6)
            throw new PhotometryIngestException("Nombre fuera de convención (OBJETO_FILTRO_EXPTIME_FECHA_AIRMASS_MJD): " + name);
        try {
            double exposure = parseOrNaN(parts[2]);
            double airmass = Double.parseDouble(parts[4].replace('a', '.'));
            double mjd = Double.parseDouble(parts[5].replace('d', '.'));
            return new FileMetadata(parts[0], parts[1], exposure, airmass, mjd);
        } catch (NumberFormatException e) {
            throw new PhotometryIngestException("Airmass o MJD ilegibles en " + name, e);
        }
    }

    private static double parseOrNaN(String s) {
        try {
            return Double.parseDouble(s.replaceAll("[^0-9.]", ""));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static String frameId(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
