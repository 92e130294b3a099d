package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.CelestialPoint;
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
 * Lista de coordenadas a excluir de las comparaciones: una estrella por fila, {@code ra, dec} en grados
 * como primeras columnas. Admite cabecera, comentarios con '#' y filas con NaN, que se ignoran.
 * Se arma a mano o exportando un catálogo de variables (VSX) del campo.
 */
public class ExclusionListReader {

    private static final Logger log = LoggerFactory.getLogger(ExclusionListReader.class);

    private final CsvMapper mapper = new CsvMapper();

    public ExclusionListReader() {
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.ALLOW_COMMENTS);
    }

    public List<CelestialPoint> read(Path file) {
        List<CelestialPoint> out = new ArrayList<>();
        int line = 0, skipped = 0;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {
            while (it.hasNext()) {
                String[] row = it.next();
                line++;
                if (row.length == 0 || (row.length == 1 && row[0].isBlank())) continue;
                if (row.length < 2)
                    throw new PhotometryIngestException(file.getFileName() + ":" + line + " necesita ra y dec");
                double ra, dec;
                try {
                    ra = parse(row[0]);
                    dec = parse(row[1]);
                } catch (NumberFormatException e) {
                    if (line == 1) continue; // cabecera
                    throw new PhotometryIngestException(file.getFileName() + ":" + line + " coordenada no numérica", e);
                }
                if (Double.isNaN(ra) || Double.isNaN(dec)) { skipped++; continue; }
                try {
                    out.add(new CelestialPoint(ra, dec));
                } catch (IllegalArgumentException e) {
                    throw new PhotometryIngestException(file.getFileName() + ":" + line + " " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new PhotometryIngestException("No se pudo leer la lista de exclusión " + file, e);
        }
        if (skipped > 0) log.debug("{}: {} filas sin coordenadas ignoradas", file.getFileName(), skipped);
        log.info("Lista de exclusión {}: {} coordenadas", file.getFileName(), out.size());
        return out;
    }

    private static double parse(String s) {
        String v = s.trim();
        return v.equalsIgnoreCase("nan") ? Double.NaN : Double.parseDouble(v);
    }
}
