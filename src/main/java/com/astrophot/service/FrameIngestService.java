package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Carga de una carpeta o lista de archivos en frames: CSV, tabla FITS o imagen FITS.
 * Todos los frames de una corrida tienen que compartir filtro.
 */
public class FrameIngestService {

    private static final Logger log = LoggerFactory.getLogger(FrameIngestService.class);

    private final PhotometryFileReader csvReader;
    private final FitsPhotometryReader tableReader;
    private final ImageStarExtractor imageExtractor;

    public FrameIngestService() {
        this(new PhotometryFileReader(), new FitsPhotometryReader(), new ImageStarExtractor());
    }

    public FrameIngestService(PhotometryFileReader csvReader, FitsPhotometryReader tableReader,
                              ImageStarExtractor imageExtractor) {
        this.csvReader = csvReader;
        this.tableReader = tableReader;
        this.imageExtractor = imageExtractor;
    }

    public List<Frame> loadFolder(Path folder) {
        if (!Files.isDirectory(folder)) throw new PhotometryIngestException("No es una carpeta: " + folder);
        List<Path> files;
        try (Stream<Path> s = Files.list(folder)) {
            files = s.filter(Files::isRegularFile).filter(FrameIngestService::isSupported).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PhotometryIngestException("No se pudo listar " + folder, e);
        }
        if (files.isEmpty()) throw new PhotometryIngestException("Sin archivos de fotometría en " + folder);
        return load(files);
    }

    public List<Frame> load(List<Path> files) {
        List<Frame> frames = new ArrayList<>(files.size());
        for (Path p : files) frames.add(load(p));
        checkSingleFilter(frames);
        log.info("Cargados {} frames", frames.size());
        return frames;
    }

    public Frame load(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) return csvReader.read(file);
        if (isFits(name)) {
            File f = file.toFile();
            return tableReader.isTable(f) ? tableReader.read(f) : imageExtractor.extract(f);
        }
        throw new PhotometryIngestException("Formato no soportado: " + file.getFileName());
    }

    // Varios filtros en la misma serie no se mezclan
    static void checkSingleFilter(List<Frame> frames) {
        Set<String> filters = new TreeSet<>();
        for (Frame f : frames) if (f.filter != null && !f.filter.isBlank()) filters.add(f.filter);
        if (filters.size() > 1)
            throw new PhotometryIngestException("La serie mezcla filtros " + filters + "; procesar cada filtro por separado");
    }

    static boolean isSupported(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") || isFits(name);
    }

    private static boolean isFits(String name) {
        return name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fts");
    }
}
