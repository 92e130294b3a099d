package com.astrophot.service;

import com.astrophot.exception.InvalidFrameSequenceException;
import com.astrophot.exception.PhotometryException;
import com.astrophot.exception.TargetNotFoundException;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PositionMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Identificación cruzada de estrellas frame a frame contra el catálogo acumulado.
 * El primer frame con detecciones siembra el catálogo; cada frame siguiente se empareja
 * contra una foto inmutable del catálogo y las altas se difieren hasta resolver el frame.
 */
public class StarMatcher {

    private static final Logger log = LoggerFactory.getLogger(StarMatcher.class);

    // Menor error primero; a igual error gana la detección sin flags
    private static final Comparator<Detection> BY_QUALITY = Comparator
            .comparingDouble((Detection d) -> d.magnitudeError)
            .thenComparing((Detection d) -> !d.isClean())
            .thenComparingDouble((Detection d) -> d.magnitude);

    static class CatalogEntry {
        final int id;
        final double u;
        final double v;
        final double magnitude;

        CatalogEntry(int id, double u, double v, double magnitude) {
            this.id = id;
            this.u = u;
            this.v = v;
            this.magnitude = magnitude;
        }
    }

    static class Candidate {
        final int detection;
        final int starId;
        final double score;

        Candidate(int detection, int starId, double score) {
            this.detection = detection;
            this.starId = starId;
            this.score = score;
        }
    }

    public MasterCatalog match(List<Frame> frames, PhotometryConfig cfg) {
        List<Frame> ordered = sortAndValidate(frames);
        PositionMetric metric = cfg.positionMetric();

        List<MasterStar> catalog = new ArrayList<>();
        Set<String> skipped = new LinkedHashSet<>();
        ExecutorService exec = Executors.newFixedThreadPool(cfg.parallelism());
        try {
            for (Frame frame : ordered) {
                List<Detection> usable = deduplicate(frame, metric, cfg.matchTolerance());
                if (usable.isEmpty()) {
                    log.warn("Frame {} sin detecciones utilizables, se omite", frame.id);
                    skipped.add(frame.id);
                    continue;
                }
                if (catalog.isEmpty()) {
                    appendNewStars(catalog, usable, metric);
                    log.debug("Frame {} siembra el catálogo con {} estrellas", frame.id, catalog.size());
                } else {
                    matchFrame(catalog, usable, cfg, exec);
                }
            }
        } finally {
            exec.shutdownNow();
        }
        if (catalog.isEmpty()) throw new InvalidFrameSequenceException("Ningún frame tiene detecciones");

        int targetId = resolveTarget(catalog, cfg);
        log.info("Matching: {} frames ({} omitidos), {} estrellas maestras, objetivo = estrella {}",
                ordered.size(), skipped.size(), catalog.size(), targetId);
        return new MasterCatalog(ordered, catalog, targetId, skipped);
    }

    // --- VALIDACIÓN DE LA SECUENCIA ---
    List<Frame> sortAndValidate(List<Frame> frames) {
        if (frames == null || frames.isEmpty()) throw new InvalidFrameSequenceException("Secuencia de frames vacía");
        List<Frame> ordered = new ArrayList<>(frames);
        ordered.sort(Comparator.comparingDouble((Frame f) -> f.timestamp));
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < ordered.size(); i++) {
            Frame f = ordered.get(i);
            if (!ids.add(f.id)) throw new InvalidFrameSequenceException("Frame duplicado: " + f.id);
            if (i > 0 && f.timestamp == ordered.get(i - 1).timestamp)
                throw new InvalidFrameSequenceException("Timestamp duplicado " + f.timestamp
                        + " en " + ordered.get(i - 1).id + " y " + f.id);
        }
        return ordered;
    }

    // Duplicados más cerca que la tolerancia: se queda la de mejor calidad
    List<Detection> deduplicate(Frame frame, PositionMetric metric, double tolerance) {
        List<Detection> sorted = new ArrayList<>();
        for (Detection d : frame.detections) if (metric.supports(d)) sorted.add(d);
        if (sorted.size() < frame.detections.size())
            log.debug("Frame {}: {} detecciones sin coordenadas {}", frame.id,
                    frame.detections.size() - sorted.size(), metric);
        sorted.sort(BY_QUALITY.thenComparingDouble(metric::u).thenComparingDouble(metric::v));

        List<Detection> kept = new ArrayList<>();
        for (Detection d : sorted) {
            boolean duplicate = false;
            for (Detection k : kept) {
                if (metric.distance(d, k) < tolerance) { duplicate = true; break; }
            }
            if (!duplicate) kept.add(d);
        }
        if (kept.size() < sorted.size())
            log.warn("Frame {}: {} detecciones duplicadas descartadas", frame.id, sorted.size() - kept.size());
        return kept;
    }

    // --- MATCHING DE UN FRAME ---
    private void matchFrame(List<MasterStar> catalog, List<Detection> detections, PhotometryConfig cfg,
                            ExecutorService exec) {
        PositionMetric metric = cfg.positionMetric();
        List<CatalogEntry> snapshot = new ArrayList<>(catalog.size());
        for (MasterStar s : catalog) snapshot.add(new CatalogEntry(s.id(), s.u(metric), s.v(metric), s.meanMagnitude()));
        snapshot.sort(Comparator.comparingDouble((CatalogEntry e) -> e.v).thenComparingInt((CatalogEntry e) -> e.id));
        List<CatalogEntry> index = List.copyOf(snapshot);

        // Búsqueda en paralelo: solo lectura sobre la foto del catálogo
        int chunks = Math.min(cfg.parallelism(), detections.size());
        int chunkSize = (detections.size() + chunks - 1) / chunks;
        List<Future<List<Candidate>>> futures = new ArrayList<>();
        for (int start = 0; start < detections.size(); start += chunkSize) {
            final int from = start, to = Math.min(detections.size(), start + chunkSize);
            futures.add(exec.submit(() -> {
                List<Candidate> out = new ArrayList<>();
                for (int i = from; i < to; i++) out.addAll(candidates(i, detections.get(i), index, cfg));
                return out;
            }));
        }
        List<Candidate> all = new ArrayList<>();
        for (Future<List<Candidate>> f : futures) all.addAll(await(f));

        // Asignación global por score: cada estrella y cada detección se usan una vez
        all.sort(Comparator.comparingDouble((Candidate c) -> c.score)
                .thenComparingInt((Candidate c) -> c.starId)
                .thenComparingInt((Candidate c) -> c.detection));
        boolean[] detectionUsed = new boolean[detections.size()];
        Set<Integer> starUsed = new HashSet<>();
        List<Detection> assignedDetections = new ArrayList<>();
        List<Integer> assignedStars = new ArrayList<>();
        for (Candidate c : all) {
            if (detectionUsed[c.detection] || starUsed.contains(c.starId)) continue;
            detectionUsed[c.detection] = true;
            starUsed.add(c.starId);
            assignedDetections.add(detections.get(c.detection));
            assignedStars.add(c.starId);
        }

        // Altas diferidas
        for (int i = 0; i < assignedStars.size(); i++) catalog.get(assignedStars.get(i) - 1).record(assignedDetections.get(i));
        List<Detection> unmatched = new ArrayList<>();
        for (int i = 0; i < detections.size(); i++) if (!detectionUsed[i]) unmatched.add(detections.get(i));
        appendNewStars(catalog, unmatched, metric);

        String frameId = detections.get(0).frameId;
        log.debug("Frame {}: {} emparejadas, {} nuevas, {} huecos", frameId, assignedStars.size(), unmatched.size(),
                index.size() - assignedStars.size());
    }

    List<Candidate> candidates(int detIndex, Detection d, List<CatalogEntry> index, PhotometryConfig cfg) {
        PositionMetric metric = cfg.positionMetric();
        double tol = cfg.matchTolerance();
        // en SKY la tolerancia está en arcsec y v en grados
        double vWindow = metric == PositionMetric.SKY ? tol / 3600.0 : tol;
        double du = metric.u(d), dv = metric.v(d);

        List<Candidate> out = new ArrayList<>();
        for (int i = lowerBound(index, dv - vWindow); i < index.size(); i++) {
            CatalogEntry e = index.get(i);
            if (e.v > dv + vWindow) break;
            double dist = metric.distance(du, dv, e.u, e.v);
            if (dist <= tol) {
                double score = dist / tol + cfg.magnitudeWeight() * Math.abs(d.magnitude - e.magnitude);
                out.add(new Candidate(detIndex, e.id, score));
            }
        }
        return out;
    }

    private static int lowerBound(List<CatalogEntry> index, double v) {
        int lo = 0, hi = index.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (index.get(mid).v < v) lo = mid + 1; else hi = mid;
        }
        return lo;
    }

    private static void appendNewStars(List<MasterStar> catalog, List<Detection> detections, PositionMetric metric) {
        List<Detection> sorted = new ArrayList<>(detections);
        // ids independientes del orden de entrada
        sorted.sort(Comparator.comparingDouble(metric::u).thenComparingDouble(metric::v)
                .thenComparingDouble((Detection d) -> d.magnitude));
        for (Detection d : sorted) catalog.add(new MasterStar(catalog.size() + 1, d));
    }

    private static <T> T await(Future<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhotometryException("Matching interrumpido", e);
        } catch (ExecutionException e) {
            throw new PhotometryException("Fallo en la búsqueda de vecinos", e.getCause());
        }
    }

    // --- RESOLUCIÓN DEL OBJETIVO ---
    int resolveTarget(List<MasterStar> catalog, PhotometryConfig cfg) {
        boolean pixel = cfg.positionMetric() == PositionMetric.PIXEL && cfg.hasTargetPixel();
        MasterStar best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (MasterStar s : catalog) {
            double d;
            if (pixel) {
                if (Double.isNaN(s.x())) continue;
                d = PositionMetric.PIXEL.distance(s.x(), s.y(), cfg.targetX(), cfg.targetY());
            } else {
                if (!s.hasSky()) continue;
                d = PositionMetric.SKY.distance(s.ra(), s.dec(), cfg.target().ra, cfg.target().dec);
            }
            if (d < bestDist) { bestDist = d; best = s; }
        }
        String label = pixel ? String.format("(x=%.1f, y=%.1f)", cfg.targetX(), cfg.targetY()) : String.valueOf(cfg.target());
        if (best == null || bestDist > cfg.targetTolerance())
            throw new TargetNotFoundException(label, bestDist, cfg.targetTolerance());
        log.debug("Objetivo {} -> estrella {} a {}", label, best.id(), String.format("%.3f", bestDist));
        return best.id();
    }
}
