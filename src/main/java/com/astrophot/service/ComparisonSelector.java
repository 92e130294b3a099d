package com.astrophot.service;

import com.astrophot.exception.InsufficientComparisonStarsException;
import com.astrophot.exception.PhotometryException;
import com.astrophot.model.CelestialPoint;
import com.astrophot.model.ClipStatistic;
import com.astrophot.model.ComparisonEnsemble;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.PhotometryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Selección del ensemble de comparación: cobertura mínima, ranking por variabilidad,
 * sigma-clipping iterativo contra el promedio del resto del ensemble y pesos por varianza inversa.
 * El ranking crudo desempata el clipping y los topes, y fija el orden del ensemble resultante; entre
 * estadísticos iguales decide el id, así el resultado no depende del orden de descubrimiento.
 */
public class ComparisonSelector {

    private static final Logger log = LoggerFactory.getLogger(ComparisonSelector.class);

    private static final double MAD_TO_SIGMA = 1.4826;
    private static final double MIN_VARIANCE = 1e-12;

    /** Curva instrumental de un candidato alineada con los frames utilizables (NaN = ausente). */
    static class Series {
        final int starId;
        final double[] mags;
        final double[] errs;
        final double meanMag;
        final double meanSqErr;
        final int count;

        Series(int starId, double[] mags, double[] errs, double meanMag, double meanSqErr, int count) {
            this.starId = starId;
            this.mags = mags;
            this.errs = errs;
            this.meanMag = meanMag;
            this.meanSqErr = meanSqErr;
            this.count = count;
        }
    }

    /** Resultado de una ronda para un candidato. */
    static class Residual {
        final int starId;
        final double scatter;
        final double normalized;

        Residual(int starId, double scatter, double normalized) {
            this.starId = starId;
            this.scatter = scatter;
            this.normalized = normalized;
        }
    }

    public ComparisonEnsemble select(MasterCatalog catalog, PhotometryConfig cfg) {
        List<Frame> frames = catalog.usableFrames();
        List<MasterStar> stars = withoutExcluded(catalog.comparisonCandidates(), cfg);
        stars.sort(Comparator.comparingInt(MasterStar::id));

        List<Series> candidates = new ArrayList<>();
        int lowCoverage = 0, noisy = 0;
        for (MasterStar s : stars) {
            Series series = toSeries(s, frames);
            if (frames.isEmpty() || (double) series.count / frames.size() < cfg.minCoverageFraction()) { lowCoverage++; continue; }
            if (Math.sqrt(series.meanSqErr) > cfg.maxMagnitudeError()) { noisy++; continue; }
            candidates.add(series);
        }
        log.info("Comparaciones: {} candidatos ({} por baja cobertura, {} por error alto descartados)",
                candidates.size(), lowCoverage, noisy);

        if (candidates.size() < cfg.minEnsembleSize()) {
            List<Integer> all = stars.stream().map(MasterStar::id).collect(Collectors.toList());
            throw new InsufficientComparisonStarsException(candidates.size(), cfg.minEnsembleSize(),
                    ComparisonEnsemble.uniform(all, true));
        }

        ExecutorService exec = Executors.newFixedThreadPool(cfg.parallelism());
        try {
            // --- RANKING INICIAL ---
            Map<Integer, Double> raw = new HashMap<>();
            List<Future<double[]>> rawFutures = new ArrayList<>();
            for (Series s : candidates) rawFutures.add(exec.submit(() -> new double[]{s.starId, rawStatistic(s, cfg)}));
            for (Future<double[]> f : rawFutures) {
                double[] r = await(f);
                raw.put((int) r[0], r[1]);
            }
            List<Series> current = new ArrayList<>(candidates);
            current.sort(Comparator.comparingDouble((Series s) -> nanLast(raw.get(s.starId)))
                    .thenComparingInt((Series s) -> s.starId));
            Map<Integer, Integer> rawRank = new HashMap<>();
            for (int i = 0; i < current.size(); i++) rawRank.put(current.get(i).starId, i);

            // --- SIGMA CLIPPING ---
            Map<Integer, Residual> stats;
            int round = 0;
            while (true) {
                stats = residuals(current, frames.size(), cfg, exec);
                if (current.size() <= cfg.minEnsembleSize()) break;
                Residual worst = worst(stats.values(), cfg.clipStatistic(), rawRank);
                if (!exceeds(worst, stats.values(), cfg)) break;
                final int rejected = worst.starId;
                current.removeIf(s -> s.starId == rejected);
                round++;
                log.debug("Ronda {}: rechazada estrella {} (dispersión {}, normalizada {})", round, rejected,
                        String.format("%.4f", worst.scatter), String.format("%.2f", worst.normalized));
            }
            if (round > 0) log.warn("Rechazadas {} estrellas por variabilidad", round);

            current = applyCaps(current, stats, rawRank, cfg);
            ComparisonEnsemble ensemble = weigh(current, stats, rawRank, cfg);
            logSummary(ensemble);
            return ensemble;
        } finally {
            exec.shutdownNow();
        }
    }

    // Variables conocidas y otros objetivos fuera de la lista de candidatos
    static List<MasterStar> withoutExcluded(List<MasterStar> stars, PhotometryConfig cfg) {
        List<MasterStar> out = new ArrayList<>(stars.size());
        if (cfg.excludedStars().isEmpty()) {
            out.addAll(stars);
            return out;
        }
        for (MasterStar s : stars) {
            CelestialPoint hit = s.hasSky() ? nearestExcluded(s, cfg) : null;
            if (hit == null) out.add(s);
            else log.debug("Estrella {} excluida como comparación por la coordenada {}", s.id(), hit);
        }
        if (out.size() < stars.size())
            log.info("Lista de exclusión: {} estrellas fuera de las comparaciones", stars.size() - out.size());
        return out;
    }

    private static CelestialPoint nearestExcluded(MasterStar s, PhotometryConfig cfg) {
        for (CelestialPoint p : cfg.excludedStars()) {
            if (CelestialPoint.separationArcsec(s.ra(), s.dec(), p.ra, p.dec) <= cfg.exclusionRadius()) return p;
        }
        return null;
    }

    static Series toSeries(MasterStar s, List<Frame> frames) {
        double[] mags = new double[frames.size()];
        double[] errs = new double[frames.size()];
        double sum = 0, sumSqErr = 0;
        int n = 0;
        for (int i = 0; i < frames.size(); i++) {
            Detection d = s.detection(frames.get(i).id).orElse(null);
            if (d == null) { mags[i] = Double.NaN; errs[i] = Double.NaN; continue; }
            mags[i] = d.magnitude;
            errs[i] = d.magnitudeError;
            sum += d.magnitude;
            sumSqErr += d.magnitudeError * d.magnitudeError;
            n++;
        }
        return new Series(s.id(), mags, errs, n == 0 ? Double.NaN : sum / n, n == 0 ? Double.NaN : sumSqErr / n, n);
    }

    // Dispersión de la curva cruda, normalizada por el ruido fotométrico si corresponde
    static double rawStatistic(Series s, PhotometryConfig cfg) {
        double std = Stats.std(s.mags);
        if (cfg.clipStatistic() == ClipStatistic.ROBUST_POPULATION) return std;
        return std / Math.sqrt(Math.max(s.meanSqErr, MIN_VARIANCE));
    }

    /**
     * Residuo de cada candidato frente al promedio del resto (leave-one-out). Cada miembro entra
     * referido a su propia magnitud media para que los huecos no introduzcan saltos.
     */
    Map<Integer, Residual> residuals(List<Series> current, int frameCount, PhotometryConfig cfg, ExecutorService exec) {
        double[] sum = new double[frameCount];
        double[] sumVar = new double[frameCount];
        int[] present = new int[frameCount];
        for (Series s : current) {
            for (int f = 0; f < frameCount; f++) {
                if (Double.isNaN(s.mags[f])) continue;
                sum[f] += s.mags[f] - s.meanMag;
                sumVar[f] += s.errs[f] * s.errs[f];
                present[f]++;
            }
        }

        List<Callable<Residual>> tasks = new ArrayList<>(current.size());
        for (Series s : current) tasks.add(() -> residual(s, sum, sumVar, present, current.size() == 1));
        Map<Integer, Residual> out = new HashMap<>();
        try {
            for (Future<Residual> f : exec.invokeAll(tasks)) {
                Residual r = await(f);
                out.put(r.starId, r);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhotometryException("Selección interrumpida", e);
        }
        return out;
    }

    static Residual residual(Series s, double[] sum, double[] sumVar, int[] present, boolean alone) {
        int n = s.mags.length;
        double[] r = new double[n];
        double[] expVar = new double[n];
        for (int f = 0; f < n; f++) {
            r[f] = Double.NaN;
            if (Double.isNaN(s.mags[f])) continue;
            double own = s.mags[f] - s.meanMag;
            double ownVar = s.errs[f] * s.errs[f];
            int others = present[f] - 1;
            if (alone) {
                r[f] = own;
                expVar[f] = ownVar;
            } else if (others > 0) {
                r[f] = own - (sum[f] - own) / others;
                expVar[f] = ownVar + (sumVar[f] - ownVar) / ((double) others * others);
            }
        }
        double mean = Stats.mean(r);
        double scatter = Stats.std(r);
        double chi = 0;
        int k = 0;
        for (int f = 0; f < n; f++) {
            if (Double.isNaN(r[f])) continue;
            double dev = r[f] - mean;
            chi += dev * dev / Math.max(expVar[f], MIN_VARIANCE);
            k++;
        }
        double normalized = k == 0 ? Double.NaN : Math.sqrt(chi / k);
        return new Residual(s.starId, scatter, normalized);
    }

    private static double value(Residual r, ClipStatistic stat) {
        return stat == ClipStatistic.NOISE_NORMALIZED ? r.normalized : r.scatter;
    }

    // Peor candidato; NaN cuenta como el peor y los empates van al peor puesto del ranking crudo
    static Residual worst(Iterable<Residual> residuals, ClipStatistic stat, Map<Integer, Integer> rawRank) {
        Residual worst = null;
        for (Residual r : residuals) {
            if (worst == null) { worst = r; continue; }
            int cmp = Double.compare(nanLast(value(r, stat)), nanLast(value(worst, stat)));
            if (cmp > 0 || (cmp == 0 && rawRank.get(r.starId) > rawRank.get(worst.starId))) worst = r;
        }
        return worst;
    }

    static boolean exceeds(Residual worst, Iterable<Residual> all, PhotometryConfig cfg) {
        double v = value(worst, cfg.clipStatistic());
        if (Double.isNaN(v)) return true;
        if (cfg.clipStatistic() == ClipStatistic.NOISE_NORMALIZED) return v > cfg.sigmaClip();

        List<Double> scatters = new ArrayList<>();
        for (Residual r : all) if (!Double.isNaN(r.scatter)) scatters.add(r.scatter);
        double median = Stats.median(scatters);
        double robustSigma = MAD_TO_SIGMA * Stats.mad(scatters, median);
        return v > median + cfg.sigmaClip() * robustSigma;
    }

    // Tope opcional por variabilidad relativa y por cantidad de miembros
    List<Series> applyCaps(List<Series> current, Map<Integer, Residual> stats, Map<Integer, Integer> rawRank,
                           PhotometryConfig cfg) {
        List<Series> ranked = new ArrayList<>(current);
        ranked.sort(Comparator.comparingDouble((Series s) -> nanLast(value(stats.get(s.starId), cfg.clipStatistic())))
                .thenComparingInt((Series s) -> rawRank.get(s.starId)));

        if (!Double.isInfinite(cfg.variabilityMultiplier())) {
            double minScatter = Double.POSITIVE_INFINITY;
            for (Series s : ranked) minScatter = Math.min(minScatter, nanLast(stats.get(s.starId).scatter));
            double limit = minScatter * cfg.variabilityMultiplier();
            while (ranked.size() > cfg.minEnsembleSize()
                    && !(stats.get(ranked.get(ranked.size() - 1).starId).scatter <= limit)) {
                Series dropped = ranked.remove(ranked.size() - 1);
                log.debug("Estrella {} supera el tope de variabilidad {}", dropped.starId, String.format("%.4f", limit));
            }
        }
        if (ranked.size() > cfg.maxComparisonStars()) ranked = new ArrayList<>(ranked.subList(0, cfg.maxComparisonStars()));
        return ranked;
    }

    // Pesos por varianza inversa, normalizados a 1; miembros en orden de ranking crudo
    static ComparisonEnsemble weigh(List<Series> selected, Map<Integer, Residual> stats, Map<Integer, Integer> rawRank,
                                    PhotometryConfig cfg) {
        List<Series> members = new ArrayList<>(selected);
        members.sort(Comparator.comparingInt((Series s) -> rawRank.get(s.starId)));
        double[] inv = new double[members.size()];
        double total = 0;
        for (int i = 0; i < members.size(); i++) {
            Series s = members.get(i);
            Residual r = stats.get(s.starId);
            double residualVar = Double.isNaN(r.scatter) ? 0 : r.scatter * r.scatter;
            double variance = Math.max(Math.max(residualVar, s.meanSqErr), MIN_VARIANCE);
            inv[i] = 1.0 / variance;
            total += inv[i];
        }
        List<ComparisonEnsemble.Member> out = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            Residual r = stats.get(members.get(i).starId);
            out.add(new ComparisonEnsemble.Member(r.starId, inv[i] / total, r.scatter, value(r, cfg.clipStatistic()), i + 1));
        }
        return new ComparisonEnsemble(out, false);
    }

    private static void logSummary(ComparisonEnsemble e) {
        List<Double> scatters = e.members.stream().map((ComparisonEnsemble.Member m) -> m.scatter).collect(Collectors.toList());
        log.info("Ensemble: {} estrellas estables, variabilidad mediana {}", e.size(),
                String.format("%.5f", Stats.median(scatters)));
        for (ComparisonEnsemble.Member m : e.members)
            log.debug("  Comp {} (#{}) peso {} dispersión {}", m.starId, m.rank, String.format("%.4f", m.weight),
                    String.format("%.5f", m.scatter));
    }

    private static double nanLast(Double v) {
        return v == null || Double.isNaN(v) ? Double.POSITIVE_INFINITY : v;
    }

    private static <T> T await(Future<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhotometryException("Selección interrumpida", e);
        } catch (ExecutionException e) {
            throw new PhotometryException("Fallo al calcular la variabilidad", e.getCause());
        }
    }
}
