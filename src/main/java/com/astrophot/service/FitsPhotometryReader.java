package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.CelestialPoint;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tablas binarias FITS con fotometría de apertura: columnas x, y, flux, fluxerr y opcionalmente
 * ra, dec y flags. Sin ra/dec se proyecta con el WCS de la tabla o del HDU primario.
 */
public class FitsPhotometryReader {

    private static final Logger log = LoggerFactory.getLogger(FitsPhotometryReader.class);

    private static final String[] X_NAMES = {"x", "xcentroid", "x_image"};
    private static final String[] Y_NAMES = {"y", "ycentroid", "y_image"};
    private static final String[] FLUX_NAMES = {"flux", "counts", "aperture_sum", "flux_aper"};
    private static final String[] ERR_NAMES = {"fluxerr", "flux_err", "countserr", "counts_err", "aperture_sum_err", "fluxerr_aper"};
    private static final String[] RA_NAMES = {"ra", "alpha_j2000"};
    private static final String[] DEC_NAMES = {"dec", "delta_j2000"};
    private static final String[] FLAG_NAMES = {"flags", "flag"};

    private final FitsHeaderService headerService;

    public FitsPhotometryReader() {
        this(new FitsHeaderService());
    }

    public FitsPhotometryReader(FitsHeaderService headerService) {
        this.headerService = headerService;
    }

    /** true si el archivo tiene al menos una tabla binaria. */
    public boolean isTable(File file) {
        try (Fits fits = new Fits(file)) {
            for (BasicHDU<?> hdu : fits.read()) if (hdu instanceof BinaryTableHDU) return true;
            return false;
        } catch (FitsException | IOException e) {
            throw new PhotometryIngestException("No se pudo abrir " + file.getName(), e);
        }
    }

    public Frame read(File file) {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) throw new PhotometryIngestException("FITS vacío: " + file.getName());
            BinaryTableHDU table = null;
            for (BasicHDU<?> hdu : hdus) {
                if (hdu instanceof BinaryTableHDU) { table = (BinaryTableHDU) hdu; break; }
            }
            if (table == null) throw new PhotometryIngestException("Sin tabla binaria en " + file.getName());

            // --- METADATOS ---
            Header primary = hdus[0].getHeader();
            FitsHeaderService.FitsMetadata meta = headerService.fromHeader(primary);
            FitsHeaderService.FitsMetadata tableMeta = headerService.fromHeader(table.getHeader());
            double mjd = Double.isNaN(tableMeta.mjd) ? meta.mjd : tableMeta.mjd;
            double airmass = Double.isNaN(tableMeta.airmass) ? meta.airmass : tableMeta.airmass;
            String filter = tableMeta.filter != null ? tableMeta.filter : meta.filter;
            if (Double.isNaN(mjd)) throw new PhotometryIngestException("Sin fecha de observación en " + file.getName());

            String frameId = PhotometryFileReader.frameId(file.toPath());
            List<Detection> detections = readRows(table, frameId, primary, file.getName());
            log.debug("{}: {} detecciones desde tabla FITS", file.getName(), detections.size());
            return new Frame(frameId, mjd, detections, airmass, filter);
        } catch (FitsException | IOException e) {
            throw new PhotometryIngestException("No se pudo leer " + file.getName(), e);
        }
    }

    private List<Detection> readRows(BinaryTableHDU table, String frameId, Header primary, String name)
            throws FitsException {
        double[] x = column(table, X_NAMES);
        double[] y = column(table, Y_NAMES);
        double[] flux = column(table, FLUX_NAMES);
        double[] err = column(table, ERR_NAMES);
        double[] ra = column(table, RA_NAMES);
        double[] dec = column(table, DEC_NAMES);
        double[] flags = column(table, FLAG_NAMES);
        if (flux == null || err == null) throw new PhotometryIngestException("Faltan columnas de flujo en " + name);
        if ((x == null || y == null) && (ra == null || dec == null))
            throw new PhotometryIngestException("Sin columnas de posición en " + name);

        Optional<WcsTransform> wcs = Optional.empty();
        if ((ra == null || dec == null) && x != null && y != null) {
            wcs = WcsTransform.fromHeader(table.getHeader());
            if (wcs.isEmpty()) wcs = WcsTransform.fromHeader(primary);
            if (wcs.isEmpty()) log.warn("{}: sin RA/DEC ni WCS, solo coordenadas de píxel", name);
        }

        List<Detection> out = new ArrayList<>(flux.length);
        int rejected = 0;
        for (int i = 0; i < flux.length; i++) {
            if (!(flux[i] > 0) || Double.isNaN(err[i])) { rejected++; continue; }
            double px = x == null ? Double.NaN : x[i];
            double py = y == null ? Double.NaN : y[i];
            double r = Double.NaN, d = Double.NaN;
            if (ra != null && dec != null) {
                r = ra[i];
                d = dec[i];
            } else if (wcs.isPresent()) {
                CelestialPoint p = wcs.get().toSky(px, py);
                r = p.ra;
                d = p.dec;
            }
            if (!Double.isNaN(d) && Math.abs(d) > 90) { rejected++; continue; }
            int f = flags == null ? 0 : (int) flags[i];
            out.add(Detection.fromCounts(frameId, r, d, px, py, flux[i], err[i], f));
        }
        if (rejected > 0) log.warn("{}: {} filas descartadas", name, rejected);
        return out;
    }

    private static double[] column(BinaryTableHDU table, String[] names) throws FitsException {
        for (int c = 0; c < table.getNCols(); c++) {
            String col = table.getColumnName(c);
            if (col == null) continue;
            for (String n : names) {
                if (col.trim().equalsIgnoreCase(n)) return toDoubles(table.getColumn(c));
            }
        }
        return null;
    }

    private static double[] toDoubles(Object data) {
        if (data instanceof double[]) return (double[]) data;
        if (data instanceof float[]) {
            float[] f = (float[]) data;
            double[] d = new double[f.length];
            for (int i = 0; i < f.length; i++) d[i] = f[i];
            return d;
        }
        if (data instanceof int[]) {
            int[] v = (int[]) data;
            double[] d = new double[v.length];
            for (int i = 0; i < v.length; i++) d[i] = v[i];
            return d;
        }
        if (data instanceof short[]) {
            short[] v = (short[]) data;
            double[] d = new double[v.length];
            for (int i = 0; i < v.length; i++) d[i] = v[i];
            return d;
        }
        if (data instanceof long[]) {
            long[] v = (long[]) data;
            double[] d = new double[v.length];
            for (int i = 0; i < v.length; i++) d[i] = v[i];
            return d;
        }
        throw new PhotometryIngestException("Tipo de columna no soportado: " + data.getClass().getSimpleName());
    }
}
