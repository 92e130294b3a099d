package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

public class FitsHeaderService {

    private static final Logger log = LoggerFactory.getLogger(FitsHeaderService.class);

    // MJD de 1970-01-01
    private static final double MJD_UNIX_EPOCH = 40587.0;
    private static final double JD_TO_MJD = 2400000.5;

    public static class FitsMetadata {
        public double mjd = Double.NaN;
        public double exposureTime = 0;
        public double airmass = Double.NaN;
        public String filter = null;
        public double gain = 1.0;
        public String object = null;
    }

    public FitsMetadata readHeader(File f) {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new PhotometryIngestException("FITS sin HDU primario: " + f.getName());
            FitsMetadata meta = fromHeader(hdu.getHeader());
            if (Double.isNaN(meta.mjd)) throw new PhotometryIngestException("Sin fecha de observación en " + f.getName());
            return meta;
        } catch (FitsException | IOException e) {
            throw new PhotometryIngestException("No se pudo leer la cabecera de " + f.getName(), e);
        }
    }

    public FitsMetadata fromHeader(Header header) {
        FitsMetadata meta = new FitsMetadata();

        // --- FECHA ---
        // MJD-OBS directo, si no JD, si no DATE-OBS
        if (header.containsKey("MJD-OBS")) meta.mjd = header.getDoubleValue("MJD-OBS", Double.NaN);
        else if (header.containsKey("JD")) meta.mjd = header.getDoubleValue("JD", Double.NaN) - JD_TO_MJD;
        else if (header.containsKey("DATE-OBS")) meta.mjd = isoToMjd(header.getStringValue("DATE-OBS"));

        // Intentar leer claves estándar y variantes
        meta.exposureTime = header.getDoubleValue("EXPTIME", 0);
        if (meta.exposureTime == 0) meta.exposureTime = header.getDoubleValue("EXPOSURE", 0);

        meta.airmass = header.getDoubleValue("AIRMASS", Double.NaN);
        if (Double.isNaN(meta.airmass)) meta.airmass = header.getDoubleValue("SECZ", Double.NaN);

        String filter = header.getStringValue("FILTER");
        meta.filter = filter == null ? null : filter.trim();

        meta.gain = header.getDoubleValue("GAIN", -1);
        if (meta.gain <= 0) meta.gain = header.getDoubleValue("EGAIN", 1.0);

        meta.object = header.getStringValue("OBJECT");
        log.debug("Cabecera: MJD {} exp {} airmass {} filtro {}", meta.mjd, meta.exposureTime, meta.airmass, meta.filter);
        return meta;
    }

    static double isoToMjd(String value) {
        if (value == null || value.isBlank()) return Double.NaN;
        String s = value.trim();
        try {
            LocalDateTime t = s.contains("T") ? LocalDateTime.parse(s) : LocalDate.parse(s).atStartOfDay();
            double dayFraction = t.toLocalTime().toNanoOfDay() / 86_400e9;
            return t.toLocalDate().toEpochDay() + MJD_UNIX_EPOCH + dayFraction;
        } catch (DateTimeParseException e) {
            log.warn("DATE-OBS ilegible: '{}'", value);
            return Double.NaN;
        }
    }
}
