package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FitsPhotometryReaderTest {

    private static final double ARCSEC = 1.0 / 3600.0;

    private final FitsPhotometryReader reader = new FitsPhotometryReader();

    @TempDir
    Path dir;

    private static BasicHDU<?> primary() throws FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(new short[][]{{0}});
        hdu.addValue("MJD-OBS", 60000.5, "");
        hdu.addValue("FILTER", "R", "");
        hdu.addValue("AIRMASS", 1.25, "");
        return hdu;
    }

    private static BinaryTableHDU table(String[] names, Object... columns) throws FitsException {
        BinaryTable data = new BinaryTable();
        for (Object c : columns) data.addColumn(c);
        BinaryTableHDU hdu = (BinaryTableHDU) Fits.makeHDU(data);
        for (int i = 0; i < names.length; i++) hdu.setColumnName(i, names[i], "");
        return hdu;
    }

    // TAN centrada en (150, 20) sobre el píxel 100,100 en base 0, 1"/px
    private static void addWcs(BasicHDU<?> hdu) throws FitsException {
        hdu.addValue("CTYPE1", "RA---TAN", "");
        hdu.addValue("CTYPE2", "DEC--TAN", "");
        hdu.addValue("CRVAL1", 150.0, "");
        hdu.addValue("CRVAL2", 20.0, "");
        hdu.addValue("CRPIX1", 101.0, "");
        hdu.addValue("CRPIX2", 101.0, "");
        hdu.addValue("CD1_1", -ARCSEC, "");
        hdu.addValue("CD1_2", 0.0, "");
        hdu.addValue("CD2_1", 0.0, "");
        hdu.addValue("CD2_2", ARCSEC, "");
    }

    private File write(String name, BasicHDU<?>... hdus) throws FitsException, IOException {
        File file = dir.resolve(name).toFile();
        try (Fits fits = new Fits()) {
            for (BasicHDU<?> hdu : hdus) fits.addHDU(hdu);
            fits.write(file);
        }
        return file;
    }

    private static BinaryTableHDU pixelTable() throws FitsException {
        return table(new String[]{"xcentroid", "ycentroid", "aperture_sum", "aperture_sum_err"},
                new double[]{100.0, 100.0, 40.0},
                new double[]{100.0, 110.0, 60.0},
                new double[]{10000.0, 2500.0, 8000.0},
                new double[]{100.0, 50.0, 90.0});
    }

    @Test
    void readsSkyColumnsAndHeaderMetadata() throws Exception {
        BinaryTableHDU table = table(new String[]{"x", "y", "flux", "fluxerr", "ra", "dec", "flags"},
                new double[]{12.0, 40.5},
                new double[]{30.0, 8.25},
                new double[]{10000.0, 1000.0},
                new double[]{100.0, 30.0},
                new double[]{240.5493, 240.5601},
                new double[]{28.1696, 28.1702},
                new int[]{0, 2});
        File file = write("xo1_0001.fits", primary(), table);

        assertThat(reader.isTable(file)).isTrue();
        Frame frame = reader.read(file);

        assertThat(frame.id).isEqualTo("xo1_0001");
        assertThat(frame.timestamp).isEqualTo(60000.5);
        assertThat(frame.filter).isEqualTo("R");
        assertThat(frame.airmass).isEqualTo(1.25);
        assertThat(frame.detections).hasSize(2);
        Detection first = frame.detections.get(0);
        assertThat(first.ra).isCloseTo(240.5493, within(1e-9));
        assertThat(first.dec).isCloseTo(28.1696, within(1e-9));
        assertThat(first.x).isEqualTo(12.0);
        assertThat(first.magnitude).isCloseTo(-10.0, within(1e-9));
        assertThat(frame.detections.get(1).flags).isEqualTo(2);
        assertThat(frame.detections.get(1).isClean()).isFalse();
    }

    @Test
    void projectsPixelsWithTheTableWcs() throws Exception {
        BinaryTableHDU table = pixelTable();
        addWcs(table);
        File file = write("frame_table_wcs.fits", primary(), table);

        Frame frame = reader.read(file);

        Detection centre = frame.detections.get(0);
        assertThat(centre.ra).isCloseTo(150.0, within(1e-9));
        assertThat(centre.dec).isCloseTo(20.0, within(1e-9));
        Detection north = frame.detections.get(1);
        assertThat((north.dec - 20.0) * 3600).isCloseTo(10.0, within(1e-3));
    }

    @Test
    void fallsBackToThePrimaryWcs() throws Exception {
        BasicHDU<?> primary = primary();
        addWcs(primary);
        File file = write("frame_primary_wcs.fits", primary, pixelTable());

        Frame frame = reader.read(file);

        assertThat(frame.detections).allSatisfy(d -> assertThat(d.hasSky()).isTrue());
        assertThat(frame.detections.get(0).ra).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void withoutWcsOnlyPixelPositionsRemain() throws Exception {
        File file = write("frame_no_wcs.fits", primary(), pixelTable());

        Frame frame = reader.read(file);

        assertThat(frame.detections).hasSize(3).allSatisfy(d -> {
            assertThat(d.hasSky()).isFalse();
            assertThat(d.hasPixel()).isTrue();
        });
    }

    @Test
    void nonPositiveFluxRowsAreRejected() throws Exception {
        BinaryTableHDU table = table(new String[]{"x", "y", "flux", "fluxerr", "ra", "dec"},
                new double[]{10.0, 20.0, 30.0},
                new double[]{10.0, 20.0, 30.0},
                new double[]{5000.0, 0.0, -12.0},
                new double[]{50.0, 10.0, 10.0},
                new double[]{150.0, 150.001, 150.002},
                new double[]{20.0, 20.0, 20.0});
        File file = write("frame_bad_flux.fits", primary(), table);

        Frame frame = reader.read(file);

        assertThat(frame.detections).hasSize(1);
        assertThat(frame.detections.get(0).x).isEqualTo(10.0);
    }

    @Test
    void missingFluxColumnsAreReported() throws Exception {
        BinaryTableHDU table = table(new String[]{"x", "y"}, new double[]{1.0}, new double[]{2.0});
        File file = write("frame_no_flux.fits", primary(), table);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(PhotometryIngestException.class)
                .hasMessageContaining("flujo");
    }
}
