package com.astrophot.service;

import com.astrophot.exception.PhotometryIngestException;
import com.astrophot.model.Frame;
import com.astrophot.model.LightCurvePoint;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PhotometryResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FrameIngestServiceTest {

    private final FrameIngestService ingest = new FrameIngestService();

    @TempDir
    Path dir;

    private static Path fixtures() throws URISyntaxException {
        return Path.of(FrameIngestServiceTest.class.getResource("/photometry").toURI());
    }

    @Test
    void loadsFolderOfCsvTables() throws URISyntaxException {
        List<Frame> frames = ingest.loadFolder(fixtures());

        assertThat(frames).hasSize(4);
        assertThat(frames).extracting((Frame f) -> f.filter).containsOnly("V");
        assertThat(frames).allSatisfy(f -> assertThat(f.detections).hasSize(5));
        assertThat(frames.get(0).timestamp).isCloseTo(60004.1, within(1e-9));
    }

    @Test
    void fixtureRunRecoversTheTransitDip() throws URISyntaxException {
        List<Frame> frames = ingest.loadFolder(fixtures());
        PhotometryConfig cfg = PhotometryConfig.builder().target(240.55, 28.17).build();

        PhotometryResult result = new PhotometryPipeline().run(frames, cfg);

        assertThat(result.ensemble.size()).isEqualTo(4);
        List<LightCurvePoint> points = result.lightCurve.points;
        assertThat(points).hasSize(4);
        // 2% de caída en el tercer frame
        assertThat(points.get(2).differentialMagnitude).isCloseTo(-2.5 * Math.log10(0.98), within(1e-4));
        assertThat(points.get(0).differentialMagnitude).isCloseTo(0.0, within(1e-4));
    }

    @Test
    void refusesMixedFilters() throws IOException {
        Files.writeString(dir.resolve("OBJ_V_10s_2023-01-01_1a0_59000d5_CAM.csv"), "10.0,20.0,1,1,1000,10\n");
        Files.writeString(dir.resolve("OBJ_B_10s_2023-01-01_1a0_59000d6_CAM.csv"), "10.0,20.0,1,1,1000,10\n");

        assertThatThrownBy(() -> ingest.loadFolder(dir))
                .isInstanceOf(PhotometryIngestException.class)
                .hasMessageContaining("filtros");
    }

    @Test
    void ignoresUnsupportedFilesAndFailsOnEmptyFolder() throws IOException {
        Files.writeString(dir.resolve("notes.txt"), "nada");

        assertThatThrownBy(() -> ingest.loadFolder(dir)).isInstanceOf(PhotometryIngestException.class);
        assertThatThrownBy(() -> ingest.load(dir.resolve("notes.txt"))).isInstanceOf(PhotometryIngestException.class);
    }
}
