package com.astrophot.service;

import com.astrophot.exception.InvalidFrameSequenceException;
import com.astrophot.exception.TargetNotFoundException;
import com.astrophot.model.CelestialPoint;
import com.astrophot.model.Detection;
import com.astrophot.model.Frame;
import com.astrophot.model.MasterCatalog;
import com.astrophot.model.MasterStar;
import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PositionMetric;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.astrophot.service.SyntheticField.constant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StarMatcherTest {

    private final StarMatcher matcher = new StarMatcher();

    private static SyntheticField field(int frames, int stars) {
        Random rnd = new Random(42);
        SyntheticField field = new SyntheticField(frames);
        for (int s = 0; s < stars; s++) field.addStar(SyntheticField.gaussian(rnd, frames, 12 + 0.3 * s, 0.01), 0.01);
        return field;
    }

    private static PhotometryConfig config(CelestialPoint target) {
        return PhotometryConfig.builder().target(target).build();
    }

    private static List<String> fingerprint(MasterCatalog catalog) {
        List<String> out = new ArrayList<>();
        for (MasterStar s : catalog.stars())
            out.add(String.format("%d %.7f %.7f %.5f %s", s.id(), s.ra(), s.dec(), s.meanMagnitude(),
                    new java.util.TreeSet<>(s.detections().keySet())));
        return out;
    }

    @Test
    void feedOrderDoesNotChangeCatalogOrTarget() {
        SyntheticField field = field(8, 10);
        PhotometryConfig cfg = config(field.position(3));
        MasterCatalog reference = matcher.match(field.frames(), cfg);

        Random rnd = new Random(7);
        for (int trial = 0; trial < 5; trial++) {
            List<Frame> shuffled = new ArrayList<>();
            for (Frame f : field.frames()) {
                List<Detection> dets = new ArrayList<>(f.detections);
                Collections.shuffle(dets, rnd);
                shuffled.add(new Frame(f.id, f.timestamp, dets, f.airmass, f.filter));
            }
            Collections.shuffle(shuffled, rnd);

            MasterCatalog catalog = matcher.match(shuffled, cfg);
            assertThat(fingerprint(catalog)).isEqualTo(fingerprint(reference));
            assertThat(catalog.targetId()).isEqualTo(reference.targetId());
        }
    }

    @Test
    void buildsOneMasterStarPerPhysicalStar() {
        SyntheticField field = field(6, 12);
        MasterCatalog catalog = matcher.match(field.frames(), config(field.position(0)));

        assertThat(catalog.stars()).hasSize(12);
        assertThat(catalog.stars()).allSatisfy(s -> assertThat(s.coverage()).isEqualTo(6));
        assertThat(catalog.targetId()).isEqualTo(SyntheticField.idOf(catalog, field.position(0)));
        assertThat(catalog.comparisonCandidates()).hasSize(11).noneMatch(s -> s.id() == catalog.targetId());
    }

    @Test
    void targetFarFromEveryStarFails() {
        SyntheticField field = field(3, 4);
        CelestialPoint star = field.position(0);
        CelestialPoint target = new CelestialPoint(star.ra, star.dec + 50.0 / 3600.0);

        assertThatThrownBy(() -> matcher.match(field.frames(), config(target)))
                .isInstanceOf(TargetNotFoundException.class)
                .satisfies(e -> assertThat(((TargetNotFoundException) e).getClosestDistance()).isCloseTo(50.0, within(1.0)));
    }

    @Test
    void emptyFrameIsSkippedAndRecorded() {
        SyntheticField field = field(4, 5);
        List<Frame> frames = new ArrayList<>(field.frames());
        frames.add(new Frame("empty", SyntheticField.MJD0 + 0.015, List.of()));

        MasterCatalog catalog = matcher.match(frames, config(field.position(0)));

        assertThat(catalog.frames()).hasSize(5);
        assertThat(catalog.skippedFrameIds()).containsExactly("empty");
        assertThat(catalog.usableFrameCount()).isEqualTo(4);
        assertThat(catalog.usableFrames()).extracting((Frame f) -> f.id).doesNotContain("empty");
    }

    @Test
    void starMissingInOneFrameKeepsItsIdentity() {
        double[] mags = constant(5, 13.0);
        mags[2] = Double.NaN;
        SyntheticField field = new SyntheticField(5);
        field.addStar(constant(5, 12.0), 0.01);
        int intermittent = field.addStar(mags, 0.01);
        field.addStar(constant(5, 12.5), 0.01);

        MasterCatalog catalog = matcher.match(field.frames(), config(field.position(0)));

        assertThat(catalog.stars()).hasSize(3);
        MasterStar star = catalog.star(SyntheticField.idOf(catalog, field.position(intermittent)));
        assertThat(star.coverage()).isEqualTo(4);
        assertThat(star.detection(SyntheticField.frameId(2))).isEmpty();
    }

    @Test
    void starAppearingLaterGetsNextId() {
        double[] late = constant(4, 14.0);
        late[0] = Double.NaN;
        late[1] = Double.NaN;
        SyntheticField field = new SyntheticField(4);
        field.addStar(constant(4, 12.0), 0.01);
        field.addStar(constant(4, 12.5), 0.01);
        int newcomer = field.addStar(late, 0.01);

        MasterCatalog catalog = matcher.match(field.frames(), config(field.position(0)));

        assertThat(SyntheticField.idOf(catalog, field.position(newcomer))).isEqualTo(3);
        assertThat(catalog.star(3).coverage()).isEqualTo(2);
    }

    @Test
    void duplicateDetectionsKeepTheSmallerMagnitudeError() {
        CelestialPoint p = new CelestialPoint(SyntheticField.RA0, SyntheticField.DEC0);
        Detection precise = new Detection("a", p.ra, p.dec, 10, 10, 12.0, 0.005, 4);
        Detection noisy = new Detection("a", p.ra + 1.0 / 3600, p.dec, 11, 10, 12.1, 0.02, 0);
        Frame frame = new Frame("a", 1.0, List.of(noisy, precise));

        List<Detection> kept = matcher.deduplicate(frame, PositionMetric.SKY, 5.0);

        assertThat(kept).containsExactly(precise);
    }

    @Test
    void equalErrorDuplicatesKeepTheCleanOne() {
        CelestialPoint p = new CelestialPoint(SyntheticField.RA0, SyntheticField.DEC0);
        Detection flagged = new Detection("a", p.ra, p.dec, 10, 10, 12.0, 0.01, 4);
        Detection clean = new Detection("a", p.ra + 1.0 / 3600, p.dec, 11, 10, 12.1, 0.01, 0);
        Frame frame = new Frame("a", 1.0, List.of(flagged, clean));

        List<Detection> kept = matcher.deduplicate(frame, PositionMetric.SKY, 5.0);

        assertThat(kept).containsExactly(clean);
    }

    @Test
    void duplicateTimestampOrEmptyInputIsRejected() {
        Frame a = new Frame("a", 1.0, List.of());
        Frame b = new Frame("b", 1.0, List.of());

        assertThatThrownBy(() -> matcher.match(List.of(a, b), config(new CelestialPoint(0, 0))))
                .isInstanceOf(InvalidFrameSequenceException.class);
        assertThatThrownBy(() -> matcher.match(List.of(), config(new CelestialPoint(0, 0))))
                .isInstanceOf(InvalidFrameSequenceException.class);
        assertThatThrownBy(() -> matcher.match(List.of(a, new Frame("a", 2.0, List.of())), config(new CelestialPoint(0, 0))))
                .isInstanceOf(InvalidFrameSequenceException.class);
    }

    @Test
    void matchesAcrossZeroRightAscension() {
        SyntheticField field = new SyntheticField(3);
        double[] errs = constant(3, 0.01);
        int wrapped = field.addStarAt(new CelestialPoint(359.99995, 10.0), constant(3, 12.0), errs);
        field.addStarAt(new CelestialPoint(0.01, 10.0), constant(3, 13.0), errs);

        MasterCatalog catalog = matcher.match(field.frames(), config(new CelestialPoint(0.00002, 10.0)));

        assertThat(catalog.stars()).hasSize(2);
        MasterStar target = catalog.target();
        assertThat(target.id()).isEqualTo(SyntheticField.idOf(catalog, field.position(wrapped)));
        assertThat(target.coverage()).isEqualTo(3);
        assertThat(target.ra()).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
    }

    @Test
    void pixelModeResolvesTargetByPixelPosition() {
        SyntheticField field = field(4, 5);
        PhotometryConfig cfg = PhotometryConfig.builder()
                .positionMetric(PositionMetric.PIXEL)
                .matchTolerance(3.0)
                .targetPixel(500 + 2 * SyntheticField.SPACING_ARCSEC, 500)
                .build();

        MasterCatalog catalog = matcher.match(field.frames(), cfg);

        assertThat(catalog.stars()).hasSize(5);
        assertThat(catalog.targetId()).isEqualTo(SyntheticField.idOf(catalog, field.position(2)));
    }
}
