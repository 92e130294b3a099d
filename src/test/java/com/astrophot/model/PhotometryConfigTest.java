package com.astrophot.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhotometryConfigTest {

    @Test
    void defaults() {
        PhotometryConfig cfg = PhotometryConfig.builder().target(10.0, 20.0).build();

        assertThat(cfg.positionMetric()).isEqualTo(PositionMetric.SKY);
        assertThat(cfg.matchTolerance()).isEqualTo(5.0);
        assertThat(cfg.targetTolerance()).isEqualTo(5.0);
        assertThat(cfg.minEnsembleSize()).isEqualTo(3);
        assertThat(cfg.sigmaClip()).isEqualTo(3.0);
        assertThat(cfg.clipStatistic()).isEqualTo(ClipStatistic.NOISE_NORMALIZED);
        assertThat(cfg.minCoverageFraction()).isEqualTo(0.8);
        assertThat(cfg.minUsableFrames()).isEqualTo(3);
        assertThat(cfg.variabilityMultiplier()).isInfinite();
        assertThat(cfg.hasTargetPixel()).isFalse();
    }

    @Test
    void targetToleranceFollowsMatchToleranceUnlessSet() {
        assertThat(PhotometryConfig.builder().target(1, 1).matchTolerance(2.5).build().targetTolerance()).isEqualTo(2.5);
        assertThat(PhotometryConfig.builder().target(1, 1).targetTolerance(8).build().targetTolerance()).isEqualTo(8.0);
    }

    @Test
    void toBuilderCopiesEveryField() {
        PhotometryConfig cfg = PhotometryConfig.builder().target(1, 2).sigmaClip(2.5).minEnsembleSize(4)
                .clipStatistic(ClipStatistic.ROBUST_POPULATION).parallelism(2).build();

        PhotometryConfig copy = cfg.toBuilder().matchTolerance(3).build();

        assertThat(copy.target()).isEqualTo(cfg.target());
        assertThat(copy.sigmaClip()).isEqualTo(2.5);
        assertThat(copy.minEnsembleSize()).isEqualTo(4);
        assertThat(copy.clipStatistic()).isEqualTo(ClipStatistic.ROBUST_POPULATION);
        assertThat(copy.parallelism()).isEqualTo(2);
        assertThat(copy.matchTolerance()).isEqualTo(3.0);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> PhotometryConfig.builder().build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).matchTolerance(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).minCoverageFraction(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).minEnsembleSize(5).maxComparisonStars(3).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).variabilityMultiplier(0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exclusionListDefaultsToEmptyWithMatchToleranceRadius() {
        PhotometryConfig cfg = PhotometryConfig.builder().target(1, 1).matchTolerance(2.0).build();

        assertThat(cfg.excludedStars()).isEmpty();
        assertThat(cfg.exclusionRadius()).isEqualTo(2.0);
        assertThat(PhotometryConfig.builder().positionMetric(PositionMetric.PIXEL).targetPixel(1, 1).build()
                .exclusionRadius()).isEqualTo(PhotometryConfig.DEFAULT_EXCLUSION_RADIUS);
    }

    @Test
    void exclusionListIsCopiedAndValidated() {
        List<CelestialPoint> known = new java.util.ArrayList<>(List.of(new CelestialPoint(10, 20)));
        PhotometryConfig cfg = PhotometryConfig.builder().target(1, 1).excludedStars(known).exclusionRadius(8).build();
        known.add(new CelestialPoint(11, 21));

        assertThat(cfg.excludedStars()).hasSize(1);
        assertThat(cfg.toBuilder().build().exclusionRadius()).isEqualTo(8.0);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).exclusionRadius(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometryConfig.builder().target(1, 1).excludedStars(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pixelTargetNeedsNoSkyCoordinate() {
        PhotometryConfig cfg = PhotometryConfig.builder().positionMetric(PositionMetric.PIXEL).targetPixel(100, 200).build();

        assertThat(cfg.target()).isNull();
        assertThat(cfg.hasTargetPixel()).isTrue();
        assertThatThrownBy(() -> PhotometryConfig.builder().targetPixel(100, 200).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
