package com.astrophot.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CelestialPointTest {

    @Test
    void separationInArcseconds() {
        CelestialPoint a = new CelestialPoint(150.0, 20.0);
        CelestialPoint b = new CelestialPoint(150.0, 20.0 + 1.0 / 3600);

        assertThat(a.separationArcsec(b)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void raSeparationShrinksWithDeclination() {
        CelestialPoint a = new CelestialPoint(10.0, 60.0);
        CelestialPoint b = new CelestialPoint(10.0 + 10.0 / 3600, 60.0);

        assertThat(a.separationArcsec(b)).isCloseTo(5.0, within(1e-3));
    }

    @Test
    void separationAcrossZeroRightAscension() {
        CelestialPoint a = new CelestialPoint(359.9999, 0.0);
        CelestialPoint b = new CelestialPoint(0.0001, 0.0);

        assertThat(a.separationArcsec(b)).isCloseTo(0.72, within(1e-6));
    }

    @Test
    void normalizesRightAscensionAndValidatesDeclination() {
        assertThat(new CelestialPoint(-10, 0).ra).isEqualTo(350.0);
        assertThat(new CelestialPoint(370, 0).ra).isCloseTo(10.0, within(1e-12));
        assertThatThrownBy(() -> new CelestialPoint(0, 91)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CelestialPoint(Double.NaN, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wrapRaDelta() {
        assertThat(CelestialPoint.wrapRaDelta(359.0)).isCloseTo(-1.0, within(1e-12));
        assertThat(CelestialPoint.wrapRaDelta(-359.0)).isCloseTo(1.0, within(1e-12));
        assertThat(CelestialPoint.wrapRaDelta(10.0)).isCloseTo(10.0, within(1e-12));
    }
}
