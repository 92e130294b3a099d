package com.astrophot.service;

import com.astrophot.model.CelestialPoint;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimbadServiceTest {

    @Test
    void parsesSesameResponse() {
        String xml = "<?xml version=\"1.0\"?><Sesame><Target><Resolver name=\"S=Simbad\">"
                + "<jpos>16:02:11.84 +28:10:10.4</jpos><jradeg> 240.5493</jradeg><jdedeg>28.1696 </jdedeg>"
                + "</Resolver></Target></Sesame>";

        Optional<CelestialPoint> p = SimbadService.parse(xml);

        assertThat(p).isPresent();
        assertThat(p.get().ra).isCloseTo(240.5493, within(1e-9));
        assertThat(p.get().dec).isCloseTo(28.1696, within(1e-9));
    }

    @Test
    void unresolvedOrMalformedIsEmpty() {
        assertThat(SimbadService.parse("<Sesame><Target><INFO>*** Nothing found ***</INFO></Target></Sesame>")).isEmpty();
        assertThat(SimbadService.parse("<jradeg>abc</jradeg><jdedeg>1</jdedeg>")).isEmpty();
        assertThat(SimbadService.parse("<jradeg>10</jradeg><jdedeg>95</jdedeg>")).isEmpty();
    }

    @Test
    void blankNameIsNotQueried() {
        assertThat(new SimbadService().search("  ")).isEmpty();
    }
}
