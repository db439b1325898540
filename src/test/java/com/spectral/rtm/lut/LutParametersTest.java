package com.spectral.rtm.lut;

import org.junit.Test;

import static org.junit.Assert.*;

public class LutParametersTest {

    @Test
    public void testDefaults() {
        LutParameters p = new LutParameters();
        assertEquals(0.25, p.getElevationSpacing(), 0.0);
        assertEquals(0.05, p.getH2oMin(), 0.0);
        assertArrayEquals(new double[] { 0.05, 5 }, p.getH2oRange(), 0.0);
        assertEquals(60, p.getRelativeAzimuthSpacing(), 0.0);
        assertEquals(0.25, p.getAerosol2Spacing(), 0.0);
        assertEquals(0, p.getAot550Spacing(), 0.0);
        assertTrue(p.isRteAutoRebuild());
        assertFalse(p.isFlagOceanElevation());
    }

    @Test
    public void testJsonOverridesSelectedKeys() {
        LutParameters p = LutParameters.fromJson("{"
                + "\"h2o_spacing\": 0.1,"
                + "\"to_sun_zenith_spacing\": 5,"
                + "\"aerosol_0_spacing\": 0.5,"
                + "\"aot_550_range\": [0.01, 2.0],"
                + "\"flag_ocean_elevation\": true,"
                + "\"not_a_parameter\": 42"
                + "}");
        assertEquals(0.1, p.getH2oSpacing(), 0.0);
        assertEquals(5, p.getToSunZenithSpacing(), 0.0);
        assertEquals(0.5, p.getAerosol0Spacing(), 0.0);
        assertArrayEquals(new double[] { 0.01, 2.0 }, p.getAot550Range(), 0.0);
        assertTrue(p.isFlagOceanElevation());
        // Untouched keys keep their defaults
        assertEquals(0.2, p.getElevationSpacingMin(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        LutParameters.fromJson("{\"h2o_spacing\": }");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAerosolIndexOutOfRange() {
        new LutParameters().aerosolRange(3);
    }
}
