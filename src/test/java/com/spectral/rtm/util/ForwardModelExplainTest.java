package com.spectral.rtm.util;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.spectral.rtm.api.Geometry;
import com.spectral.rtm.engine.RadiativeTransfer;
import com.spectral.rtm.engine.StubEngine;

import static org.junit.Assert.*;

public class ForwardModelExplainTest {
    private RadiativeTransfer rt;

    @Before
    public void setUp() {
        StubEngine vswir = StubEngine.of("vswir", new double[] { 400, 500, 600 }, 2).topography(true);
        StubEngine tir = StubEngine.of("tir", new double[] { 8000, 9000 }, 2).emissive(true);
        rt = new RadiativeTransfer(List.of(tir, vswir), StubEngine.stateVector("AOT550", "H2OSTR"),
                Map.of("H2O_ABSCO", 0.01));
    }

    @Test
    public void testDumpEngines() {
        String dump = new ForwardModelExplain(rt).dumpEngines();
        assertTrue(dump, dump.startsWith("Radiative transfer (2 engines, 5 channels)"));
        assertTrue(dump, dump.contains("[0] vswir channels 0..2"));
        assertTrue(dump, dump.contains("(TOPO)"));
        assertTrue(dump, dump.contains("[1] tir channels 3..4"));
        assertTrue(dump, dump.contains("(EMISSIVE)"));
    }

    @Test
    public void testDumpStateVector() {
        String dump = new ForwardModelExplain(rt).dumpStateVector();
        assertTrue(dump, dump.startsWith("Statevector (2 elements)"));
        assertTrue(dump, dump.contains("AOT550 bounds="));
        assertTrue(dump, dump.contains("Unknowns:"));
        assertTrue(dump, dump.contains("H2O_ABSCO="));
    }

    @Test
    public void testExplainQuantitiesMarksPlaceholders() {
        String dump = new ForwardModelExplain(rt).explainQuantities(new double[] { 0.1, 1.5 },
                Geometry.ofSolarZenith(30));
        assertTrue(dump, dump.contains("rhoatm [5]"));
        assertTrue(dump, dump.contains("dir-dir (PLACEHOLDER)"));
        assertTrue(dump, dump.contains("vswir: 3 channels"));
    }
}
