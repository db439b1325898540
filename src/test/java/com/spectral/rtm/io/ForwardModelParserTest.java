package com.spectral.rtm.io;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import com.spectral.rtm.io.ForwardModelDefinition.EngineDef;
import com.spectral.rtm.io.ForwardModelDefinition.RadiativeTransferDef;

import static org.junit.Assert.*;

public class ForwardModelParserTest {

    private static Path resource(String name) throws Exception {
        return Paths.get(ForwardModelParserTest.class.getResource(name).toURI());
    }

    @Test
    public void testParseFile() throws Exception {
        ForwardModelDefinition def = ForwardModelParser.parseFile(resource("/forward_model.json"));
        RadiativeTransferDef rt = def.getRadiativeTransfer();

        assertEquals("/data/lut/global", rt.getLutPath());
        assertEquals("mlg", rt.getInterpolatorStyle());
        assertEquals(2, rt.getStatevector().size());
        assertEquals("AOT550", rt.getStatevector().keySet().iterator().next());
        assertEquals(100.0, rt.getStatevector().get("H2OSTR").getPriorSigma(), 0.0);
        assertEquals(0.01, rt.getUnknowns().get("H2O_ABSCO"), 0.0);

        assertEquals(2, rt.getRadiativeTransferEngines().size());
        EngineDef tir = rt.getRadiativeTransferEngines().get(0);
        assertEquals("modtran", tir.getEngineName());
        assertEquals("tir", tir.getName());
        assertEquals(3, tir.getLutGrid().get("H2OSTR").size());
        assertEquals(8000.0, ((Number) tir.getProperties().get("first_wavelength")).doubleValue(), 0.0);
        assertEquals(Boolean.TRUE, rt.getRadiativeTransferEngines().get(1).getOverwriteInterpolator());

        assertEquals("/data/wl.txt", def.getInstrument().getWavelengthFile());
    }

    @Test
    public void testMissingRadiativeTransferSection() {
        try {
            ForwardModelParser.parse("{\"instrument\": {}}");
            fail("Should throw IllegalArgumentException without a radiative_transfer section");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("radiative_transfer"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        ForwardModelParser.parse("{\"radiative_transfer\": ");
    }

    @Test
    public void testEmptySectionsGetDefaults() {
        ForwardModelDefinition def = ForwardModelParser.parse("{\"radiative_transfer\": {}}");
        assertTrue(def.getRadiativeTransfer().getStatevector().isEmpty());
        assertTrue(def.getRadiativeTransfer().getUnknowns().isEmpty());
        assertNull(def.getInstrument());
    }
}
