package com.spectral.rtm.engine;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.spectral.rtm.api.Geometry;
import com.spectral.rtm.io.EngineFactory;
import com.spectral.rtm.io.EngineParameters;
import com.spectral.rtm.io.EngineRegistry;
import com.spectral.rtm.io.EngineType;
import com.spectral.rtm.io.ForwardModelDefinition;
import com.spectral.rtm.io.ForwardModelParser;

import static org.junit.Assert.*;

public class RadiativeTransferConfigTest {

    private ForwardModelDefinition def;
    private List<EngineParameters> seen;
    private EngineFactory factory;

    @Before
    public void setUp() throws Exception {
        def = ForwardModelParser.parseFile(
                Paths.get(getClass().getResource("/forward_model.json").toURI()));
        seen = new ArrayList<>();
        // Three channels starting at the configured wavelength
        factory = p -> {
            seen.add(p);
            double first = ((Number) p.property("first_wavelength", 0.0)).doubleValue();
            return StubEngine.of(p.engineConfig().getName(), new double[] { first, first + 10, first + 20 }, 2);
        };
    }

    @Test
    public void testBuildsFromConfiguration() {
        EngineRegistry registry = new EngineRegistry()
                .registerFactory(EngineType.MODTRAN, factory)
                .registerFactory(EngineType.SRTMNET, factory);

        RadiativeTransfer rt = RadiativeTransfer.fromDefinition(def, registry);

        // Declared tir first, sorted to vswir first
        assertEquals("vswir", rt.engines().get(0).name());
        assertArrayEquals(new double[] { 400, 410, 420, 8000, 8010, 8020 }, rt.wavelengths(), 0.0);
        assertEquals(List.of("AOT550", "H2OSTR"), rt.stateVector().names());
        assertEquals(List.of("H2O_ABSCO"), rt.unknownNames());
        assertArrayEquals(new double[] { 0.1, 1.5 }, rt.xa(), 0.0);

        assertEquals(2, seen.size());
        EngineParameters tir = seen.get(0);
        assertEquals(EngineType.MODTRAN, tir.type());
        assertEquals("/data/lut/global", tir.lutPath());
        assertEquals("nds", tir.interpolatorStyle());
        assertEquals("/data/wl.txt", tir.wavelengthFile());
        assertEquals("/data/lut/vswir", seen.get(1).lutPath());

        double[] rdn = rt.calcRdn(rt.xa(), new double[6], new double[6], new double[6], Geometry.ofSolarZenith(30));
        assertEquals(6, rdn.length);
    }

    @Test
    public void testUnknownEngineName() {
        def.getRadiativeTransfer().getRadiativeTransferEngines().get(0).setEngineName("disort");
        try {
            RadiativeTransfer.fromDefinition(def, new EngineRegistry().registerFactory(EngineType.SRTMNET, factory));
            fail("Should throw IllegalArgumentException for an unknown engine");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Must be one of"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testUnregisteredEngineType() {
        RadiativeTransfer.fromDefinition(def, new EngineRegistry().registerFactory(EngineType.SRTMNET, factory));
    }

    @Test
    public void testStatevectorMismatch() {
        def.getRadiativeTransfer().getStatevector().remove("H2OSTR");
        EngineRegistry registry = new EngineRegistry()
                .registerFactory(EngineType.MODTRAN, factory)
                .registerFactory(EngineType.SRTMNET, factory);
        try {
            RadiativeTransfer.fromDefinition(def, registry);
            fail("Should throw IllegalStateException on state vector mismatch");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("expected=1, got=2"));
        }
    }
}
