package com.spectral.rtm.io;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * POJO representation of the forward model configuration.
 *
 * <p>
 * The keys in {@link LayerDef} may be given at three levels: per engine, for
 * the instrument, and globally for the radiative transfer section.
 * {@link LayeredConfig} resolves them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ForwardModelDefinition {
    private RadiativeTransferDef radiativeTransfer;
    private InstrumentDef instrument;

    /** Keys that can be overridden per level. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class LayerDef {
        private String interpolatorStyle;
        private Boolean overwriteInterpolator;
        private Map<String, List<Double>> lutGrid;
        private String lutPath;
        private String wavelengthFile;
    }

    /** Global radiative transfer section. */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class RadiativeTransferDef extends LayerDef {
        private LinkedHashMap<String, StateElementDef> statevector = new LinkedHashMap<>();
        private LinkedHashMap<String, Double> unknowns = new LinkedHashMap<>();
        private List<EngineDef> radiativeTransferEngines;
    }

    /** Instrument section; only the layered keys are read here. */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class InstrumentDef extends LayerDef {
    }

    /** One radiative transfer engine. */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class EngineDef extends LayerDef {
        private String engineName;
        private String name;
        private Map<String, Object> properties = new LinkedHashMap<>();
    }

    /** One retrieved state vector element. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class StateElementDef {
        private double[] bounds;
        private double scale = 1.0;
        private double init;
        private double priorMean;
        private double priorSigma;
    }
}
