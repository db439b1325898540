package com.spectral.rtm.lut;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.spectral.rtm.io.ForwardModelParser;

import lombok.Data;

/**
 * Look-up table grid options.
 *
 * <p>
 * For each dimension, {@code *Spacing} is the anticipated spacing, or 0 to
 * use a single point. If the data do not spread by at least
 * {@code *SpacingMin}, a single point is used as well. Any property may be
 * overridden from a JSON file; unknown keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class LutParameters {
    // km
    private double elevationSpacing = 0.25;
    private double elevationSpacingMin = 0.2;

    // g cm-2
    private double h2oSpacing = 0.25;
    private double h2oSpacingMin = 0.03;
    private double h2oMin = 0.05;
    private double[] h2oRange = { 0.05, 5 };

    // degrees
    private double toSensorZenithSpacing = 10;
    private double toSensorZenithSpacingMin = 2;
    private double toSunZenithSpacing = 10;
    private double toSunZenithSpacingMin = 2;
    private double relativeAzimuthSpacing = 60;
    private double relativeAzimuthSpacingMin = 25;

    // AOD
    @JsonProperty("aerosol_0_spacing")
    private double aerosol0Spacing = 0;
    @JsonProperty("aerosol_0_spacing_min")
    private double aerosol0SpacingMin = 0;
    @JsonProperty("aerosol_1_spacing")
    private double aerosol1Spacing = 0;
    @JsonProperty("aerosol_1_spacing_min")
    private double aerosol1SpacingMin = 0;
    @JsonProperty("aerosol_2_spacing")
    private double aerosol2Spacing = 0.25;
    @JsonProperty("aerosol_2_spacing_min")
    private double aerosol2SpacingMin = 0;
    @JsonProperty("aerosol_0_range")
    private double[] aerosol0Range = { 0.001, 1 };
    @JsonProperty("aerosol_1_range")
    private double[] aerosol1Range = { 0.001, 1 };
    @JsonProperty("aerosol_2_range")
    private double[] aerosol2Range = { 0.001, 1 };
    @JsonProperty("aot_550_range")
    private double[] aot550Range = { 0.001, 1 };
    @JsonProperty("aot_550_spacing")
    private double aot550Spacing = 0;
    @JsonProperty("aot_550_spacing_min")
    private double aot550SpacingMin = 0;

    private boolean rteAutoRebuild = true;
    private boolean flagOceanElevation = false;

    /** Defaults overridden by the given JSON document. */
    public static LutParameters fromJson(String json) {
        return ForwardModelParser.read(json, LutParameters.class);
    }

    public static LutParameters load(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    double[] aerosolRange(int i) {
        return switch (i) {
            case 0 -> aerosol0Range;
            case 1 -> aerosol1Range;
            case 2 -> aerosol2Range;
            default -> throw new IllegalArgumentException("No aerosol fraction " + i);
        };
    }

    double aerosolSpacing(int i) {
        return switch (i) {
            case 0 -> aerosol0Spacing;
            case 1 -> aerosol1Spacing;
            case 2 -> aerosol2Spacing;
            default -> throw new IllegalArgumentException("No aerosol fraction " + i);
        };
    }

    double aerosolSpacingMin(int i) {
        return switch (i) {
            case 0 -> aerosol0SpacingMin;
            case 1 -> aerosol1SpacingMin;
            case 2 -> aerosol2SpacingMin;
            default -> throw new IllegalArgumentException("No aerosol fraction " + i);
        };
    }
}
