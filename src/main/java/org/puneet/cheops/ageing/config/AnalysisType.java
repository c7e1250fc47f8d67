package org.puneet.cheops.ageing.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Categories of monitored data, each with its own parameter groups.
 *
 * <p>Binned noise applies only to types whose data source is a lightcurve. Types with
 * {@code calculateStats == false} report raw values instead of statistics.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public enum AnalysisType {
    DRP_LIGHTCURVE("DRP Lightcurve", DataSource.DRP_LIGHTCURVE, true,
            "Time-series RAW photometric data",
            ParameterGroup.of("FLUX", "FLUX"),
            ParameterGroup.of("BACKGROUND", "BACKGROUND"),
            ParameterGroup.of("CONTA_LC", "CONTA_LC"),
            ParameterGroup.of("SMEARING_LC", "SMEARING_LC")),

    RPC_LIGHTCURVE("RPC Lightcurve", DataSource.RPC_LIGHTCURVE, true,
            "Time-series processed photometric data",
            ParameterGroup.of("FLUX", "FLUX"),
            ParameterGroup.of("BACKGROUND", "BACKGROUND"),
            ParameterGroup.of("CONTA_LC", "CONTA_LC"),
            ParameterGroup.of("SMEARING_LC", "SMEARING_LC")),

    PIPE_LIGHTCURVE_SA("PIPE Lightcurve (sa)", DataSource.PIPE_LIGHTCURVE_SA, true,
            "PIPE lightcurve from SubArray data",
            ParameterGroup.of("FLUX", "FLUX"),
            ParameterGroup.of("FLUXERR", "FLUXERR"),
            ParameterGroup.of("Background", "BG"),
            ParameterGroup.of("Position", "XC", "YC"),
            ParameterGroup.of("Roll", "ROLL"),
            ParameterGroup.of("thermFront_2", "thermFront_2")),

    PIPE_LIGHTCURVE_IM("PIPE Lightcurve (im)", DataSource.PIPE_LIGHTCURVE_IM, true,
            "PIPE lightcurve from Imagette data",
            ParameterGroup.of("FLUX", "FLUX"),
            ParameterGroup.of("FLUXERR", "FLUXERR"),
            ParameterGroup.of("Background", "BG"),
            ParameterGroup.of("Position", "XC", "YC"),
            ParameterGroup.of("Roll", "ROLL"),
            ParameterGroup.of("thermFront_2", "thermFront_2")),

    GEOMETRY("Geometry", DataSource.SCI_RAW_METADATA, true,
            "Geometric angles during observations",
            ParameterGroup.of("Sun Angle", "LOS_TO_SUN_ANGLE"),
            ParameterGroup.of("Moon Angle", "LOS_TO_MOON_ANGLE"),
            ParameterGroup.of("Earth Angle", "LOS_TO_EARTH_ANGLE")),

    VOLTAGES("Voltages", DataSource.SCI_RAW_METADATA, true,
            "CCD voltage readings",
            ParameterGroup.of("VOD", "HK_VOLT_FEE_VOD"),
            ParameterGroup.of("VRD", "HK_VOLT_FEE_VRD"),
            ParameterGroup.of("VOG", "HK_VOLT_FEE_VOG"),
            ParameterGroup.of("VSS", "HK_VOLT_FEE_VSS")),

    TEMPERATURES("Temperatures", DataSource.SCI_RAW_METADATA, true,
            "Temperature sensor readings",
            ParameterGroup.of("CCD Temp", "HK_TEMP_FEE_CCD"),
            ParameterGroup.of("ADC Temp", "HK_TEMP_FEE_ADC"),
            ParameterGroup.of("Bias Temp", "HK_TEMP_FEE_BIAS")),

    THERMISTORS("Thermistors", DataSource.SCI_RAW_METADATA, true,
            "Thermistor readings",
            ParameterGroup.of("Aft Thermistors", "thermAft_1", "thermAft_2", "thermAft_3", "thermAft_4"),
            ParameterGroup.of("Front Thermistors", "thermFront_1", "thermFront_2", "thermFront_3", "thermFront_4")),

    CENTROIDS("Centroids", DataSource.CENTROID_SUBARRAY, true,
            "Centroid positions by method",
            ParameterGroup.of("OBS", "OBS_OFF_X", "OBS_OFF_Y", "OBS_LOC_X", "OBS_LOC_Y"),
            ParameterGroup.of("FSW_INFLIGHT", "FSW_INFLIGHT_LOC_X", "FSW_INFLIGHT_LOC_Y", "FSW_INFLIGHT_X", "FSW_INFLIGHT_Y"),
            ParameterGroup.of("DRP", "DRP_LOC_X", "DRP_LOC_Y", "DRP_X", "DRP_Y"),
            ParameterGroup.of("FSW_GROUND", "FSW_GROUND_LOC_X", "FSW_GROUND_LOC_Y", "FSW_GROUND_X", "FSW_GROUND_Y"),
            ParameterGroup.of("IWCOG", "IWCOG_LOC_X", "IWCOG_LOC_Y", "IWCOG_X", "IWCOG_Y"),
            ParameterGroup.of("EE90", "EE90_LOC_X", "EE90_LOC_Y", "EE90_X", "EE90_Y")),

    BACKGROUND_LEVEL("Background Level", DataSource.CONT_DATA, true,
            "Straylight background levels",
            ParameterGroup.of("Straylight BG", "SL_BG", "SL_MIN", "SL_MAX")),

    BACKGROUND_VARIATION("Background Variation", DataSource.CONT_DATA, true,
            "South Atlantic Anomaly variance",
            ParameterGroup.of("SAA Variance", "SAA_VAR", "SAA_MIN", "SAA_MAX")),

    ENCIRCLED_ENERGY("Encircled Energy", DataSource.EE90_DATA, true,
            "90% encircled energy measurements",
            ParameterGroup.of("EE90", "EE90")),

    PSF_SHAPE("PSF Shape", DataSource.GENERAL_REPORT, false,
            "PSF shape parameters (direct values)",
            ParameterGroup.of("Location", "cntr", "loc_x", "loc_y"),
            ParameterGroup.of("Sigma", "sy_std", "sx_std", "sy_max", "sx_max", "sy_diff", "sx_diff"),
            ParameterGroup.of("Radius", "ry_max", "rx_max", "ry_min", "rx_min", "ry_avr", "rx_avr", "ry_std", "rx_std"),
            ParameterGroup.of("Height", "h_avr", "h_std", "h_max", "h_min"));

    private final String displayName;
    private final DataSource source;
    private final boolean calculateStats;
    private final String description;
    private final List<ParameterGroup> groups;

    AnalysisType(String displayName, DataSource source, boolean calculateStats,
                 String description, ParameterGroup... groups) {
        this.displayName = displayName;
        this.source = source;
        this.calculateStats = calculateStats;
        this.description = description;
        this.groups = List.of(groups);
    }

    public String getDisplayName() {
        return displayName;
    }

    public DataSource getSource() {
        return source;
    }

    /**
     * @return false for types whose parameters are reported as raw values
     */
    public boolean isCalculateStats() {
        return calculateStats;
    }

    /**
     * @return true when binned-noise analysis applies to this type
     */
    public boolean isBinnedNoiseApplicable() {
        return calculateStats && source.isLightcurve();
    }

    public String getDescription() {
        return description;
    }

    public List<ParameterGroup> getGroups() {
        return groups;
    }

    /**
     * @return every parameter of every group, in declaration order
     */
    public List<String> getAllParameters() {
        List<String> params = new ArrayList<>();
        for (ParameterGroup group : groups) {
            params.addAll(group.getParameters());
        }
        return Collections.unmodifiableList(params);
    }

    public boolean hasParameter(String parameter) {
        for (ParameterGroup group : groups) {
            if (group.contains(parameter)) {
                return true;
            }
        }
        return false;
    }

    public Optional<ParameterGroup> findGroup(String groupName) {
        return groups.stream().filter(g -> g.getName().equals(groupName)).findFirst();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
