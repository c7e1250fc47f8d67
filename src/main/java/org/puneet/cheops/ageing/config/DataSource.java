package org.puneet.cheops.ageing.config;

/**
 * Per-visit data products the analysis types draw their parameters from.
 *
 * <p>Only the properties the engine needs are kept here: whether the product is a
 * lightcurve (and therefore gets binned-noise analysis), and which column carries the
 * sample time in which format. File discovery belongs to the ingestion layer.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public enum DataSource {
    DRP_LIGHTCURVE("DRP_lightcurve", true, "UTC_TIME", TimeFormat.ISO_UTC),
    RPC_LIGHTCURVE("RPC_lightcurve", true, "UTC_TIME", TimeFormat.ISO_UTC),
    PIPE_LIGHTCURVE_SA("PIPE_lightcurve_sa", true, "MJD_TIME", TimeFormat.MJD),
    PIPE_LIGHTCURVE_IM("PIPE_lightcurve_im", true, "MJD_TIME", TimeFormat.MJD),
    SCI_RAW_METADATA("sci_raw_metadata", false, "UTC_TIME", TimeFormat.ISO_UTC),
    CENTROID_SUBARRAY("centroid_subarray", false, "OBS_MJD", TimeFormat.MJD),
    CONT_DATA("cont_data", false, "MJD_TIME", TimeFormat.MJD),
    EE90_DATA("ee90_data", false, "EE90_MJD", TimeFormat.MJD),
    GENERAL_REPORT("general_report", false, null, TimeFormat.NONE);

    /**
     * Encoding of the time column.
     */
    public enum TimeFormat {
        MJD,
        ISO_UTC,
        NONE
    }

    private final String sourceName;
    private final boolean lightcurve;
    private final String timeColumn;
    private final TimeFormat timeFormat;

    DataSource(String sourceName, boolean lightcurve, String timeColumn, TimeFormat timeFormat) {
        this.sourceName = sourceName;
        this.lightcurve = lightcurve;
        this.timeColumn = timeColumn;
        this.timeFormat = timeFormat;
    }

    public String getSourceName() {
        return sourceName;
    }

    public boolean isLightcurve() {
        return lightcurve;
    }

    /**
     * @return the time column name, or null for products without per-sample times
     */
    public String getTimeColumn() {
        return timeColumn;
    }

    public TimeFormat getTimeFormat() {
        return timeFormat;
    }
}
