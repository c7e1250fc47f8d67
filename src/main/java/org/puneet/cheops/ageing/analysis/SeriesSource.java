package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.config.AnalysisType;
import org.puneet.cheops.ageing.exceptions.ValidationException;
import org.puneet.cheops.ageing.model.TimeSeries;

import java.io.IOException;

/**
 * Supplies the raw series of a (target, analysis type, parameter) selection.
 * Implemented by the ingestion layer.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
@FunctionalInterface
public interface SeriesSource {

    /**
     * @param target target name
     * @param analysisType analysis type the parameter belongs to
     * @param parameter parameter column name
     * @return the series, with NaN gaps marked invalid
     * @throws IOException if the underlying data cannot be read
     * @throws ValidationException if the data does not form a valid series
     */
    TimeSeries load(String target, AnalysisType analysisType, String parameter)
            throws IOException, ValidationException;
}
