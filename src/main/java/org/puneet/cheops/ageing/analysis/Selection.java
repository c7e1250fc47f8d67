package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.config.AnalysisType;

import java.util.List;
import java.util.Objects;

/**
 * Full selection tuple of one analysis request. Two equal selections always yield the same
 * result for unchanged source data, so a selection doubles as the cache key.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class Selection {

    private final String target;
    private final AnalysisType analysisType;
    private final String parameter;
    private final boolean removeOutliers;
    private final double outlierMultiplier;
    private final List<Double> binWidthsHours;

    public Selection(String target, AnalysisType analysisType, String parameter,
                     boolean removeOutliers, double outlierMultiplier, List<Double> binWidthsHours) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.analysisType = Objects.requireNonNull(analysisType, "analysisType cannot be null");
        this.parameter = Objects.requireNonNull(parameter, "parameter cannot be null");
        this.removeOutliers = removeOutliers;
        this.outlierMultiplier = outlierMultiplier;
        this.binWidthsHours = List.copyOf(Objects.requireNonNull(binWidthsHours, "binWidthsHours cannot be null"));
    }

    public String getTarget() {
        return target;
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public String getParameter() {
        return parameter;
    }

    public boolean isRemoveOutliers() {
        return removeOutliers;
    }

    public double getOutlierMultiplier() {
        return outlierMultiplier;
    }

    public List<Double> getBinWidthsHours() {
        return binWidthsHours;
    }

    /**
     * @return a copy of this selection for another parameter of the same analysis type
     */
    public Selection withParameter(String otherParameter) {
        return new Selection(target, analysisType, otherParameter, removeOutliers, outlierMultiplier, binWidthsHours);
    }

    /**
     * @return a copy of this selection with the outlier filter switched on or off
     */
    public Selection withOutlierRemoval(boolean enabled) {
        return new Selection(target, analysisType, parameter, enabled, outlierMultiplier, binWidthsHours);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Selection that = (Selection) obj;
        return removeOutliers == that.removeOutliers
                && Double.compare(outlierMultiplier, that.outlierMultiplier) == 0
                && target.equals(that.target)
                && analysisType == that.analysisType
                && parameter.equals(that.parameter)
                && binWidthsHours.equals(that.binWidthsHours);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, analysisType, parameter, removeOutliers, outlierMultiplier, binWidthsHours);
    }

    @Override
    public String toString() {
        return String.format("Selection{target='%s', type=%s, parameter='%s', removeOutliers=%s, k=%s, widths=%s}",
                target, analysisType.getDisplayName(), parameter, removeOutliers, outlierMultiplier, binWidthsHours);
    }
}
