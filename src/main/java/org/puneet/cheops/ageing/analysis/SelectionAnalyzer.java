package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.exceptions.AnalysisException;

/**
 * Anything that turns a selection into a result.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
@FunctionalInterface
public interface SelectionAnalyzer {

    AnalysisResult compute(Selection selection) throws AnalysisException;
}
