package com.raditha.smells.detectors;

import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;

import java.util.List;

/**
 * A structural detector. Implementations hold only their immutable options and
 * never modify the unit, so one instance may scan many units concurrently.
 */
public interface SmellDetector {

    /**
     * The smell this detector reports.
     */
    SmellKind kind();

    /**
     * Scan one unit.
     *
     * @param unit Fully built source model
     * @return Findings in the order the detector produced them, possibly empty
     */
    List<Finding> detect(SourceUnit unit);
}
