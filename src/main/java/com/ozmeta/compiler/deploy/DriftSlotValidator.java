package com.ozmeta.compiler.deploy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.drift.DriftFinding;
import com.ozmeta.compiler.drift.DriftReport;
import com.ozmeta.compiler.drift.DriftValidator;
import com.ozmeta.compiler.drift.LiveTargetObservation;
import com.ozmeta.compiler.drift.LiveTargetObserver;
import com.ozmeta.compiler.model.physical.TargetProjection;

/**
 * Fails a slot when any of its target platforms drifts from the compiled
 * projection.
 */
public class DriftSlotValidator implements SlotValidator {

    private static final Logger log = LoggerFactory.getLogger(DriftSlotValidator.class);

    private final LiveTargetObserver observer;
    private final DriftValidator driftValidator;

    public DriftSlotValidator(LiveTargetObserver observer, DriftValidator driftValidator) {
        this.observer = observer;
        this.driftValidator = driftValidator;
    }

    @Override
    public List<String> validate(String switchGroup, SlotBuild build) throws IOException {
        List<String> failures = new ArrayList<>();
        for (TargetProjection projection : build.getProjections()) {
            LiveTargetObservation observation = observer.observe(projection);
            DriftReport report = driftValidator.validate(projection, observation);
            if (report.hasDrift()) {
                log.warn("Drift on {}: {} finding(s)", report.getTargetKey(), report.getFindings().size());
            }
            for (DriftFinding finding : report.getFindings()) {
                failures.add(report.getTargetKey() + ": " + finding);
            }
        }
        return failures;
    }
}
