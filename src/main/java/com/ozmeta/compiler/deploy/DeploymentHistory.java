package com.ozmeta.compiler.deploy;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.ozmeta.compiler.util.JsonSupport;

/**
 * Append-only log of deployment attempts.
 */
public class DeploymentHistory {

    private final List<DeploymentRecord> records = new ArrayList<>();

    public synchronized void append(DeploymentRecord record) {
        records.add(record);
    }

    public synchronized List<DeploymentRecord> records() {
        return List.copyOf(records);
    }

    public synchronized List<DeploymentRecord> forGroup(String switchGroup) {
        return records.stream()
                .filter(r -> r.getSwitchGroup().equals(switchGroup))
                .collect(Collectors.toList());
    }

    public String toJson() {
        return JsonSupport.toCanonicalJson(records());
    }
}
