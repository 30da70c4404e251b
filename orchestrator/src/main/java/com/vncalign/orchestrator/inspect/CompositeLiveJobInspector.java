package com.vncalign.orchestrator.inspect;

import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Union of the pid files (exact, our own children) and the process-table
 * scan (best effort, catches executors started by anything else).
 */
@Component
@Primary
public class CompositeLiveJobInspector implements LiveJobInspector {

    private final PidFileTracker        pidFiles;
    private final ProcessTableInspector processTable;

    public CompositeLiveJobInspector(PidFileTracker pidFiles, ProcessTableInspector processTable) {
        this.pidFiles     = pidFiles;
        this.processTable = processTable;
    }

    @Override
    public Set<String> runningJobIds() {
        Set<String> ids = new LinkedHashSet<>(pidFiles.runningJobIds());
        ids.addAll(processTable.runningJobIds());
        return ids;
    }
}
