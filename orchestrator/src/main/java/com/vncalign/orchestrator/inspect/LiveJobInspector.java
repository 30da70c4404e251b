package com.vncalign.orchestrator.inspect;

import java.util.Set;

/**
 * Reports which alignment jobs have an executor process running right now,
 * whoever started it (this server, a previous incarnation, or another
 * instance pointed at the same directory).
 */
public interface LiveJobInspector {

    Set<String> runningJobIds();
}
