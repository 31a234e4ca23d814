package com.agentwatch.monitor.provider;

import java.io.IOException;
import java.util.List;

/**
 * Provider-specific source of live processes and candidate transcripts.
 * Implementations scan the process table and the provider's log directory.
 */
public interface SessionDiscovery {

    List<AgentProcess> listProcesses() throws IOException;

    List<TranscriptFile> listTranscripts() throws IOException;
}
