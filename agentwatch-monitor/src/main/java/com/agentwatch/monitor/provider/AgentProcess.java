package com.agentwatch.monitor.provider;

/**
 * A live agent process reported by discovery.
 *
 * @param sessionId session id parsed from the command line, if any
 * @param resumeId  id passed to a resume flag, if any
 * @param cwd       working directory of the process, if known
 */
public record AgentProcess(int pid, String sessionId, String resumeId, String cwd,
        double cpuPercent, double memMb) {
}
