package com.agentwatch.monitor.provider;

import com.agentwatch.monitor.session.SessionSnapshot;

import java.util.List;

/**
 * Receives the full snapshot list after every refresh.
 */
@FunctionalInterface
public interface RefreshListener {

    void onRefresh(List<SessionSnapshot> snapshots) throws Exception;
}
