package com.agentwatch.app;

import com.agentwatch.hooks.HookEvent;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;
import com.agentwatch.registry.SessionRegistry;
import com.agentwatch.registry.SessionRegistryRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RegistryBindingListenerTest {

    private final SessionRegistry registry = new SessionRegistry(SessionRegistry.DEFAULT_TTL_MS, null, "codex");

    private final HookEvent event = HookEvent.builder()
            .hookEventName(HookEvent.SESSION_START)
            .sessionId("s1")
            .cwd("/work/alpha")
            .build();

    private final SessionSnapshot snapshot = SessionSnapshot.builder()
            .provider("claude")
            .sessionId("s1")
            .state(SessionState.ACTIVE)
            .build();

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void binding_upsertsRegistryRecord() throws Exception {
        RegistryBindingListener listener = new RegistryBindingListener(registry,
                (e, s) -> Optional.of(new ThreadBinding("user-a", "mg", "thread-1", "parent-1")));

        listener.onSessionStart(event, snapshot);

        SessionRegistryRecord record = registry.getByThread("thread-1");
        assertNotNull(record);
        assertEquals("s1", record.sessionId());
        assertEquals("claude", record.provider());
        assertEquals("user-a", record.ownerUserId());
        assertEquals("parent-1", record.parentChannelId());
        assertEquals("/work/alpha", record.cwd());
    }

    @Test
    void noBinding_leavesRegistryUntouched() throws Exception {
        RegistryBindingListener listener = new RegistryBindingListener(registry, (e, s) -> Optional.empty());

        listener.onSessionStart(event, snapshot);

        assertEquals(0, registry.size());
    }
}
