package com.agentwatch.app;

import com.agentwatch.hooks.HookEvent;
import com.agentwatch.hooks.SessionStartListener;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.registry.SessionRegistry;
import com.agentwatch.registry.SessionRegistryUpsert;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Records newly started sessions in the resume registry once the chat side
 * has bound them to a thread.
 */
@Slf4j
public class RegistryBindingListener implements SessionStartListener {

    private final SessionRegistry registry;
    private final ThreadBinder binder;

    public RegistryBindingListener(SessionRegistry registry, ThreadBinder binder) {
        this.registry = registry;
        this.binder = binder;
    }

    @Override
    public void onSessionStart(HookEvent event, SessionSnapshot snapshot) throws Exception {
        Optional<ThreadBinding> binding = binder.bindThread(event, snapshot);
        if (binding.isEmpty()) {
            log.debug("Session {} not bound to a thread", event.sessionId());
            return;
        }
        ThreadBinding b = binding.get();
        registry.upsert(SessionRegistryUpsert.builder()
                .sessionId(event.sessionId())
                .provider(event.provider())
                .ownerUserId(b.ownerUserId())
                .mappingKey(b.mappingKey())
                .cwd(event.cwd())
                .threadChannelId(b.threadChannelId())
                .parentChannelId(b.parentChannelId())
                .build());
        log.info("Session {} bound to thread {}", event.sessionId(), b.threadChannelId());
    }
}
