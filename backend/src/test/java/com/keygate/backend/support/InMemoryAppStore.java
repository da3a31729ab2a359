package com.keygate.backend.support;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.app.domain.App;
import com.keygate.backend.modules.auth.application.port.AppProvider;

public class InMemoryAppStore implements AppProvider {

    private final Map<Long, App> apps = new ConcurrentHashMap<>();

    public InMemoryAppStore register(App app) {
        apps.put(app.id(), app);
        return this;
    }

    @Override
    public Optional<App> app(CallContext ctx, long appId) {
        ctx.throwIfCancelled("InMemoryAppStore.app");
        return Optional.ofNullable(apps.get(appId));
    }
}
