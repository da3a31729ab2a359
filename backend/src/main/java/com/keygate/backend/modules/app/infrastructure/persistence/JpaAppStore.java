package com.keygate.backend.modules.app.infrastructure.persistence;

import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.app.domain.App;
import com.keygate.backend.modules.auth.application.port.AppProvider;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaAppStore implements AppProvider {

    private final AppRepository appRepository;

    public JpaAppStore(AppRepository appRepository) {
        this.appRepository = appRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<App> app(CallContext ctx, long appId) {
        ctx.throwIfCancelled("AppStore.app");
        return appRepository.findById(appId).map(AppEntity::toDomain);
    }
}
