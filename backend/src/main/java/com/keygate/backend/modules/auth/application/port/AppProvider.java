package com.keygate.backend.modules.auth.application.port;

import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.app.domain.App;

public interface AppProvider {

    Optional<App> app(CallContext ctx, long appId);
}
