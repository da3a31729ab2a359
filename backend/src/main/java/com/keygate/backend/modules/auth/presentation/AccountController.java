package com.keygate.backend.modules.auth.presentation;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.global.web.RequestContextFilter;
import com.keygate.backend.modules.account.domain.AccountStatus;
import com.keygate.backend.modules.auth.application.AuthService;
import com.keygate.backend.modules.auth.presentation.dto.ChangeStatusRequest;
import com.keygate.backend.modules.auth.presentation.dto.ChangeStatusResponse;
import com.keygate.backend.modules.auth.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/accounts")
@Tag(name = "Accounts")
public class AccountController {

    private final AuthService authService;
    private final Clock clock;

    public AccountController(AuthService authService, Clock clock) {
        this.authService = authService;
        this.clock = clock;
    }

    @Operation(summary = "Change account status", description = "Admin only. Any status value is accepted.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "401", description = "Missing, unknown or expired access token"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "Unknown account")
    })
    @PutMapping("/{accountId}/status")
    public ResponseEntity<ChangeStatusResponse> changeStatus(
            @PathVariable long accountId,
            @Valid @RequestBody ChangeStatusRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        authService.requireAdmin(ctx, BearerTokens.require(authorization));
        AccountStatus status = authService.changeStatus(ctx, accountId, request.status());
        return ResponseEntity.ok(new ChangeStatusResponse(accountId, status));
    }

    @Operation(summary = "List live sessions", description = "Own account, or any account for admins.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions, oldest first"),
            @ApiResponse(responseCode = "401", description = "Missing, unknown or expired access token"),
            @ApiResponse(responseCode = "403", description = "Foreign account and caller is not an admin")
    })
    @GetMapping("/{accountId}/sessions")
    public ResponseEntity<List<SessionResponse>> sessions(
            @PathVariable long accountId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        authService.requireAccountAccess(ctx, BearerTokens.require(authorization), accountId);
        Instant now = clock.instant();
        List<SessionResponse> sessions = authService.getActiveAccountSessions(ctx, accountId).stream()
                .map(session -> SessionResponse.from(session, now))
                .toList();
        return ResponseEntity.ok(sessions);
    }
}
