package com.keygate.backend.modules.auth.presentation;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.global.web.RequestContextFilter;
import com.keygate.backend.modules.account.domain.AccountRole;
import com.keygate.backend.modules.auth.application.AuthService;
import com.keygate.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.keygate.backend.modules.auth.presentation.dto.LoginRequest;
import com.keygate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.keygate.backend.modules.auth.presentation.dto.RefreshResponse;
import com.keygate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.keygate.backend.modules.auth.presentation.dto.RegisterResponse;
import com.keygate.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.keygate.backend.modules.auth.presentation.dto.TokenRequest;
import com.keygate.backend.modules.auth.presentation.dto.ValidateResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register an account", description = "Creating an ADMIN account requires an admin bearer token.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "403", description = "Admin role required for ADMIN accounts"),
            @ApiResponse(responseCode = "500", description = "Duplicate email or store failure")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(
            @Valid @RequestBody RegisterRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        AccountRole role = request.roleOrDefault();
        if (role.isAdmin()) {
            authService.requireAdmin(ctx, BearerTokens.require(authorization));
        }
        long accountId = authService.registerNewAccount(ctx, request.email(), request.password(), role, request.appId());
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(accountId));
    }

    @Operation(summary = "Log in", description = "Opens a new session for the given app.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token pair issued"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "404", description = "Unknown app")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(
            @Valid @RequestBody LoginRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        return ResponseEntity.ok(TokenPairResponse.from(authService.login(
                ctx, request.email(), request.password(), userAgent, httpRequest.getRemoteAddr(), request.appId())));
    }

    @Operation(summary = "Log out everywhere", description = "Revokes every live session of the caller's account.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Sessions revoked"),
            @ApiResponse(responseCode = "401", description = "Missing, unknown or expired access token")
    })
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        long accountId = authService.authenticate(ctx, BearerTokens.require(authorization));
        authService.logout(ctx, accountId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Change password")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Old password does not match"),
            @ApiResponse(responseCode = "404", description = "Unknown account")
    })
    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request, HttpServletRequest httpRequest) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        authService.changePassword(ctx, request.accountId(), request.oldPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Refresh a session", description = "Issues a new session; the one holding the refresh token stays usable.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair issued"),
            @ApiResponse(responseCode = "401", description = "Unknown, revoked or expired refresh token"),
            @ApiResponse(responseCode = "404", description = "Unknown account or app")
    })
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh(
            @Valid @RequestBody RefreshRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletRequest httpRequest
    ) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        return ResponseEntity.ok(RefreshResponse.from(authService.refreshAccountSession(
                ctx, request.accountId(), request.refreshToken(), userAgent, httpRequest.getRemoteAddr())));
    }

    @Operation(summary = "Validate an access token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Validity and expiry of the session"),
            @ApiResponse(responseCode = "401", description = "Unknown or revoked token")
    })
    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody TokenRequest request, HttpServletRequest httpRequest) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        return ResponseEntity.ok(ValidateResponse.from(authService.validateAccountSession(ctx, request.token())));
    }

    @Operation(summary = "Revoke a session", description = "Idempotent; unknown tokens are accepted.")
    @ApiResponse(responseCode = "204", description = "Session revoked")
    @PostMapping("/revoke")
    public ResponseEntity<Void> revoke(@Valid @RequestBody TokenRequest request, HttpServletRequest httpRequest) {
        CallContext ctx = RequestContextFilter.callContext(httpRequest);
        authService.revokeAccountSession(ctx, request.token());
        return ResponseEntity.noContent().build();
    }
}
