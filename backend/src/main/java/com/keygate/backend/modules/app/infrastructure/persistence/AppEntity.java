package com.keygate.backend.modules.app.infrastructure.persistence;

import java.time.Duration;

import com.keygate.backend.global.jpa.AbstractTimestampedEntity;
import com.keygate.backend.modules.app.domain.App;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Apps are provisioned by migration or by an operator; the id is assigned, not generated.
 */
@Entity
@Table(name = "app")
public class AppEntity extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "secret", nullable = false, length = 512)
    private String secret;

    @Column(name = "token_ttl_seconds")
    private Long tokenTtlSeconds;

    @Column(name = "refresh_token_ttl_seconds")
    private Long refreshTokenTtlSeconds;

    @Column(name = "redirect_url", length = 2048)
    private String redirectUrl;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public Long getTokenTtlSeconds() {
        return tokenTtlSeconds;
    }

    public void setTokenTtlSeconds(Long tokenTtlSeconds) {
        this.tokenTtlSeconds = tokenTtlSeconds;
    }

    public Long getRefreshTokenTtlSeconds() {
        return refreshTokenTtlSeconds;
    }

    public void setRefreshTokenTtlSeconds(Long refreshTokenTtlSeconds) {
        this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }

    public void setRedirectUrl(String redirectUrl) {
        this.redirectUrl = redirectUrl;
    }

    public App toDomain() {
        return new App(
                id,
                name,
                secret,
                tokenTtlSeconds != null ? Duration.ofSeconds(tokenTtlSeconds) : null,
                refreshTokenTtlSeconds != null ? Duration.ofSeconds(refreshTokenTtlSeconds) : null,
                redirectUrl
        );
    }
}
