package com.keygate.backend.modules.app.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppRepository extends JpaRepository<AppEntity, Long> {
}
