package com.agrinova.backend.modules.security.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.security.domain.SecurityEvent;
import com.agrinova.backend.modules.security.domain.SecurityEventType;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityEventRepository extends JpaRepository<SecurityEvent, UUID> {

    List<SecurityEvent> findByEventTypeOrderByCreatedAtDesc(SecurityEventType eventType);

    List<SecurityEvent> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
