package com.mailflow.mailflow_backend.repository;

import com.mailflow.mailflow_backend.model.domain.LlmProviderConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LlmProviderConfigRepository extends JpaRepository<LlmProviderConfig, UUID> {

    Optional<LlmProviderConfig> findFirstByUserIdAndEnabledTrueOrderByUpdatedAtDesc(String userId);

    // Rows without a user are the global default
    Optional<LlmProviderConfig> findFirstByUserIdIsNullAndEnabledTrueOrderByUpdatedAtDesc();
}
