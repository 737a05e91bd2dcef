package com.magicminds.backend.modules.profile.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.magicminds.backend.modules.profile.domain.ParentAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ParentAccountRepository extends JpaRepository<ParentAccount, UUID> {

    Optional<ParentAccount> findByAuth0UserId(String auth0UserId);
}
