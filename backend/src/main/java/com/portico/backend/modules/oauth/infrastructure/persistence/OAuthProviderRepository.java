package com.portico.backend.modules.oauth.infrastructure.persistence;

import java.util.List;

import com.portico.backend.modules.oauth.domain.OAuthProvider;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OAuthProviderRepository extends JpaRepository<OAuthProvider, String> {

    List<OAuthProvider> findAllByOrderByProviderAsc();

    List<OAuthProvider> findAllByEnabledTrueOrderByProviderAsc();
}
