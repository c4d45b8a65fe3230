package com.clinic.waitlist.repository;

import com.clinic.waitlist.entity.Provider;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProviderRepository extends JpaRepository<Provider, Long> {

    boolean existsByKeyIgnoreCaseAndActiveTrue(String key);
}
