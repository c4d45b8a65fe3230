package com.clinic.waitlist.service;

import com.clinic.waitlist.repository.ProviderRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProviderDirectoryService implements ProviderDirectory {

    private final ProviderRepository providerRepository;

    public ProviderDirectoryService(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String providerKey) {
        if (StringUtils.isBlank(providerKey)) return false;
        return providerRepository.existsByKeyIgnoreCaseAndActiveTrue(providerKey.trim());
    }
}
