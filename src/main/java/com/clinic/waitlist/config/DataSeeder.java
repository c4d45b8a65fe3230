package com.clinic.waitlist.config;

import com.clinic.waitlist.entity.Provider;
import com.clinic.waitlist.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Seeds a demo provider directory on an empty store. Off unless {@code waitlist.seed.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "waitlist.seed.enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seedProviders(ProviderRepository providerRepo) {
        return args -> {
            if (providerRepo.count() > 0) {
                log.info("Providers already seeded, skipping");
                return;
            }

            List<Provider> providers = List.of(
                    Provider.builder().key("dr-ahmed").name("Dr Ahmed").active(true).build(),
                    Provider.builder().key("dr-john").name("Dr John").active(true).build(),
                    Provider.builder().key("hyg-sara").name("Sara (hygienist)").active(true).build()
            );
            providerRepo.saveAll(providers);
            log.info("Seeded {} providers", providers.size());
        };
    }
}
