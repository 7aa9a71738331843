package com.fhi.farm_breeding.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.tools.SingleFlight;

@Configuration
@EnableConfigurationProperties(BreedingProperties.class)
public class BreedingConfig
{
    /**
     * Source of "today" for gestation clocks, ages and profile freshness.
     */
    @Bean
    public Clock clock()
    {   return Clock.systemDefaultZone();
    }

    /**
     * Programmatic transactions, for work that must commit before its result is shared
     * (e.g. a profile computed on behalf of concurrent callers).
     */
    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager)
    {   return new TransactionTemplate(transactionManager);
    }

    /**
     * De-duplicates concurrent profile computations of the same animal.
     */
    @Bean
    public SingleFlight<Long, GeneticProfile> profileSingleFlight(BreedingProperties properties)
    {   return new SingleFlight<>("genetic-profile", properties.getSingleFlightTimeout());
    }
}
