package com.fhi.farm_breeding.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;


/**
 * Logs the profiles, datasource and effective breeding settings at startup,
 * to check which configuration a running instance actually picked up.
 *
 * <p>Enabled with:
 * <pre>
 *   app.startup-diagnostics-logger.enabled=true
 * </pre>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.startup-diagnostics-logger.enabled", havingValue = "true", matchIfMissing = false)
public class StartupDiagnosticsLogger
{
   private static final String PREFIX = "[Startup Diagnostics]";

   private final Environment environment;
   private final BreedingProperties breedingProperties;

   @Value("${spring.liquibase.contexts:__UNSET__}")
   private String liquibaseContexts;


   public StartupDiagnosticsLogger(Environment environment, BreedingProperties breedingProperties)
   {  this.environment = environment;
      this.breedingProperties = breedingProperties;
   }


   @PostConstruct
   public void logDebugInfo()
   {
      log.info("{} Diagnostics mode is ON", PREFIX);

      log.info("{} Active Spring profiles         : {}", PREFIX, Arrays.toString(environment.getActiveProfiles()));
      log.info("{} Liquibase contexts             : {}", PREFIX, liquibaseContexts);
      log.info("{} Property: spring.datasource.url = {}", PREFIX, environment.getProperty("spring.datasource.url", "NOT SET"));

      log.info("{} Default gestation days         : {}", PREFIX, breedingProperties.getDefaultGestationDays());
      log.info("{} Profile freshness window       : {}", PREFIX, breedingProperties.getProfileFreshness());
      log.info("{} Pedigree depth / max ancestors : {} / {}", PREFIX, breedingProperties.getPedigreeDepth(), breedingProperties.getPedigreeMaxAncestors());
   }
}
