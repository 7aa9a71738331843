package com.fhi.farm_breeding.config;

import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import com.fhi.farm_breeding.tools.ProfilingQueryExecutionListener;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;

/**
 * Replaces the application's {@link DataSource} with a datasource-proxy wrapper that hands every
 * executed statement to {@link ProfilingQueryExecutionListener}.
 *
 * <p>Never enable in production.
 *
 * <p>Liquibase gets its own plain {@code liquibaseDataSource}. Running the changelog through the
 * proxy makes Spring report a circular dependency, so:
 * - the proxy wraps a Hikari pool built from {@code spring.datasource.*};
 * - Liquibase uses a separate, unproxied data source;
 * - the proxied data source is {@code @Primary} for JPA and everything else.
 */
@Configuration
@Profile({ "local", "dev", "int", "test" })
@Slf4j
public class DataSourceProxyConfig
{
    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariConfig hikariConfig()
    {   return new HikariConfig();
    }


    /**
     * Builds the Hikari pool from the datasource properties and wraps it in the profiling proxy.
     */
    @Bean
    @Primary
    public DataSource proxiedDataSource(DataSourceProperties dsProps,
                                        HikariConfig hikariConfig,
                                        ProfilingQueryExecutionListener queryExecutionListener)
    {
        // Pool is built here rather than injected: an injected DataSource is not fully
        // configured yet at this point (auto-commit in particular).
        hikariConfig.setJdbcUrl (dsProps.getUrl());
        hikariConfig.setUsername(dsProps.getUsername());
        hikariConfig.setPassword(dsProps.getPassword());
        if (dsProps.getDriverClassName() != null)
        {   hikariConfig.setDriverClassName(dsProps.getDriverClassName());
        }

        HikariDataSource hikariDs = new HikariDataSource(hikariConfig);

        log.debug("Hikari pool [{}]: auto-commit={}, maximum-pool-size={}, minimum-idle={}",
                  hikariDs.getPoolName(), hikariDs.isAutoCommit(), hikariDs.getMaximumPoolSize(), hikariDs.getMinimumIdle());

        DataSource proxiedDataSource = ProxyDataSourceBuilder
                .create(hikariDs)
                .name("PROXY-DS")  // used in logs
                .listener(queryExecutionListener)
                .multiline()
                .countQuery()
                .build();

        try (Connection testConn = proxiedDataSource.getConnection())
        {   log.debug("proxiedDataSource auto-commit : {}", testConn.getAutoCommit());
        }
        catch (SQLException e)
        {   log.warn("Failed to read auto-commit status of proxiedDataSource: {}", e.getMessage());
        }

        return proxiedDataSource;
    }


    /**
     * The data source Liquibase runs the changelog with.
     */
    @Bean(name = "liquibaseDataSource")
    @LiquibaseDataSource
    public DataSource liquibaseDataSource(DataSourceProperties properties)
    {   return properties.initializeDataSourceBuilder().build();
    }


    /**
     * SQL profiling listener used by the proxied data source.
     *
     * @param enabled whether SQL statements are logged
     */
    @Bean
    public ProfilingQueryExecutionListener queryExecutionListener
          (@Value("${profiling.sql.enabled:false}")              boolean enabled,
           @Value("${profiling.sql.logLinePrefix:PROFILING---}") String logLinePrefix
          )
    {   return new ProfilingQueryExecutionListener(enabled, logLinePrefix);
    }
}
