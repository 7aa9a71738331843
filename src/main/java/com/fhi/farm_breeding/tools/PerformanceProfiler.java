package com.fhi.farm_breeding.tools;

import java.util.Arrays;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.hibernate.SessionFactory;
import org.hibernate.stat.Statistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs Hibernate activity per public service call: duration, queries, entity and collection
 * loads. Complements {@link ProfilingQueryExecutionListener}, which works per SQL statement.
 *
 * <p>Only the outermost service call of a thread is measured, since statistics are reset at
 * its start. Nested service calls (e.g. the offspring factory inside birth recording) are
 * included in the outer figures.
 *
 * <p>Hibernate statistics are global to the session factory, so figures are only reliable
 * while a single request runs. Enable in local and test profiles only.
 */
@Aspect
@Component
@Slf4j
public class PerformanceProfiler
{
    @Value("${profiling.performance.enabled:false}")
    private boolean profilerEnabled;

    @Value("${profiling.performance.slowCallThreshold:500}")
    private long slowCallThreshold;

    @Value("${profiling.performance.queryCountThreshold:50}")
    private long queryCountThreshold;

    @Value("${profiling.performance.printQueryThreshold:5}")
    private long printQueryThreshold;

    @Value("${profiling.performance.logLinePrefix:PROFILING---}")
    private String logLinePrefix;

    private final SessionFactory sessionFactory;

    private final ThreadLocal<Boolean> insideProfiledCall = ThreadLocal.withInitial(() -> Boolean.FALSE);


    public PerformanceProfiler(EntityManagerFactory entityManagerFactory)
    {   this.sessionFactory = entityManagerFactory.unwrap(SessionFactory.class);
    }

    @PostConstruct
    public void init()
    {
        if (profilerEnabled && !sessionFactory.getStatistics().isStatisticsEnabled())
        {   log.warn("Performance profiling is on but Hibernate statistics are NOT enabled. Set 'hibernate.generate_statistics: true'.");
        }
    }


    @Around("execution(public * com.fhi.farm_breeding.service..*(..))")
    public Object profile(ProceedingJoinPoint joinPoint) throws Throwable
    {
        if (!profilerEnabled || insideProfiledCall.get())
        {   return joinPoint.proceed();
        }

        Statistics stats = sessionFactory.getStatistics();
        stats.clear();
        insideProfiledCall.set(Boolean.TRUE);
        long start = System.currentTimeMillis();
        try
        {   return joinPoint.proceed();
        }
        finally
        {
            insideProfiledCall.set(Boolean.FALSE);
            long duration            = System.currentTimeMillis() - start;
            long queryCount          = stats.getQueryExecutionCount();
            long entityLoadCount     = stats.getEntityLoadCount();
            long collectionLoadCount = stats.getCollectionLoadCount();  // element collections count here
            String call = joinPoint.getSignature().toShortString();

            log.info("{} [{} ms; {} queries; {} entities; {} collections] for [{}]",
                     logLinePrefix, duration, queryCount, entityLoadCount, collectionLoadCount, call);

            if (queryCount > printQueryThreshold)
            {   log.debug("{} first queries of [{}]: {}", logLinePrefix, call, Arrays.stream(stats.getQueries()).limit(3).toList());
            }
            if (duration > slowCallThreshold)
            {   log.warn("{} SLOW CALL: [{}] took {} ms", logLinePrefix, call, duration);
            }
            if (queryCount > queryCountThreshold)
            {   log.warn("{} HIGH QUERY COUNT: [{}] ran {} queries", logLinePrefix, call, queryCount);
            }
        }
    }
}
