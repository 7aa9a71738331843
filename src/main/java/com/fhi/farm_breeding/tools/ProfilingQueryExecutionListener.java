package com.fhi.farm_breeding.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;

/**
 * datasource-proxy listener that logs each executed SQL statement together with the
 * application frame that caused it.
 *
 * <p>The caller is the first stack frame inside {@code com.fhi.farm_breeding} that is not
 * infrastructure (this listener, the profiler aspect, the data-source configuration).
 * For service code this is typically the orchestration method, e.g.
 * {@code BirthEventService:recordBirth:112}, which makes N+1 patterns in the pedigree and
 * relatives traversal easy to spot.
 *
 * <p>Statements whose batch reports a failure are logged at WARN.
 */
@Slf4j
public class ProfilingQueryExecutionListener implements QueryExecutionListener
{
    private static final String APP_PACKAGE_START = "com.fhi.farm_breeding";

    /**
     * Application classes that are never a meaningful caller.
     */
    private static final List<String> IGNORED_APP_PREFIXES = List.of(
        ProfilingQueryExecutionListener.class.getName(),
        PerformanceProfiler.class.getName(),
        APP_PACKAGE_START + ".config."
    );

    private final boolean enabled;

    /**
     * Prefix of every log line, to make them easy to grep.
     */
    private final String logLinePrefix;


    public ProfilingQueryExecutionListener(boolean enabled, String logLinePrefix)
    {   this.enabled = enabled;
        this.logLinePrefix = logLinePrefix;
    }


    @Override
    public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
        // timing is taken by the proxy itself
    }

    @Override
    public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
        if (!enabled) return;

        String sql = queryInfoList.stream()
                                  .map(QueryInfo::getQuery)
                                  .collect(Collectors.joining("\n"));

        String caller = findApplicationCaller()
                            .map(frame -> simpleName(frame.getClassName()) + ":" + frame.getMethodName() + ":" + frame.getLineNumber())
                            .orElse("unknown");

        if (execInfo.isSuccess())
        {   log.info("{} [{}] {} ms, batch={}:\n{}", logLinePrefix, caller, execInfo.getElapsedTime(), execInfo.isBatch(), sql);
        }
        else
        {   log.warn("{} [{}] FAILED after {} ms:\n{}", logLinePrefix, caller, execInfo.getElapsedTime(), sql);
        }
    }


    /**
     * First application frame on the current stack, skipping the profiling plumbing.
     */
    private Optional<StackTraceElement> findApplicationCaller()
    {
        return Arrays.stream(Thread.currentThread().getStackTrace())
                     .filter(frame -> frame.getClassName().startsWith(APP_PACKAGE_START))
                     .filter(frame -> IGNORED_APP_PREFIXES.stream().noneMatch(frame.getClassName()::startsWith))
                     .findFirst();
    }

    /**
     * Simple class name from a fully qualified one, without loading the class.
     * CGLIB proxy suffixes are cut off.
     */
    private static String simpleName(String className)
    {
        String simple = className.substring(className.lastIndexOf('.') + 1);
        int proxyMarker = simple.indexOf("$$");
        return proxyMarker > 0 ? simple.substring(0, proxyMarker) : simple;
    }
}
