package com.fhi.farm_breeding.tools;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Synchronous single-flight: among concurrent calls for the same key, only the first
 * (the leader) runs the computation; the others (followers) block and receive the
 * leader's result or exception.
 *
 * <p>A follower waits at most {@code followerTimeout}. After that it stops waiting and
 * computes on its own, so the computation must be idempotent.
 *
 * <p>A call re-entering the same key from the leader's own thread computes directly
 * instead of waiting on itself.
 *
 * <p>A forced call only accepts the result of a forced computation. It waits out a plain
 * one in flight for the same key and then starts its own.
 *
 * @param <K> key type
 * @param <V> result type
 */
@Slf4j
public class SingleFlight<K, V>
{
    private record InFlight<V>(CompletableFuture<V> promise, Thread leader, boolean forced) {}

    private final String name;
    private final Duration followerTimeout;
    private final ConcurrentHashMap<K, InFlight<V>> inFlight = new ConcurrentHashMap<>();


    public SingleFlight(String name, Duration followerTimeout)
    {   this.name = name;
        this.followerTimeout = followerTimeout;
    }


    public V execute(K key, Supplier<V> computation)
    {   return execute(key, false, computation);
    }

    /**
     * @param forced the caller needs a result computed for a forced call, never one shared from a plain call
     */
    public V execute(K key, boolean forced, Supplier<V> computation)
    {
        while (true)
        {
            InFlight<V> mine = new InFlight<>(new CompletableFuture<>(), Thread.currentThread(), forced);
            InFlight<V> existing = inFlight.putIfAbsent(key, mine);

            if (existing == null)
            {   return runAsLeader(key, mine, computation);
            }
            if (existing.leader() == Thread.currentThread())
            {   return computation.get();
            }
            if (!forced || existing.forced())
            {   return awaitLeader(key, existing.promise(), computation);
            }
            if (!awaitCompletion(key, existing.promise()))
            {   return computation.get();
            }
            inFlight.remove(key, existing);
        }
    }

    /**
     * Number of keys currently being computed.
     */
    public int inFlightCount()
    {   return inFlight.size();
    }


    private V runAsLeader(K key, InFlight<V> entry, Supplier<V> computation)
    {
        try
        {   V result = computation.get();
            entry.promise().complete(result);
            return result;
        }
        catch (RuntimeException | Error e)
        {   entry.promise().completeExceptionally(e);
            throw e;
        }
        finally
        {   inFlight.remove(key, entry);
        }
    }

    /**
     * Waits for a plain computation to finish, whatever its outcome.
     *
     * @return false if it is still running after {@code followerTimeout}
     */
    private boolean awaitCompletion(K key, CompletableFuture<V> leaderPromise)
    {
        log.debug("[{}] forced call waiting out a plain computation for key {}", name, key);
        try
        {   leaderPromise.handle((result, error) -> result).get(followerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        }
        catch (TimeoutException e)
        {   log.warn("[{}] gave up waiting {} for key {}, computing independently", name, followerTimeout, key);
            return false;
        }
        catch (ExecutionException e)
        {   throw new IllegalStateException("Single-flight leader failed for key " + key, e.getCause());
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for key " + key, e);
        }
    }

    private V awaitLeader(K key, CompletableFuture<V> leaderPromise, Supplier<V> computation)
    {
        log.debug("[{}] joining in-flight computation for key {}", name, key);
        try
        {   return leaderPromise.get(followerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e)
        {   log.warn("[{}] gave up waiting {} for key {}, computing independently", name, followerTimeout, key);
            return computation.get();
        }
        catch (ExecutionException e)
        {   Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Single-flight leader failed for key " + key, cause);
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for key " + key, e);
        }
    }
}
