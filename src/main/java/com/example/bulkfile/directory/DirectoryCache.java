package com.example.bulkfile.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Time-bounded cache of directory group memberships and the current domain.
 *
 * <p>Entries are only written by {@link #warm(boolean)}, which bulk-fetches every known group
 * so that workers never query the directory per item. Concurrent warm calls collapse into a
 * single in-flight refresh; late callers wait for that refresh instead of fetching again.
 * A failed refresh keeps whatever was cached before.</p>
 */
public final class DirectoryCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryCache.class);
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private final DirectoryProvider provider;
    private final Set<String> groupKeys;
    private final Duration ttl;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, DirectoryCacheEntry> entries = new HashMap<>();
    private String domain;
    private Instant domainExpiresAt = Instant.MIN;

    private final Object flightLock = new Object();
    private CompletableFuture<Void> inFlight;

    public DirectoryCache(DirectoryProvider provider, Collection<String> groupKeys) {
        this(provider, groupKeys, DEFAULT_TTL, Clock.systemUTC());
    }

    public DirectoryCache(DirectoryProvider provider, Collection<String> groupKeys, Duration ttl, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.groupKeys = Set.copyOf(groupKeys);
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    /**
     * Refreshes every stale or missing group (all groups when {@code force} is set).
     * Safe to call from many threads; only one refresh runs at a time.
     *
     * @throws DirectoryUnavailableException if any group or the domain could not be fetched;
     *                                       successfully fetched groups are still stored
     */
    public void warm(boolean force) throws DirectoryUnavailableException {
        CompletableFuture<Void> flight;
        boolean leader = false;
        synchronized (flightLock) {
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            flight = inFlight;
        }

        if (leader) {
            try {
                refresh(force);
                flight.complete(null);
            } catch (DirectoryUnavailableException | RuntimeException ex) {
                flight.completeExceptionally(ex);
            } finally {
                if (!flight.isDone()) {
                    flight.completeExceptionally(new IllegalStateException("Directory refresh aborted"));
                }
                synchronized (flightLock) {
                    inFlight = null;
                }
            }
        }

        try {
            flight.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DirectoryUnavailableException("Interrupted while waiting for directory refresh", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DirectoryUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DirectoryUnavailableException("Directory refresh failed", cause);
        }
    }

    /**
     * Returns the cached entry for a group if it is present and not yet expired.
     */
    public Optional<DirectoryCacheEntry> lookup(String key) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            DirectoryCacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Picks a random member of a cached group; empty when the group is missing, stale or empty.
     */
    public Optional<String> resolveRandomMember(String groupKey) {
        return lookup(groupKey)
                .map(DirectoryCacheEntry::members)
                .filter(members -> !members.isEmpty())
                .map(members -> members.get(ThreadLocalRandom.current().nextInt(members.size())));
    }

    public Optional<String> currentDomain() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            if (domain == null || !now.isBefore(domainExpiresAt)) {
                return Optional.empty();
            }
            return Optional.of(domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every cached entry; the next warm fetches everything again.
     */
    public void invalidate() {
        lock.writeLock().lock();
        try {
            entries.clear();
            domain = null;
            domainExpiresAt = Instant.MIN;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> groupKeys() {
        return groupKeys;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Schedules a background warm at half the TTL so entries are renewed before they expire.
     * Failures of any kind are logged and retried on the next tick.
     */
    public AutoRefresh startAutoRefresh(ScheduledExecutorService scheduler) {
        long periodMillis = Math.max(1L, ttl.toMillis() / 2);
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> {
            try {
                warm(false);
            } catch (DirectoryUnavailableException | RuntimeException ex) {
                LOGGER.warn("Background directory refresh failed; keeping cached groups", ex);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        return () -> task.cancel(false);
    }

    private void refresh(boolean force) throws DirectoryUnavailableException {
        Instant now = clock.instant();
        List<String> due = new ArrayList<>();
        boolean domainDue;
        lock.readLock().lock();
        try {
            for (String key : groupKeys) {
                DirectoryCacheEntry entry = entries.get(key);
                if (force || entry == null || entry.isExpired(now)) {
                    due.add(key);
                }
            }
            domainDue = force || domain == null || !now.isBefore(domainExpiresAt);
        } finally {
            lock.readLock().unlock();
        }

        Map<String, DirectoryCacheEntry> fetched = new LinkedHashMap<>();
        DirectoryUnavailableException failure = null;
        for (String key : due) {
            try {
                List<String> members = provider.fetchGroup(key);
                fetched.put(key, new DirectoryCacheEntry(key,
                        members == null ? List.of() : members,
                        clock.instant().plus(ttl)));
            } catch (DirectoryUnavailableException ex) {
                failure = accumulate(failure, ex);
            } catch (RuntimeException ex) {
                failure = accumulate(failure, new DirectoryUnavailableException("Fetching group " + key + " failed", ex));
            }
        }

        String fetchedDomain = null;
        if (domainDue) {
            try {
                fetchedDomain = provider.currentDomain();
            } catch (DirectoryUnavailableException ex) {
                failure = accumulate(failure, ex);
            } catch (RuntimeException ex) {
                failure = accumulate(failure, new DirectoryUnavailableException("Fetching current domain failed", ex));
            }
        }

        lock.writeLock().lock();
        try {
            entries.putAll(fetched);
            if (fetchedDomain != null) {
                domain = fetchedDomain;
                domainExpiresAt = clock.instant().plus(ttl);
            }
        } finally {
            lock.writeLock().unlock();
        }

        LOGGER.debug("Directory refresh stored {} of {} due groups", fetched.size(), due.size());
        if (failure != null) {
            throw failure;
        }
    }

    private static DirectoryUnavailableException accumulate(DirectoryUnavailableException first,
                                                            DirectoryUnavailableException next) {
        if (first == null) {
            return next;
        }
        if (first != next) {
            first.addSuppressed(next);
        }
        return first;
    }

    /**
     * Handle for a scheduled background refresh.
     */
    @FunctionalInterface
    public interface AutoRefresh extends AutoCloseable {
        @Override
        void close();
    }
}
