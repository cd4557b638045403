package com.safepocket.categorizer.rules;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active {@link RuleBundle}. The bundle is refreshed from the {@link RuleSource} once its
 * TTL has elapsed or on request. When the source is unavailable the newer of the cache file snapshot
 * and the bundle already in memory is served instead, and failing both an empty bundle. Learned rules
 * are re-read from their own file on every refresh, whatever the source outcome.
 */
public class RuleStore {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    private static final Comparator<CategorizationRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(CategorizationRule::priority).reversed();

    private final RuleSource source;
    private final RuleCacheFile cacheFile;
    private final LearnedRuleFile learnedRuleFile;
    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<HeldBundle> current = new AtomicReference<>();
    private final Object reloadLock = new Object();
    private final List<Consumer<RuleBundle>> reloadListeners = new CopyOnWriteArrayList<>();

    public RuleStore(RuleSource source, RuleCacheFile cacheFile, LearnedRuleFile learnedRuleFile, Duration ttl) {
        this(source, cacheFile, learnedRuleFile, ttl, Clock.systemUTC());
    }

    RuleStore(RuleSource source, RuleCacheFile cacheFile, LearnedRuleFile learnedRuleFile, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        this.source = source;
        this.cacheFile = cacheFile;
        this.learnedRuleFile = learnedRuleFile;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Registers a callback run with each newly installed bundle, on the reloading thread.
     */
    public void addReloadListener(Consumer<RuleBundle> listener) {
        reloadListeners.add(listener);
    }

    public RuleBundle load(boolean forceReload) {
        HeldBundle held = current.get();
        if (!forceReload && held != null && held.validAt(clock.instant())) {
            return held.bundle();
        }
        synchronized (reloadLock) {
            HeldBundle latest = current.get();
            if (!forceReload && latest != null && latest != held && latest.validAt(clock.instant())) {
                return latest.bundle();
            }
            HeldBundle next = fetch(latest);
            current.set(next);
            for (Consumer<RuleBundle> listener : reloadListeners) {
                listener.accept(next.bundle());
            }
            return next.bundle();
        }
    }

    /**
     * The bundle currently held, without triggering a load.
     */
    public Optional<RuleBundle> current() {
        return Optional.ofNullable(current.get()).map(HeldBundle::bundle);
    }

    public String describeSource() {
        return source.describe();
    }

    private HeldBundle fetch(HeldBundle previous) {
        Instant now = clock.instant();
        List<CategorizationRule> learned = sortByPriority(learnedRuleFile.load());
        try {
            RuleSource.Snapshot snapshot = source.fetch();
            RuleBundle bundle = new RuleBundle(sortByPriority(snapshot.rules()), snapshot.ownerMap(),
                    snapshot.taxonomy(), now, RuleBundle.Origin.SOURCE, learned);
            log.info("Loaded {} categorization rules, {} learned rules, {} owner accounts, {} top-level categories from {}",
                    bundle.rules().size(), learned.size(), bundle.ownerMap().size(), bundle.taxonomy().tier1Count(),
                    source.describe());
            writeCache(bundle);
            return new HeldBundle(bundle, now.plus(ttl));
        } catch (RuleSourceException ex) {
            return new HeldBundle(degrade(now, previous, ex).withLearnedRules(learned), now.plus(ttl));
        }
    }

    private RuleBundle degrade(Instant now, HeldBundle previous, RuleSourceException cause) {
        Optional<RuleBundle> cached = cacheFile.read();
        Optional<RuleBundle> inMemory = Optional.ofNullable(previous)
                .map(HeldBundle::bundle)
                .filter(bundle -> bundle.origin() != RuleBundle.Origin.EMPTY);

        if (inMemory.isPresent()
                && (cached.isEmpty() || inMemory.get().loadedAt().isAfter(cached.get().loadedAt()))) {
            RuleBundle stale = inMemory.get().withOrigin(RuleBundle.Origin.STALE);
            log.warn("Rule source {} unavailable ({}); keeping {} rules in memory loaded at {}",
                    source.describe(), cause.getMessage(), stale.rules().size(), stale.loadedAt());
            return stale;
        }
        if (cached.isPresent()) {
            RuleBundle bundle = cached.get();
            RuleBundle sorted = new RuleBundle(sortByPriority(bundle.rules()), bundle.ownerMap(), bundle.taxonomy(),
                    bundle.loadedAt(), RuleBundle.Origin.CACHE_FILE);
            log.warn("Rule source {} unavailable ({}); serving {} rules from cache file {} loaded at {}",
                    source.describe(), cause.getMessage(), sorted.rules().size(), cacheFile.path(), sorted.loadedAt());
            return sorted;
        }
        log.error("Rule source {} unavailable and no rule cache present; categorizing without rules",
                source.describe(), cause);
        return RuleBundle.empty(now);
    }

    private void writeCache(RuleBundle bundle) {
        if (!cacheFile.enabled()) {
            return;
        }
        try {
            cacheFile.write(bundle);
        } catch (IOException ex) {
            log.warn("Failed to write rule cache file {}: {}", cacheFile.path(), ex.getMessage());
        }
    }

    static List<CategorizationRule> sortByPriority(List<CategorizationRule> rules) {
        List<CategorizationRule> sorted = new ArrayList<>(rules);
        // List.sort is stable: equal priorities keep their authoring order.
        sorted.sort(BY_PRIORITY_DESC);
        return List.copyOf(sorted);
    }

    private record HeldBundle(RuleBundle bundle, Instant expiresAt) {
        boolean validAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
