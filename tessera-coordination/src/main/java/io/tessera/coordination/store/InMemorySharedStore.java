package io.tessera.coordination.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.tessera.core.store.SharedStore;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Single-process {@link SharedStore} backed by a Caffeine cache with per-entry expiry.
///
/// Every entry carries its own TTL through a variable {@link Expiry}; reads never
/// extend it. Suitable for tests and for coordinators that share one JVM.
///
/// ### Glob matching
/// `*` matches any run of characters and `?` exactly one; everything else is literal.
///
/// @implNote Thread-safe. Caffeine provides atomic single-key operations.
public class InMemorySharedStore implements SharedStore {

    private static final Logger LOG = Logger.getLogger(InMemorySharedStore.class);

    private record Entry(String value, long ttlNanos) {}

    private final Cache<String, Entry> cache;

    public InMemorySharedStore() {
        this(Ticker.systemTicker(), 100_000);
    }

    /// Creates a store.
    ///
    /// @param ticker time source for expiry, not null
    /// @param maximumSize bound on live entries, positive
    public InMemorySharedStore(Ticker ticker, long maximumSize) {
        Objects.requireNonNull(ticker, "ticker must not be null");
        this.cache =
                Caffeine.newBuilder()
                        .ticker(ticker)
                        .maximumSize(maximumSize)
                        .expireAfter(new PerEntryExpiry())
                        .executor(Runnable::run)
                        .build();
        LOG.debugv("In-memory shared store created: maximumSize={0}", maximumSize);
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        boolean live = cache.getIfPresent(key) != null;
        cache.invalidate(key);
        return live;
    }

    @Override
    public boolean exists(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return cache.getIfPresent(key) != null;
    }

    @Override
    public Set<String> keysMatching(String pattern) {
        Pattern regex = globToRegex(Objects.requireNonNull(pattern, "pattern must not be null"));
        return cache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .filter(key -> cache.getIfPresent(key) != null)
                .collect(Collectors.toUnmodifiableSet());
    }

    /// Number of entries not yet evicted, expired ones included until cleanup.
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(
                String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(
                String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
