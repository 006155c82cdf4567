package app.walkupmusic.sdk.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory store. Values are lost when the process exits.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private static final String PROBE_KEY = "__walkup_store_probe__";

    private final Map<String, StoredEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCredentialStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCredentialStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void set(String name, String value, CookieAttributes attributes) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        CookieAttributes resolved = attributes == null ? CookieAttributes.defaults() : attributes;
        StoredEntry entry = StoredEntry.of(value, resolved, clock.instant());
        if (entry.isExpired(clock.instant())) {
            entries.remove(name);
            return;
        }
        entries.put(name, entry);
    }

    @Override
    public Optional<String> get(String name) {
        StoredEntry entry = entries.get(name);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(name, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void delete(String name, String path) {
        String scope = path == null || path.isBlank() ? CookieAttributes.DEFAULT_PATH : path;
        entries.computeIfPresent(name, (key, entry) -> scope.equals(entry.path()) ? null : entry);
    }

    @Override
    public boolean isAvailable() {
        set(PROBE_KEY, "probe", CookieAttributes.defaults().withMaxAge(Duration.ofSeconds(1)));
        boolean ok = get(PROBE_KEY).filter("probe"::equals).isPresent();
        delete(PROBE_KEY);
        return ok;
    }
}
