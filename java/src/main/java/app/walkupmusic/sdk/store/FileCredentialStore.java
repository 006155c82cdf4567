package app.walkupmusic.sdk.store;

import app.walkupmusic.sdk.internal.Json;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Credential store persisting entries as a JSON document so sessions survive process restarts.
 *
 * <p>All access is serialised on the instance; the file is rewritten through a temporary sibling and an atomic
 * move, so a concurrent reader in another process sees either the old or the new document. Expired entries are
 * invisible to {@link #get(String)} and pruned on the next write. I/O failures surface as
 * {@link UncheckedIOException}.</p>
 */
public final class FileCredentialStore implements CredentialStore {

    private static final Logger LOGGER = Logger.getLogger(FileCredentialStore.class.getName());
    private static final String PROBE_KEY = "__walkup_store_probe__";
    private static final TypeReference<LinkedHashMap<String, StoredEntry>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final Clock clock;

    public FileCredentialStore(Path file) {
        this(file, Clock.systemUTC());
    }

    public FileCredentialStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void set(String name, String value, CookieAttributes attributes) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        CookieAttributes resolved = attributes == null ? CookieAttributes.defaults() : attributes;
        Instant now = clock.instant();

        Map<String, StoredEntry> entries = readLive(now);
        StoredEntry entry = StoredEntry.of(value, resolved, now);
        if (entry.isExpired(now)) {
            entries.remove(name);
        } else {
            entries.put(name, entry);
        }
        write(entries);
    }

    @Override
    public synchronized Optional<String> get(String name) {
        StoredEntry entry = readLive(clock.instant()).get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public synchronized void delete(String name, String path) {
        String scope = path == null || path.isBlank() ? CookieAttributes.DEFAULT_PATH : path;
        Map<String, StoredEntry> entries = readLive(clock.instant());
        StoredEntry existing = entries.get(name);
        if (existing == null || !scope.equals(existing.path())) {
            return;
        }
        entries.remove(name);
        write(entries);
    }

    @Override
    public boolean isAvailable() {
        try {
            set(PROBE_KEY, "probe", CookieAttributes.defaults().withMaxAge(Duration.ofSeconds(1)));
            boolean ok = get(PROBE_KEY).filter("probe"::equals).isPresent();
            delete(PROBE_KEY);
            return ok;
        } catch (UncheckedIOException ex) {
            LOGGER.fine(() -> "[walkup-sdk] credential file " + file + " is not usable: " + ex.getMessage());
            return false;
        }
    }

    public Path getFile() {
        return file;
    }

    private Map<String, StoredEntry> readLive(Instant now) {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            if (bytes.length == 0) {
                return new LinkedHashMap<>();
            }
            LinkedHashMap<String, StoredEntry> entries = Json.mapper().readValue(bytes, ENTRIES_TYPE);
            entries.values().removeIf(entry -> entry == null || entry.isExpired(now));
            return entries;
        } catch (IOException ex) {
            throw new UncheckedIOException("read credential file " + file, ex);
        }
    }

    private void write(Map<String, StoredEntry> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            Json.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("write credential file " + file, ex);
        }
    }
}
