package com.phillippitts.podcaster.service.prompt.registry;

import com.phillippitts.podcaster.exception.PromptNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * Thread-safe in-memory {@link PromptRegistry}.
 *
 * <p>All versions of one key live in a single immutable map that is replaced atomically with
 * {@link ConcurrentHashMap#compute}, so a reader never sees two active versions of a key.
 */
public class InMemoryPromptRegistry implements PromptRegistry {

    private static final Logger LOG = LogManager.getLogger(InMemoryPromptRegistry.class);

    private final Map<String, NavigableMap<Integer, PromptVersion>> prompts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPromptRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PromptVersion get(String key) {
        NavigableMap<Integer, PromptVersion> versions = prompts.get(key);
        if (versions == null) {
            throw new PromptNotFoundException(key);
        }
        return versions.values().stream()
                .filter(PromptVersion::active)
                .findFirst()
                .orElseThrow(() -> new PromptNotFoundException(key));
    }

    @Override
    public PromptVersion get(String key, int version) {
        NavigableMap<Integer, PromptVersion> versions = prompts.get(key);
        PromptVersion found = versions == null ? null : versions.get(version);
        if (found == null) {
            throw new PromptNotFoundException(key, version);
        }
        return found;
    }

    @Override
    public PromptVersion create(PromptDraft draft, int version, boolean activate) {
        if (version < 1) {
            throw new IllegalArgumentException("Prompt version must be >= 1, got " + version);
        }
        return insert(draft, existing -> version, activate);
    }

    @Override
    public PromptVersion createNewVersion(PromptDraft draft, boolean activate) {
        return insert(draft, existing -> existing.isEmpty() ? 1 : existing.lastKey() + 1, activate);
    }

    @Override
    public void setActive(String key, int version) {
        prompts.compute(key, (k, existing) -> {
            if (existing == null || !existing.containsKey(version)) {
                throw new PromptNotFoundException(key, version);
            }
            TreeMap<Integer, PromptVersion> updated = new TreeMap<>();
            existing.forEach((v, prompt) -> updated.put(v, prompt.withActive(v == version)));
            return Collections.unmodifiableNavigableMap(updated);
        });
        LOG.info("Activated prompt {} v{}", key, version);
    }

    @Override
    public List<PromptVersion> listActive() {
        List<PromptVersion> active = new ArrayList<>();
        prompts.values().forEach(versions -> versions.values().stream()
                .filter(PromptVersion::active)
                .forEach(active::add));
        active.sort(Comparator.comparing(PromptVersion::key));
        return List.copyOf(active);
    }

    @Override
    public List<PromptVersion> listVersions(String key) {
        NavigableMap<Integer, PromptVersion> versions = prompts.get(key);
        return versions == null ? List.of() : List.copyOf(versions.values());
    }

    private PromptVersion insert(PromptDraft draft, ToIntFunction<NavigableMap<Integer, PromptVersion>> numbering,
                                 boolean activate) {
        Objects.requireNonNull(draft, "draft must not be null");
        PromptVersion[] created = new PromptVersion[1];
        prompts.compute(draft.key(), (key, existing) -> {
            TreeMap<Integer, PromptVersion> updated = existing == null ? new TreeMap<>() : new TreeMap<>(existing);
            int version = numbering.applyAsInt(updated);
            if (updated.containsKey(version)) {
                throw new IllegalStateException("Prompt '" + key + "' already has version " + version);
            }
            if (activate) {
                updated.replaceAll((v, prompt) -> prompt.withActive(false));
            }
            created[0] = draft.toVersion(version, activate, clock.instant());
            updated.put(version, created[0]);
            return Collections.unmodifiableNavigableMap(updated);
        });
        LOG.info("Registered prompt {}{}", created[0].label(), activate ? " (active)" : "");
        return created[0];
    }
}
