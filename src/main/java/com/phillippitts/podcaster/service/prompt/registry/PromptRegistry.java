package com.phillippitts.podcaster.service.prompt.registry;

import com.phillippitts.podcaster.exception.PromptNotFoundException;

import java.util.List;

/**
 * Versioned store of prompt templates and their model options, keyed by {@code (key, version)}.
 *
 * <p>Each key has at most one active version. Activating a version deactivates the others of
 * the same key.
 */
public interface PromptRegistry {

    /**
     * Returns the active version of a prompt.
     *
     * @throws PromptNotFoundException if the key is unknown or has no active version
     */
    PromptVersion get(String key);

    /**
     * Returns a specific version of a prompt, active or not.
     *
     * @throws PromptNotFoundException if the key or version is unknown
     */
    PromptVersion get(String key, int version);

    /**
     * Stores a draft under an explicit version number.
     *
     * @param activate make the new version the active one
     * @throws IllegalArgumentException if {@code version} is below 1
     * @throws IllegalStateException    if the version already exists for the key
     */
    PromptVersion create(PromptDraft draft, int version, boolean activate);

    /**
     * Stores a draft as the next version of its key (1 for a new key).
     */
    PromptVersion createNewVersion(PromptDraft draft, boolean activate);

    /**
     * Makes {@code version} the active version of {@code key}.
     *
     * @throws PromptNotFoundException if the key or version is unknown
     */
    void setActive(String key, int version);

    /** Active version of every key, ordered by key. */
    List<PromptVersion> listActive();

    /** All versions of a key in ascending order; empty for an unknown key. */
    List<PromptVersion> listVersions(String key);
}
