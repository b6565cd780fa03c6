package com.example.audiobook.adapters;

import com.example.audiobook.utils.model.NamingPattern;

import java.util.Set;

/**
 * Persisted user preferences of the pipeline.
 */
public interface PreferenceStore {
    boolean isRestrictedOnly();

    void setRestrictedOnly(boolean restrictedOnly);

    NamingPattern getNamingPattern();

    void setNamingPattern(NamingPattern namingPattern);

    boolean isCompanionCoverEnabled();

    void setCompanionCoverEnabled(boolean enabled);

    Set<String> getManuallyPaused();

    void setManuallyPaused(Set<String> itemIds);
}
