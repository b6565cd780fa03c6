package com.example.audiobook.service;

import com.example.audiobook.adapters.PreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Persisted set of items the user paused explicitly. An item stays in the ledger until it is
 * resumed by the user, completed or cancelled. Automatic network sweeps only read it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualPauseLedger {
    private final PreferenceStore preferenceStore;

    /**
     * Mark the item as manually paused. Reserved for the user-initiated pause path.
     *
     * @return Returns true when the item was not yet marked.
     */
    synchronized boolean mark(String itemId) {
        Set<String> itemIds = new LinkedHashSet<>(preferenceStore.getManuallyPaused());
        if (!itemIds.add(itemId)) {
            return false;
        }
        preferenceStore.setManuallyPaused(itemIds);
        log.debug("Marked {} as manually paused", itemId);
        return true;
    }

    /**
     * Remove the manual pause marker of the item.
     *
     * @return Returns true when the item was marked.
     */
    public synchronized boolean clear(String itemId) {
        Set<String> itemIds = new LinkedHashSet<>(preferenceStore.getManuallyPaused());
        if (!itemIds.remove(itemId)) {
            return false;
        }
        preferenceStore.setManuallyPaused(itemIds);
        log.debug("Cleared manual pause marker for {}", itemId);
        return true;
    }

    public synchronized boolean contains(String itemId) {
        return preferenceStore.getManuallyPaused().contains(itemId);
    }

    public synchronized Set<String> getItemIds() {
        return Set.copyOf(preferenceStore.getManuallyPaused());
    }
}
