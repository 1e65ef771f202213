package com.contact.resolution.store;

import com.contact.resolution.core.model.DuplicateGroup;

/**
 * What an incremental sync needs to know about a stored contact: its content hash and
 * the dedup metadata that must survive the upsert.
 */
public record SyncState(String recordHash, DuplicateGroup duplicateGroup) {
}
