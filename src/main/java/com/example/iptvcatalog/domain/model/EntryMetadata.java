package com.example.iptvcatalog.domain.model;

/**
 * Classification-specific attributes of a playlist entry, stored as JSON on the channel row.
 */
public interface EntryMetadata {
}
