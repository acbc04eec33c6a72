package dev.sidechain.entity;

/**
 * Entities whose id is assigned before the first save (user ids come from the
 * account service) track insert-vs-update with a {@code newRecord} flag that
 * {@link dev.sidechain.config.PersistableEntityCallback} clears on load.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
