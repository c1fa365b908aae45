package com.cadforge.core.entity;

import com.cadforge.core.model.Entity;

/**
 * One entry in an entity's local history.
 *
 * @param sequence operation sequence of the owning workspace that wrote it
 * @param entity   the content for {@link Kind#VALUE}, null otherwise
 * @param kind     what the entry means for lookups
 */
record EntityVersion(long sequence, Entity entity, Kind kind) {

    enum Kind {
        VALUE,
        TOMBSTONE,
        INHERIT     // defer to the base table again
    }
}
