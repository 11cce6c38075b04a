package com.github.kchobantonov.data.context.repository.support;

/**
 * Lifecycle state of a record tracked by a {@link ChangeTracker}.
 */
public enum EntityState {
	/** Not tracked. */
	DETACHED,
	/** Tracked and equal to what the store holds. */
	UNCHANGED,
	/** To be inserted on the next save. */
	ADDED,
	/** To be updated on the next save. */
	MODIFIED,
	/** To be removed on the next save. */
	DELETED;

	public boolean isPending() {
		return this == ADDED || this == MODIFIED || this == DELETED;
	}
}
