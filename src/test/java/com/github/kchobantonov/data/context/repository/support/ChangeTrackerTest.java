package com.github.kchobantonov.data.context.repository.support;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.github.kchobantonov.data.context.support.Employee;

@DisplayName("ChangeTracker Tests")
class ChangeTrackerTest {

	private ChangeTracker tracker;
	private Employee ann;
	private Employee bob;

	@BeforeEach
	void setUp() {
		tracker = new ChangeTracker();
		ann = Employee.of(1L, "Ann", "sales", 3000, 21);
		bob = Employee.of(2L, "Bob", "it", 5200, 25);
	}

	@Test
	@DisplayName("Should report untracked instances as detached")
	void shouldReportDetached() {
		assertThat(tracker.getState(ann)).isEqualTo(EntityState.DETACHED);
		assertThat(tracker.hasChanges()).isFalse();
	}

	@Test
	@DisplayName("Should track by identity rather than equality")
	void shouldTrackByIdentity() {
		// Given
		Employee annCopy = Employee.of(1L, "Ann", "sales", 3000, 21);

		// When
		tracker.setState(ann, EntityState.MODIFIED);

		// Then
		assertThat(annCopy).isEqualTo(ann);
		assertThat(tracker.getState(annCopy)).isEqualTo(EntityState.DETACHED);
		assertThat(tracker.getState(ann)).isEqualTo(EntityState.MODIFIED);
	}

	@Test
	@DisplayName("Should forget added instances that get deleted")
	void shouldDetachDeletedAddedInstance() {
		// Given
		tracker.setState(ann, EntityState.ADDED);

		// When
		tracker.setState(ann, EntityState.DELETED);

		// Then
		assertThat(tracker.getState(ann)).isEqualTo(EntityState.DETACHED);
		assertThat(tracker.getTrackedObjects()).isEmpty();
	}

	@Test
	@DisplayName("Should keep a pending state when attaching a tracked instance")
	void shouldNotDowngradePendingStateOnAttach() {
		// Given
		tracker.setState(ann, EntityState.MODIFIED);

		// When
		tracker.attach(ann);
		tracker.attach(bob);

		// Then
		assertThat(tracker.getState(ann)).isEqualTo(EntityState.MODIFIED);
		assertThat(tracker.getState(bob)).isEqualTo(EntityState.UNCHANGED);
		assertThat(tracker.getPendingEntries()).extracting(EntityEntry::getEntity).containsExactly(ann);
	}

	@Test
	@DisplayName("Should keep tracking order when accepting a replacement instance")
	void shouldReplaceInstanceInPlace() {
		// Given
		Employee persisted = Employee.of(1L, "Ann", "sales", 3000, 21);
		tracker.setState(ann, EntityState.ADDED);
		tracker.setState(bob, EntityState.MODIFIED);

		// When
		tracker.acceptChanges(ann, persisted);

		// Then
		assertThat(tracker.getTrackedObjects()).hasSize(2).first().isSameAs(persisted);
		assertThat(tracker.getState(persisted)).isEqualTo(EntityState.UNCHANGED);
		assertThat(tracker.getState(ann)).isEqualTo(EntityState.DETACHED);
		assertThat(tracker.getState(bob)).isEqualTo(EntityState.MODIFIED);
	}

	@Test
	@DisplayName("Should record the user class of tracked instances")
	void shouldRecordModelType() {
		tracker.attach(ann);

		assertThat(tracker.getEntries()).extracting(EntityEntry::getModelType).containsExactly(Employee.class);
	}
}
