package com.github.kchobantonov.data.context.domain;

import static com.github.kchobantonov.data.context.support.Employees.names;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.domain.Sort.Direction;
import org.springframework.data.domain.Sort.NullHandling;

import com.github.kchobantonov.data.context.support.Employee;
import com.google.common.collect.ImmutableList;

@DisplayName("SortKey Tests")
class SortKeyTest {

	private final List<Employee> employees = ImmutableList.of( //
			Employee.of(1L, "Ann", "sales", 3000, null), //
			Employee.of(2L, "Bob", "it", 5200, 40), //
			Employee.of(3L, "Cid", null, 4100, 30));

	@Test
	@DisplayName("Should treat null as the smallest value by default")
	void shouldSortNullsAsSmallest() {
		assertThat(names(sorted(SortKey.asc(Employee::getAge)))).containsExactly("Ann", "Cid", "Bob");
		assertThat(names(sorted(SortKey.desc(Employee::getAge)))).containsExactly("Bob", "Cid", "Ann");
	}

	@Test
	@DisplayName("Should honour explicit null handling in both directions")
	void shouldHonourExplicitNullHandling() {
		assertThat(names(sorted(SortKey.property("age", Direction.ASC, NullHandling.NULLS_LAST))))
				.containsExactly("Cid", "Bob", "Ann");
		assertThat(names(sorted(SortKey.property("age", Direction.DESC, NullHandling.NULLS_FIRST))))
				.containsExactly("Ann", "Bob", "Cid");
	}

	@Test
	@DisplayName("Should read bean properties by path")
	void shouldReadPropertyPath() {
		// Given
		SortKey<Employee> key = SortKey.property("department", Direction.ASC);

		// Then
		assertThat(key.hasProperty()).isTrue();
		assertThat(names(sorted(key))).containsExactly("Cid", "Bob", "Ann");
	}

	@Test
	@DisplayName("Should convert property keys to Spring Data orders and back")
	void shouldConvertToOrder() {
		// Given
		SortKey<Employee> key = SortKey.from(Sort.Order.desc("salary").nullsLast());

		// When
		Sort.Order order = key.toOrder();

		// Then
		assertThat(order.getProperty()).isEqualTo("salary");
		assertThat(order.getDirection()).isEqualTo(Direction.DESC);
		assertThat(order.getNullHandling()).isEqualTo(NullHandling.NULLS_LAST);
	}

	@Test
	@DisplayName("Should keep ignore case when converting from and to Spring Data orders")
	void shouldKeepIgnoreCase() {
		// Given
		SortKey<Employee> key = SortKey.from(Sort.Order.asc("name").ignoreCase());

		// When
		Sort.Order order = key.toOrder();

		// Then
		assertThat(key.isIgnoreCase()).isTrue();
		assertThat(order.isIgnoreCase()).isTrue();
		assertThat(order).isEqualTo(Sort.Order.asc("name").ignoreCase());
	}

	@Test
	@DisplayName("Should compare string keys without regard to case when ignoring case")
	void shouldCompareIgnoringCase() {
		// Given
		List<Employee> mixedCase = ImmutableList.of( //
				Employee.of(1L, "bob", "it", 1000, 30), //
				Employee.of(2L, "Amy", "it", 1000, 31), //
				Employee.of(3L, "Cal", "it", 1000, 32));

		// When
		List<Employee> caseSensitive = ImmutableList.sortedCopyOf(
				SortKey.<Employee>property("name", Direction.ASC).toComparator(), mixedCase);
		List<Employee> caseInsensitive = ImmutableList.sortedCopyOf(
				SortKey.<Employee>property("name", Direction.ASC).ignoringCase().toComparator(), mixedCase);

		// Then
		assertThat(names(caseSensitive)).containsExactly("Amy", "Cal", "bob");
		assertThat(names(caseInsensitive)).containsExactly("Amy", "bob", "Cal");
	}

	@Test
	@DisplayName("Should refuse to convert extractor keys to orders")
	void shouldRefuseOrderWithoutProperty() {
		SortKey<Employee> key = SortKey.asc(Employee::getName);

		assertThat(key.hasProperty()).isFalse();
		assertThatThrownBy(key::toOrder).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("Should reject properties that are not comparable")
	void shouldRejectNonComparableProperty() {
		// Given
		SortKey<Holder> key = SortKey.property("value", Direction.ASC);
		List<Holder> holders = ImmutableList.of(new Holder(), new Holder());

		// Then
		assertThatThrownBy(() -> ImmutableList.sortedCopyOf(key.toComparator(), holders))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("not comparable");
	}

	@Test
	@DisplayName("Should reject empty property paths")
	void shouldRejectEmptyPropertyPath() {
		assertThatThrownBy(() -> SortKey.property(" ", Direction.ASC)).isInstanceOf(IllegalArgumentException.class);
	}

	private List<Employee> sorted(SortKey<Employee> key) {
		return ImmutableList.sortedCopyOf(key.toComparator(), employees);
	}

	public static class Holder {
		private final Object value = new Object();

		public Object getValue() {
			return value;
		}
	}
}
