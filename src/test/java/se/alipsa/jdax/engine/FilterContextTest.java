package se.alipsa.jdax.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.BitSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.value.Value;

/** Tests for the immutable {@link FilterContext}. */
class FilterContextTest {

  @Test
  void keysAreNormalized() {
    FilterContext filter = FilterContext.empty().withColumnEquals("Sales", "Region", Value.of("North"));
    assertEquals(Set.of(Value.of("North")), filter.columnFilter("sales", "REGION"));
    assertEquals(filter, FilterContext.empty().withColumnEquals("SALES", "region", Value.of("North")));
  }

  @Test
  void modificationsReturnNewInstances() {
    FilterContext empty = FilterContext.empty();
    FilterContext filtered = empty.withColumnEquals("T", "c", Value.of(1));
    assertTrue(empty.isEmpty());
    assertFalse(filtered.isEmpty());
    assertSame(filtered, filtered.withoutColumn("T", "other"));
  }

  @Test
  void intersectKeepsCommonValues() {
    FilterContext filter = FilterContext.empty().withColumnIn("T", "c", List.of(Value.of(1), Value.of(2)))
        .intersectColumn("T", "c", List.of(Value.of(2), Value.of(3)));
    assertEquals(Set.of(Value.of(2)), filter.columnFilter("T", "c"));
  }

  @Test
  void withoutTableClearsColumnAndRowFilters() {
    BitSet rows = new BitSet();
    rows.set(1);
    FilterContext filter = FilterContext.empty().withColumnEquals("T", "a", Value.of(1))
        .withColumnEquals("U", "a", Value.of(1)).withRowFilter("t", rows).withoutTable("T");
    assertNull(filter.columnFilter("T", "a"));
    assertFalse(filter.hasRowFilter("T"));
    assertEquals(Set.of(Value.of(1)), filter.columnFilter("U", "a"));
  }

  @Test
  void rowFiltersIntersectAndAreCopied() {
    BitSet first = new BitSet();
    first.set(0, 3);
    BitSet second = new BitSet();
    second.set(2, 5);
    FilterContext filter = FilterContext.empty().intersectRowFilter("T", first).intersectRowFilter("T", second);
    BitSet rows = filter.rowFilter("T");
    assertEquals(1, rows.cardinality());
    rows.clear();
    assertEquals(1, filter.rowFilter("T").cardinality());
  }

  @Test
  void relationshipModifiersDoNotMakeTheContextNonEmpty() {
    FilterContext filter = FilterContext.empty().withActivatedRelationship(2)
        .withOverride(0, RelationshipOverride.BOTH);
    assertTrue(filter.isEmpty());
    assertTrue(filter.isActivated(2));
    assertEquals(RelationshipOverride.BOTH, filter.override(0));
  }
}
