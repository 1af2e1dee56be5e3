package se.alipsa.jdax.pivot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static se.alipsa.jdax.TestModels.values;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.value.Value;

/** Tests for pivot key ordering and header display. */
class PivotKeysTest {

  @Test
  void blankSortsFirstThenNumbersTextAndBooleans() {
    List<Value> sorted = new ArrayList<>(values(true, "b", 2, null, "B", 1, "a"));
    sorted.sort(PivotKeys.VALUE_ORDER);
    assertEquals(values(null, 1, 2, "a", "B", "b", true), sorted);
  }

  @Test
  void keysCompareLexicographically() {
    List<List<Value>> keys = new ArrayList<>(List.of(values("x", 2), values("x", 1), values("w", 9), values("x")));
    keys.sort(PivotKeys.KEY_ORDER);
    assertEquals(List.of(values("w", 9), values("x"), values("x", 1), values("x", 2)), keys);
  }

  @Test
  void display() {
    assertEquals("(blank)", PivotKeys.display(Value.BLANK));
    assertEquals("2024", PivotKeys.display(Value.of(2024)));
    assertEquals("FALSE", PivotKeys.display(Value.of(false)));
    assertEquals("North / (blank)", PivotKeys.display(values("North", null), " / "));
  }
}
