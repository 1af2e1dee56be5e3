package se.alipsa.jdax.pivot;

import java.util.Objects;

/** Header formatting of {@link PivotEngine#pivotCrosstab}. */
public final class CrosstabOptions {

  private final String columnFieldSeparator;
  private final String columnMeasureSeparator;
  private final boolean includeMeasureNameWhenSingle;

  private CrosstabOptions(Builder builder) {
    this.columnFieldSeparator = builder.columnFieldSeparator;
    this.columnMeasureSeparator = builder.columnMeasureSeparator;
    this.includeMeasureNameWhenSingle = builder.includeMeasureNameWhenSingle;
  }

  public static CrosstabOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Joins the values of a multi-field column key, as in {@code 2024 / Q1}.
   *
   * @return the separator, {@code " / "} by default
   */
  public String columnFieldSeparator() {
    return columnFieldSeparator;
  }

  /**
   * Joins a column key label and a measure name, as in {@code A - Total}.
   *
   * @return the separator, {@code " - "} by default
   */
  public String columnMeasureSeparator() {
    return columnMeasureSeparator;
  }

  public boolean includeMeasureNameWhenSingle() {
    return includeMeasureNameWhenSingle;
  }

  /** Builder for {@link CrosstabOptions}. */
  public static final class Builder {
    private String columnFieldSeparator = " / ";
    private String columnMeasureSeparator = " - ";
    private boolean includeMeasureNameWhenSingle;

    private Builder() {
    }

    public Builder columnFieldSeparator(String separator) {
      this.columnFieldSeparator = Objects.requireNonNull(separator, "separator");
      return this;
    }

    public Builder columnMeasureSeparator(String separator) {
      this.columnMeasureSeparator = Objects.requireNonNull(separator, "separator");
      return this;
    }

    public Builder includeMeasureNameWhenSingle(boolean include) {
      this.includeMeasureNameWhenSingle = include;
      return this;
    }

    public CrosstabOptions build() {
      return new CrosstabOptions(this);
    }
  }
}
