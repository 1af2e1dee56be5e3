package se.alipsa.jdax.table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdax.value.Value;

/**
 * Builds accelerated tables from Avro records supplied by a host. The value
 * mapping is fixed and lossy: every numeric, decimal, date, time and timestamp
 * kind collapses to a number, strings and enums become text, booleans stay
 * booleans and nulls become blank.
 */
public final class AvroTableAdapter {

  private static final Logger log = LoggerFactory.getLogger(AvroTableAdapter.class);
  private static final double MILLIS_PER_DAY = 86_400_000d;

  private AvroTableAdapter() {
  }

  /**
   * Convert records into an immutable columnar table. Columns follow the field
   * order of {@code schema}.
   *
   * @param name
   *          table name
   * @param schema
   *          record schema
   * @param records
   *          the rows
   * @return the accelerated table
   */
  public static Table toTable(String name, Schema schema, Iterable<GenericRecord> records) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(records, "records");
    if (schema.getType() != Schema.Type.RECORD) {
      throw new IllegalArgumentException("expected a record schema, got " + schema.getType());
    }
    List<Schema.Field> fields = schema.getFields();
    List<String> columns = new ArrayList<>(fields.size());
    List<List<Value>> columnValues = new ArrayList<>(fields.size());
    for (Schema.Field field : fields) {
      columns.add(field.name());
      columnValues.add(new ArrayList<>());
    }
    int rows = 0;
    for (GenericRecord record : records) {
      for (int i = 0; i < fields.size(); i++) {
        Schema.Field field = fields.get(i);
        columnValues.get(i).add(toValue(record.get(field.pos()), field.schema()));
      }
      rows++;
    }
    if (log.isDebugEnabled()) {
      log.debug("Built columnar table {} with {} columns and {} rows from Avro records", name, columns.size(), rows);
    }
    return Table.columnar(name, columns, columnValues);
  }

  /**
   * Resolve a nullable union to its non-null branch.
   *
   * @param s
   *          the declared schema
   * @return the effective schema
   */
  static Schema effectiveSchema(Schema s) {
    if (s.getType() != Schema.Type.UNION) {
      return s;
    }
    for (Schema branch : s.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        return branch;
      }
    }
    return s;
  }

  /**
   * Map one Avro datum to a value.
   *
   * @param v
   *          the datum, may be {@code null}
   * @param s
   *          the field schema
   * @return the mapped value
   */
  static Value toValue(Object v, Schema s) {
    if (v == null) {
      return Value.BLANK;
    }
    Schema effective = effectiveSchema(s);
    LogicalType logical = effective.getLogicalType();
    switch (effective.getType()) {
      case STRING:
      case ENUM:
        return Value.of(v.toString());
      case BOOLEAN:
        return Value.of((Boolean) v);
      case INT:
        if (logical instanceof LogicalTypes.TimeMillis) {
          return Value.of(((Number) v).intValue() / MILLIS_PER_DAY);
        }
        return Value.of(((Number) v).intValue());
      case LONG:
        return Value.of(longValue(((Number) v).longValue(), logical));
      case FLOAT:
      case DOUBLE:
        return Value.of(((Number) v).doubleValue());
      case BYTES:
        if (logical instanceof LogicalTypes.Decimal dec) {
          ByteBuffer bb = ((ByteBuffer) v).duplicate();
          byte[] bytes = new byte[bb.remaining()];
          bb.get(bytes);
          return Value.of(new BigDecimal(new BigInteger(bytes), dec.getScale()).doubleValue());
        }
        return bytesToValue(v);
      case FIXED:
        if (logical instanceof LogicalTypes.Decimal dec) {
          byte[] bytes = ((GenericData.Fixed) v).bytes();
          return Value.of(new BigDecimal(new BigInteger(bytes), dec.getScale()).doubleValue());
        }
        return bytesToValue(((GenericData.Fixed) v).bytes());
      default:
        return Value.of(v.toString());
    }
  }

  private static double longValue(long raw, LogicalType logical) {
    if (logical instanceof LogicalTypes.TimestampMillis || logical instanceof LogicalTypes.LocalTimestampMillis) {
      return raw / MILLIS_PER_DAY;
    }
    if (logical instanceof LogicalTypes.TimestampMicros || logical instanceof LogicalTypes.LocalTimestampMicros) {
      return raw / (MILLIS_PER_DAY * 1000d);
    }
    if (logical instanceof LogicalTypes.TimeMicros) {
      return raw / (MILLIS_PER_DAY * 1000d);
    }
    return raw;
  }

  private static Value bytesToValue(Object v) {
    byte[] bytes;
    if (v instanceof ByteBuffer byteBuffer) {
      ByteBuffer duplicate = byteBuffer.duplicate();
      bytes = new byte[duplicate.remaining()];
      duplicate.get(bytes);
    } else if (v instanceof byte[] array) {
      bytes = array;
    } else {
      return Value.of(v.toString());
    }
    try {
      return Value.of(StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes)).toString());
    } catch (CharacterCodingException e) {
      StringBuilder hex = new StringBuilder(bytes.length * 2);
      for (byte b : bytes) {
        hex.append(String.format("%02x", b));
      }
      return Value.of(hex.toString());
    }
  }
}
