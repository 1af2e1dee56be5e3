package se.alipsa.jdax.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.List;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;
import se.alipsa.jdax.value.Value;

/** Tests for {@link AvroTableAdapter}. */
class AvroTableAdapterTest {

  private static final Schema SCHEMA = SchemaBuilder.record("Sale").fields()
      .requiredString("region")
      .optionalInt("units")
      .requiredBoolean("promo")
      .requiredDouble("price")
      .endRecord();

  @Test
  void convertsRecordsToColumnarTable() {
    GenericRecord first = new GenericData.Record(SCHEMA);
    first.put("region", "North");
    first.put("units", 3);
    first.put("promo", true);
    first.put("price", 9.5);
    GenericRecord second = new GenericData.Record(SCHEMA);
    second.put("region", "South");
    second.put("units", null);
    second.put("promo", false);
    second.put("price", 2.0);

    Table table = AvroTableAdapter.toTable("Sales", SCHEMA, List.of(first, second));

    assertEquals(List.of("region", "units", "promo", "price"), table.columns());
    assertEquals(2, table.rowCount());
    assertFalse(table.isMutable());
    assertEquals(Value.of("North"), table.value(0, "region"));
    assertEquals(Value.of(3), table.value(0, "units"));
    assertEquals(Value.BLANK, table.value(1, "units"));
    assertEquals(Value.of(false), table.value(1, "promo"));
    assertEquals(11.5, table.backend().statsSum(3).getAsDouble());
  }

  @Test
  void mapsLogicalTypesToNumbers() {
    Schema date = LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
    assertEquals(Value.of(19000), AvroTableAdapter.toValue(19000, date));

    Schema timestamp = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
    assertEquals(Value.of(1.5), AvroTableAdapter.toValue(129_600_000L, timestamp));

    Schema decimal = LogicalTypes.decimal(6, 2).addToSchema(Schema.create(Schema.Type.BYTES));
    ByteBuffer unscaled = ByteBuffer.wrap(new BigDecimal("12.34").unscaledValue().toByteArray());
    assertEquals(Value.of(12.34), AvroTableAdapter.toValue(unscaled, decimal));
  }

  @Test
  void decodesBytesAsTextOrHex() {
    Schema bytes = Schema.create(Schema.Type.BYTES);
    assertEquals(Value.of("hi"), AvroTableAdapter.toValue(ByteBuffer.wrap("hi".getBytes()), bytes));
    assertEquals(Value.of("ff00"), AvroTableAdapter.toValue(ByteBuffer.wrap(new byte[] {(byte) 0xff, 0}), bytes));
  }

  @Test
  void nullableUnionResolvesToValueBranch() {
    Schema union = Schema.createUnion(Schema.create(Schema.Type.NULL), Schema.create(Schema.Type.STRING));
    assertEquals(Schema.Type.STRING, AvroTableAdapter.effectiveSchema(union).getType());
    assertEquals(Value.BLANK, AvroTableAdapter.toValue(null, union));
  }

  @Test
  void rejectsNonRecordSchemas() {
    assertThrows(IllegalArgumentException.class,
        () -> AvroTableAdapter.toTable("x", Schema.create(Schema.Type.STRING), List.of()));
  }
}
