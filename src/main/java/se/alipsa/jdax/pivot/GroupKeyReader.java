package se.alipsa.jdax.pivot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.engine.FilterContext;
import se.alipsa.jdax.engine.RowSetResolver;
import se.alipsa.jdax.helper.DaxUtil;
import se.alipsa.jdax.model.DataModel;
import se.alipsa.jdax.model.DataModel.PathDirection;
import se.alipsa.jdax.model.RelationshipInfo;
import se.alipsa.jdax.table.Table;
import se.alipsa.jdax.value.Value;

/**
 * Reads the group key of a base-table row. Columns on other tables are reached
 * like {@code RELATED}: over the unique active many-to-one path, yielding blank
 * when a key on the way is blank or unmatched.
 */
final class GroupKeyReader {

  private final Table baseTable;
  private final List<Accessor> accessors;

  private GroupKeyReader(Table baseTable, List<Accessor> accessors) {
    this.baseTable = baseTable;
    this.accessors = accessors;
  }

  static GroupKeyReader create(DataModel model, Table baseTable, List<GroupByColumn> groupBy, FilterContext filter) {
    String baseKey = DaxUtil.normalize(baseTable.name());
    List<Accessor> accessors = new ArrayList<>(groupBy.size());
    for (GroupByColumn col : groupBy) {
      Table target = model.requireTable(col.table());
      int column = target.requireColumn(col.column());
      if (DaxUtil.normalize(target.name()).equals(baseKey)) {
        accessors.add(new Accessor(List.of(), List.of(), target, column));
        continue;
      }
      Optional<List<Integer>> path = model.findUniqueActiveRelationshipPath(baseTable.name(), target.name(),
          PathDirection.MANY_TO_ONE, idx -> RowSetResolver.isRelationshipActive(model, filter, idx));
      if (path.isEmpty()) {
        throw DaxException.eval("no active relationship from " + baseTable.name() + " to " + target.name()
            + " to group by " + DaxUtil.columnRef(col.table(), col.column()));
      }
      List<RelationshipInfo> hops = new ArrayList<>();
      List<Table> hopTables = new ArrayList<>();
      for (int idx : path.get()) {
        RelationshipInfo info = model.relationship(idx);
        hops.add(info);
        hopTables.add(model.requireTable(info.relationship().toTable()));
      }
      accessors.add(new Accessor(hops, hopTables, target, column));
    }
    return new GroupKeyReader(baseTable, accessors);
  }

  List<Value> read(int row) {
    List<Value> key = new ArrayList<>(accessors.size());
    for (Accessor accessor : accessors) {
      key.add(accessor.read(baseTable, row));
    }
    return key;
  }

  /** One key column: the hops from the base table and the column read at the end. */
  private record Accessor(List<RelationshipInfo> hops, List<Table> hopTables, Table target, int column) {

    Value read(Table baseTable, int baseRow) {
      int row = baseRow;
      Table current = baseTable;
      for (int i = 0; i < hops.size(); i++) {
        RelationshipInfo hop = hops.get(i);
        Value key = current.value(row, hop.fromColumnIndex());
        if (key.isBlank()) {
          return Value.BLANK;
        }
        row = hop.toRow(key);
        if (row < 0) {
          return Value.BLANK;
        }
        current = hopTables.get(i);
      }
      return target.value(row, column);
    }
  }
}
