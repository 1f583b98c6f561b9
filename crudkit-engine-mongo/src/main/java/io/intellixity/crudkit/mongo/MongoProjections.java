package io.intellixity.crudkit.mongo;

import io.intellixity.crudkit.model.FieldSelection;
import io.intellixity.crudkit.query.SortField;
import io.intellixity.crudkit.store.Relation;
import org.bson.Document;

import java.util.List;

/** Field selections and sort fields rendered as Mongo projection / sort documents. */
final class MongoProjections {
  private MongoProjections() {}

  /** Projection for a selection; null when every field is returned. */
  static Document projection(FieldSelection sel) {
    if (sel == null || sel.isAll()) return null;
    Document d = new Document();
    if (sel.mode() == FieldSelection.Mode.INCLUDE) {
      for (String f : sel.fields()) d.put(f, 1);
      if (sel.excludesId()) d.put(MongoValues.ID, 0);
      // {} would return everything
      if (d.isEmpty()) d.put(MongoValues.ID, 1);
      return d;
    }
    for (String f : sel.fields()) d.put(f, 0);
    return d;
  }

  /**
   * Projection for fetching referenced documents: {@code _id} is always kept for matching, as is the
   * nested relation's path. The relation's own selection is applied afterwards.\n
   */
  static Document forPopulate(Relation relation) {
    FieldSelection sel = relation.targetFields();
    if (sel.isAll()) return null;
    Document d = new Document();
    if (sel.mode() == FieldSelection.Mode.INCLUDE) {
      for (String f : sel.fields()) d.put(f, 1);
      d.put(MongoValues.ID, 1);
      return d;
    }
    for (String f : sel.fields()) {
      if (!f.equals(MongoValues.ID)) d.put(f, 0);
    }
    return d.isEmpty() ? null : d;
  }

  static Document sort(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) {
      d.put(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return d;
  }
}
