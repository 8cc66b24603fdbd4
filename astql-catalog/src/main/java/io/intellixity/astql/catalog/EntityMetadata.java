package io.intellixity.astql.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Plain description of an entity, handed in by the caller instead of discovered by reflection. */
public record EntityMetadata(String typeName, String target, List<FieldDescriptor> fields) {
  public EntityMetadata {
    Objects.requireNonNull(typeName, "typeName");
    if (typeName.isBlank()) throw new IllegalArgumentException("typeName is blank");
    fields = (fields == null) ? List.of() : List.copyOf(fields);
  }

  public EntityMetadata(String typeName, List<FieldDescriptor> fields) {
    this(typeName, null, fields);
  }

  /** Explicit target, else the lower-cased type name plus {@code s}. */
  public String resolvedTarget() {
    if (target != null && !target.isBlank()) return target;
    return typeName.toLowerCase(Locale.ROOT) + "s";
  }

  public boolean hasField(String nameOrColumn) {
    for (FieldDescriptor f : fields) {
      if (f.answersTo(nameOrColumn)) return true;
    }
    return false;
  }
}
