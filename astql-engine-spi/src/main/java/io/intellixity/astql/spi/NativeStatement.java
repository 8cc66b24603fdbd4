package io.intellixity.astql.spi;

/** Marker for a renderer's backend-native output (SQL text plus binds, a document command, ...). */
public interface NativeStatement {
}
