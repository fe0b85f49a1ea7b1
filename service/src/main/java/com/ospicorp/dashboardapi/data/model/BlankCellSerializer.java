package com.ospicorp.dashboardapi.data.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.List;

/** Writes grid cells as a JSON array, blank cells as {@code ""}. */
public class BlankCellSerializer extends StdSerializer<List<Double>> {

  @SuppressWarnings("unchecked")
  public BlankCellSerializer() {
    super((Class<List<Double>>) (Class<?>) List.class);
  }

  @Override
  public void serialize(List<Double> cells, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    gen.writeStartArray();
    for (Double cell : cells) {
      if (cell == null) {
        gen.writeString("");
      } else {
        gen.writeNumber(cell);
      }
    }
    gen.writeEndArray();
  }
}
