package io.harmonia.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.harmonia.core.context.Dataset;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a {@link Dataset} as `{"columns": [...], "rows": [{...}, ...]}`, rows in order.
///
/// @implNote Package-private. Registered by {@link HarmoniaJacksonModule}.
class DatasetSerializer extends StdSerializer<Dataset> {

    @Serial private static final long serialVersionUID = 8120983475627113340L;

    DatasetSerializer() {
        super(Dataset.class);
    }

    @Override
    public void serialize(Dataset dataset, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart("columns");
        for (String column : dataset.getColumns()) {
            gen.writeString(column);
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("rows");
        for (Map<String, Object> row : dataset.getRows()) {
            gen.writeObject(row);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
