package io.harmonia.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.harmonia.core.pipeline.PipelineDefinition;
import io.harmonia.core.pipeline.Step;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Writes a {@link PipelineDefinition} in the document layout read by
/// {@link PipelineDefinitionDeserializer}. Raw `${...}` references are written untouched.
///
/// @implNote Package-private. Registered by {@link HarmoniaJacksonModule}.
class PipelineDefinitionSerializer extends StdSerializer<PipelineDefinition> {

    @Serial private static final long serialVersionUID = -4035092618774108525L;

    PipelineDefinitionSerializer() {
        super(PipelineDefinition.class);
    }

    @Override
    public void serialize(PipelineDefinition definition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", definition.getName());
        gen.writeStringField("version", definition.getVersion());
        if (!definition.getDescription().isEmpty()) {
            gen.writeStringField("description", definition.getDescription());
        }
        if (!definition.getMetadata().isEmpty()) {
            gen.writeObjectField("metadata", definition.getMetadata());
        }
        if (!definition.getParameters().isEmpty()) {
            gen.writeObjectField("parameters", definition.getParameters());
        }

        gen.writeArrayFieldStart("steps");
        for (Step step : definition.getSteps()) {
            gen.writeStartObject();
            gen.writeStringField("name", step.name());
            gen.writeObjectFieldStart("action");
            gen.writeStringField("type", step.operationType());
            if (!step.params().isEmpty()) {
                gen.writeObjectField("params", step.params());
            }
            gen.writeEndObject();
            gen.writeStringField("on_failure", step.onFailure().name().toLowerCase(Locale.ROOT));
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
