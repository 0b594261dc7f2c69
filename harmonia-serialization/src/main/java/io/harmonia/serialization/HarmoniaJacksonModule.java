package io.harmonia.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.harmonia.core.context.Dataset;
import io.harmonia.core.pipeline.PipelineDefinition;
import java.io.Serial;

/// Jackson `SimpleModule` that registers every Harmonia type handler in one place.
///
/// - `PipelineDefinition`: {@link PipelineDefinitionSerializer} /
///   {@link PipelineDefinitionDeserializer}, using the `steps[].action.type` document layout
/// - `Dataset`: {@link DatasetSerializer}, write-only, used by context snapshots
///
/// All registrations are explicit; nothing is discovered through classpath scanning.
///
/// @see PipelineDefinitionLoader for the convenience factory API
public class HarmoniaJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3061785517725946213L;

    public HarmoniaJacksonModule() {
        super("HarmoniaJacksonModule");

        addSerializer(PipelineDefinition.class, new PipelineDefinitionSerializer());
        addDeserializer(PipelineDefinition.class, new PipelineDefinitionDeserializer());

        addSerializer(Dataset.class, new DatasetSerializer());
    }
}
