package io.harmonia.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.harmonia.core.pipeline.FailurePolicy;
import io.harmonia.core.pipeline.PipelineDefinition;
import io.harmonia.core.pipeline.Step;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Deserializes a pipeline document into a {@link PipelineDefinition}.
///
/// Expected layout:
/// {@snippet lang=yaml :
/// name: protein_harmonization
/// version: "1.0"
/// description: Map UniProt accessions
/// metadata: {}
/// parameters:
///   data_file: "${env.DATA_DIR}/proteins.csv"
/// steps:
///   - name: load
///     action:
///       type: LOAD_DATASET_IDENTIFIERS
///       params:
///         file_path: "${parameters.data_file}"
///     on_failure: strict
/// }
///
/// Every structural problem in the document is collected before failing, so a
/// single error lists all of them. Step problems name the zero-based step index.
/// A step that references `${parameters.x}` where `x` is not a declared parameter
/// is reported too.
///
/// @implNote Package-private. Registered by {@link HarmoniaJacksonModule}.
class PipelineDefinitionDeserializer extends StdDeserializer<PipelineDefinition> {

    @Serial private static final long serialVersionUID = 5873340915046276218L;

    private static final Pattern PARAMETER_REFERENCE =
            Pattern.compile("\\$\\{parameters\\.([A-Za-z0-9_\\-]+)");

    PipelineDefinitionDeserializer() {
        super(PipelineDefinition.class);
    }

    @Override
    public PipelineDefinition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Pipeline document must be a mapping");
        }

        List<String> errors = new ArrayList<>();
        String name = text(root, "name");
        if (name == null || name.isBlank()) {
            errors.add("Missing required field: name");
        }
        Map<String, Object> parameters = mapping(mapper, root, "parameters", "parameters", errors);
        Map<String, Object> metadata = mapping(mapper, root, "metadata", "metadata", errors);

        JsonNode stepsNode = root.get("steps");
        List<Step> steps = new ArrayList<>();
        if (stepsNode == null || stepsNode.isNull()) {
            errors.add("Missing required field: steps");
        } else if (!stepsNode.isArray()) {
            errors.add("Field 'steps' must be a list");
        } else if (stepsNode.isEmpty()) {
            errors.add("Pipeline must have at least one step");
        } else {
            for (int i = 0; i < stepsNode.size(); i++) {
                Step step = readStep(mapper, stepsNode.get(i), i, parameters.keySet(), errors);
                if (step != null) {
                    steps.add(step);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw JsonMappingException.from(p, String.join("; ", errors));
        }

        return PipelineDefinition.builder()
                .name(name)
                .version(root.hasNonNull("version") ? root.get("version").asText() : "1.0")
                .description(text(root, "description"))
                .parameters(parameters)
                .metadata(metadata)
                .steps(steps)
                .build();
    }

    private static Step readStep(
            ObjectMapper mapper,
            JsonNode node,
            int index,
            Set<String> declaredParameters,
            List<String> errors) {
        if (!node.isObject()) {
            errors.add("Step " + index + " must be a mapping");
            return null;
        }
        int before = errors.size();
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            errors.add("Step " + index + " missing 'name' field");
        }
        JsonNode action = node.get("action");
        String type = null;
        Map<String, Object> params = Map.of();
        if (action == null || !action.isObject()) {
            errors.add("Step " + index + " missing 'action' field");
        } else {
            type = text(action, "type");
            if (type == null || type.isBlank()) {
                errors.add("Step " + index + " action missing 'type' field");
            }
            params = mapping(mapper, action, "params", "Step " + index + " action.params", errors);
        }

        FailurePolicy onFailure = FailurePolicy.STRICT;
        String policy = text(node, "on_failure");
        try {
            onFailure = FailurePolicy.fromString(policy);
        } catch (IllegalArgumentException e) {
            errors.add("Step " + index + " has unknown on_failure '" + policy + "'");
        }

        Matcher matcher = PARAMETER_REFERENCE.matcher(node.toString());
        while (matcher.find()) {
            String reference = matcher.group(1);
            if (!declaredParameters.contains(reference)) {
                String error = "Step " + index + " references undefined parameter: " + reference;
                if (!errors.contains(error)) {
                    errors.add(error);
                }
            }
        }

        if (errors.size() > before) {
            return null;
        }
        return new Step(name, type, params, onFailure);
    }

    private static Map<String, Object> mapping(
            ObjectMapper mapper, JsonNode parent, String field, String label, List<String> errors) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            errors.add("Field '" + label + "' must be a mapping");
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
