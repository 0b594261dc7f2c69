package io.harmonia.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.harmonia.core.exception.ConfigurationException;
import io.harmonia.core.pipeline.PipelineDefinition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads and writes pipeline documents in YAML or JSON.
///
/// ### Usage
/// {@snippet :
/// PipelineDefinition definition = PipelineDefinitionLoader.load(Path.of("pipelines/proteins.yaml"));
///
/// String yaml = PipelineDefinitionLoader.toYaml(definition);
/// PipelineDefinition restored = PipelineDefinitionLoader.fromYaml(yaml);
/// }
///
/// Loaded definitions are structurally validated ({@link PipelineDefinition#validate()})
/// before they are returned. Values keep their `${...}` references; resolution happens
/// when the pipeline runs.
///
/// @implNote Thread-safe. Mappers are created per call via {@link #createYamlMapper()}
/// and {@link #createJsonMapper()}. For high-throughput scenarios, cache the mapper.
///
/// @see HarmoniaJacksonModule for the registered type handlers
public final class PipelineDefinitionLoader {

    private static final Logger logger = Logger.getLogger(PipelineDefinitionLoader.class.getName());

    private PipelineDefinitionLoader() {}

    /// Loads a pipeline document, picking the format from the file extension.
    ///
    /// `.json` files are read as JSON; `.yaml`, `.yml` and anything else as YAML.
    ///
    /// @param file the document to read, not null
    /// @return the validated definition, never null
    /// @throws ConfigurationException if the file cannot be read or is not a valid pipeline
    public static PipelineDefinition load(Path file) throws ConfigurationException {
        Objects.requireNonNull(file, "file must not be null");
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read pipeline file " + file + ": " + e.getMessage(), e);
        }
        logger.fine(() -> "Loading pipeline document " + file);
        ObjectMapper mapper = isJson(file) ? createJsonMapper() : createYamlMapper();
        return read(mapper, content, file.toString());
    }

    /// @throws ConfigurationException if the document is not a valid pipeline
    public static PipelineDefinition fromYaml(String yaml) throws ConfigurationException {
        return read(createYamlMapper(), yaml, "<yaml>");
    }

    /// @throws ConfigurationException if the document is not a valid pipeline
    public static PipelineDefinition fromJson(String json) throws ConfigurationException {
        return read(createJsonMapper(), json, "<json>");
    }

    /// Serializes a definition to YAML in the layout {@link #fromYaml(String)} reads.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toYaml(PipelineDefinition definition) {
        return write(createYamlMapper(), definition);
    }

    /// Serializes a definition to pretty-printed JSON.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(PipelineDefinition definition) {
        return write(createJsonMapper(), definition);
    }

    /// Creates an ObjectMapper for JSON pipeline documents.
    ///
    /// Registers:
    /// - `HarmoniaJacksonModule` for pipeline and dataset types
    /// - `JavaTimeModule` for `Instant` values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    /// Creates an ObjectMapper for YAML pipeline documents, configured like
    /// {@link #createJsonMapper()}.
    public static ObjectMapper createYamlMapper() {
        YAMLFactory factory =
                YAMLFactory.builder()
                        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                        .build();
        return configure(new ObjectMapper(factory));
    }

    static boolean isJson(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new HarmoniaJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static PipelineDefinition read(ObjectMapper mapper, String content, String source)
            throws ConfigurationException {
        PipelineDefinition definition;
        try {
            definition = mapper.readValue(content, PipelineDefinition.class);
        } catch (JsonMappingException e) {
            throw new ConfigurationException(
                    "Invalid pipeline document " + source + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "Malformed pipeline document " + source + ": " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new ConfigurationException("Empty pipeline document " + source);
        }
        definition.validate();
        return definition;
    }

    private static String write(ObjectMapper mapper, PipelineDefinition definition) {
        try {
            return mapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize pipeline '" + definition.getName() + "': " + e.getMessage(), e);
        }
    }
}
