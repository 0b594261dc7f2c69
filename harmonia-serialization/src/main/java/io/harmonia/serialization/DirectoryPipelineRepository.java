package io.harmonia.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.harmonia.core.exception.ConfigurationException;
import io.harmonia.core.pipeline.PipelineDefinition;
import io.harmonia.core.pipeline.PipelineRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// {@link PipelineRepository} backed by a directory tree of YAML and JSON documents.
///
/// ### Lookup
/// {@link #findByName(String)} first tries `<dir>/<name>.yaml`, `.yml` and `.json`.
/// If none exists it scans the whole tree, in path order, for a document whose
/// `name` field matches.
///
/// Documents are read on every call; edits on disk are picked up without a restart.
/// Unreadable documents are skipped with a warning while scanning, but a document
/// addressed directly by file name must be valid. Names containing path separators
/// or `..` are rejected rather than resolved outside the directory.
public final class DirectoryPipelineRepository implements PipelineRepository {

    private static final Logger logger =
            Logger.getLogger(DirectoryPipelineRepository.class.getName());

    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");
    private static final String NO_DESCRIPTION = "No description available";

    private final Path directory;

    public DirectoryPipelineRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /// @throws ConfigurationException if `name` is not a plain file name, or the
    ///     document named after it is not a valid pipeline
    @Override
    public Optional<PipelineDefinition> findByName(String name) throws ConfigurationException {
        Objects.requireNonNull(name, "name must not be null");
        Path root = directory.toAbsolutePath().normalize();
        for (String extension : EXTENSIONS) {
            Path candidate;
            try {
                candidate = root.resolve(name + extension).normalize();
            } catch (InvalidPathException e) {
                throw new ConfigurationException("Invalid pipeline name '" + name + "'", e);
            }
            if (!root.equals(candidate.getParent())) {
                throw new ConfigurationException(
                        "Invalid pipeline name '" + name + "': must be a plain file name");
            }
            if (Files.isRegularFile(candidate)) {
                return Optional.of(PipelineDefinitionLoader.load(candidate));
            }
        }

        for (Path file : documents()) {
            Optional<JsonNode> tree = readTree(file);
            if (tree.isPresent() && name.equals(tree.get().path("name").asText(null))) {
                Optional<PipelineDefinition> definition = tryLoad(file);
                if (definition.isPresent()) {
                    return definition;
                }
            }
        }
        return Optional.empty();
    }

    /// Loads every valid document of the tree, sorted by pipeline name.
    @Override
    public List<PipelineDefinition> findAll() {
        List<PipelineDefinition> definitions = new ArrayList<>();
        for (Path file : documents()) {
            tryLoad(file).ifPresent(definitions::add);
        }
        definitions.sort(Comparator.comparing(PipelineDefinition::getName));
        return List.copyOf(definitions);
    }

    /// Lists the documents of the tree without validating them, sorted by name.
    ///
    /// A missing directory yields an empty list.
    public List<PipelineSummary> list() {
        List<PipelineSummary> summaries = new ArrayList<>();
        for (Path file : documents()) {
            readTree(file)
                    .filter(JsonNode::isObject)
                    .ifPresent(
                            tree ->
                                    summaries.add(
                                            new PipelineSummary(
                                                    tree.path("name").asText(stem(file)),
                                                    tree.path("description").asText(NO_DESCRIPTION),
                                                    file,
                                                    tree.has("parameters"))));
        }
        summaries.sort(Comparator.comparing(PipelineSummary::name));
        return List.copyOf(summaries);
    }

    public Path getDirectory() {
        return directory;
    }

    private List<Path> documents() {
        if (!Files.isDirectory(directory)) {
            logger.warning("Pipeline directory not found: " + directory);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(DirectoryPipelineRepository::isDocument)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan pipeline directory " + directory, e);
        }
    }

    private Optional<PipelineDefinition> tryLoad(Path file) {
        try {
            return Optional.of(PipelineDefinitionLoader.load(file));
        } catch (ConfigurationException e) {
            logger.warning("Skipping pipeline document " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<JsonNode> readTree(Path file) {
        ObjectMapper mapper =
                PipelineDefinitionLoader.isJson(file)
                        ? PipelineDefinitionLoader.createJsonMapper()
                        : PipelineDefinitionLoader.createYamlMapper();
        try {
            return Optional.ofNullable(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            logger.warning("Could not read pipeline document " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isDocument(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    private static String stem(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
