package io.harmonia.core.path;

import io.harmonia.core.HarmoniaConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Default {@link PathResolver} driven by {@link HarmoniaConfig} directories.
///
/// @implNote The filename-only fallback walks the primary data directory and can
/// return the wrong file when several files share a name. Every use is logged at
/// `WARNING`, and it can be switched off with
/// {@link HarmoniaConfig#setFilenameFallbackEnabled(boolean)}.
public class DefaultPathResolver implements PathResolver {

    private static final Logger logger = Logger.getLogger(DefaultPathResolver.class.getName());

    private static final int FALLBACK_SEARCH_DEPTH = 8;

    private final Path baseDir;
    private final List<Path> dataSearchPath;
    private final Path outputDir;
    private final Path tempOutputDir;
    private final boolean filenameFallbackEnabled;

    public DefaultPathResolver(HarmoniaConfig config) {
        this(
                config,
                Path.of(System.getProperty("java.io.tmpdir"), "harmonia", "output"));
    }

    DefaultPathResolver(HarmoniaConfig config, Path tempOutputDir) {
        Objects.requireNonNull(config, "config must not be null");
        this.baseDir = config.getBaseDir();
        this.dataSearchPath = config.getDataSearchPath();
        this.outputDir = config.getOutputDir();
        this.tempOutputDir = tempOutputDir;
        this.filenameFallbackEnabled = config.isFilenameFallbackEnabled();
    }

    @Override
    public PathResolution resolve(String pathExpression, PathMode mode) {
        Objects.requireNonNull(pathExpression, "pathExpression must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Path path = expandHome(pathExpression);
        return mode == PathMode.INPUT ? resolveInput(path) : resolveOutput(path);
    }

    private PathResolution resolveInput(Path path) {
        if (path.isAbsolute()) {
            if (Files.exists(path)) {
                return new PathResolution(path, true, PathResolution.Strategy.ABSOLUTE);
            }
        } else {
            Path candidate = baseDir.resolve(path).normalize();
            if (Files.exists(candidate)) {
                return new PathResolution(candidate, true, PathResolution.Strategy.BASE_DIR);
            }
            for (Path dataDir : dataSearchPath) {
                candidate = dataDir.resolve(path).normalize();
                if (Files.exists(candidate)) {
                    return new PathResolution(candidate, true, PathResolution.Strategy.DATA_DIR);
                }
            }
        }

        if (filenameFallbackEnabled && path.getFileName() != null) {
            List<Path> matches = findByFileName(path.getFileName().toString());
            if (!matches.isEmpty()) {
                Path match = matches.get(0);
                logger.warning(
                        "FILENAME FALLBACK: '"
                                + path
                                + "' not found; using '"
                                + match
                                + "' matched by file name only"
                                + (matches.size() > 1
                                        ? " (" + matches.size() + " candidates: " + matches + ")"
                                        : ""));
                return new PathResolution(match, true, PathResolution.Strategy.FILENAME_FALLBACK);
            }
        }

        logger.fine("Input path not found: " + path);
        return new PathResolution(path, false, PathResolution.Strategy.NOT_FOUND);
    }

    private List<Path> findByFileName(String fileName) {
        Path primary = dataSearchPath.get(0);
        if (!Files.isDirectory(primary)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(primary, FALLBACK_SEARCH_DEPTH)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().equals(fileName))
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            logger.warning("Filename fallback search in " + primary + " failed: " + e.getMessage());
            return List.of();
        }
    }

    private PathResolution resolveOutput(Path path) {
        Path root = outputDir.normalize();
        Path target = path.isAbsolute() ? path : root.resolve(path).normalize();
        if (!path.isAbsolute() && !target.startsWith(root)) {
            // Relative output never leaves the output directory; keep only the file name.
            Path name = target.getFileName();
            Path clamped = name == null || name.toString().equals("..") ? root : root.resolve(name);
            logger.warning("Output path " + path + " points outside " + root + "; using " + clamped);
            target = clamped;
        }
        if (prepareParent(target)) {
            return new PathResolution(target, true, PathResolution.Strategy.OUTPUT_DIR);
        }

        Path fallback = tempOutputDir.resolve(target.getFileName().toString());
        logger.warning("Output location " + target + " is not writable; using " + fallback);
        prepareParent(fallback);
        return new PathResolution(fallback, true, PathResolution.Strategy.TEMP_FALLBACK);
    }

    private static boolean prepareParent(Path target) {
        Path parent = target.toAbsolutePath().getParent();
        if (parent == null) {
            return true;
        }
        try {
            Files.createDirectories(parent);
            return Files.isWritable(parent);
        } catch (IOException | SecurityException e) {
            logger.fine("Cannot create " + parent + ": " + e.getMessage());
            return false;
        }
    }

    private static Path expandHome(String expression) {
        if (expression.equals("~") || expression.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + expression.substring(1));
        }
        return Path.of(expression);
    }
}
