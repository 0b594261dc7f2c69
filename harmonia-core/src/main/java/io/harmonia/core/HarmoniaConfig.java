package io.harmonia.core;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Configuration options for the Harmonia pipeline environment.
///
/// Controls the directories the path resolver searches and writes to, the
/// default values of directory environment variables, the shared worker pool,
/// and run-level limits. Use the {@link Builder} for fluent configuration or
/// {@link #fromEnvironment(Map)} to read `HARMONIA_*` variables.
///
/// ### Default Values
/// - `baseDir`: the working directory
/// - `dataDir`: `/procedure/data/local_data`
/// - `tmpDir`: `${java.io.tmpdir}/harmonia`
/// - `cacheDir`: `<tmpDir>/cache`
/// - `outputDir`: `<tmpDir>/output`
/// - `configDir`: `<baseDir>/configs`
/// - `filenameFallbackEnabled`: `true`
/// - `pipelineTimeout`: none
/// - `workerThreads`: `4`
/// - `maxSubstitutionPasses`: `10`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link HarmoniaFactory}
/// and do not modify afterwards.
///
/// @see HarmoniaFactory
public class HarmoniaConfig {

    private static final Logger logger = Logger.getLogger(HarmoniaConfig.class.getName());

    public static final String ENV_PREFIX = "HARMONIA_";

    private Path baseDir = Path.of("").toAbsolutePath();
    private Path dataDir = Path.of("/procedure/data/local_data");
    private Path tmpDir = Path.of(System.getProperty("java.io.tmpdir"), "harmonia");
    private Path cacheDir;
    private Path outputDir;
    private Path configDir;
    private List<Path> additionalDataDirs = new ArrayList<>();
    private boolean filenameFallbackEnabled = true;
    private Duration pipelineTimeout;
    private int workerThreads = 4;
    private int maxSubstitutionPasses = 10;

    public HarmoniaConfig() {}

    /// Reads overrides from `HARMONIA_*` environment variables.
    ///
    /// Recognised: `HARMONIA_BASE_DIR`, `HARMONIA_DATA_DIR`, `HARMONIA_CACHE_DIR`,
    /// `HARMONIA_OUTPUT_DIR`, `HARMONIA_CONFIG_DIR`, `HARMONIA_TMP_DIR`,
    /// `HARMONIA_PIPELINE_TIMEOUT` (ISO-8601 duration such as `PT30M`),
    /// `HARMONIA_WORKER_THREADS` and `HARMONIA_FILENAME_FALLBACK`. Absent or invalid
    /// values keep the default; invalid ones are logged.
    ///
    /// @param environment variables to read, usually `System.getenv()`, not null
    /// @return a new configuration, never null
    public static HarmoniaConfig fromEnvironment(Map<String, String> environment) {
        HarmoniaConfig config = new HarmoniaConfig();
        String value;
        if ((value = environment.get(ENV_PREFIX + "BASE_DIR")) != null) {
            config.baseDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "DATA_DIR")) != null) {
            config.dataDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "TMP_DIR")) != null) {
            config.tmpDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "CACHE_DIR")) != null) {
            config.cacheDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "OUTPUT_DIR")) != null) {
            config.outputDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "CONFIG_DIR")) != null) {
            config.configDir = Path.of(value);
        }
        if ((value = environment.get(ENV_PREFIX + "PIPELINE_TIMEOUT")) != null) {
            try {
                config.pipelineTimeout = Duration.parse(value);
            } catch (DateTimeParseException e) {
                logger.warning("Ignoring invalid " + ENV_PREFIX + "PIPELINE_TIMEOUT: " + value);
            }
        }
        if ((value = environment.get(ENV_PREFIX + "WORKER_THREADS")) != null) {
            try {
                config.workerThreads = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Ignoring invalid " + ENV_PREFIX + "WORKER_THREADS: " + value);
            }
        }
        if ((value = environment.get(ENV_PREFIX + "FILENAME_FALLBACK")) != null) {
            config.filenameFallbackEnabled = Boolean.parseBoolean(value.trim());
        }
        return config;
    }

    /// Returns the built-in default table for directory environment variables.
    ///
    /// Consulted by the expression resolver when `${env.NAME}` or `${NAME}` is
    /// not set in the process environment.
    ///
    /// @return `DATA_DIR`, `CACHE_DIR`, `OUTPUT_DIR`, `CONFIG_DIR`, `BASE_DIR` and
    ///     `TMP_DIR` mapped to this configuration's directories, never null
    public Map<String, String> environmentDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("DATA_DIR", getDataDir().toString());
        defaults.put("CACHE_DIR", getCacheDir().toString());
        defaults.put("OUTPUT_DIR", getOutputDir().toString());
        defaults.put("CONFIG_DIR", getConfigDir().toString());
        defaults.put("BASE_DIR", getBaseDir().toString());
        defaults.put("TMP_DIR", getTmpDir().toString());
        return defaults;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path getTmpDir() {
        return tmpDir;
    }

    public void setTmpDir(Path tmpDir) {
        this.tmpDir = tmpDir;
    }

    public Path getCacheDir() {
        return cacheDir != null ? cacheDir : tmpDir.resolve("cache");
    }

    public void setCacheDir(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public Path getOutputDir() {
        return outputDir != null ? outputDir : tmpDir.resolve("output");
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path getConfigDir() {
        return configDir != null ? configDir : baseDir.resolve("configs");
    }

    public void setConfigDir(Path configDir) {
        this.configDir = configDir;
    }

    /// Returns the conventional data directories searched after the base directory.
    ///
    /// @return `dataDir` followed by any additional directories, never null
    public List<Path> getDataSearchPath() {
        List<Path> dirs = new ArrayList<>();
        dirs.add(dataDir);
        dirs.addAll(additionalDataDirs);
        return dirs;
    }

    public List<Path> getAdditionalDataDirs() {
        return List.copyOf(additionalDataDirs);
    }

    public void setAdditionalDataDirs(List<Path> additionalDataDirs) {
        this.additionalDataDirs = new ArrayList<>(additionalDataDirs);
    }

    /// Returns whether the filename-only input path fallback is allowed.
    ///
    /// The fallback can pick the wrong file when several files share a name.
    public boolean isFilenameFallbackEnabled() {
        return filenameFallbackEnabled;
    }

    public void setFilenameFallbackEnabled(boolean filenameFallbackEnabled) {
        this.filenameFallbackEnabled = filenameFallbackEnabled;
    }

    /// @return the run-level timeout, or null when runs are unbounded
    public Duration getPipelineTimeout() {
        return pipelineTimeout;
    }

    public void setPipelineTimeout(Duration pipelineTimeout) {
        this.pipelineTimeout = pipelineTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /// ### Contracts
    /// - **Precondition**: `workerThreads` should be positive
    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getMaxSubstitutionPasses() {
        return maxSubstitutionPasses;
    }

    public void setMaxSubstitutionPasses(int maxSubstitutionPasses) {
        this.maxSubstitutionPasses = maxSubstitutionPasses;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link HarmoniaConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final HarmoniaConfig config = new HarmoniaConfig();

        public Builder baseDir(Path baseDir) {
            config.baseDir = baseDir;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            config.dataDir = dataDir;
            return this;
        }

        public Builder tmpDir(Path tmpDir) {
            config.tmpDir = tmpDir;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            config.cacheDir = cacheDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            config.outputDir = outputDir;
            return this;
        }

        public Builder configDir(Path configDir) {
            config.configDir = configDir;
            return this;
        }

        public Builder additionalDataDir(Path dir) {
            config.additionalDataDirs.add(dir);
            return this;
        }

        public Builder filenameFallbackEnabled(boolean enabled) {
            config.filenameFallbackEnabled = enabled;
            return this;
        }

        public Builder pipelineTimeout(Duration timeout) {
            config.pipelineTimeout = timeout;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            config.workerThreads = workerThreads;
            return this;
        }

        public Builder maxSubstitutionPasses(int passes) {
            config.maxSubstitutionPasses = passes;
            return this;
        }

        /// @return the configured instance, never null
        public HarmoniaConfig build() {
            return config;
        }
    }
}
