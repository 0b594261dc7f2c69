package io.harmonia.serialization;

import java.nio.file.Path;

/// Listing entry of a pipeline document found by {@link DirectoryPipelineRepository}.
///
/// @param name declared pipeline name, or the file stem when the document has none
/// @param description declared description, or `"No description available"`
/// @param file the document the entry was read from
/// @param hasParameters whether the document declares a `parameters` block
public record PipelineSummary(String name, String description, Path file, boolean hasParameters) {}
