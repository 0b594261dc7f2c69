package io.harmonia.core.chunking;

import io.harmonia.core.context.Dataset;
import io.harmonia.core.context.ExecutionContext;

/// Work applied to one piece of a chunked dataset.
@FunctionalInterface
public interface PieceProcessor {

    /// Processes one piece.
    ///
    /// @param piece the rows of this piece, not null
    /// @param pieceContext isolated context holding the piece under the input key, not null
    /// @return the output rows for this piece, not null
    /// @throws Exception if the piece fails
    Dataset process(Dataset piece, ExecutionContext pieceContext) throws Exception;
}
