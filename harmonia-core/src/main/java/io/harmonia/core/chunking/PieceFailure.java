package io.harmonia.core.chunking;

/// A piece that failed during a chunked invocation.
///
/// @param index zero-based piece index
/// @param startRow index of the piece's first row in the input dataset
/// @param rowCount rows in the piece
/// @param message failure description, not null
public record PieceFailure(int index, int startRow, int rowCount, String message) {

    @Override
    public String toString() {
        return "piece " + index + " (rows " + startRow + ".." + (startRow + rowCount - 1) + "): "
                + message;
    }
}
