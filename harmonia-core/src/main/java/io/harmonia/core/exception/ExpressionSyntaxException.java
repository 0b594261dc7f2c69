package io.harmonia.core.exception;

import java.io.Serial;

/// Raised for a malformed `${...}` reference, such as an unterminated marker or
/// a bracket index that is neither a number nor a quoted key.
public class ExpressionSyntaxException extends ConfigurationException {
    @Serial private static final long serialVersionUID = 6023180557125349214L;

    private final String expression;
    private final int position;

    public ExpressionSyntaxException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    /// @return zero-based offset into {@link #getExpression()} where parsing failed
    public int getPosition() {
        return position;
    }
}
