package io.harmonia.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when a step names an operation type that is not registered.
public class UnknownOperationException extends PipelineException {
    @Serial private static final long serialVersionUID = -8250116331790342567L;

    private final String stepName;
    private final String operationType;
    private final List<String> knownTypes;

    public UnknownOperationException(
            String stepName, String operationType, List<String> knownTypes) {
        super(
                "Step '"
                        + stepName
                        + "' uses unknown operation type '"
                        + operationType
                        + "'. Registered types: "
                        + knownTypes);
        this.stepName = stepName;
        this.operationType = operationType;
        this.knownTypes = List.copyOf(knownTypes);
    }

    public String getStepName() {
        return stepName;
    }

    public String getOperationType() {
        return operationType;
    }

    public List<String> getKnownTypes() {
        return knownTypes;
    }
}
