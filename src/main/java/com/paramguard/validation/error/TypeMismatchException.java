package com.paramguard.validation.error;

/**
 * The converted value does not conform to the parameter's declared type.
 */
public class TypeMismatchException extends ParameterValidationException {
    private final String declaredType;
    private final String receivedType;

    public TypeMismatchException(final String parameterName, final String declaredType, final String receivedType) {
        super("Parameter '" + parameterName + "' must be type '" + declaredType + "', got '" + receivedType + "'",
            parameterName);
        this.declaredType = declaredType;
        this.receivedType = receivedType;
    }

    /** Display name of the type as declared, before any normalisation. */
    public String declaredType() {
        return declaredType;
    }

    public String receivedType() {
        return receivedType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TYPE_MISMATCH;
    }
}
