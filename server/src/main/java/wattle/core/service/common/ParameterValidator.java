package wattle.core.service.common;

/**
 * Assertions on required token request parameters.
 */
public final class ParameterValidator {

    private ParameterValidator() {}

    /**
     * Returns the value if present.
     *
     * @param value         the parameter value
     * @param parameterName the wire name of the parameter
     * @throws InvalidRequestException if the value is null or blank
     */
    public static String required(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("The " + parameterName + " parameter is required");
        }
        return value;
    }
}
