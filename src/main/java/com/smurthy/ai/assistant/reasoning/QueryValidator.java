package com.smurthy.ai.assistant.reasoning;

/**
 * Input checks run before any processing. Length is measured on the stripped query.
 */
public final class QueryValidator {

    private QueryValidator() {
    }

    /**
     * @return the stripped query
     * @throws DispatchException with a validation {@link ErrorCode}
     */
    public static String validate(String query, RuntimeConfig config) {
        if (query == null || query.isBlank()) {
            throw new DispatchException(ErrorCode.INVALID_QUERY, "Query must be a non-empty string");
        }
        String stripped = query.strip();
        int length = stripped.length();
        if (length < config.minQueryLength()) {
            throw new DispatchException(ErrorCode.QUERY_TOO_SHORT,
                    "Query too short (minimum " + config.minQueryLength() + " characters)");
        }
        if (length > config.maxQueryLength()) {
            throw new DispatchException(ErrorCode.QUERY_TOO_LONG,
                    "Query too long (maximum " + config.maxQueryLength() + " characters)");
        }
        return stripped;
    }
}
