package io.skillagent.spec;

import static io.skillagent.spec.A2AErrorCodes.JSON_PARSE_ERROR_CODE;

/**
 * The request body is not valid JSON.
 */
public class JSONParseError extends A2AError {

    public JSONParseError() {
        this("Parse error");
    }

    public JSONParseError(String message) {
        super(JSON_PARSE_ERROR_CODE, message, null);
    }
}
