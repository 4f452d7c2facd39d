package at.sv.huebridge.api;

/**
 * Exception to signal a backend error of the bridge (5xx, 429), an error payload in an otherwise successful response,
 * or a response that could not be parsed. The controllers retry after an ApiFailure.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }

    public ApiFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
