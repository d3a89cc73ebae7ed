package com.zatca.fatoora.exception;

/**
 * Base Fatoora exception class
 * 
 * This is an unchecked exception (RuntimeException) reserved for programmer
 * errors and fatal failures such as malformed key material. Regulator
 * validation failures are returned as result objects, never thrown.
 */
public class FatooraException extends RuntimeException {
    private final String code;
    private final Integer statusCode;

    public FatooraException(String message) {
        this(message, null, null, null);
    }

    public FatooraException(String message, String code) {
        this(message, code, null, null);
    }

    public FatooraException(String message, String code, Integer statusCode) {
        this(message, code, statusCode, null);
    }

    public FatooraException(String message, String code, Throwable cause) {
        this(message, code, null, cause);
    }

    public FatooraException(String message, String code, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
