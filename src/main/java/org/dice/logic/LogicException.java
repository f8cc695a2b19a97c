package org.dice.logic;

/**
 * Root of every recoverable failure raised by the engine. Each failure carries an
 * {@link ErrorCode} so callers can branch on the kind of problem without matching on
 * exception types.
 */
public class LogicException extends RuntimeException {

    public enum ErrorCode {
        LEX_ERROR(1),
        SYNTAX_ERROR(2),
        UNBOUND_VARIABLE(3),
        TOO_MANY_VARIABLES(4),
        DUPLICATE_GATE_NAME(10),
        UNKNOWN_PIN(11),
        INPUT_ALREADY_CONNECTED(12),
        UNRESOLVED_INPUT(13),
        CYCLE_DETECTED(14);

        public final int code;

        ErrorCode(int code) {
            this.code = code;
        }
    }

    private final ErrorCode errorCode;

    public LogicException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
