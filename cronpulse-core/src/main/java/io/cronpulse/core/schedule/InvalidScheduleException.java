package io.cronpulse.core.schedule;

public final class InvalidScheduleException extends IllegalArgumentException {
    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        this(expression, reason, null);
    }

    public InvalidScheduleException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
