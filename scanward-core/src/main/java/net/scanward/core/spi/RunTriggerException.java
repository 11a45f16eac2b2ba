package net.scanward.core.spi;

public class RunTriggerException extends Exception {
    private final String code;

    public RunTriggerException(String message, String code) {
        super(message);
        this.code = code;
    }

    public RunTriggerException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
