package io.funcprops.dump;

/**
 * A property dump could not be written completely. Callers must stop rather
 * than continue with a partial dump.
 */
public class FatalDumpException extends RuntimeException {

    public FatalDumpException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
