package com.pitchforge.providers;

/**
 * Every provider was exhausted and no usable template text was available.
 * The only failure callers of the generation core ever see.
 */
public class TerminalGenerationException extends RuntimeException {

    public TerminalGenerationException(String message) {
        super(message);
    }

    public TerminalGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
