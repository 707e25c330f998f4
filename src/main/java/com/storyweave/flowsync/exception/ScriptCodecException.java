package com.storyweave.flowsync.exception;

/**
 * Thrown when a script or graph document cannot be read or written as JSON.
 */
public class ScriptCodecException extends RuntimeException {

    public ScriptCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
