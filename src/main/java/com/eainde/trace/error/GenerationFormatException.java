package com.eainde.trace.error;

/**
 * Generation output held no recoverable JSON object, even after fence stripping,
 * balanced-object extraction and the lenient reformat pass.
 */
public class GenerationFormatException extends PipelineException {

    public GenerationFormatException(String message) {
        super(message);
    }

    public GenerationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
