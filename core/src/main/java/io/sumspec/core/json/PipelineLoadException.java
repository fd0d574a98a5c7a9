// file: core/src/main/java/io/sumspec/core/json/PipelineLoadException.java
package io.sumspec.core.json;

/** The pipeline or catalog JSON could not be read or parsed. */
public class PipelineLoadException extends RuntimeException {

    public PipelineLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public PipelineLoadException(String message) {
        super(message);
    }
}
