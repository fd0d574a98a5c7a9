// file: format/src/main/java/io/sumspec/format/UnsupportedNodeException.java
package io.sumspec.format;

/**
 * A format was asked to render an expression variant it does not handle.
 */
public class UnsupportedNodeException extends UnsupportedOperationException {

    private final String variant;
    private final String format;

    public UnsupportedNodeException(String variant, String format) {
        super("format " + format + " does not support " + variant + " nodes");
        this.variant = variant;
        this.format = format;
    }

    public String variant() {
        return variant;
    }

    public String format() {
        return format;
    }
}
