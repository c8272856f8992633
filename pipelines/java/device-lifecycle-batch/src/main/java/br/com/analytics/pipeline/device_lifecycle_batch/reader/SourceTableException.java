package br.com.analytics.pipeline.device_lifecycle_batch.reader;

public class SourceTableException extends RuntimeException {

    private final String source;

    public SourceTableException(String source, String message, Throwable cause) {
        super("Cannot read source table '" + source + "': " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
