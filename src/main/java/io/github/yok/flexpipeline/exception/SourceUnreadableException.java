package io.github.yok.flexpipeline.exception;

/**
 * Thrown when the entity's source file does not exist or cannot be parsed.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceUnreadableException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public SourceUnreadableException(String message) {
        super(message);
    }

    public SourceUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
