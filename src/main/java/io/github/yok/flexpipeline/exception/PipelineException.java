package io.github.yok.flexpipeline.exception;

/**
 * Base class of the errors that terminate or reject part of a pipeline run.
 *
 * @author Yasuharu.Okawauchi
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
