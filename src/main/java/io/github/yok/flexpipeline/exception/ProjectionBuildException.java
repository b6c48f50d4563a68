package io.github.yok.flexpipeline.exception;

import lombok.Getter;

/**
 * Thrown when a single projection cannot be built. Never fatal for the run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ProjectionBuildException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String projection;

    public ProjectionBuildException(String projection, String message) {
        super(message);
        this.projection = projection;
    }

    public ProjectionBuildException(String projection, String message, Throwable cause) {
        super(message, cause);
        this.projection = projection;
    }
}
