package com.social.tipping.exception;

/**
 * A collaborator the submission path cannot proceed without did not answer.
 */
public class DependencyUnavailableException extends TipPipelineException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
