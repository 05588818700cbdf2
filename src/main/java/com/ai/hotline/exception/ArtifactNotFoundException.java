package com.ai.hotline.exception;

public class ArtifactNotFoundException extends HotlineException {

    private final String artifactId;

    public ArtifactNotFoundException(String artifactId) {
        super("Audio artifact not found: " + artifactId);
        this.artifactId = artifactId;
    }

    public String getArtifactId() {
        return artifactId;
    }
}
