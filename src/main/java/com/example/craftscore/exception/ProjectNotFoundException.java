package com.example.craftscore.exception;

public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(String projectId) {
        super("Scored project not found: " + projectId);
    }
}
