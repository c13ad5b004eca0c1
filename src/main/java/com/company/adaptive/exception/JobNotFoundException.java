package com.company.adaptive.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
    }
}
