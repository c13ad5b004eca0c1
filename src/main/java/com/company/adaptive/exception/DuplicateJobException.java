package com.company.adaptive.exception;

public class DuplicateJobException extends RuntimeException {
    public DuplicateJobException(String jobName) {
        super("Job already scheduled: " + jobName);
    }
}
