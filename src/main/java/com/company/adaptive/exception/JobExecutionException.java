package com.company.adaptive.exception;

import lombok.Getter;

@Getter
public class JobExecutionException extends RuntimeException {
    private final String jobName;

    public JobExecutionException(String jobName, Throwable cause) {
        super("Job " + jobName + " failed: " + cause.getMessage(), cause);
        this.jobName = jobName;
    }
}
