package com.company.adaptive.scheduled;

/**
 * A built-in maintenance job. Every bean of this type is registered with the
 * {@link MaintenanceScheduler} at startup.
 */
public interface MaintenanceJob extends Runnable {

    String name();

    IntervalSpec intervalSpec();
}
