package com.company.adaptive.service;

import com.company.adaptive.domain.ResourceSnapshot;

/**
 * Source of host resource utilization for the health aggregator.
 */
public interface ResourceProbe {

    ResourceSnapshot sample();
}
