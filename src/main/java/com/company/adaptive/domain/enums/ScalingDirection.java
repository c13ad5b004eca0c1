package com.company.adaptive.domain.enums;

public enum ScalingDirection {
    SCALE_UP,
    SCALE_DOWN,
    HOLD
}
