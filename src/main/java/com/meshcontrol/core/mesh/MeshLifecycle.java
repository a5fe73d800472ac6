package com.meshcontrol.core.mesh;

public enum MeshLifecycle {
    CREATED,
    RUNNING,
    STOPPED
}
