package com.planaccel.ir;

/**
 * Where and in which layout a node produces its output: row-oriented on the host, or
 * columnar on the accelerator device.
 */
public enum Representation {
    HOST,
    DEVICE
}
