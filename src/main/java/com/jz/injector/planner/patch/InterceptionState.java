package com.jz.injector.planner.patch;

/** planner 注入的生命周期：UNINSTALLED -> PENDING -> INSTALLED | FAILED */
public enum InterceptionState {
    UNINSTALLED,
    PENDING,
    INSTALLED,
    FAILED
}
