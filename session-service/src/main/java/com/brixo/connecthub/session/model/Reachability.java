package com.brixo.connecthub.session.model;

public enum Reachability {
    REACHABLE,
    UNREACHABLE;

    public static Reachability of(boolean reachable) {
        return reachable ? REACHABLE : UNREACHABLE;
    }
}
