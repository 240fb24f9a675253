package com.eduhub.scheduling.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum SessionType {
    ONE_ON_ONE,
    GROUP,
    CLASS;

    /** Kinds produced by recurrence expansion; one-off sessions are created elsewhere. */
    public static final Set<SessionType> GENERATED = Collections.unmodifiableSet(EnumSet.of(GROUP, CLASS));
}
