package com.eduhub.scheduling.domain.resolver;

import com.eduhub.scheduling.domain.model.SessionType;

/**
 * Who and where a recurrence rule books: the resources every occurrence of the rule binds.
 */
public record RuleBinding(String tutorId, String centerId, String groupId, SessionType sessionType, String label) {
}
