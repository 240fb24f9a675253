package com.eduhub.scheduling.domain.resolver;

import com.eduhub.scheduling.domain.recurrence.Occurrence;
import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;

/**
 * An occurrence paired with the binding of the rule that produced it.
 */
public record Candidate(Occurrence occurrence, RuleBinding binding) {

    public ResourceBindingKey key() {
        return new ResourceBindingKey(binding.tutorId(), binding.centerId(), occurrence.startAtUtc());
    }
}
