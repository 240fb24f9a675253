package com.eduhub.scheduling.domain.resolver;

import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Partitions a candidate batch into creatable, already-stored and conflicting entries.
 *
 * Candidates are taken in input order and the first one for a key wins. Intra-batch
 * duplicates are reported as conflicts, never raised.
 */
@Slf4j
@Component
public class ConflictResolver {

    public Resolution resolve(List<Candidate> candidates, Set<ResourceBindingKey> existing) {
        Set<ResourceBindingKey> seen = new HashSet<>();
        List<Candidate> creatable = new ArrayList<>();
        List<Candidate> alreadyExists = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();

        for (Candidate candidate : candidates) {
            ResourceBindingKey key = candidate.key();
            if (!seen.add(key)) {
                conflicts.add("Overlap for " + key.format() + " (rule: " + candidate.binding().label() + ")");
                continue;
            }
            if (existing.contains(key)) {
                alreadyExists.add(candidate);
            } else {
                creatable.add(candidate);
            }
        }

        if (!conflicts.isEmpty()) {
            log.warn("Dropped {} overlapping candidates out of {}", conflicts.size(), candidates.size());
        }
        return new Resolution(creatable, alreadyExists, conflicts);
    }
}
