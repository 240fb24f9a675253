package com.eduhub.scheduling.domain.resolver;

import java.util.List;

/**
 * Outcome of resolving a candidate batch against itself and the stored bindings.
 *
 * @param creatable      candidates with unique keys, none already stored
 * @param alreadyExists  candidates whose key is already in the store
 * @param batchConflicts one message per candidate dropped as an intra-batch duplicate
 */
public record Resolution(List<Candidate> creatable, List<Candidate> alreadyExists, List<String> batchConflicts) {
}
