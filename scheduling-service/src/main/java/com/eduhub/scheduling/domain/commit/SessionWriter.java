package com.eduhub.scheduling.domain.commit;

import java.util.List;

/**
 * Write capability handed to the commit engine. A real run writes through the store,
 * a preview writes nowhere.
 */
public interface SessionWriter {

    /**
     * Writes the rows, skipping any whose binding already exists.
     *
     * @return number of rows actually persisted
     */
    int write(List<NewSession> rows);

    boolean isDryRun();
}
