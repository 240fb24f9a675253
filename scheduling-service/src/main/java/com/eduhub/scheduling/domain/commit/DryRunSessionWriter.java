package com.eduhub.scheduling.domain.commit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports every row as written without touching the store.
 */
@Slf4j
@Component(DryRunSessionWriter.NAME)
public class DryRunSessionWriter implements SessionWriter {

    public static final String NAME = "dryRun";

    @Override
    public int write(List<NewSession> rows) {
        log.debug("Dry run: {} sessions would be written", rows.size());
        return rows.size();
    }

    @Override
    public boolean isDryRun() {
        return true;
    }
}
