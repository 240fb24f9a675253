package com.eduhub.scheduling.domain.commit;

import com.eduhub.scheduling.domain.store.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component(LiveSessionWriter.NAME)
@RequiredArgsConstructor
public class LiveSessionWriter implements SessionWriter {

    public static final String NAME = "live";

    private final SessionStore sessionStore;

    @Override
    public int write(List<NewSession> rows) {
        return sessionStore.createSessions(rows);
    }

    @Override
    public boolean isDryRun() {
        return false;
    }
}
