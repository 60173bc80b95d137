package io.tickwork.core.snapshot;

import java.io.IOException;

public interface JobSnapshotStore {
    JobSnapshot load() throws IOException;

    void save(JobSnapshot snapshot) throws IOException;
}
