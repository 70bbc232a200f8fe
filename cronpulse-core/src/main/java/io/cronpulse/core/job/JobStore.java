package io.cronpulse.core.job;

import java.io.IOException;
import java.util.List;

public interface JobStore {
    List<Job> listEnabledJobs() throws IOException;

    long appendOutcome(ExecutionOutcome outcome) throws IOException;
}
