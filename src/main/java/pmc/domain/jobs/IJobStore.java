package pmc.domain.jobs;

import java.io.IOException;
import java.util.List;

/**
 * Persistent storage of tracked jobs, used for crash recovery and the pending report backlog
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2026
 */
public interface IJobStore {

    void save(TrackedJob job) throws IOException;

    List<TrackedJob> loadAll() throws IOException;
}
