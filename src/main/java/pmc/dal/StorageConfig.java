package pmc.dal;

import java.nio.file.Path;

/**
 * Local persisted state locations
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 06/10/2026
 */
public record StorageConfig(Path commandCachePath, Path jobStorePath) {

    public void validate() throws ConfigurationException {
        if (commandCachePath == null) {
            throw ConfigurationException.missing("command.cache.path");
        }
        if (jobStorePath == null) {
            throw ConfigurationException.missing("job.store.path");
        }
    }
}
