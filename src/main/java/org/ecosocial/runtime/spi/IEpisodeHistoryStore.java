package org.ecosocial.runtime.spi;

import java.io.IOException;
import java.util.List;

/**
 * Persistent record of completed episodes, oldest first.
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (com.typesafe.config.Config options)}
 */
public interface IEpisodeHistoryStore {

    /**
     * Appends a summary, evicting the oldest entries beyond the store's capacity.
     *
     * @param summary the completed episode
     * @throws IOException if the history cannot be written
     */
    void append(EpisodeSummary summary) throws IOException;

    /**
     * Loads the retained history.
     *
     * @return the summaries, oldest first; empty if nothing was recorded yet
     * @throws IOException if the history exists but cannot be read
     */
    List<EpisodeSummary> load() throws IOException;
}
