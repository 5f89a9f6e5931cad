package tracking.registry;

import tracking.model.OccurrenceCode;

import java.util.List;

/**
 * Supplies the full occurrence code taxonomy. Called once at start and on every reload.
 *
 * <p>Implementations should return the complete set; the registry never merges partial
 * results. Throwing leaves the previously loaded taxonomy in place.
 *
 * @see ClasspathOccurrenceCodeSource
 */
@FunctionalInterface
public interface OccurrenceCodeSource {

    List<OccurrenceCode> load() throws Exception;
}
