package co.fanki.changeimpact.impact.domain;

import java.io.IOException;
import java.util.List;

/**
 * Source of the component topology the engine analyzes.
 *
 * <p>Called once per analysis. Implementations own how components and
 * their dependencies are discovered; the engine treats the returned list
 * as a read-only snapshot.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CodeStructureProvider {

    /**
     * Lists every known component with its declared dependencies.
     *
     * @return the component snapshot, never null
     * @throws IOException if the underlying structure cannot be read
     */
    List<ComponentDependencies> listComponents() throws IOException;

}
