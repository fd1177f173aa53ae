package co.fanki.changeimpact.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the impact model.
 *
 * <p>Value objects are immutable, compared by their attributes and
 * validated on construction. Every entity of an analysis call is one:
 * nothing outlives the call except what the caller keeps.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
