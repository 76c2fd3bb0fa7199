package teranet.mapdev.layout.service;

import java.util.Optional;

/**
 * Looks up the fixed line width a layout is declared to use.
 */
public interface LineWidthResolver {

    /**
     * Resolve the fixed line width of a layout.
     *
     * @param layoutGuid the layout guid, with or without the "LAY_" prefix
     * @return the width (600 or 2500), or empty when no specific width is enforced
     */
    Optional<Integer> resolve(String layoutGuid);

    /**
     * @return true when the layout has a configured width
     */
    default boolean hasConfiguredWidth(String layoutGuid) {
        return resolve(layoutGuid).isPresent();
    }
}
