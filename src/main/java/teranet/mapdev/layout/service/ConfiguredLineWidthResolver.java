package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.config.LineSizeConfig;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.Layout;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link LineWidthResolver} backed by the layout.line-size.* properties.
 *
 * Guids compare case-insensitively and are normalized to carry the "LAY_" prefix.
 */
@Service
public class ConfiguredLineWidthResolver implements LineWidthResolver {

    private static final String ENDPOINT = "LineWidthResolver";

    public static final int NARROW_LINE_WIDTH = 600;
    public static final int WIDE_LINE_WIDTH = 2500;

    private final Set<String> narrowLayouts;
    private final Set<String> wideLayouts;

    public ConfiguredLineWidthResolver(LineSizeConfig lineSizeConfig, TechLogger techLogger) {
        this.narrowLayouts = normalizeAll(lineSizeConfig.getLayouts600());
        this.wideLayouts = normalizeAll(lineSizeConfig.getLayouts2500());
        techLogger.info(ENDPOINT, String.format(
                "Loaded line widths for %d layouts of %d and %d layouts of %d characters",
                narrowLayouts.size(), NARROW_LINE_WIDTH, wideLayouts.size(), WIDE_LINE_WIDTH));
    }

    @Override
    public Optional<Integer> resolve(String layoutGuid) {
        if (layoutGuid == null || layoutGuid.isBlank()) {
            return Optional.empty();
        }

        String key = normalize(layoutGuid);
        if (narrowLayouts.contains(key)) {
            return Optional.of(NARROW_LINE_WIDTH);
        }
        if (wideLayouts.contains(key)) {
            return Optional.of(WIDE_LINE_WIDTH);
        }
        return Optional.empty();
    }

    /**
     * Prefix a guid with "LAY_" when missing and upper-case it for comparison.
     */
    static String normalize(String layoutGuid) {
        String trimmed = layoutGuid.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        return upper.startsWith(Layout.GUID_PREFIX) ? upper : Layout.GUID_PREFIX + upper;
    }

    private static Set<String> normalizeAll(List<String> guids) {
        if (guids == null) {
            return Collections.emptySet();
        }
        return guids.stream()
                .filter(guid -> guid != null && !guid.isBlank())
                .map(ConfiguredLineWidthResolver::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }
}
