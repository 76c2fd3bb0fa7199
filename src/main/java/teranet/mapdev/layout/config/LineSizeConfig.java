package teranet.mapdev.layout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-layout fixed line widths (layout.line-size.*).
 *
 * Guids may be listed with or without the "LAY_" prefix; layouts in neither list have no
 * specific width enforced.
 */
@Configuration
@ConfigurationProperties(prefix = "layout.line-size")
@Data
public class LineSizeConfig {

    /** Layouts whose lines are 600 characters wide (layout.line-size.layouts-600) */
    private List<String> layouts600 = new ArrayList<>();

    /** Layouts whose lines are 2500 characters wide (layout.line-size.layouts-2500) */
    private List<String> layouts2500 = new ArrayList<>();
}
