package teranet.mapdev.layout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine settings, mapped from application.properties:
 * - layout.engine.record-length
 * - layout.engine.default-line-length
 * - layout.engine.max-nesting-depth
 * - layout.engine.sequence-prefix-length
 */
@Configuration
@ConfigurationProperties(prefix = "layout.engine")
@Data
public class LayoutEngineConfig {

    /** Width of one physical mqseries record */
    private int recordLength = 600;

    /** Width enforced by the validator when no per-layout width is configured */
    private int defaultLineLength = 600;

    /** Deepest line nesting the validator and parser descend into */
    private int maxNestingDepth = 32;

    /** Length of the numeric running counter that prefixes LINHA records */
    private int sequencePrefixLength = 6;
}
