package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.model.MappingRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls source-to-target relations out of the ContentValue text of a mapping rule.
 *
 * Two assignment forms are recognized:
 * - {@code I.LINHA000/Campo = T.enviNFe/NFe/infNFe/ide/cUF}
 * - {@code T.enviNFe/NFe/infNFe/ide/cUF = ... I.LINHA000/Campo}
 */
@Service
public class MappingRuleExtractor {

    private static final Pattern SOURCE_TO_TARGET =
            Pattern.compile("I\\.([^/]+)/([^\\s=;]+)\\s*=\\s*T\\.([^\\s;]+)");

    private static final Pattern TARGET_FROM_SOURCE =
            Pattern.compile("T\\.([^\\s=;]+)\\s*=\\s*[^;]*I\\.([^/]+)/([^\\s;]+)");

    /**
     * Extract every relation of one rule, source-to-target forms first.
     *
     * @param contentValue the rule text, may be null
     * @return the relations in match order, empty when none
     */
    public List<MappingRule> extract(String contentValue) {
        List<MappingRule> rules = new ArrayList<>();
        if (contentValue == null || contentValue.isBlank()) {
            return rules;
        }

        Matcher forward = SOURCE_TO_TARGET.matcher(contentValue);
        while (forward.find()) {
            rules.add(new MappingRule(forward.group(1).trim(), forward.group(2), forward.group(3)));
        }

        Matcher backward = TARGET_FROM_SOURCE.matcher(contentValue);
        while (backward.find()) {
            rules.add(new MappingRule(backward.group(2).trim(), backward.group(3), backward.group(1)));
        }
        return rules;
    }
}
