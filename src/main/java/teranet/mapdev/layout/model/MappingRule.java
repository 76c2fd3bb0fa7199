package teranet.mapdev.layout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One source-to-target relation extracted from a mapping rule:
 * {@code I.<sourceLine>/<sourceField>} projected onto {@code T.<targetPath>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MappingRule {

    private String sourceLine;
    private String sourceField;
    private String targetPath;

    /**
     * @return last segment of the target path, the leaf element name
     */
    public String getTargetElement() {
        if (targetPath == null) {
            return "";
        }
        int slash = targetPath.lastIndexOf('/');
        return slash >= 0 ? targetPath.substring(slash + 1) : targetPath;
    }

    /**
     * @return target path without its leaf, used as grouping key
     */
    public String getParentPath() {
        if (targetPath == null) {
            return "";
        }
        int slash = targetPath.lastIndexOf('/');
        return slash >= 0 ? targetPath.substring(0, slash) : "";
    }

    /**
     * @return last segment of the grouping key, e.g. "emit" for enviNFe/NFe/infNFe/emit/CNPJ
     */
    public String getSection() {
        String parent = getParentPath();
        int slash = parent.lastIndexOf('/');
        return slash >= 0 ? parent.substring(slash + 1) : parent;
    }

    /**
     * @return source reference relative to the intermediate document root
     */
    public String getSourceXPath() {
        return "ROOT/" + sourceLine + "/" + sourceField;
    }
}
