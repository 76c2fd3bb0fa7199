package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.logging.TechLogger;

import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for the names written into a TCL mapping document.
 *
 * Features:
 * - Short line identifiers (HEADER, TRAILER, A..Z, AA..AZ, Z&lt;n&gt;)
 * - lowerCamelCase field names
 * - Decimal length attributes for monetary fields
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class TclNamingService {

    private static final String ENDPOINT = "TclNaming";

    private static final String LINE_PREFIX = "LINHA";
    private static final String EMPTY_LINE_IDENTIFIER = "X";
    private static final String UNKNOWN_FIELD_NAME = "Unknown";
    private static final String DECIMAL_SUFFIX = ",2,0";
    private static final int LETTERS = 26;

    private static final String[] DECIMAL_MARKERS = {"Valor", "Preco", "Total", "vBC", "vICMS", "vST"};

    private final TechLogger techLogger;

    public TclNamingService(TechLogger techLogger) {
        this.techLogger = techLogger;
    }

    /**
     * Short identifier of a line in the TCL document.
     *
     * Examples:
     * - HEADER → HEADER
     * - TRAILER → TRAILER
     * - LINHA000 → A
     * - LINHA025 → Z
     * - LINHA026 → AA
     * - LINHA051 → AZ
     * - LINHA052 → Z052
     * - detalhe → D
     * - "" → X
     *
     * @param lineName the line name from the layout
     * @return the identifier, never empty
     */
    public String lineIdentifier(String lineName) {
        if (lineName == null || lineName.isEmpty()) {
            return EMPTY_LINE_IDENTIFIER;
        }
        if ("HEADER".equals(lineName) || "TRAILER".equals(lineName)) {
            return lineName;
        }

        if (lineName.startsWith(LINE_PREFIX)) {
            String number = lineName.substring(LINE_PREFIX.length());
            if (!number.isEmpty() && number.chars().allMatch(Character::isDigit)) {
                int n;
                try {
                    n = Integer.parseInt(number);
                } catch (NumberFormatException e) {
                    techLogger.debug(ENDPOINT, "Line number out of range in " + lineName + ", using Z prefix");
                    return "Z" + number;
                }
                if (n < LETTERS) {
                    return String.valueOf((char) ('A' + n));
                }
                if (n < 2 * LETTERS) {
                    return "A" + (char) ('A' + (n - LETTERS));
                }
                return "Z" + number;
            }
        }

        return lineName.substring(0, 1).toUpperCase();
    }

    /**
     * Convert a field name to lowerCamelCase.
     *
     * Splits on space, hyphen and underscore. Only the first character of each token changes:
     * lowered for the first token, raised for the others.
     *
     * Examples:
     * "Codigo Produto" → "codigoProduto"
     * "CNPJ_Emitente" → "cNPJEmitente"
     * "data-emissao" → "dataEmissao"
     * "___" → "___"
     *
     * @param fieldName the field name from the layout
     * @return the sanitized name, "Unknown" for null or empty input
     */
    public String sanitizeFieldName(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return UNKNOWN_FIELD_NAME;
        }

        List<String> tokens = new ArrayList<>();
        for (String token : fieldName.split("[ \\-_]")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return fieldName;
        }

        StringBuilder result = new StringBuilder();
        String first = tokens.get(0);
        result.append(Character.toLowerCase(first.charAt(0))).append(first.substring(1));
        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            result.append(Character.toUpperCase(token.charAt(0))).append(token.substring(1));
        }
        return result.toString();
    }

    /**
     * Whether a field holds a monetary value written with two implied decimals.
     *
     * True when the name contains Valor, Preco, Total, vBC, vICMS or vST, or starts with a
     * lowercase v followed by an uppercase letter (vProd, vNF).
     */
    public boolean isDecimalField(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return false;
        }
        for (String marker : DECIMAL_MARKERS) {
            if (fieldName.contains(marker)) {
                return true;
            }
        }
        return fieldName.length() > 1
                && fieldName.charAt(0) == 'v'
                && Character.isUpperCase(fieldName.charAt(1));
    }

    /**
     * Value of the length attribute: the width, or "&lt;width&gt;,2,0" for decimal fields.
     */
    public String lengthAttribute(String fieldName, int length) {
        return isDecimalField(fieldName) ? length + DECIMAL_SUFFIX : String.valueOf(length);
    }
}
