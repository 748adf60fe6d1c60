package tech.noetzold.results_gateway.controller;

import tech.noetzold.results_gateway.exception.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validation of path and query parameters shared by the controllers.
 */
final class RequestParams {

    static final String GET_DISABLED_PARAM = "get_disabled";
    static final String OSD_ELIGIBLE_PARAM = "osd_eligible";

    private static final Pattern CLUSTER_NAME = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern RULE_SELECTOR = Pattern.compile("^([a-zA-Z_0-9.]+)\\|([a-zA-Z_0-9]+)$");

    private RequestParams() {
    }

    static String clusterName(String value) {
        if (value == null || !CLUSTER_NAME.matcher(value.trim()).matches()) {
            throw new BadRequestException("Error during parsing param 'cluster' with value '" + value
                    + "'. Error: 'invalid UUID format'");
        }
        return value.trim();
    }

    static List<String> clusterList(String value) {
        List<String> clusters = new ArrayList<>();
        for (String part : value.split(",")) {
            clusters.add(clusterName(part));
        }
        return clusters;
    }

    /**
     * @return rule ID at index 0, error key at index 1
     */
    static String[] ruleSelector(String value) {
        var matcher = RULE_SELECTOR.matcher(value == null ? "" : value);
        if (!matcher.matches()) {
            throw new BadRequestException("Error during parsing param 'rule_selector' with value '" + value
                    + "'. Error: 'expected format is rule_id|ERROR_KEY'");
        }
        return new String[]{matcher.group(1), matcher.group(2)};
    }

    /**
     * Parses an optional boolean query parameter; absent means false.
     *
     * @throws BadRequestException when the value is not a boolean
     */
    static boolean booleanParam(String name, String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new BadRequestException("Error during parsing param '" + name + "' with value '" + value + "'");
    }
}
