package io.ietfdata.json.jackson;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.util.Map;

/**
 * snake_case naming, plus renames for wire fields whose names are Java keywords or clash with Object methods.
 */
final class DatatrackerNamingStrategy extends PropertyNamingStrategies.SnakeCaseStrategy {

    private static final Map<String, String> RENAMES = Map.of(
            "docAbstract", "abstract",
            "notifyList", "notify");

    @Override
    public String translate(String input) {
        String renamed = RENAMES.get(input);
        return renamed != null ? renamed : super.translate(input);
    }
}
