package me.golemcore.dispatch.domain.model.schema;

/**
 * Optional semantic format of a string field.
 */
public enum StringFormat {

    EMAIL("email"),

    /**
     * ISO-8601 date, local date-time or offset date-time.
     */
    DATE_TIME("date-time");

    private final String jsonName;

    StringFormat(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * Name used by the JSON Schema {@code format} keyword.
     */
    public String getJsonName() {
        return jsonName;
    }
}
