package org.flowvault.api.store;

/**
 * Sort orders offered by the flow list.
 * <p>
 * Each key maps to one indexed or cheap column of the flow view.
 */
public enum FlowSortKey {
    CREATED("timestamp_created"),
    METHOD("method"),
    URL("url"),
    SIZE("size"),
    STATUS("status_code"),
    DURATION("duration");

    private final String column;

    FlowSortKey(String column) {
        this.column = column;
    }

    /**
     * Returns the flow view column this key sorts by.
     *
     * @return the column name
     */
    public String column() {
        return column;
    }
}
