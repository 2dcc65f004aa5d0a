package org.flowvault.api.store;

import java.util.List;

/**
 * One page of a filtered, sorted flow list.
 *
 * @param ids   Flow ids on this page, in display order.
 * @param total Number of flows matching the filter across all pages.
 */
public record FlowPage(List<String> ids, long total) {

    public FlowPage {
        ids = List.copyOf(ids);
    }
}
