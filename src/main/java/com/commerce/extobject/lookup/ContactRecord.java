package com.commerce.extobject.lookup;

import lombok.Builder;
import lombok.Value;

/**
 * The owning contact of an external record, as far as identifier matching is concerned.
 */
@Value
@Builder
public class ContactRecord {

    /**
     * Internal record id.
     */
    String recordId;

    /**
     * Customer number assigned by the commerce system.
     */
    String customerId;

    String accountId;

    String name;
}
