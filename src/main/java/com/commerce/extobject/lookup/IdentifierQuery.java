package com.commerce.extobject.lookup;

import lombok.NonNull;
import lombok.Value;

/**
 * Matches a record whose customer id, record id or account id equals the candidate.
 * The three conditions are alternatives; at most one record is returned.
 */
@Value
public class IdentifierQuery {

    public static final int LIMIT = 1;

    @NonNull
    String candidate;

    public boolean matches(ContactRecord contact) {
        return candidate.equals(contact.getCustomerId())
                || candidate.equals(contact.getRecordId())
                || candidate.equals(contact.getAccountId());
    }
}
