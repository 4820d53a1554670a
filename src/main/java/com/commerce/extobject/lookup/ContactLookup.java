package com.commerce.extobject.lookup;

import java.util.Optional;

/**
 * Single-record lookup of a contact by identifier.
 */
public interface ContactLookup {

    Optional<ContactRecord> find(IdentifierQuery query);
}
