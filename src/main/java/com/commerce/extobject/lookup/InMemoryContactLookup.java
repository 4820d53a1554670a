package com.commerce.extobject.lookup;

import java.util.List;
import java.util.Optional;

/**
 * {@link ContactLookup} over a fixed list. The first contact in list order that matches wins.
 */
public class InMemoryContactLookup implements ContactLookup {

    private final List<ContactRecord> contacts;

    public InMemoryContactLookup(List<ContactRecord> contacts) {
        this.contacts = List.copyOf(contacts);
    }

    @Override
    public Optional<ContactRecord> find(IdentifierQuery query) {
        return contacts.stream()
                .filter(query::matches)
                .limit(IdentifierQuery.LIMIT)
                .findFirst();
    }
}
