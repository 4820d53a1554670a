package com.commerce.extobject.lookup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;

/**
 * Resolves the owning contact of an external record or fails with {@link RecordNotFoundException}.
 */
public class ContactResolver {
    private static final Logger log = LoggerFactory.getLogger(ContactResolver.class);

    public static final String NOT_FOUND_TEMPLATE = "No contact found for identifier ''{0}''";

    private final ContactLookup lookup;

    public ContactResolver(ContactLookup lookup) {
        this.lookup = lookup;
    }

    public ContactRecord resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Contact identifier must not be blank");
        }
        return lookup.find(new IdentifierQuery(identifier))
                .orElseThrow(() -> {
                    log.debug("Contact lookup missed for identifier {}", identifier);
                    return new RecordNotFoundException(identifier,
                            MessageFormat.format(NOT_FOUND_TEMPLATE, identifier));
                });
    }
}
