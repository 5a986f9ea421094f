package com.example.cronkeeper.domain.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Selects entries by id (at most one) or by name (every entry with that name).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = EntryIdentifier.Id.class, name = "Id"),
        @JsonSubTypes.Type(value = EntryIdentifier.Name.class, name = "Name")
})
public sealed interface EntryIdentifier {

    /**
     * Numeric text selects by id, anything else by name.
     */
    static EntryIdentifier parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Invalid entry identifier");
        }
        try {
            var id = Long.parseLong(text);
            if (id >= 0) {
                return new Id(id);
            }
        } catch (NumberFormatException e) {
            // not numeric, falls through to a name
        }
        return new Name(text);
    }

    record Id(long id) implements EntryIdentifier {
        @Override
        public String toString() {
            return "#" + id;
        }
    }

    record Name(String name) implements EntryIdentifier {
        @Override
        public String toString() {
            return name;
        }
    }
}
