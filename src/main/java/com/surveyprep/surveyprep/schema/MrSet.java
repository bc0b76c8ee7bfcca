package com.surveyprep.surveyprep.schema;

import java.util.List;

/**
 * One multi-response question: its name and the ordered option columns that belong to it.
 */
public record MrSet(String name, List<String> members) {

    public MrSet {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Multi-response set name is required");
        }
        members = members == null ? List.of() : List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("Multi-response set " + name + " needs at least 2 member columns");
        }
    }
}
