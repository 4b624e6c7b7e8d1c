package com.infra.whatif.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeAction {
    CREATE("Create"),
    MODIFY("Modify"),
    DELETE("Delete"),
    DEPLOY("Deploy"),
    NO_CHANGE("NoChange"),
    IGNORE("Ignore");

    private final String label;

    ChangeAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ChangeAction parse(String value) {
        if (value == null || value.isBlank()) return null;
        String compact = value.trim().replace(" ", "").replace("_", "");
        for (ChangeAction action : values()) {
            if (action.label.equalsIgnoreCase(compact)) {
                return action;
            }
        }
        return null;
    }
}
