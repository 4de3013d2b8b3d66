package com.booking.realtime.model.event;

import java.io.Serializable;

@SuppressWarnings("unused")
public enum ChangeEventType implements Serializable {
    INSERT(1, "I", InsertChangeEvent.class),
    UPDATE(2, "U", UpdateChangeEvent.class),
    DELETE(3, "D", DeleteChangeEvent.class),
    TRUNCATE(4, "T", TruncateChangeEvent.class);

    private final int code;
    private final String action;
    private final Class<? extends ChangeEvent> definition;

    ChangeEventType(int code, String action, Class<? extends ChangeEvent> definition) {
        this.code = code;
        this.action = action;
        this.definition = definition;
    }

    public int getCode() {
        return this.code;
    }

    /**
     * Single letter action code used by wal2json.
     */
    public String getAction() {
        return this.action;
    }

    public Class<? extends ChangeEvent> getDefinition() {
        return this.definition;
    }

    public boolean carriesRecord() {
        return this == INSERT || this == UPDATE;
    }

    public boolean carriesOldRecord() {
        return this == UPDATE || this == DELETE;
    }

    public static ChangeEventType fromAction(String action) {
        for (ChangeEventType type : ChangeEventType.values()) {
            if (type.action.equals(action)) {
                return type;
            }
        }

        return null;
    }

    public static ChangeEventType fromName(String name) {
        for (ChangeEventType type : ChangeEventType.values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }

        return null;
    }
}
