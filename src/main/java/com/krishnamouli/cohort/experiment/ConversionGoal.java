package com.krishnamouli.cohort.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Something an experiment tries to move, e.g. a form submit or a button click.
 */
public class ConversionGoal {

    public enum Type {
        PAGE_VIEW,
        CLICK,
        FORM_SUBMIT,
        CUSTOM;

        @JsonCreator
        public static Type fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String id;
    private final String name;
    private final Type type;
    private final String value;

    @JsonCreator
    public ConversionGoal(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("type") Type type,
            @JsonProperty("value") String value) {
        this.id = Objects.requireNonNull(id, "goal id");
        this.name = name;
        this.type = type != null ? type : Type.CUSTOM;
        this.value = value;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ConversionGoal{" + id + ", " + type.wireName() + "=" + value + "}";
    }
}
