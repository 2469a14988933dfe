package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A by-name reference to another entity. The target stays null until the
 * correlator resolves the name; the referenced entity is never owned.
 */
@JsonPropertyOrder({"name", "resolved"})
public class EntityRef<T extends FortranEntity> {
    public String name;
    @JsonIgnore
    public T target;

    public EntityRef(String name) {
        this.name = name;
    }

    public EntityRef(T target) {
        this.name = target.name;
        this.target = target;
    }

    public boolean isResolved() {
        return target != null;
    }

    public void resolve(T entity) {
        this.target = entity;
        if (entity != null && entity.name != null) {
            this.name = entity.name;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
