package com.buildingsync.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Base entity with common fields using generics
 * Provides standardized structure for all cached domain entities
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> {
    
    /**
     * Unique identifier for the entity
     */
    private ID id;
    
    /**
     * Ingestion timestamp (epoch millis)
     */
    private long timestamp;
}
