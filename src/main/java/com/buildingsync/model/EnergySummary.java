package com.buildingsync.model;

import lombok.Builder;
import lombok.Value;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Before/after renovation figures shown by the building information panel.
 * Any value may be null when the source omits it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnergySummary {
    
    /** kWh/m²a before renovation */
    Double energyDemandSpecificBefore;
    
    /** kWh/m²a after renovation */
    Double energyDemandSpecificAfter;
    
    /** t CO2/a before renovation */
    Double co2TonnesBefore;
    
    /** t CO2/a after renovation */
    Double co2TonnesAfter;
    
    public static EnergySummary empty() {
        return EnergySummary.builder().build();
    }
}
