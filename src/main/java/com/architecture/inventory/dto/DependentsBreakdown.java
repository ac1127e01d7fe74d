package com.architecture.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Who depends on an asset, split by distance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependentsBreakdown {

    private List<String> direct;        // Assets listing this one in depends_on
    private List<String> intermediate;  // Transitive dependents that are neither direct nor final
    private List<String> terminal;      // Transitive dependents nothing depends on
}
