package com.architecture.inventory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provenance of a group of assets: the YAML file they were read from and the
 * file-level {@code general.title}, if any.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceFile {

    private String path;    // Absolute path of the asset file
    private String title;   // general.title, null when the file has no general section
}
