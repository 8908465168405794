package com.defaultrisk.domain.model;

import lombok.Value;

/**
 * Reference to a staged dataset artifact on the shared staging volume.
 */
@Value
public class DatasetRef {

    String path;
    String originalFilename;
}
