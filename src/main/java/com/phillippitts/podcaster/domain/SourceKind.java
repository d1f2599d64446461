package com.phillippitts.podcaster.domain;

/**
 * Kind of source a podcast is generated from.
 */
public enum SourceKind {
    URL
}
