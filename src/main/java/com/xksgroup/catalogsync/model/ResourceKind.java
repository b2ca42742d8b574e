package com.xksgroup.catalogsync.model;

public enum ResourceKind {
    MEDIA_SEGMENT,  // one episode playlist
    COVER           // poster image
}
